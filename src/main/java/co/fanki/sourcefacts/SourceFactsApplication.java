package co.fanki.sourcefacts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Source Facts Analyzer Application.
 *
 * <p>Entry point of the service that extracts functions, call order,
 * dependencies, data flow, I/O and side-effect facts from source files and
 * serves them over REST.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class SourceFactsApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(SourceFactsApplication.class, args);
    }

}
