package co.fanki.sourcefacts.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Source Facts Analyzer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Source Facts Analyzer API")
                        .description("""
                                Source Facts Analyzer - static analysis of JavaScript, C#,
                                Python, CSS, JSON and HTML sources.

                                ## Facets
                                - **Functions**: declared function and method names
                                - **Call order**: callee chains in source order
                                - **Dependencies**: imports, requires and referenced files
                                - **Data flow**: globals, DOM, events, storage and shared state
                                - **I/O**: inputs and outputs touched by the unit
                                - **Side effects**: tagged effects, or PURE

                                Every facet is rendered as a deterministic string.
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
