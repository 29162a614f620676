package co.fanki.sourcefacts.config;

import co.fanki.sourcefacts.analysis.domain.python.InterpreterLocator;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check controller providing endpoints for liveness and readiness probes.
 *
 * <p>Provides /health for basic liveness check and /ready for a readiness
 * report. A missing Python interpreter only degrades Python analysis, so it
 * is reported but never fails the probe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private final InterpreterLocator interpreterLocator;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theInterpreterLocator probes the Python interpreter candidates
     */
    public HealthCheckController(final InterpreterLocator theInterpreterLocator) {
        this.interpreterLocator = theInterpreterLocator;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return "ok" string
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness probe endpoint.
     *
     * @return status map with component health information
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean pythonAvailable = interpreterLocator.isAvailable();

        final Map<String, Object> status = Map.of(
            "status", "ready",
            "python", pythonAvailable ? "available" : "unavailable",
            "pythonCandidates", interpreterLocator.candidates()
        );
        return ResponseEntity.ok(status);
    }

}
