package co.fanki.sourcefacts.analysis.application;

import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;
import co.fanki.sourcefacts.shared.AnalysisException;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST controller for source analysis operations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Analysis", description = "Extract functions, calls, dependencies and effects from source files")
public class AnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisController.class);

    private final AnalysisService analysisService;

    /**
     * Creates a new AnalysisController.
     *
     * @param theAnalysisService the analysis service
     */
    public AnalysisController(final AnalysisService theAnalysisService) {
        this.analysisService = theAnalysisService;
    }

    /**
     * Analyzes one source text.
     *
     * @param request the file request
     * @return the rendered facts, or 400 on an invalid request
     */
    @Operation(
            summary = "Analyze source text",
            description = "Analyzes the given text as the given language, or as the "
                    + "language implied by the path extension when none is given"
    )
    @PostMapping("/file")
    public ResponseEntity<?> analyzeFile(@RequestBody final FileRequest request) {

        LOG.info("Received analysis request for: {}", request.path());

        try {
            final AnalysisOutcome outcome = analysisService.analyze(
                    request.path(), request.language(), request.text());
            return ResponseEntity.ok(AnalysisResponse.from(outcome));

        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid request: {}", e.getMessage());
            return badRequest("INVALID_REQUEST", e.getMessage());
        } catch (AnalysisException e) {
            LOG.warn("Analysis rejected: {}", e.getMessage());
            return badRequest(e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * Reads and analyzes a batch of files within one run.
     *
     * @param request the batch request
     * @return the responses and counters, or 400 on an invalid request
     */
    @Operation(
            summary = "Analyze files on disk",
            description = "Reads each path, relative to the base directory when given, "
                    + "and analyzes all of them in one run. Unreadable files are skipped."
    )
    @PostMapping("/batch")
    public ResponseEntity<?> analyzeBatch(@RequestBody final BatchRequest request) {

        LOG.info("Received batch analysis request for {} paths",
                request.paths() == null ? 0 : request.paths().size());

        try {
            final Path base = request.baseDirectory() == null
                    || request.baseDirectory().isBlank()
                    ? null : Path.of(request.baseDirectory());
            final BatchReport report = analysisService.analyzeFiles(
                    request.paths(), base);
            return ResponseEntity.ok(BatchResponse.from(report));

        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid request: {}", e.getMessage());
            return badRequest("INVALID_REQUEST", e.getMessage());
        } catch (AnalysisException e) {
            LOG.warn("Analysis rejected: {}", e.getMessage());
            return badRequest(e.getErrorCode(), e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, String>> badRequest(
            final String errorCode, final String message) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", message == null ? errorCode : message,
                "errorCode", errorCode));
    }

    /**
     * Request for a single source text.
     */
    public record FileRequest(
            String path,
            String language,
            String text
    ) {}

    /**
     * Request for a batch of files on disk.
     */
    public record BatchRequest(
            List<String> paths,
            String baseDirectory
    ) {}

    /**
     * Response of a batch run.
     */
    public record BatchResponse(
            String runId,
            List<AnalysisResponse> results,
            List<String> unreadable,
            long analyzed,
            long degraded
    ) {
        public static BatchResponse from(final BatchReport report) {
            return new BatchResponse(
                    report.runId(),
                    report.outcomes().stream()
                            .map(AnalysisResponse::from)
                            .toList(),
                    report.unreadable(),
                    report.analyzedCount(),
                    report.degradedCount());
        }
    }

}
