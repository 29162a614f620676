package co.fanki.sourcefacts.analysis.application;

import co.fanki.sourcefacts.analysis.application.AnalysisController.BatchRequest;
import co.fanki.sourcefacts.analysis.application.AnalysisController.BatchResponse;
import co.fanki.sourcefacts.analysis.application.AnalysisController.FileRequest;
import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;
import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.Language;
import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.AnalysisException.FailureKind;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.isNull;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link AnalysisController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisControllerTest {

    private AnalysisService analysisService;

    private AnalysisController controller;

    @BeforeEach
    void setUp() {
        analysisService = createMock(AnalysisService.class);
        controller = new AnalysisController(analysisService);
    }

    @Test
    void whenAnalyzingFile_givenValidRequest_shouldReturnRenderedFacts() {
        final AnalysisResult result = new AnalysisResult(List.of("b", "a"),
                List.of("a", "b"), List.of(), null, null, null);
        expect(analysisService.analyze("src/app.js", "", "code"))
                .andReturn(AnalysisOutcome.success("src/app.js",
                        Language.ECMASCRIPT, result));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeFile(
                new FileRequest("src/app.js", "", "code"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        final AnalysisResponse body = (AnalysisResponse) response.getBody();
        assertEquals("ECMASCRIPT", body.language());
        assertEquals("a; b", body.functions());
        assertEquals("a -> b", body.callOrder());
        assertNull(body.diagnostic());
        verify(analysisService);
    }

    @Test
    void whenAnalyzingFile_givenDegradedOutcome_shouldStillReturnOk() {
        expect(analysisService.analyze("x.rb", null, "puts 1"))
                .andReturn(AnalysisOutcome.failure("x.rb", Language.UNSUPPORTED,
                        "unsupported language"));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeFile(
                new FileRequest("x.rb", null, "puts 1"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("unsupported language",
                ((AnalysisResponse) response.getBody()).diagnostic());
        verify(analysisService);
    }

    @Test
    @SuppressWarnings("unchecked")
    void whenAnalyzingFile_givenInvalidRequest_shouldReturnBadRequest() {
        expect(analysisService.analyze(isNull(), eq("js"), eq("x")))
                .andThrow(new IllegalArgumentException("Source path cannot be blank"));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeFile(
                new FileRequest(null, "js", "x"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        final Map<String, String> body = (Map<String, String>) response.getBody();
        assertEquals("INVALID_REQUEST", body.get("errorCode"));
        assertEquals("Source path cannot be blank", body.get("error"));
        verify(analysisService);
    }

    @Test
    @SuppressWarnings("unchecked")
    void whenAnalyzingFile_givenAnalysisFailure_shouldReturnItsErrorCode() {
        expect(analysisService.analyze("a.py", "", ""))
                .andThrow(new AnalysisException("no python",
                        FailureKind.INTERPRETER_NOT_FOUND));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeFile(
                new FileRequest("a.py", "", ""));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INTERPRETER_NOT_FOUND",
                ((Map<String, String>) response.getBody()).get("errorCode"));
        verify(analysisService);
    }

    @Test
    void whenAnalyzingBatch_givenBaseDirectory_shouldReturnCounters() {
        final List<String> paths = List.of("a.css", "b.json", "c.css");
        expect(analysisService.analyzeFiles(paths, Path.of("/repo")))
                .andReturn(new BatchReport("run-1", List.of(
                        AnalysisOutcome.success("/repo/a.css", Language.CSS,
                                AnalysisResult.empty()),
                        AnalysisOutcome.failure("/repo/b.json", Language.JSON,
                                "PARSE_FAILURE: broken")),
                        List.of("c.css")));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeBatch(
                new BatchRequest(paths, "/repo"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        final BatchResponse body = (BatchResponse) response.getBody();
        assertEquals("run-1", body.runId());
        assertEquals(2, body.results().size());
        assertEquals(List.of("c.css"), body.unreadable());
        assertEquals(1, body.analyzed());
        assertEquals(1, body.degraded());
        verify(analysisService);
    }

    @Test
    void whenAnalyzingBatch_givenBlankBaseDirectory_shouldPassNoBase() {
        final List<String> paths = List.of("/abs/a.css");
        expect(analysisService.analyzeFiles(eq(paths), isNull(Path.class)))
                .andReturn(new BatchReport("run-2", List.of(), List.of()));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeBatch(
                new BatchRequest(paths, " "));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(analysisService);
    }

    @Test
    @SuppressWarnings("unchecked")
    void whenAnalyzingBatch_givenNoPaths_shouldReturnBadRequest() {
        expect(analysisService.analyzeFiles(isNull(), isNull(Path.class)))
                .andThrow(new IllegalArgumentException(
                        "At least one path is required"));
        replay(analysisService);

        final ResponseEntity<?> response = controller.analyzeBatch(
                new BatchRequest(null, null));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_REQUEST",
                ((Map<String, String>) response.getBody()).get("errorCode"));
        verify(analysisService);
    }

}
