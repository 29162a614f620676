package co.fanki.sourcefacts.analysis.application;

import co.fanki.sourcefacts.analysis.domain.AnalysisDispatcher;
import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;
import co.fanki.sourcefacts.analysis.domain.Language;
import co.fanki.sourcefacts.analysis.domain.markup.JsonDocumentAnalyzer;
import co.fanki.sourcefacts.analysis.domain.markup.StylesheetAnalyzer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisService}.
 *
 * <p>Runs against a real dispatcher with the markup front ends, which need
 * neither a parser runtime nor an interpreter.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisServiceTest {

    @TempDir
    Path tempDir;

    private AnalysisService service;

    @BeforeEach
    void setUp() {
        service = new AnalysisService(new AnalysisDispatcher(List.of(
                new StylesheetAnalyzer(), new JsonDocumentAnalyzer())));
    }

    @Test
    void whenAnalyzing_givenInMemoryText_shouldRouteByExtension() {
        final AnalysisOutcome outcome = service.analyze("styles/app.css", null,
                "@import 'base.css';");

        assertFalse(outcome.hasDiagnostic());
        assertEquals(Language.CSS, outcome.language());
        assertEquals("base.css", outcome.result().dependenciesSummary());
    }

    @Test
    void whenAnalyzing_givenExplicitLanguageTag_shouldIgnoreExtension() {
        final AnalysisOutcome outcome = service.analyze("settings.txt", "json",
                "{\"debug\": true}");

        assertEquals(Language.JSON, outcome.language());
        assertEquals("Inputs{CONFIG:debug}", outcome.result().ioSummary());
    }

    @Test
    void whenAnalyzing_givenUnsupportedLanguage_shouldReturnDiagnostic() {
        final AnalysisOutcome outcome = service.analyze("tool.rb", "",
                "puts 1");

        assertEquals(AnalysisDispatcher.UNSUPPORTED_LANGUAGE,
                outcome.diagnostic());
        assertEquals("", outcome.result().functionsSummary());
    }

    @Test
    void whenAnalyzing_givenBlankPath_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> service.analyze(" ", "css", ""));
    }

    @Test
    void whenAnalyzingFiles_givenMixedBatch_shouldSkipUnreadableAndKeepGoing()
            throws IOException {
        Files.writeString(tempDir.resolve("app.css"), ".a { color: red; }");
        Files.writeString(tempDir.resolve("broken.json"), "{\"a\": ");
        Files.write(tempDir.resolve("latin1.css"),
                new byte[] {'.', 'a', (byte) 0xC3, (byte) 0x28});
        Files.createDirectory(tempDir.resolve("folder.css"));
        Files.writeString(tempDir.resolve("ok.json"), "[]");

        final BatchReport report = service.analyzeFiles(List.of(
                "app.css", "broken.json", "missing.css", "latin1.css",
                "folder.css", "ok.json"), tempDir);

        assertEquals(3, report.outcomes().size());
        assertEquals(List.of("missing.css", "latin1.css", "folder.css"),
                report.unreadable());
        assertEquals(2, report.analyzedCount());
        assertEquals(1, report.degradedCount());

        final AnalysisOutcome broken = report.outcomes().get(1);
        assertTrue(broken.diagnostic().startsWith("PARSE_FAILURE: "));
        assertEquals("", broken.result().dataFlowSummary());
        assertEquals("JSON{root=array}",
                report.outcomes().get(2).result().dataFlowSummary());
    }

    @Test
    void whenAnalyzingFiles_givenBlankAndNullPaths_shouldSkipThemAndKeepGoing()
            throws IOException {
        Files.writeString(tempDir.resolve("ok.css"), "@import 'base.css';");

        final BatchReport report = service.analyzeFiles(
                Arrays.asList(" ", null, "ok.css"), tempDir);

        assertEquals(List.of(" ", ""), report.unreadable());
        assertEquals(1, report.analyzedCount());
        assertEquals("base.css",
                report.outcomes().get(0).result().dependenciesSummary());
    }

    @Test
    void whenAnalyzingFiles_givenAbsolutePath_shouldIgnoreBaseDirectory()
            throws IOException {
        final Path file = tempDir.resolve("abs.css");
        Files.writeString(file, "@import 'x.css';");

        final BatchReport report = service.analyzeFiles(
                List.of(file.toString()), Path.of("/does/not/exist"));

        assertEquals(1, report.analyzedCount());
        assertEquals(file.toString(), report.outcomes().get(0).path());
    }

    @Test
    void whenAnalyzingFiles_givenTwoBatches_shouldUseDistinctRuns()
            throws IOException {
        Files.writeString(tempDir.resolve("a.css"), "");

        final BatchReport first = service.analyzeFiles(List.of("a.css"), tempDir);
        final BatchReport second = service.analyzeFiles(List.of("a.css"), tempDir);

        assertNotEquals(first.runId(), second.runId());
    }

    @Test
    void whenAnalyzingFiles_givenNoPaths_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> service.analyzeFiles(List.of(), tempDir));
    }

}
