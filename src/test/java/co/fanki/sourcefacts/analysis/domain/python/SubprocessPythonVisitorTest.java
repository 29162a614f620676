package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link SubprocessPythonVisitor}.
 *
 * <p>The protocol tests run {@code /bin/sh} as the interpreter: it takes the
 * program with {@code -c} and receives the file path as {@code $0}, exactly
 * as Python would.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class SubprocessPythonVisitorTest {

    private static final String SHELL = "/bin/sh";

    private static final Path FILE = Path.of("/tmp/sample.py");

    @Test
    void whenVisiting_givenValidJson_shouldConvertToResult() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor("""
                cat > /dev/null
                printf '%s' '{"functions":["b","a"],"call_order":["x","y","x"],\
                "dependencies":["os"],"data_flow":{"Globals":{"write":["n"]}},\
                "io_summary":{"inputs":[],"outputs":["LOG:print"]},\
                "side_effects":["LOG:print"],"extra":1}'
                """, 10);

        final AnalysisResult result = visitor.visit(SHELL, FILE, "print(1)");

        assertEquals(List.of("a", "b"), result.functions());
        assertEquals("x -> y -> x", result.callOrderSummary());
        assertEquals("Globals{write=[n]}", result.dataFlowSummary());
        assertEquals("Outputs{LOG:print}", result.ioSummary());
        assertEquals("SideEffects{LOG:print}", result.sideEffectsSummary());
    }

    @Test
    void whenVisiting_givenNonJsonOutputAndZeroExit_shouldThrowSubprocessFailure() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "cat > /dev/null; echo 'Traceback: not json'", 10);

        final SubprocessFailureException e = assertThrows(
                SubprocessFailureException.class,
                () -> visitor.visit(SHELL, FILE, "x = 1"));

        assertTrue(e.getMessage().contains("not a JSON object"));
    }

    @Test
    void whenVisiting_givenNonZeroExit_shouldThrowWithStderr() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "cat > /dev/null; echo boom >&2; exit 3", 10);

        final SubprocessFailureException e = assertThrows(
                SubprocessFailureException.class,
                () -> visitor.visit(SHELL, FILE, "x = 1"));

        assertTrue(e.getMessage().contains("code 3"));
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    void whenVisiting_givenErrorField_shouldThrowWithVisitorMessage() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "cat > /dev/null; printf '{\"error\":\"SyntaxError: bad\"}'", 10);

        final SubprocessFailureException e = assertThrows(
                SubprocessFailureException.class,
                () -> visitor.visit(SHELL, FILE, "x = ("));

        assertTrue(e.getMessage().contains("SyntaxError: bad"));
    }

    @Test
    void whenVisiting_givenHungProcess_shouldTimeOut() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "exec sleep 30", 1);

        assertTimeoutPreemptively(Duration.ofSeconds(15), () -> {
            final SubprocessFailureException e = assertThrows(
                    SubprocessFailureException.class,
                    () -> visitor.visit(SHELL, FILE, "x = 1"));
            assertTrue(e.getMessage().contains("timed out"));
        });
    }

    @Test
    void whenVisiting_givenLargeSourceAndChildNotReadingStdin_shouldTimeOut() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "exec sleep 20", 2);
        final String source = "x = 1\n".repeat(200_000);

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            final SubprocessFailureException e = assertThrows(
                    SubprocessFailureException.class,
                    () -> visitor.visit(SHELL, FILE, source));
            assertTrue(e.getMessage().contains("timed out"));
        });
    }

    @Test
    void whenVisiting_givenPathArgument_shouldPassItAsFirstArgument() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "cat > /dev/null; printf '{\"functions\":[\"%s\"]}' \"$0\"", 10);

        final AnalysisResult result = visitor.visit(SHELL, FILE, "");

        assertEquals(List.of(FILE.toString()), result.functions());
    }

    @Test
    void whenVisiting_givenSource_shouldWriteItToStdin() {
        final SubprocessPythonVisitor visitor = new SubprocessPythonVisitor(
                "printf '{\"functions\":[\"%s\"]}' \"$(cat)\"", 10);

        final AnalysisResult result = visitor.visit(SHELL, FILE, "from_stdin");

        assertEquals(List.of("from_stdin"), result.functions());
    }

    @Test
    void whenVisiting_givenRealInterpreter_shouldExtractPythonFacts(
            @TempDir final Path dir) throws IOException {
        final InterpreterLocator locator = new InterpreterLocator(
                List.of("python3", "python"), 10);
        assumeTrue(locator.isAvailable(), "No Python interpreter installed");

        final String source = """
                import os
                from json import loads

                counter = 0

                class Repo:
                    def save(self, path, data):
                        with open(path, "w") as f:
                            f.write(data)

                def bump():
                    global counter
                    counter += 1
                    print(os.getenv("HOME"))
                """;
        final Path file = dir.resolve("sample.py");
        Files.writeString(file, source);

        final AnalysisResult result = new SubprocessPythonVisitor(60)
                .visit(locator.locate(), file, source);

        assertEquals(List.of("Repo.save", "bump"), result.functions());
        assertEquals("open -> f.write -> print -> os.getenv",
                result.callOrderSummary());
        assertEquals("json.loads; os", result.dependenciesSummary());
        assertEquals("Globals{write=[counter]} | Storage{write=[open]}"
                        + " | Logs{emit=[print]} | Config{read=[os.getenv]}"
                        + " | SharedState{globals=[counter]}",
                result.dataFlowSummary());
        assertEquals("Inputs{CONFIG:os.getenv} | Outputs{FILE:open; LOG:print}",
                result.ioSummary());
        assertEquals("SideEffects{CONFIG:os.getenv; FILE:write; LOG:print;"
                + " STATE:global}", result.sideEffectsSummary());
    }

    @Test
    void whenVisiting_givenDefNestedInMethod_shouldKeepClassQualifier() {
        final InterpreterLocator locator = new InterpreterLocator(
                List.of("python3", "python"), 10);
        assumeTrue(locator.isAvailable(), "No Python interpreter installed");

        final String source = """
                class A:
                    def m(self):
                        def inner():
                            return 1
                        return inner()

                def top():
                    def helper():
                        return 2
                    return helper()
                """;

        final AnalysisResult result = new SubprocessPythonVisitor(60)
                .visit(locator.locate(), FILE, source);

        assertEquals(List.of("A.inner", "A.m", "helper", "top"),
                result.functions());
    }

    @Test
    void whenVisiting_givenJsonLoadsAndJsonLoad_shouldOnlyTreatLoadAsFileRead() {
        final InterpreterLocator locator = new InterpreterLocator(
                List.of("python3", "python"), 10);
        assumeTrue(locator.isAvailable(), "No Python interpreter installed");

        final AnalysisResult parseOnly = new SubprocessPythonVisitor(60)
                .visit(locator.locate(), FILE, """
                        import json
                        settings = json.loads('{"debug": true}')
                        """);
        final AnalysisResult fromFile = new SubprocessPythonVisitor(60)
                .visit(locator.locate(), FILE, """
                        import json
                        def load(f):
                            return json.load(f)
                        """);

        assertTrue(parseOnly.io().inputs().isEmpty());
        assertFalse(parseOnly.sideEffects().tags().contains("FILE:read"));
        assertEquals("Inputs{FILE:json.load}", fromFile.ioSummary());
        assertEquals("SideEffects{FILE:read}", fromFile.sideEffectsSummary());
    }

    @Test
    void whenVisiting_givenRealInterpreterAndSyntaxError_shouldThrow() {
        final InterpreterLocator locator = new InterpreterLocator(
                List.of("python3", "python"), 10);
        assumeTrue(locator.isAvailable(), "No Python interpreter installed");

        assertThrows(SubprocessFailureException.class,
                () -> new SubprocessPythonVisitor(60).visit(locator.locate(),
                        FILE, "x = ("));
    }

    @Test
    void whenCreating_givenNonPositiveTimeout_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new SubprocessPythonVisitor("pass", 0));
    }

}
