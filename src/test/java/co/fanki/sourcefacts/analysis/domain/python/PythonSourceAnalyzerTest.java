package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.analysis.domain.AnalysisDispatcher;
import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;
import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Path;
import java.util.List;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PythonSourceAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonSourceAnalyzerTest {

    private InterpreterLocator locator;
    private PythonVisitorService visitor;

    private PythonSourceAnalyzer analyzer;

    private AnalysisRunContext context;

    @BeforeEach
    void setUp() {
        locator = createMock(InterpreterLocator.class);
        visitor = createMock(PythonVisitorService.class);
        analyzer = new PythonSourceAnalyzer(locator, visitor);
        context = AnalysisRunContext.open();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void whenAnalyzing_givenSamePathTwice_shouldVisitOnce() {
        final SourceUnit unit = SourceUnit.of("pkg/app.py", "x = 1");
        final AnalysisResult visited = new AnalysisResult(List.of("main"),
                List.of(), List.of(), null, null, null);

        expect(locator.locate()).andReturn("python3").once();
        expect(visitor.visit("python3", unit.absolutePath(), "x = 1"))
                .andReturn(visited).once();
        replay(locator, visitor);

        assertSame(visited, analyzer.analyze(unit, context));
        assertSame(visited, analyzer.analyze(unit, context));

        verify(locator, visitor);
    }

    @Test
    void whenAnalyzing_givenFailedVisit_shouldNotCacheTheFailure() {
        final SourceUnit unit = SourceUnit.of("pkg/app.py", "x = 1");
        final AnalysisResult visited = AnalysisResult.empty();

        expect(locator.locate()).andReturn("python3").once();
        expect(visitor.visit(eq("python3"), anyObject(Path.class), anyString()))
                .andThrow(new SubprocessFailureException("flaky"));
        expect(visitor.visit(eq("python3"), anyObject(Path.class), anyString()))
                .andReturn(visited);
        replay(locator, visitor);

        assertThrows(SubprocessFailureException.class,
                () -> analyzer.analyze(unit, context));
        assertSame(visited, analyzer.analyze(unit, context));

        verify(locator, visitor);
    }

    @Test
    void whenAnalyzing_givenNoInterpreter_shouldFailEveryFileWithoutProbingAgain() {
        expect(locator.locate()).andThrow(
                new InterpreterNotFoundException("none")).once();
        replay(locator, visitor);

        assertThrows(InterpreterNotFoundException.class,
                () -> analyzer.analyze(SourceUnit.of("a.py", ""), context));
        assertThrows(InterpreterNotFoundException.class,
                () -> analyzer.analyze(SourceUnit.of("b.py", ""), context));

        verify(locator, visitor);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void whenDispatchingBatch_givenNonJsonForOneFile_shouldReportAndContinue() {
        expect(locator.locate()).andReturn("/bin/sh").once();
        replay(locator);

        final PythonSourceAnalyzer shellBacked = new PythonSourceAnalyzer(locator,
                new SubprocessPythonVisitor("""
                        cat > /dev/null
                        case "$0" in
                          *broken.py) echo 'this is not json' ;;
                          *) printf '{"functions":["ok"],"side_effects":[]}' ;;
                        esac
                        """, 10));
        final AnalysisDispatcher dispatcher = new AnalysisDispatcher(
                List.of(shellBacked));

        final AnalysisOutcome broken = dispatcher.dispatch("broken.py", "x = 1",
                "", context);
        final AnalysisOutcome fine = dispatcher.dispatch("fine.py", "y = 2",
                "", context);

        assertTrue(broken.hasDiagnostic());
        assertTrue(broken.diagnostic().startsWith("SUBPROCESS_FAILURE"));
        assertSame(AnalysisResult.empty(), broken.result());
        assertFalse(fine.hasDiagnostic());
        assertEquals(List.of("ok"), fine.result().functions());
        assertEquals("PURE", fine.result().sideEffectsSummary());

        verify(locator);
    }

    @Test
    void whenAnalyzing_givenWrongLanguage_shouldReject() {
        replay(locator, visitor);

        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(SourceUnit.of("a.js", ""), context));
    }

}
