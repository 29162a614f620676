package co.fanki.sourcefacts.config;

import co.fanki.sourcefacts.analysis.domain.AnalysisDispatcher;
import co.fanki.sourcefacts.analysis.domain.SourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.SourceSanitizer;
import co.fanki.sourcefacts.analysis.domain.csharp.CSharpSourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.csharp.HeuristicLimits;
import co.fanki.sourcefacts.analysis.domain.ecmascript.EcmaScriptSourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.markup.HtmlDocumentAnalyzer;
import co.fanki.sourcefacts.analysis.domain.markup.JsonDocumentAnalyzer;
import co.fanki.sourcefacts.analysis.domain.markup.StylesheetAnalyzer;
import co.fanki.sourcefacts.analysis.domain.python.InterpreterLocator;
import co.fanki.sourcefacts.analysis.domain.python.PythonSourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.python.PythonVisitorService;
import co.fanki.sourcefacts.analysis.domain.python.SubprocessPythonVisitor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the front ends and the dispatcher.
 *
 * <p>Every tunable comes from {@code application.yml} under the
 * {@code analyzer.} prefix, with the defaults written next to each
 * {@code @Value}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalyzerConfiguration {

    @Bean
    public SourceSanitizer sourceSanitizer(
            @Value("${analyzer.pragmas:target,include,includepath}")
            final List<String> pragmas) {
        return new SourceSanitizer(pragmas);
    }

    @Bean
    public HeuristicLimits heuristicLimits(
            @Value("${analyzer.heuristic.max-line-length:500}") final int maxLineLength,
            @Value("${analyzer.heuristic.max-paren-depth:5}") final int maxParenDepth,
            @Value("${analyzer.heuristic.paren-window:200}") final int parenWindow,
            @Value("${analyzer.heuristic.max-call-matches:10000}") final int maxCallMatches,
            @Value("${analyzer.heuristic.max-scan-matches:5000}") final int maxScanMatches,
            @Value("${analyzer.heuristic.max-close-paren-steps:50000}") final int maxCloseParenSteps,
            @Value("${analyzer.heuristic.max-name-segments:5}") final int maxNameSegments,
            @Value("${analyzer.heuristic.max-generic-length:100}") final int maxGenericLength) {
        return new HeuristicLimits(maxLineLength, maxParenDepth, parenWindow,
                maxCallMatches, maxScanMatches, maxCloseParenSteps,
                maxNameSegments, maxGenericLength);
    }

    @Bean
    public InterpreterLocator interpreterLocator(
            @Value("${analyzer.python.candidates:python3,python}")
            final List<String> candidates,
            @Value("${analyzer.python.probe-timeout-seconds:10}")
            final long probeTimeoutSeconds) {
        return new InterpreterLocator(candidates, probeTimeoutSeconds);
    }

    @Bean
    public PythonVisitorService pythonVisitorService(
            @Value("${analyzer.python.timeout-seconds:60}")
            final long timeoutSeconds) {
        return new SubprocessPythonVisitor(timeoutSeconds);
    }

    /**
     * Creates the dispatcher over every front end.
     *
     * @param sanitizer the shared sanitizer
     * @param limits the heuristic caps
     * @param locator finds the Python interpreter
     * @param visitor runs the Python visitor
     * @return the dispatcher
     */
    @Bean
    public AnalysisDispatcher analysisDispatcher(
            final SourceSanitizer sanitizer,
            final HeuristicLimits limits,
            final InterpreterLocator locator,
            final PythonVisitorService visitor) {
        final List<SourceAnalyzer> analyzers = List.of(
                new EcmaScriptSourceAnalyzer(sanitizer),
                new CSharpSourceAnalyzer(sanitizer, limits),
                new PythonSourceAnalyzer(locator, visitor),
                new StylesheetAnalyzer(),
                new JsonDocumentAnalyzer(),
                new HtmlDocumentAnalyzer());
        return new AnalysisDispatcher(analyzers);
    }

}
