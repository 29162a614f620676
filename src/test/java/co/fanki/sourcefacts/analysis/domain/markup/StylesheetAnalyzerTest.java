package co.fanki.sourcefacts.analysis.domain.markup;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link StylesheetAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StylesheetAnalyzerTest {

    private static final String STYLESHEET = """
            @import url("base.css");
            @import 'theme.css';
            :root { --main-color: red; --gap: 4px; }
            .logo { background: url(img/logo.png); }
            .dot { background: url("data:image/png;base64,AAA"); }
            """;

    private final StylesheetAnalyzer analyzer = new StylesheetAnalyzer();

    private AnalysisRunContext context;

    @BeforeEach
    void setUp() {
        context = AnalysisRunContext.open();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void whenAnalyzing_givenImportsAndAssets_shouldReportNonInlineReferences() {
        final AnalysisResult result = analyze(STYLESHEET);

        assertEquals("base.css; img/logo.png; theme.css",
                result.dependenciesSummary());
        assertEquals("Inputs{FILE:@import(base.css); FILE:@import(theme.css); "
                + "FILE:url(base.css); FILE:url(img/logo.png)}",
                result.ioSummary());
    }

    @Test
    void whenAnalyzing_givenStylesheet_shouldDescribeItsShape() {
        final AnalysisResult result = analyze(STYLESHEET);

        assertEquals("CSS{assets=[base.css, data:image/png;base64,AAA, "
                + "img/logo.png]; customProps=[gap, main-color]; "
                + "imports=[base.css, theme.css]; rules=3}",
                result.dataFlowSummary());
    }

    @Test
    void whenAnalyzing_givenStylesheet_shouldLeaveSideEffectsUnanalyzed() {
        final AnalysisResult result = analyze(STYLESHEET);

        assertEquals("", result.sideEffectsSummary());
        assertEquals(List.of(), result.functions());
        assertEquals(List.of(), result.callOrder());
    }

    @Test
    void whenAnalyzing_givenEmptyStylesheet_shouldOnlyCountRules() {
        final AnalysisResult result = analyze("");

        assertEquals("CSS{rules=0}", result.dataFlowSummary());
        assertEquals("", result.dependenciesSummary());
        assertEquals("", result.ioSummary());
    }

    private AnalysisResult analyze(final String text) {
        return analyzer.analyze(SourceUnit.of("styles/app.css", text), context);
    }

}
