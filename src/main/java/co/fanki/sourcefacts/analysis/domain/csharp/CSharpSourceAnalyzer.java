package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.Language;
import co.fanki.sourcefacts.analysis.domain.SourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.SourceSanitizer;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;
import co.fanki.sourcefacts.shared.Preconditions;

import java.util.ArrayList;
import java.util.Set;

/**
 * C# implementation of {@link SourceAnalyzer}, built on bounded regular
 * expression scans instead of a parser.
 *
 * <p>The source is first stripped of comments and string contents, keeping
 * every line break and column, so that nothing inside a literal is mistaken
 * for code. Every scan is capped by {@link HeuristicLimits}; a capped match
 * is dropped and the scan goes on.</p>
 *
 * <p>Known approximations: a constructor chained with {@code : base(...)}
 * shows up in the call order under its own name, and {@code x.y += ...} on
 * a plain field is read as an event subscription.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CSharpSourceAnalyzer extends SourceAnalyzer {

    private final SourceSanitizer sanitizer;

    private final CSharpDeclarationScanner declarations;

    private final CSharpCallScanner calls;

    private final CSharpApiCatalog catalog;

    /**
     * Creates a new analyzer.
     *
     * @param theSanitizer the comment and string stripper
     * @param theLimits the scan caps
     */
    public CSharpSourceAnalyzer(final SourceSanitizer theSanitizer,
            final HeuristicLimits theLimits) {
        this.sanitizer = Preconditions.requireNonNull(theSanitizer,
                "Sanitizer cannot be null");
        Preconditions.requireNonNull(theLimits, "Limits cannot be null");
        this.declarations = new CSharpDeclarationScanner(theLimits);
        this.calls = new CSharpCallScanner(theLimits);
        this.catalog = new CSharpApiCatalog(theLimits);
    }

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.CSHARP);
    }

    /** {@inheritDoc} */
    @Override
    protected AnalysisResult extract(final SourceUnit unit,
            final AnalysisRunContext context) {
        final String code = sanitizer.stripComments(unit.rawText(), true);

        final Set<String> usings = declarations.usings(code);
        final CSharpApiUsage usage = catalog.scan(code);

        return new AnalysisResult(
                new ArrayList<>(declarations.functions(code)),
                calls.callOrder(code),
                new ArrayList<>(usings),
                usage.dataFlow(usings),
                usage.io(),
                usage.sideEffects());
    }

}
