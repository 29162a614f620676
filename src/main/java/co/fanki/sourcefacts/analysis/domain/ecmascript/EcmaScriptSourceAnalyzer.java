package co.fanki.sourcefacts.analysis.domain.ecmascript;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.AnalysisRunContext;
import co.fanki.sourcefacts.analysis.domain.Language;
import co.fanki.sourcefacts.analysis.domain.SourceAnalyzer;
import co.fanki.sourcefacts.analysis.domain.SourceSanitizer;
import co.fanki.sourcefacts.analysis.domain.SourceUnit;
import co.fanki.sourcefacts.analysis.domain.ecmascript.DataFlowCollector.ScopedFacts;
import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.AnalysisException.FailureKind;
import co.fanki.sourcefacts.shared.Preconditions;

import com.google.javascript.rhino.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * ECMAScript implementation of {@link SourceAnalyzer}.
 *
 * <p>Parses the unit once with the Closure Compiler parser and runs every
 * collector over the same tree:</p>
 * <ul>
 *   <li>{@link FunctionCatalogCollector}: declared function names</li>
 *   <li>{@link CallOrderCollector}: callee chains in encounter order</li>
 *   <li>{@link DependencyCollector}: import, require and re-export
 *       specifiers</li>
 *   <li>{@link DataFlowCollector}: scope-aware globals, DOM, events,
 *       storage and shared state</li>
 *   <li>{@link IoCollector} and {@link SideEffectCollector}: table-driven
 *       classification of calls and assignments</li>
 * </ul>
 *
 * <p>Pragma lines are blanked before parsing so host directives such as
 * {@code #target} do not break the parse. Private member names come back
 * from the parser encoded and are reported as {@code #name}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EcmaScriptSourceAnalyzer extends SourceAnalyzer {

    private final SourceSanitizer sanitizer;

    private final ClosureAstParser parser;

    /**
     * Creates a new analyzer.
     *
     * @param theSanitizer the sanitizer used to blank pragma lines
     */
    public EcmaScriptSourceAnalyzer(final SourceSanitizer theSanitizer) {
        this.sanitizer = Preconditions.requireNonNull(theSanitizer,
                "Sanitizer cannot be null");
        this.parser = new ClosureAstParser();
    }

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.ECMASCRIPT);
    }

    /** {@inheritDoc} */
    @Override
    protected AnalysisResult extract(final SourceUnit unit,
            final AnalysisRunContext context) {
        final String code = sanitizer.stripPragmas(unit.rawText());
        final Node root;
        final ScopedFacts scoped;
        try {
            root = parser.parse(unit.path(), code);
            scoped = DataFlowCollector.collect(root);
        } catch (final StackOverflowError e) {
            throw new AnalysisException("Source is too deeply nested: "
                    + unit.path(), FailureKind.PARSE_FAILURE, e);
        }

        return new AnalysisResult(
                decode(new FunctionCatalogCollector().collect(root)),
                decode(new CallOrderCollector().collect(root)),
                new ArrayList<>(new DependencyCollector().collect(root)),
                scoped.dataFlow(),
                new IoCollector().collect(root),
                new SideEffectCollector().collect(root,
                        scoped.moduleStateWritten()));
    }

    private static List<String> decode(final Collection<String> names) {
        final List<String> decoded = new ArrayList<>(names.size());
        for (final String name : names) {
            decoded.add(EcmaScriptPreprocessor.decode(name));
        }
        return decoded;
    }

}
