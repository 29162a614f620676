package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Abstract front end turning one {@link SourceUnit} into raw facts.
 *
 * <p>Each language family has its own way of getting at the facts: a real
 * parser, a bounded heuristic scan, or a visitor running in another process.
 * Subclasses implement {@link #extract(SourceUnit, AnalysisRunContext)};
 * this class provides the template method
 * {@link #analyze(SourceUnit, AnalysisRunContext)} that validates the input
 * and logs what came out.</p>
 *
 * <p>Front ends report per-file problems by throwing
 * {@link AnalysisException}; degrading them into an empty result is the
 * dispatcher's job.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceAnalyzer.class);

    /**
     * Returns the languages this front end accepts.
     *
     * @return the supported languages, never empty
     */
    public abstract Set<Language> languages();

    /**
     * Extracts the facts of one unit.
     *
     * @param unit the source unit
     * @param context the current run
     * @return the raw facts
     * @throws AnalysisException if the unit cannot be analyzed
     */
    protected abstract AnalysisResult extract(SourceUnit unit,
            AnalysisRunContext context);

    /**
     * Analyzes one source unit.
     *
     * <p>Template method: checks that the unit belongs to this front end,
     * delegates to {@link #extract(SourceUnit, AnalysisRunContext)} and logs
     * a short summary of the result.</p>
     *
     * @param unit the source unit
     * @param context the current run
     * @return the facts, never null
     * @throws AnalysisException if the unit cannot be analyzed
     */
    public AnalysisResult analyze(final SourceUnit unit,
            final AnalysisRunContext context) {
        Preconditions.requireNonNull(unit, "Source unit cannot be null");
        Preconditions.requireNonNull(context, "Run context cannot be null");
        Preconditions.require(languages().contains(unit.language()),
                "Cannot analyze " + unit.language() + " with "
                        + getClass().getSimpleName());

        final long start = System.nanoTime();
        final AnalysisResult result = extract(unit, context);
        final long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        LOG.debug("Analyzed {} in {} ms: {} functions, {} calls, "
                        + "{} dependencies",
                unit.path(), elapsedMillis, result.functions().size(),
                result.callOrder().size(), result.dependencies().size());
        return result;
    }

}
