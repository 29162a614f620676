package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.AnalysisException;
import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes each source unit to the front end of its language.
 *
 * <p>This is the only place where per-file failures are degraded: an
 * {@link AnalysisException} thrown by a front end becomes an empty result
 * plus a diagnostic, logged once at warn level. Units of an unknown
 * language get the same treatment without reaching any front end.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisDispatcher.class);

    /** The diagnostic of units nobody can analyze. */
    public static final String UNSUPPORTED_LANGUAGE = "unsupported language";

    private final Map<Language, SourceAnalyzer> analyzers;

    /**
     * Creates a new dispatcher.
     *
     * @param theAnalyzers the front ends, each language claimed at most once
     */
    public AnalysisDispatcher(final List<SourceAnalyzer> theAnalyzers) {
        Preconditions.requireNonEmpty(theAnalyzers,
                "At least one analyzer is required");
        final Map<Language, SourceAnalyzer> routes = new EnumMap<>(
                Language.class);
        for (final SourceAnalyzer analyzer : theAnalyzers) {
            for (final Language language : analyzer.languages()) {
                final SourceAnalyzer previous = routes.put(language, analyzer);
                Preconditions.require(previous == null, "Language " + language
                        + " is claimed by more than one analyzer");
            }
        }
        this.analyzers = Collections.unmodifiableMap(routes);
    }

    /**
     * Returns the languages that can be routed.
     *
     * @return the supported languages
     */
    public Set<Language> supportedLanguages() {
        return analyzers.keySet();
    }

    /**
     * Analyzes one unit, never failing on its content.
     *
     * @param unit the source unit, cannot be null
     * @param context the current run, cannot be null
     * @return the outcome, with an empty result and a diagnostic on failure
     */
    public AnalysisOutcome dispatch(final SourceUnit unit,
            final AnalysisRunContext context) {
        Preconditions.requireNonNull(unit, "Source unit cannot be null");
        Preconditions.requireNonNull(context, "Run context cannot be null");

        final Language language = unit.language();
        final SourceAnalyzer analyzer = analyzers.get(language);
        if (analyzer == null) {
            LOG.warn("Skipping {}: {} '{}'", unit.path(), UNSUPPORTED_LANGUAGE,
                    unit.languageTag());
            return AnalysisOutcome.failure(unit.path(), Language.UNSUPPORTED,
                    UNSUPPORTED_LANGUAGE);
        }

        try {
            return AnalysisOutcome.success(unit.path(), language,
                    analyzer.analyze(unit, context));
        } catch (final AnalysisException e) {
            LOG.warn("Could not analyze {} [{}]: {}", unit.path(),
                    e.getErrorCode(), e.getMessage());
            return AnalysisOutcome.failure(unit.path(), language,
                    e.getErrorCode() + ": " + e.getMessage());
        }
    }

    /**
     * Analyzes raw text.
     *
     * @param path the file path
     * @param text the source text
     * @param languageTag the language tag, blank to use the path extension
     * @param context the current run
     * @return the outcome
     */
    public AnalysisOutcome dispatch(final String path, final String text,
            final String languageTag, final AnalysisRunContext context) {
        return dispatch(new SourceUnit(path, languageTag, text), context);
    }

}
