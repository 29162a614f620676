package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.Preconditions;

import java.util.Optional;

/**
 * What the dispatcher hands back for one source unit.
 *
 * <p>The result is always present, possibly empty. The diagnostic is set when
 * the unit could not be analyzed fully and says why, for logging.</p>
 *
 * @param path the path of the unit
 * @param language the language the unit was routed as
 * @param result the best-effort facts
 * @param diagnostic the failure description, null when analysis succeeded
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisOutcome(
        String path,
        Language language,
        AnalysisResult result,
        String diagnostic) {

    /**
     * Creates a new outcome.
     *
     * @param path the path, cannot be blank
     * @param language the language, cannot be null
     * @param result the result, cannot be null
     * @param diagnostic the diagnostic, may be null
     */
    public AnalysisOutcome {
        Preconditions.requireNonBlank(path, "Path cannot be blank");
        Preconditions.requireNonNull(language, "Language cannot be null");
        Preconditions.requireNonNull(result, "Result cannot be null");
    }

    public static AnalysisOutcome success(final String path,
            final Language language, final AnalysisResult result) {
        return new AnalysisOutcome(path, language, result, null);
    }

    public static AnalysisOutcome failure(final String path,
            final Language language, final String diagnostic) {
        return new AnalysisOutcome(path, language, AnalysisResult.empty(),
                Preconditions.requireNonBlank(diagnostic,
                        "Diagnostic cannot be blank"));
    }

    public boolean hasDiagnostic() {
        return diagnostic != null;
    }

    public Optional<String> diagnosticMessage() {
        return Optional.ofNullable(diagnostic);
    }

}
