package co.fanki.sourcefacts.analysis.application;

import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;
import co.fanki.sourcefacts.analysis.domain.AnalysisResult;

/**
 * The rendered facts of one source unit, one field per persisted cell.
 *
 * @param path the path of the unit
 * @param language the language it was routed as
 * @param functions the function names, joined by {@code "; "}
 * @param callOrder the call order, joined by {@code " -> "}
 * @param dependencies the dependencies, joined by {@code "; "}
 * @param dataFlow the canonical data-flow string
 * @param io the canonical I/O string
 * @param sideEffects the canonical side-effect string
 * @param diagnostic why the unit came back empty, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisResponse(
        String path,
        String language,
        String functions,
        String callOrder,
        String dependencies,
        String dataFlow,
        String io,
        String sideEffects,
        String diagnostic) {

    /**
     * Renders an outcome.
     *
     * @param outcome the dispatcher outcome
     * @return the response
     */
    public static AnalysisResponse from(final AnalysisOutcome outcome) {
        final AnalysisResult result = outcome.result();
        return new AnalysisResponse(
                outcome.path(),
                outcome.language().name(),
                result.functionsSummary(),
                result.callOrderSummary(),
                result.dependenciesSummary(),
                result.dataFlowSummary(),
                result.ioSummary(),
                result.sideEffectsSummary(),
                outcome.diagnostic());
    }

}
