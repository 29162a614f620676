package co.fanki.sourcefacts.analysis.application;

import co.fanki.sourcefacts.analysis.domain.AnalysisOutcome;

import java.util.List;

/**
 * The outcome of one batch run.
 *
 * @param runId the id of the run, as logged
 * @param outcomes one outcome per readable file, in request order
 * @param unreadable the paths that could not be read and were skipped
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BatchReport(
        String runId,
        List<AnalysisOutcome> outcomes,
        List<String> unreadable) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
        unreadable = List.copyOf(unreadable);
    }

    /**
     * Counts the files analyzed without a diagnostic.
     *
     * @return the number of clean outcomes
     */
    public long analyzedCount() {
        return outcomes.stream().filter(o -> !o.hasDiagnostic()).count();
    }

    /**
     * Counts the files that came back empty with a diagnostic.
     *
     * @return the number of degraded outcomes
     */
    public long degradedCount() {
        return outcomes.stream().filter(AnalysisOutcome::hasDiagnostic).count();
    }

}
