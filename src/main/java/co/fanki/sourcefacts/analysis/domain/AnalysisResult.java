package co.fanki.sourcefacts.analysis.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * The normalized bundle of facts extracted from one source unit.
 *
 * <p>Function names and dependencies are stored sorted and duplicate free;
 * the call order keeps source encounter order, duplicates included. A result
 * has no identity beyond the call that produced it.</p>
 *
 * @param functions the declared function names, sorted
 * @param callOrder the callee chains in encounter order
 * @param dependencies the dependency specifiers, sorted
 * @param dataFlow the data-flow facts
 * @param io the input and output touchpoints
 * @param sideEffects the side-effect verdict
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisResult(
        List<String> functions,
        List<String> callOrder,
        List<String> dependencies,
        DataFlowFacts dataFlow,
        IoFacts io,
        SideEffectTags sideEffects) {

    private static final AnalysisResult EMPTY = new AnalysisResult(List.of(),
            List.of(), List.of(), DataFlowFacts.empty(), IoFacts.empty(),
            SideEffectTags.notAnalyzed());

    /**
     * Creates a new result, normalizing every facet.
     *
     * @param functions the function names, any order
     * @param callOrder the call order
     * @param dependencies the dependencies, any order
     * @param dataFlow the data-flow facts, null is read as empty
     * @param io the I/O facts, null is read as empty
     * @param sideEffects the side effects, null is read as not analyzed
     */
    public AnalysisResult {
        functions = sortedUnique(functions);
        callOrder = callOrder == null ? List.of() : List.copyOf(callOrder);
        dependencies = sortedUnique(dependencies);
        dataFlow = dataFlow == null ? DataFlowFacts.empty() : dataFlow;
        io = io == null ? IoFacts.empty() : io;
        sideEffects = sideEffects == null
                ? SideEffectTags.notAnalyzed() : sideEffects;
    }

    /**
     * Returns the all-empty result used when a unit cannot be analyzed.
     *
     * @return the empty result
     */
    public static AnalysisResult empty() {
        return EMPTY;
    }

    /**
     * Renders the function names, joined by {@code "; "}.
     *
     * @return the functions cell
     */
    public String functionsSummary() {
        return CategorySerializer.renderSet(functions);
    }

    /**
     * Renders the call order, joined by {@code " -> "}.
     *
     * @return the call order cell
     */
    public String callOrderSummary() {
        return CategorySerializer.renderSequence(callOrder);
    }

    /**
     * Renders the dependencies, joined by {@code "; "}.
     *
     * @return the dependencies cell
     */
    public String dependenciesSummary() {
        return CategorySerializer.renderSet(dependencies);
    }

    public String dataFlowSummary() {
        return CategorySerializer.render(dataFlow);
    }

    public String ioSummary() {
        return CategorySerializer.render(io);
    }

    public String sideEffectsSummary() {
        return CategorySerializer.render(sideEffects);
    }

    private static List<String> sortedUnique(final Collection<String> values) {
        if (values == null) {
            return List.of();
        }
        final TreeSet<String> sorted = new TreeSet<>();
        for (final String value : values) {
            if (value != null && !value.isBlank()) {
                sorted.add(value);
            }
        }
        return List.copyOf(new ArrayList<>(sorted));
    }

}
