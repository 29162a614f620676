package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.analysis.domain.AnalysisResult;
import co.fanki.sourcefacts.analysis.domain.DataFlowFacts;
import co.fanki.sourcefacts.analysis.domain.FactCategory;
import co.fanki.sourcefacts.analysis.domain.IoFacts;
import co.fanki.sourcefacts.analysis.domain.SideEffectTags;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The JSON object the visitor program writes to stdout.
 *
 * <p>{@code data_flow} maps a category display name to labels to items;
 * the empty label holds unlabeled items. Summaries are rendered on this
 * side so that every front end shares one serializer.</p>
 *
 * @param functions the class-qualified function names
 * @param callOrder the flattened callee chains, in visit order
 * @param dependencies the imported modules
 * @param dataFlow category to label to items
 * @param ioSummary the inputs and outputs
 * @param sideEffects the side-effect tags
 * @param error set when the visitor could not analyze the unit
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisitorResponse(
        List<String> functions,
        @JsonProperty("call_order") List<String> callOrder,
        List<String> dependencies,
        @JsonProperty("data_flow") Map<String, Map<String, List<String>>> dataFlow,
        @JsonProperty("io_summary") IoSummary ioSummary,
        @JsonProperty("side_effects") List<String> sideEffects,
        String error
) {

    private static final Logger LOG = LoggerFactory.getLogger(
            VisitorResponse.class);

    /**
     * The inputs and outputs reported by the visitor.
     *
     * @param inputs the input touchpoints
     * @param outputs the output touchpoints
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IoSummary(List<String> inputs, List<String> outputs) {}

    /**
     * Whether the visitor reported an error.
     *
     * @return true when the error field is present
     */
    public boolean hasError() {
        return error != null;
    }

    /**
     * Converts the payload into facts.
     *
     * @return the result
     */
    public AnalysisResult toResult() {
        final DataFlowFacts.Builder flow = DataFlowFacts.builder();
        if (dataFlow != null) {
            dataFlow.forEach((categoryName, labels) -> {
                final Optional<FactCategory> category =
                        FactCategory.fromDisplayName(categoryName);
                if (category.isEmpty()) {
                    LOG.debug("Ignoring unknown data-flow category {}",
                            categoryName);
                    return;
                }
                if (labels != null) {
                    labels.forEach((label, items) -> {
                        if (items != null) {
                            items.forEach(item -> flow.add(category.get(),
                                    label == null ? DataFlowFacts.UNLABELED : label,
                                    item));
                        }
                    });
                }
            });
        }

        final IoFacts io = ioSummary == null
                ? IoFacts.empty()
                : IoFacts.of(orEmpty(ioSummary.inputs()),
                        orEmpty(ioSummary.outputs()));
        final SideEffectTags tags = sideEffects == null
                ? SideEffectTags.notAnalyzed()
                : SideEffectTags.of(sideEffects);

        return new AnalysisResult(functions, callOrder, dependencies,
                flow.build(), io, tags);
    }

    private static List<String> orEmpty(final List<String> values) {
        return values == null ? List.of() : values;
    }

}
