package co.fanki.sourcefacts.analysis.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Renders facts into the canonical, deterministic strings persisted by
 * callers.
 *
 * <p>Format: {@code Category{item1; item2}}, categories joined by
 * {@code " | "} in {@link FactCategory} declaration order. Items inside a
 * category are deduplicated and sorted; a labeled group is one item written
 * as {@code label=[a, b]}. Empty categories are omitted. Side effects are the
 * exception: an analyzed unit with no tags renders as {@value #PURE}.</p>
 *
 * <p>Examples: {@code Globals{write=[x, y]} | Storage{read=[open]}},
 * {@code SideEffects{FILE:write; LOG:print}}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CategorySerializer {

    /** The marker of an analyzed unit without side effects. */
    public static final String PURE = "PURE";

    private static final String CATEGORY_SEPARATOR = " | ";
    private static final String ITEM_SEPARATOR = "; ";
    private static final String LIST_SEPARATOR = ", ";
    private static final String SEQUENCE_SEPARATOR = " -> ";

    private CategorySerializer() {
        // Utility class, not instantiable
    }

    /**
     * Renders data-flow facts.
     *
     * @param facts the facts
     * @return the canonical string, empty when there are no facts
     */
    public static String render(final DataFlowFacts facts) {
        final List<String> segments = new ArrayList<>();
        for (final Map.Entry<FactCategory, SortedMap<String, SortedSet<String>>> entry
                : facts.groups().entrySet()) {
            final List<String> items = new ArrayList<>();
            entry.getValue().forEach((label, values) -> {
                if (DataFlowFacts.UNLABELED.equals(label)) {
                    items.addAll(values);
                } else {
                    items.add(label + "=[" + String.join(LIST_SEPARATOR, values) + "]");
                }
            });
            appendSegment(segments, entry.getKey().displayName(), items);
        }
        return String.join(CATEGORY_SEPARATOR, segments);
    }

    /**
     * Renders I/O facts as {@code Inputs{..} | Outputs{..}}.
     *
     * @param facts the facts
     * @return the canonical string, empty when there are no facts
     */
    public static String render(final IoFacts facts) {
        final List<String> segments = new ArrayList<>();
        appendSegment(segments, "Inputs", facts.inputs());
        appendSegment(segments, "Outputs", facts.outputs());
        return String.join(CATEGORY_SEPARATOR, segments);
    }

    /**
     * Renders side-effect tags.
     *
     * @param tags the tags
     * @return {@code SideEffects{..}}, {@value #PURE} when analyzed and empty,
     *         or an empty string when not analyzed
     */
    public static String render(final SideEffectTags tags) {
        if (!tags.isAnalyzed()) {
            return "";
        }
        if (tags.isPure()) {
            return PURE;
        }
        final List<String> segments = new ArrayList<>();
        appendSegment(segments, "SideEffects", tags.tags());
        return String.join(CATEGORY_SEPARATOR, segments);
    }

    /**
     * Renders a set-like collection: deduplicated, sorted, joined by
     * {@code "; "}.
     *
     * @param values the values, e.g. function names or dependencies
     * @return the joined values
     */
    public static String renderSet(final Collection<String> values) {
        return String.join(ITEM_SEPARATOR, new TreeSet<>(values));
    }

    /**
     * Renders an ordered sequence as is, joined by {@code " -> "}.
     *
     * @param values the values, e.g. the call order
     * @return the joined values
     */
    public static String renderSequence(final List<String> values) {
        return String.join(SEQUENCE_SEPARATOR, values);
    }

    private static void appendSegment(final List<String> segments,
            final String name, final Collection<String> items) {
        final TreeSet<String> sorted = new TreeSet<>(items);
        if (sorted.isEmpty()) {
            return;
        }
        segments.add(name + "{" + String.join(ITEM_SEPARATOR, sorted) + "}");
    }

}
