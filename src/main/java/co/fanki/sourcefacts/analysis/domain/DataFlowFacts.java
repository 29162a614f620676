package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.Preconditions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Data-flow and state-management facts of one source unit.
 *
 * <p>Facts are grouped by {@link FactCategory} and, inside a category, by an
 * optional label. A labeled group renders as {@code label=[a, b]}; unlabeled
 * items render as they are. Every group is a sorted set, so the structure is
 * duplicate free by construction.</p>
 *
 * <p>The ECMAScript front end fills the eight classic sets (globals written
 * and read, DOM created, queried and modified, event listeners, storage
 * operations and shared state); the other front ends add their own labeled
 * groups.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DataFlowFacts {

    /** Label for the unlabeled items of a category. */
    public static final String UNLABELED = "";

    public static final String WRITE = "write";
    public static final String READ = "read";
    public static final String CREATE = "create";
    public static final String QUERY = "query";
    public static final String MODIFY = "modify";

    private static final DataFlowFacts EMPTY = new Builder().build();

    private final Map<FactCategory, SortedMap<String, SortedSet<String>>> groups;

    private DataFlowFacts(
            final Map<FactCategory, SortedMap<String, SortedSet<String>>> theGroups) {
        final Map<FactCategory, SortedMap<String, SortedSet<String>>> copy =
                new EnumMap<>(FactCategory.class);
        theGroups.forEach((category, labels) -> {
            final SortedMap<String, SortedSet<String>> labelCopy = new TreeMap<>();
            labels.forEach((label, items) -> {
                if (!items.isEmpty()) {
                    labelCopy.put(label, Collections.unmodifiableSortedSet(
                            new TreeSet<>(items)));
                }
            });
            if (!labelCopy.isEmpty()) {
                copy.put(category, Collections.unmodifiableSortedMap(labelCopy));
            }
        });
        this.groups = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns facts with no items at all.
     *
     * @return the empty facts
     */
    public static DataFlowFacts empty() {
        return EMPTY;
    }

    /**
     * Creates a new builder.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the items of one labeled group.
     *
     * @param category the category
     * @param label the label, {@link #UNLABELED} for plain items
     * @return the sorted items, empty if the group does not exist
     */
    public SortedSet<String> items(final FactCategory category,
            final String label) {
        final SortedMap<String, SortedSet<String>> labels = groups.get(category);
        if (labels == null) {
            return Collections.emptySortedSet();
        }
        return labels.getOrDefault(label, Collections.emptySortedSet());
    }

    /**
     * Returns every non-empty group, keyed by category in rendering order.
     *
     * @return an unmodifiable view of the groups
     */
    public Map<FactCategory, SortedMap<String, SortedSet<String>>> groups() {
        return groups;
    }

    /**
     * Whether no category holds any item.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public SortedSet<String> globalsWritten() {
        return items(FactCategory.GLOBALS, WRITE);
    }

    public SortedSet<String> globalsRead() {
        return items(FactCategory.GLOBALS, READ);
    }

    public SortedSet<String> domCreated() {
        return items(FactCategory.DOM, CREATE);
    }

    public SortedSet<String> domQueried() {
        return items(FactCategory.DOM, QUERY);
    }

    public SortedSet<String> domModified() {
        return items(FactCategory.DOM, MODIFY);
    }

    public SortedSet<String> eventListeners() {
        return items(FactCategory.EVENTS, UNLABELED);
    }

    public SortedSet<String> storageOps() {
        return items(FactCategory.STORAGE, UNLABELED);
    }

    public SortedSet<String> sharedState() {
        return items(FactCategory.SHARED_STATE, UNLABELED);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DataFlowFacts)) {
            return false;
        }
        return groups.equals(((DataFlowFacts) other).groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return CategorySerializer.render(this);
    }

    /**
     * Accumulates facts while a front end walks a source unit.
     *
     * <p>Not thread safe; one builder belongs to one analysis call.</p>
     */
    public static final class Builder {

        private final Map<FactCategory, SortedMap<String, SortedSet<String>>> groups =
                new EnumMap<>(FactCategory.class);

        private Builder() {
        }

        /**
         * Adds an unlabeled item.
         *
         * @param category the category
         * @param item the item, blank items are ignored
         * @return this builder
         */
        public Builder add(final FactCategory category, final String item) {
            return add(category, UNLABELED, item);
        }

        /**
         * Adds an item to a labeled group.
         *
         * @param category the category
         * @param label the group label
         * @param item the item, blank items are ignored
         * @return this builder
         */
        public Builder add(final FactCategory category, final String label,
                final String item) {
            Preconditions.requireNonNull(category, "Category cannot be null");
            Preconditions.requireNonNull(label, "Label cannot be null");
            if (item == null || item.isBlank()) {
                return this;
            }
            groups.computeIfAbsent(category, c -> new TreeMap<>())
                    .computeIfAbsent(label, l -> new TreeSet<>())
                    .add(item);
            return this;
        }

        /**
         * Adds every item of another facts value.
         *
         * @param other the facts to merge in
         * @return this builder
         */
        public Builder merge(final DataFlowFacts other) {
            other.groups.forEach((category, labels) ->
                    labels.forEach((label, items) ->
                            items.forEach(item -> add(category, label, item))));
            return this;
        }

        public Builder globalWritten(final String name) {
            return add(FactCategory.GLOBALS, WRITE, name);
        }

        public Builder globalRead(final String name) {
            return add(FactCategory.GLOBALS, READ, name);
        }

        public Builder domCreated(final String tag) {
            return add(FactCategory.DOM, CREATE, tag);
        }

        public Builder domQueried(final String selector) {
            return add(FactCategory.DOM, QUERY, selector);
        }

        public Builder domModified(final String operation) {
            return add(FactCategory.DOM, MODIFY, operation);
        }

        public Builder eventListener(final String listener) {
            return add(FactCategory.EVENTS, listener);
        }

        public Builder storageOp(final String operation) {
            return add(FactCategory.STORAGE, operation);
        }

        public Builder sharedState(final String entry) {
            return add(FactCategory.SHARED_STATE, entry);
        }

        /**
         * Builds the immutable facts.
         *
         * @return the facts
         */
        public DataFlowFacts build() {
            return new DataFlowFacts(groups);
        }
    }

}
