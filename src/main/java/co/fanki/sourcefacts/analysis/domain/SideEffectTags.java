package co.fanki.sourcefacts.analysis.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Side-effect categories detected in one source unit.
 *
 * <p>Two states must never be confused: a unit that was analyzed and matched
 * nothing is {@link #isPure() pure}, while a unit that was never analyzed
 * (structured data, failed analysis) has no verdict at all.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SideEffectTags {

    private static final SideEffectTags NOT_ANALYZED = new SideEffectTags(
            false, Collections.emptySortedSet());

    private final boolean analyzed;
    private final SortedSet<String> tags;

    private SideEffectTags(final boolean isAnalyzed,
            final SortedSet<String> theTags) {
        this.analyzed = isAnalyzed;
        this.tags = theTags;
    }

    /**
     * Returns the "no verdict" value.
     *
     * @return the not-analyzed tags
     */
    public static SideEffectTags notAnalyzed() {
        return NOT_ANALYZED;
    }

    /**
     * Creates the verdict of an analysis.
     *
     * @param tags the detected {@code CATEGORY} or {@code CATEGORY:detail}
     *             tags, may be empty
     * @return the analyzed tags
     */
    public static SideEffectTags of(final Collection<String> tags) {
        final SortedSet<String> copy = new TreeSet<>();
        for (final String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                copy.add(tag);
            }
        }
        return new SideEffectTags(true, Collections.unmodifiableSortedSet(copy));
    }

    /**
     * Whether the unit was analyzed for side effects at all.
     *
     * @return true if there is a verdict
     */
    public boolean isAnalyzed() {
        return analyzed;
    }

    /**
     * Whether the unit was analyzed and matched no category.
     *
     * @return true if pure
     */
    public boolean isPure() {
        return analyzed && tags.isEmpty();
    }

    /**
     * Returns the sorted tags.
     *
     * @return the tags, empty when pure or not analyzed
     */
    public SortedSet<String> tags() {
        return tags;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SideEffectTags)) {
            return false;
        }
        final SideEffectTags that = (SideEffectTags) other;
        return analyzed == that.analyzed && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(analyzed, tags);
    }

    @Override
    public String toString() {
        return CategorySerializer.render(this);
    }

}
