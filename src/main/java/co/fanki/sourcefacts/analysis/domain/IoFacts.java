package co.fanki.sourcefacts.analysis.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Input and output touchpoints of one source unit.
 *
 * <p>Both sets hold {@code CATEGORY:detail} strings such as
 * {@code FILE:File.ReadAllText()} or {@code LOG:console.log}.</p>
 *
 * @param inputs where data comes from
 * @param outputs where data goes to
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IoFacts(SortedSet<String> inputs, SortedSet<String> outputs) {

    private static final IoFacts EMPTY = new IoFacts(new TreeSet<>(),
            new TreeSet<>());

    /**
     * Creates new I/O facts, copying both sets.
     *
     * @param inputs the inputs, null is read as empty
     * @param outputs the outputs, null is read as empty
     */
    public IoFacts {
        inputs = freeze(inputs);
        outputs = freeze(outputs);
    }

    /**
     * Returns facts with no inputs and no outputs.
     *
     * @return the empty facts
     */
    public static IoFacts empty() {
        return EMPTY;
    }

    /**
     * Creates facts from any two collections.
     *
     * @param inputs the inputs
     * @param outputs the outputs
     * @return the facts
     */
    public static IoFacts of(final Collection<String> inputs,
            final Collection<String> outputs) {
        return new IoFacts(new TreeSet<>(inputs), new TreeSet<>(outputs));
    }

    /**
     * Whether there is neither an input nor an output.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return inputs.isEmpty() && outputs.isEmpty();
    }

    @Override
    public String toString() {
        return CategorySerializer.render(this);
    }

    private static SortedSet<String> freeze(final Collection<String> values) {
        final SortedSet<String> copy = new TreeSet<>();
        if (values != null) {
            for (final String value : values) {
                if (value != null && !value.isBlank()) {
                    copy.add(value);
                }
            }
        }
        return Collections.unmodifiableSortedSet(copy);
    }

}
