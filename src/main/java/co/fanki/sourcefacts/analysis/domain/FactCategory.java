package co.fanki.sourcefacts.analysis.domain;

import java.util.Optional;

/**
 * Named buckets used to group data-flow facts.
 *
 * <p>The declaration order is the rendering order of
 * {@link CategorySerializer}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FactCategory {

    GLOBALS("Globals"),
    DOM("DOM"),
    EVENTS("Events"),
    INPUT("Input"),
    STORAGE("Storage"),
    NETWORK("Network"),
    LOGS("Logs"),
    CONFIG("Config"),
    SHARED_STATE("SharedState"),
    CSS("CSS"),
    JSON("JSON"),
    HTML("HTML");

    private final String displayName;

    FactCategory(final String theDisplayName) {
        this.displayName = theDisplayName;
    }

    /**
     * Returns the name written in the canonical rendering.
     *
     * @return the display name, e.g. {@code SharedState}
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Looks a category up by its display name.
     *
     * @param name the display name, as written by the visitor subprocess
     * @return the category, empty if unknown
     */
    public static Optional<FactCategory> fromDisplayName(final String name) {
        for (final FactCategory category : values()) {
            if (category.displayName.equals(name)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

}
