package co.fanki.sourcefacts.analysis.domain;

import java.util.Locale;
import java.util.Set;

/**
 * Languages the dispatcher knows how to route.
 *
 * <p>Each language is recognized by a set of tags: file extensions without
 * the leading dot plus a few spelled-out names. Markup and structured-data
 * languages carry no executable code and are flagged as such.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Language {

    /** JavaScript in all its module flavours. */
    ECMASCRIPT(false, "js", "jsx", "mjs", "cjs", "javascript"),

    /** C#, analyzed heuristically. */
    CSHARP(false, "cs", "csharp"),

    /** Python, analyzed by an out-of-process visitor. */
    PYTHON(false, "py", "python"),

    /** Cascading style sheets. */
    CSS(true, "css"),

    /** JSON documents. */
    JSON(true, "json"),

    /** HTML documents. */
    HTML(true, "html", "htm"),

    /** Anything else. */
    UNSUPPORTED(false);

    private final boolean markup;
    private final Set<String> tags;

    Language(final boolean isMarkup, final String... theTags) {
        this.markup = isMarkup;
        this.tags = Set.of(theTags);
    }

    /**
     * Whether this language only carries references, never code.
     *
     * @return true for markup and structured-data languages
     */
    public boolean isMarkup() {
        return markup;
    }

    /**
     * Resolves a language tag.
     *
     * <p>Accepts extensions with or without the leading dot, in any case,
     * and the spelled-out language names.</p>
     *
     * @param tag the tag, may be null
     * @return the language, {@link #UNSUPPORTED} when nothing matches
     */
    public static Language fromTag(final String tag) {
        if (tag == null || tag.isBlank()) {
            return UNSUPPORTED;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (final Language language : values()) {
            if (language.tags.contains(normalized)) {
                return language;
            }
        }
        return UNSUPPORTED;
    }

    /**
     * Resolves the language of a file path from its extension.
     *
     * @param path the file path, may be null
     * @return the language, {@link #UNSUPPORTED} when there is no extension
     */
    public static Language fromPath(final String path) {
        if (path == null) {
            return UNSUPPORTED;
        }
        final int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        final int dot = path.lastIndexOf('.');
        if (dot <= slash + 1 || dot == path.length() - 1) {
            return UNSUPPORTED;
        }
        return fromTag(path.substring(dot + 1));
    }

}
