package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.Preconditions;

import java.nio.file.Path;

/**
 * One file handed to the analyzer: its path, declared language tag and raw
 * text.
 *
 * <p>Immutable and owned by the caller. When the language tag is blank the
 * language is taken from the path extension.</p>
 *
 * @param path the file path as known by the caller
 * @param languageTag the declared language tag, may be blank
 * @param rawText the raw source text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceUnit(String path, String languageTag, String rawText) {

    /**
     * Creates a new source unit.
     *
     * @param path the file path, cannot be blank
     * @param languageTag the declared language tag, null is read as blank
     * @param rawText the raw source text, cannot be null
     */
    public SourceUnit {
        Preconditions.requireNonBlank(path, "Source path cannot be blank");
        Preconditions.requireNonNull(rawText, "Source text cannot be null");
        languageTag = languageTag == null ? "" : languageTag.trim();
    }

    /**
     * Creates a source unit whose language comes from the path extension.
     *
     * @param path the file path
     * @param rawText the raw source text
     * @return the source unit
     */
    public static SourceUnit of(final String path, final String rawText) {
        return new SourceUnit(path, "", rawText);
    }

    /**
     * Resolves the language of this unit.
     *
     * @return the declared language, or the one implied by the extension
     */
    public Language language() {
        if (!languageTag.isEmpty()) {
            return Language.fromTag(languageTag);
        }
        return Language.fromPath(path);
    }

    /**
     * Returns the absolute, normalized form of the path.
     *
     * <p>Used as the cache key of the out-of-process front end.</p>
     *
     * @return the absolute path
     */
    public Path absolutePath() {
        return Path.of(path).toAbsolutePath().normalize();
    }

}
