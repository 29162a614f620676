package co.fanki.sourcefacts.analysis.domain;

import co.fanki.sourcefacts.shared.Preconditions;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prepares source text for the front ends without moving line breaks.
 *
 * <p>Two modes are offered. {@link #stripPragmas(String)} blanks directive
 * lines such as {@code #target photoshop} that no parser accepts.
 * {@link #stripComments(String, boolean)} is a character-level state machine
 * for C-family text: it drops {@code //} and block comments and can blank the
 * contents of string literals, one space per character, so that column and
 * line based heuristics downstream keep working.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceSanitizer {

    /** Directive keywords stripped by default. */
    public static final List<String> DEFAULT_PRAGMAS = List.of(
            "target", "include", "includepath");

    private final Pattern pragmaPattern;

    /**
     * Creates a sanitizer for the given directive keywords.
     *
     * @param pragmaKeywords the keywords following {@code #}, cannot be empty
     */
    public SourceSanitizer(final List<String> pragmaKeywords) {
        Preconditions.requireNonEmpty(pragmaKeywords,
                "At least one pragma keyword is required");
        final String alternatives = pragmaKeywords.stream()
                .map(String::trim)
                .filter(keyword -> !keyword.isEmpty())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.pragmaPattern = Pattern.compile(
                "^[ \\t]*#(?:" + alternatives + ")\\b[^\\r\\n]*$",
                Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
    }

    /**
     * Creates a sanitizer for {@link #DEFAULT_PRAGMAS}.
     *
     * @return the sanitizer
     */
    public static SourceSanitizer withDefaults() {
        return new SourceSanitizer(DEFAULT_PRAGMAS);
    }

    /**
     * Replaces every pragma line by an empty line.
     *
     * @param source the raw source
     * @return the source with the same number of lines
     */
    public String stripPragmas(final String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        return pragmaPattern.matcher(source).replaceAll("");
    }

    /**
     * Removes comments and optionally blanks string literal contents.
     *
     * <p>Regular literals ({@code "..."}, {@code '...'}) honor backslash
     * escapes. Verbatim literals ({@code @"..."}, {@code $@"..."},
     * {@code @$"..."}) only honor a doubled quote. Line breaks are always
     * kept, including those inside block comments and strings.</p>
     *
     * @param code the C-family source
     * @param removeStrings whether to blank string contents, quotes included
     * @return the sanitized text
     */
    public String stripComments(final String code, final boolean removeStrings) {
        if (code == null || code.isEmpty()) {
            return "";
        }

        final StringBuilder result = new StringBuilder(code.length());
        final int length = code.length();
        boolean inString = false;
        boolean inVerbatim = false;
        char quote = 0;
        int i = 0;

        while (i < length) {
            final char c = code.charAt(i);
            final char next = i + 1 < length ? code.charAt(i + 1) : 0;

            if (!inString) {
                if (c == '/' && next == '/') {
                    i += 2;
                    while (i < length && !isLineBreak(code.charAt(i))) {
                        i++;
                    }
                    continue;
                }
                if (c == '/' && next == '*') {
                    i += 2;
                    while (i < length && !(code.charAt(i) == '*'
                            && i + 1 < length && code.charAt(i + 1) == '/')) {
                        if (isLineBreak(code.charAt(i))) {
                            result.append(code.charAt(i));
                        }
                        i++;
                    }
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '\'') {
                    inString = true;
                    quote = c;
                    inVerbatim = c == '"' && isVerbatimPrefix(code, i);
                    result.append(removeStrings ? ' ' : c);
                    i++;
                    continue;
                }
                result.append(c);
                i++;
                continue;
            }

            result.append(blankOrKeep(c, removeStrings));

            if (inVerbatim) {
                if (c == '"' && next == '"') {
                    result.append(removeStrings ? ' ' : '"');
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    inString = false;
                    inVerbatim = false;
                }
                i++;
                continue;
            }

            if (c == '\\' && i + 1 < length) {
                result.append(blankOrKeep(next, removeStrings));
                i += 2;
                continue;
            }
            if (c == quote) {
                inString = false;
            }
            i++;
        }
        return result.toString();
    }

    private static boolean isVerbatimPrefix(final String code, final int quoteIndex) {
        final char prev1 = quoteIndex >= 1 ? code.charAt(quoteIndex - 1) : 0;
        final char prev2 = quoteIndex >= 2 ? code.charAt(quoteIndex - 2) : 0;
        return prev1 == '@'
                || (prev1 == '$' && prev2 == '@');
    }

    private static char blankOrKeep(final char c, final boolean removeStrings) {
        if (!removeStrings || isLineBreak(c)) {
            return c;
        }
        return ' ';
    }

    private static boolean isLineBreak(final char c) {
        return c == '\n' || c == '\r';
    }

}
