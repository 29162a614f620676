package co.fanki.sourcefacts.analysis.domain.ecmascript;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Rewrites ECMAScript text into the dialect the Closure parser accepts.
 *
 * <p>Two constructs are rewritten, only in code: never inside string,
 * template or regular expression literals, nor in comments.</p>
 * <ul>
 *   <li>Private names: {@code #name} becomes {@value #PRIVATE_PREFIX}
 *       {@code name}. {@link #decode(String)} turns such a name back into
 *       {@code #name} for reporting.</li>
 *   <li>Top-level {@code await}: optionally replaced by {@code void }, a
 *       unary operator of the same precedence and length;
 *       {@code for await} becomes a plain {@code for}.</li>
 * </ul>
 *
 * <p>Line breaks are never added or removed, so parse errors keep their
 * line numbers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class EcmaScriptPreprocessor {

    /** The spelling of an encoded private name. */
    static final String PRIVATE_PREFIX = "__private__";

    private static final Pattern AWAIT_WORD = Pattern.compile("\\bawait\\b");

    private static final String REGEX_PRECEDERS = "(,=:[!&|?{};+-*%<>~^";

    private final String code;
    private final boolean awaitAsVoid;
    private final StringBuilder out;
    private final Deque<Integer> templateBraces = new ArrayDeque<>();

    private int pos;
    private int braceDepth;
    private char lastSignificant;
    private String lastWord = "";

    private EcmaScriptPreprocessor(final String theCode,
            final boolean isAwaitAsVoid) {
        this.code = theCode;
        this.awaitAsVoid = isAwaitAsVoid;
        this.out = new StringBuilder(theCode.length() + 32);
    }

    /**
     * Encodes every private name.
     *
     * @param code the source text
     * @return the text the parser accepts for private members
     */
    static String encodePrivateNames(final String code) {
        return new EcmaScriptPreprocessor(code, false).rewrite();
    }

    /**
     * Encodes every private name and neutralizes every {@code await}.
     *
     * @param code the source text
     * @return the text the parser accepts for top-level await
     */
    static String encodeWithoutAwait(final String code) {
        return new EcmaScriptPreprocessor(code, true).rewrite();
    }

    /**
     * Whether the text contains the word {@code await} anywhere.
     *
     * @param code the source text
     * @return true if a retry without await may help
     */
    static boolean mentionsAwait(final String code) {
        return AWAIT_WORD.matcher(code).find();
    }

    /**
     * Whether a parsed identifier is an encoded private name.
     *
     * @param name the identifier
     * @return true for encoded private names
     */
    static boolean isPrivateName(final String name) {
        return name != null && name.startsWith(PRIVATE_PREFIX);
    }

    /**
     * Restores the {@code #} spelling of every private name in a name.
     *
     * @param name a function name or callee chain
     * @return the name as written in the source
     */
    static String decode(final String name) {
        return name.replace(PRIVATE_PREFIX, "#");
    }

    private String rewrite() {
        final int length = code.length();
        while (pos < length) {
            final char c = code.charAt(pos);
            final char next = pos + 1 < length ? code.charAt(pos + 1) : 0;

            if (c == '/' && next == '/') {
                copyUntil(lineEnd(pos));
            } else if (c == '/' && next == '*') {
                final int end = code.indexOf("*/", pos + 2);
                copyUntil(end < 0 ? length : end + 2);
            } else if (c == '\'' || c == '"') {
                copyUntil(stringEnd(pos, c));
                significant(c);
            } else if (c == '`') {
                out.append(c);
                pos++;
                template();
            } else if (c == '/' && startsRegex()) {
                copyUntil(regexEnd(pos));
                significant(')');
            } else if (c == '#' && isIdentifierStart(next)) {
                out.append(PRIVATE_PREFIX);
                pos++;
            } else if (isIdentifierPart(c)) {
                word();
            } else if (Character.isWhitespace(c)) {
                out.append(c);
                pos++;
            } else {
                punctuation(c);
            }
        }
        return out.toString();
    }

    private void punctuation(final char c) {
        if (c == '{') {
            braceDepth++;
        } else if (c == '}') {
            if (!templateBraces.isEmpty() && templateBraces.peek() == braceDepth) {
                templateBraces.pop();
                braceDepth--;
                out.append(c);
                pos++;
                template();
                return;
            }
            braceDepth--;
        }
        out.append(c);
        pos++;
        significant(c);
    }

    private void word() {
        final int start = pos;
        while (pos < code.length() && isIdentifierPart(code.charAt(pos))) {
            pos++;
        }
        final String word = code.substring(start, pos);
        final boolean member = start > 0 && code.charAt(start - 1) == '.';
        if (awaitAsVoid && "await".equals(word) && !member) {
            out.append("for".equals(lastWord) ? "     " : "void ");
        } else {
            out.append(word);
        }
        lastWord = word;
        lastSignificant = word.charAt(word.length() - 1);
    }

    // Copies template text up to the closing backtick or a substitution.
    private void template() {
        final int length = code.length();
        while (pos < length) {
            final char c = code.charAt(pos);
            if (c == '\\' && pos + 1 < length) {
                out.append(c).append(code.charAt(pos + 1));
                pos += 2;
                continue;
            }
            out.append(c);
            pos++;
            if (c == '`') {
                significant(c);
                return;
            }
            if (c == '$' && pos < length && code.charAt(pos) == '{') {
                out.append('{');
                pos++;
                braceDepth++;
                templateBraces.push(braceDepth);
                significant('{');
                return;
            }
        }
    }

    private boolean startsRegex() {
        return lastSignificant == 0
                || REGEX_PRECEDERS.indexOf(lastSignificant) >= 0
                || "return".equals(lastWord) || "typeof".equals(lastWord);
    }

    private void significant(final char c) {
        lastSignificant = c;
        lastWord = "";
    }

    private void copyUntil(final int end) {
        out.append(code, pos, end);
        pos = end;
    }

    private int lineEnd(final int from) {
        int i = from;
        while (i < code.length() && code.charAt(i) != '\n'
                && code.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private int stringEnd(final int from, final char quote) {
        int i = from + 1;
        while (i < code.length()) {
            final char c = code.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote || c == '\n') {
                return i + 1;
            }
            i++;
        }
        return code.length();
    }

    private int regexEnd(final int from) {
        boolean inClass = false;
        int i = from + 1;
        while (i < code.length()) {
            final char c = code.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\n') {
                return i;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                return i + 1;
            }
            i++;
        }
        return code.length();
    }

    private static boolean isIdentifierStart(final char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

}
