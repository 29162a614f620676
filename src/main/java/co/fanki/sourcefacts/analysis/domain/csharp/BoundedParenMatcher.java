package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.shared.Preconditions;

/**
 * Finds matching closing parentheses without ever scanning unboundedly.
 *
 * <p>Both searches give up and return {@code -1} when their cap is reached;
 * callers treat that as an abandoned match, not as an error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class BoundedParenMatcher {

    private final HeuristicLimits limits;

    /**
     * Creates a new matcher.
     *
     * @param theLimits the caps to honor
     */
    public BoundedParenMatcher(final HeuristicLimits theLimits) {
        this.limits = Preconditions.requireNonNull(theLimits,
                "Limits cannot be null");
    }

    /**
     * Closes a declaration's parameter list.
     *
     * <p>Searches at most {@code parenWindow} characters and gives up as soon
     * as the nesting goes deeper than {@code maxParenDepth}.</p>
     *
     * @param text the text
     * @param afterOpen the index right after the opening parenthesis
     * @return the index of the closing parenthesis, or -1
     */
    public int closeDeclaration(final String text, final int afterOpen) {
        final int end = Math.min(text.length(),
                afterOpen + limits.parenWindow());
        int depth = 1;
        for (int i = afterOpen; i < end; i++) {
            final char c = text.charAt(i);
            if (c == '(') {
                depth++;
                if (depth > limits.maxParenDepth()) {
                    return -1;
                }
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Closes a call's argument list.
     *
     * <p>Walks at most {@code maxCloseParenSteps} characters.</p>
     *
     * @param text the text
     * @param openIndex the index of the opening parenthesis
     * @return the index of the closing parenthesis, or -1
     */
    public int closeCall(final String text, final int openIndex) {
        final int end = Math.min(text.length(),
                openIndex + limits.maxCloseParenSteps());
        int depth = 0;
        for (int i = openIndex; i < end; i++) {
            final char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Returns the index of the first non-whitespace character at or after
     * the given index.
     *
     * @param text the text
     * @param from the start index
     * @return the index, or the text length when only whitespace remains
     */
    static int skipWhitespace(final String text, final int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Returns the first non-whitespace character before the given index.
     *
     * @param text the text
     * @param before the exclusive end index
     * @return the character, or 0 when there is none
     */
    static char previousNonWhitespace(final String text, final int before) {
        int i = before - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i >= 0 ? text.charAt(i) : 0;
    }

}
