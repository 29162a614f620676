package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the call order of C# source stripped of comments and strings.
 *
 * <p>A candidate is {@code name(} or {@code a.b.c(}, optionally with generic
 * arguments. Control-flow keywords are dropped, as are attributes
 * ({@code [Name(...)]}). After the matching close parenthesis, a block,
 * an expression body or a {@code where} clause marks a declaration rather
 * than a call. Candidates whose parenthesis does not close within the step
 * cap are abandoned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CSharpCallScanner {

    private static final Logger LOG = LoggerFactory.getLogger(
            CSharpCallScanner.class);

    private final HeuristicLimits limits;

    private final BoundedParenMatcher parens;

    private final Pattern call;

    /**
     * Creates a new scanner.
     *
     * @param theLimits the caps to honor
     */
    public CSharpCallScanner(final HeuristicLimits theLimits) {
        this.limits = Preconditions.requireNonNull(theLimits,
                "Limits cannot be null");
        this.parens = new BoundedParenMatcher(theLimits);
        this.call = Pattern.compile(
                "([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*){0,"
                        + theLimits.maxNameSegments() + "})"
                        + "(?:<[^>]{0," + theLimits.maxGenericLength() + "}>)?"
                        + "\\s*\\(");
    }

    /**
     * Returns the callee chains in source order.
     *
     * @param code the sanitized source, string contents blanked
     * @return the chains, duplicates kept
     */
    public List<String> callOrder(final String code) {
        final List<String> calls = new ArrayList<>();
        final Matcher matcher = call.matcher(code);
        int examined = 0;
        while (matcher.find()) {
            if (++examined > limits.maxCallMatches()) {
                LOG.debug("Call scan stopped after {} candidates",
                        limits.maxCallMatches());
                break;
            }
            final String chain = matcher.group(1);
            final String last = chain.substring(chain.lastIndexOf('.') + 1);
            if (CSharpApiCatalog.SKIP_CALL_NAMES.contains(last)) {
                continue;
            }
            if (BoundedParenMatcher.previousNonWhitespace(code,
                    matcher.start()) == '[') {
                continue;
            }
            final int close = parens.closeCall(code, matcher.end() - 1);
            if (close < 0) {
                LOG.debug("Abandoned call candidate {}: argument list does not"
                        + " close within bounds", chain);
                continue;
            }
            if (!isDeclaration(code, close + 1)) {
                calls.add(chain);
            }
        }
        return calls;
    }

    private static boolean isDeclaration(final String code, final int from) {
        final int next = BoundedParenMatcher.skipWhitespace(code, from);
        if (code.startsWith("{", next) || code.startsWith("=>", next)) {
            return true;
        }
        if (!code.startsWith("where", next)) {
            return false;
        }
        final int after = next + "where".length();
        return after >= code.length()
                || !Character.isJavaIdentifierPart(code.charAt(after));
    }

}
