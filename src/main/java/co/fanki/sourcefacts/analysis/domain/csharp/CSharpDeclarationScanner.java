package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds method declarations, constructors and namespace imports in C#
 * source that has already been stripped of comments and string contents.
 *
 * <p>A method candidate is a modifier, a return type and a name followed by
 * {@code (}. It becomes a declaration only when its parameter list closes
 * within the configured window and depth and the next token opens a block
 * or an expression body. Constructors are the names of the types the unit
 * declares, written after an access modifier.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CSharpDeclarationScanner {

    private static final Logger LOG = LoggerFactory.getLogger(
            CSharpDeclarationScanner.class);

    private static final Pattern METHOD = Pattern.compile(
            "\\b(?:public|protected|internal|private|static|virtual|override"
                    + "|sealed|async|partial|extern|unsafe|new)\\b"
                    + "[\\s\\w<>,\\[\\]]*\\s+([A-Za-z_][A-Za-z0-9_]*)"
                    + "\\s*(?:<[^>]{0,100}>)?\\s*\\(");

    private static final Pattern TYPE = Pattern.compile(
            "\\b(?:class|struct|record)\\s+([A-Za-z_][A-Za-z0-9_]*)");

    private static final Pattern CONSTRUCTOR = Pattern.compile(
            "\\b(?:public|protected|internal|private)\\s+"
                    + "([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    private static final Pattern USING = Pattern.compile(
            "^\\s*(?:global\\s+)?using\\s+(?:static\\s+)?"
                    + "(?:([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*)?"
                    + "([A-Za-z_][A-Za-z0-9_.]*)\\s*;",
            Pattern.MULTILINE);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private final HeuristicLimits limits;

    private final BoundedParenMatcher parens;

    /**
     * Creates a new scanner.
     *
     * @param theLimits the caps to honor
     */
    public CSharpDeclarationScanner(final HeuristicLimits theLimits) {
        this.limits = Preconditions.requireNonNull(theLimits,
                "Limits cannot be null");
        this.parens = new BoundedParenMatcher(theLimits);
    }

    /**
     * Returns the declared method and constructor names.
     *
     * @param code the sanitized source
     * @return the names, sorted
     */
    public Set<String> functions(final String code) {
        final Set<String> functions = new TreeSet<>();
        int lineStart = 0;
        final Matcher breaks = LINE_BREAK.matcher(code);
        while (lineStart <= code.length()) {
            final int lineEnd;
            final int nextStart;
            if (breaks.find(lineStart)) {
                lineEnd = breaks.start();
                nextStart = breaks.end();
            } else {
                lineEnd = code.length();
                nextStart = code.length() + 1;
            }
            if (lineEnd - lineStart <= limits.maxLineLength()) {
                scanLine(code, lineStart, lineEnd, functions);
            } else {
                LOG.debug("Skipping a {} character line", lineEnd - lineStart);
            }
            lineStart = nextStart;
        }
        functions.addAll(constructors(code));
        return functions;
    }

    private void scanLine(final String code, final int lineStart,
            final int lineEnd, final Set<String> functions) {
        final Matcher matcher = METHOD.matcher(code).region(lineStart, lineEnd);
        while (matcher.find()) {
            final String name = matcher.group(1);
            if (CSharpApiCatalog.SKIP_CALL_NAMES.contains(name)) {
                continue;
            }
            final int close = parens.closeDeclaration(code, matcher.end());
            if (close < 0) {
                LOG.debug("Abandoned declaration candidate {}: parameter list"
                        + " does not close within bounds", name);
                continue;
            }
            if (opensBody(code, close + 1)) {
                functions.add(name);
            }
        }
    }

    private Set<String> constructors(final String code) {
        final Set<String> types = new HashSet<>();
        final Matcher typeMatcher = TYPE.matcher(code);
        int matches = 0;
        while (matches++ < limits.maxScanMatches() && typeMatcher.find()) {
            types.add(typeMatcher.group(1));
        }

        final Set<String> constructors = new TreeSet<>();
        if (types.isEmpty()) {
            return constructors;
        }
        final Matcher ctorMatcher = CONSTRUCTOR.matcher(code);
        matches = 0;
        while (matches++ < limits.maxScanMatches() && ctorMatcher.find()) {
            if (types.contains(ctorMatcher.group(1))) {
                constructors.add(ctorMatcher.group(1));
            }
        }
        return constructors;
    }

    /**
     * Returns the namespaces the unit imports.
     *
     * <p>Handles {@code global using} and {@code using static}; an alias is
     * kept as {@code Alias=Target}.</p>
     *
     * @param code the sanitized source
     * @return the specifiers, sorted
     */
    public Set<String> usings(final String code) {
        final Set<String> usings = new TreeSet<>();
        final Matcher matcher = USING.matcher(code);
        int matches = 0;
        while (matches++ < limits.maxScanMatches() && matcher.find()) {
            final String alias = matcher.group(1);
            final String target = matcher.group(2);
            usings.add(alias != null ? alias + "=" + target : target);
        }
        return usings;
    }

    private static boolean opensBody(final String code, final int from) {
        final int next = BoundedParenMatcher.skipWhitespace(code, from);
        return code.startsWith("{", next) || code.startsWith("=>", next);
    }

}
