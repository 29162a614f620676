package co.fanki.sourcefacts.analysis.domain.csharp;

import co.fanki.sourcefacts.shared.Preconditions;

/**
 * The caps that keep the heuristic scanners terminating on any input.
 *
 * @param maxLineLength lines longer than this are not scanned for
 *        declarations
 * @param maxParenDepth nesting depth allowed inside a declaration's
 *        parameter list
 * @param parenWindow characters searched for a declaration's closing
 *        parenthesis
 * @param maxCallMatches call candidates examined per unit
 * @param maxScanMatches matches examined per auxiliary scan (usings, types,
 *        static fields, events)
 * @param maxCloseParenSteps characters walked looking for a call's closing
 *        parenthesis
 * @param maxNameSegments extra dotted segments allowed in a callee chain
 * @param maxGenericLength characters allowed between a callee's angle
 *        brackets
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record HeuristicLimits(
        int maxLineLength,
        int maxParenDepth,
        int parenWindow,
        int maxCallMatches,
        int maxScanMatches,
        int maxCloseParenSteps,
        int maxNameSegments,
        int maxGenericLength) {

    private static final HeuristicLimits DEFAULTS = new HeuristicLimits(
            500, 5, 200, 10_000, 5_000, 50_000, 5, 100);

    /**
     * Validates every cap.
     */
    public HeuristicLimits {
        Preconditions.requirePositive(maxLineLength,
                "Max line length must be positive");
        Preconditions.requirePositive(maxParenDepth,
                "Max paren depth must be positive");
        Preconditions.requirePositive(parenWindow,
                "Paren window must be positive");
        Preconditions.requirePositive(maxCallMatches,
                "Max call matches must be positive");
        Preconditions.requirePositive(maxScanMatches,
                "Max scan matches must be positive");
        Preconditions.requirePositive(maxCloseParenSteps,
                "Max close paren steps must be positive");
        Preconditions.requirePositive(maxNameSegments,
                "Max name segments must be positive");
        Preconditions.requirePositive(maxGenericLength,
                "Max generic length must be positive");
    }

    public static HeuristicLimits defaults() {
        return DEFAULTS;
    }

}
