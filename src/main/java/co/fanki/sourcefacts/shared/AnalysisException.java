package co.fanki.sourcefacts.shared;

/**
 * Base exception for failures while analyzing one source unit.
 *
 * <p>Every failure carries a {@link FailureKind} that decides how far it
 * reaches: most kinds are local to one file, interpreter discovery is fatal
 * for every file of that language in the run. The kind name doubles as the
 * error code exposed by the REST layer.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    /**
     * Creates a new analysis exception.
     *
     * @param message the error message
     * @param theKind the failure kind
     */
    public AnalysisException(final String message, final FailureKind theKind) {
        super(message);
        this.kind = Preconditions.requireNonNull(theKind,
                "Failure kind cannot be null");
    }

    /**
     * Creates a new analysis exception with a cause.
     *
     * @param message the error message
     * @param theKind the failure kind
     * @param cause the underlying cause
     */
    public AnalysisException(final String message, final FailureKind theKind,
            final Throwable cause) {
        super(message, cause);
        this.kind = Preconditions.requireNonNull(theKind,
                "Failure kind cannot be null");
    }

    /**
     * Returns the failure kind.
     *
     * @return the kind, never null
     */
    public FailureKind kind() {
        return kind;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the failure kind name
     */
    public String getErrorCode() {
        return kind.name();
    }

    /** The failure taxonomy of the analyzer. */
    public enum FailureKind {

        /** The AST front end rejected the input. */
        PARSE_FAILURE,

        /** A heuristic depth, iteration or window cap was reached. */
        HEURISTIC_BOUND_EXCEEDED,

        /** No candidate interpreter command works. */
        INTERPRETER_NOT_FOUND,

        /** Non-zero exit, malformed JSON or an explicit error field. */
        SUBPROCESS_FAILURE,

        /** The source file could not be read. */
        FILE_UNREADABLE
    }

}
