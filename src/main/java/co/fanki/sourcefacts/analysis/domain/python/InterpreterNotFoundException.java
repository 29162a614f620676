package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.shared.AnalysisException;

/**
 * No candidate interpreter command works on this host.
 *
 * <p>Fatal for every unit of the language for the rest of the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InterpreterNotFoundException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message what was probed
     */
    public InterpreterNotFoundException(final String message) {
        super(message, FailureKind.INTERPRETER_NOT_FOUND);
    }

}
