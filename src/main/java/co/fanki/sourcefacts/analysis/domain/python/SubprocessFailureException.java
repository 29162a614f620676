package co.fanki.sourcefacts.analysis.domain.python;

import co.fanki.sourcefacts.shared.AnalysisException;

/**
 * The visitor subprocess did not produce a usable result for one unit:
 * non-zero exit, timeout, malformed JSON or an explicit error field.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SubprocessFailureException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public SubprocessFailureException(final String message) {
        super(message, FailureKind.SUBPROCESS_FAILURE);
    }

    public SubprocessFailureException(final String message,
            final Throwable cause) {
        super(message, FailureKind.SUBPROCESS_FAILURE, cause);
    }

}
