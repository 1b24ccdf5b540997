package co.fanki.surveyflow.shared;

/**
 * Raised when an operation is not allowed in the current lifecycle state,
 * for example answering a response that is already complete.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InvalidStateException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new invalid-state exception.
     *
     * @param message the error message
     */
    public InvalidStateException(final String message) {
        super(message, "INVALID_STATE");
    }

}
