package co.fanki.surveyflow.response.domain;

import co.fanki.surveyflow.shared.DomainException;

/**
 * Raised when a submitted answer does not fit the question it answers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InvalidAnswerException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new invalid-answer exception.
     *
     * @param message the error message
     */
    public InvalidAnswerException(final String message) {
        super(message, "INVALID_ANSWER");
    }

}
