package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.DomainException;

/**
 * Raised when a determinant points at a question that does not exist in
 * the survey, or at its own source.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowReferenceException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new flow reference exception.
     *
     * @param message the error message
     */
    public FlowReferenceException(final String message) {
        super(message, "FLOW_REFERENCE_INVALID");
    }

}
