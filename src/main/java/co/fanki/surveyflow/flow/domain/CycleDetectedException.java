package co.fanki.surveyflow.flow.domain;

import java.util.List;

/**
 * Raised when a cycle is reachable from the start question.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CycleDetectedException extends FlowValidationException {

    private static final long serialVersionUID = 1L;

    CycleDetectedException(final String message,
            final FlowValidationResult<?> result) {
        super(message, "FLOW_CYCLE_DETECTED", result);
    }

    /**
     * Returns the references forming the cycle, first and last equal.
     *
     * @return the cycle path
     */
    public List<?> cyclePath() {
        return result().cyclePath();
    }

}
