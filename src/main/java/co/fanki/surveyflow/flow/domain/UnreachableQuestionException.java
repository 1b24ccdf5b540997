package co.fanki.surveyflow.flow.domain;

import java.util.List;

/**
 * Raised when the only problem with a graph is that some questions cannot
 * be reached from the start question.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class UnreachableQuestionException extends FlowValidationException {

    private static final long serialVersionUID = 1L;

    UnreachableQuestionException(final String message,
            final FlowValidationResult<?> result) {
        super(message, "FLOW_UNREACHABLE_QUESTION", result);
    }

    public List<?> unreachable() {
        return result().unreachable();
    }

}
