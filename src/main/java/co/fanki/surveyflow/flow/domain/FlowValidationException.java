package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.DomainException;

import java.util.List;

/**
 * Raised when a flow graph fails validation.
 *
 * <p>Carries the complete {@link FlowValidationResult} so an author can fix
 * every problem in one pass. Use {@link #from(FlowValidationResult)} to get
 * the most specific subtype.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowValidationException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final transient FlowValidationResult<?> result;

    /**
     * Creates a new flow validation exception.
     *
     * @param message the summary message
     * @param errorCode the error code
     * @param theResult the full validation result
     */
    protected FlowValidationException(final String message,
            final String errorCode, final FlowValidationResult<?> theResult) {
        super(message, errorCode);
        this.result = theResult;
    }

    /**
     * Creates the exception matching the most severe problem in a result.
     *
     * @param result an invalid validation result
     * @return a cycle, unreachable-question or generic validation exception
     */
    public static FlowValidationException from(
            final FlowValidationResult<?> result) {
        final String summary = "Survey flow is invalid: "
                + String.join("; ", result.errors());
        if (result.hasCycle()) {
            return new CycleDetectedException(summary, result);
        }
        if (result.issues().stream().allMatch(
                issue -> issue.type() == FlowIssue.Type.UNREACHABLE)) {
            return new UnreachableQuestionException(summary, result);
        }
        return new FlowValidationException(summary, "FLOW_INVALID", result);
    }

    public FlowValidationResult<?> result() {
        return result;
    }

    public List<String> errors() {
        return result.errors();
    }

}
