package co.fanki.surveyflow.response.domain;

import co.fanki.surveyflow.flow.domain.NavigationDeterminant;
import co.fanki.surveyflow.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * An answer to one question, stamped with the step it led to.
 *
 * <p>The stamped step is decided once, when the answer is submitted, and
 * never recomputed: later edits to the survey flow do not change where an
 * existing answer leads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Answer {

    private final String id;
    private final String responseId;
    private final String questionId;
    private final AnswerPayload payload;
    private final NavigationDeterminant<String> nextStep;
    private final Instant createdAt;

    private Answer(final String theId, final String theResponseId,
            final String theQuestionId, final AnswerPayload thePayload,
            final NavigationDeterminant<String> theNextStep,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Answer ID is required");
        this.responseId = Preconditions.requireNonBlank(theResponseId,
                "Response ID is required");
        this.questionId = Preconditions.requireNonBlank(theQuestionId,
                "Question ID is required");
        this.payload = Preconditions.requireNonNull(thePayload,
                "Answer payload is required");
        this.nextStep = Preconditions.requireNonNull(theNextStep,
                "Next step is required");
        Preconditions.require(!theNextStep.isSequential(),
                "Next step must be resolved");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Creates a new answer.
     *
     * @param responseId the owning response
     * @param questionId the answered question
     * @param payload what was answered
     * @param nextStep the resolved step, never sequential
     * @return a new Answer instance
     */
    public static Answer create(final String responseId,
            final String questionId, final AnswerPayload payload,
            final NavigationDeterminant<String> nextStep) {
        return new Answer(UUID.randomUUID().toString(), responseId,
                questionId, payload, nextStep, Instant.now());
    }

    /**
     * Reconstitutes an answer from persistence.
     *
     * @param id the answer ID
     * @param responseId the response ID
     * @param questionId the question ID
     * @param payload the stored payload
     * @param nextStep the stamped step
     * @param createdAt when answered
     * @return the reconstituted Answer
     */
    public static Answer reconstitute(final String id, final String responseId,
            final String questionId, final AnswerPayload payload,
            final NavigationDeterminant<String> nextStep,
            final Instant createdAt) {
        return new Answer(id, responseId, questionId, payload, nextStep,
                createdAt);
    }

    public String id() {
        return id;
    }

    public String responseId() {
        return responseId;
    }

    public String questionId() {
        return questionId;
    }

    public AnswerPayload payload() {
        return payload;
    }

    public NavigationDeterminant<String> nextStep() {
        return nextStep;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
