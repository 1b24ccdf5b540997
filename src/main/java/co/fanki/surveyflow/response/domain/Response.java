package co.fanki.surveyflow.response.domain;

import co.fanki.surveyflow.shared.InvalidStateException;
import co.fanki.surveyflow.shared.Preconditions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root for one respondent's pass through a survey.
 *
 * <p>Tracks the questions visited, in the order they were first answered,
 * and whether the pass is complete. A complete response accepts no more
 * answers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Response {

    private final String id;
    private final String surveyId;
    private final String respondentId;
    private boolean complete;
    private final List<String> visited;
    private final Instant startedAt;
    private Instant submittedAt;

    private Response(final String theId, final String theSurveyId,
            final String theRespondentId, final List<String> theVisited,
            final Instant theStartedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Response ID is required");
        this.surveyId = Preconditions.requireNonBlank(theSurveyId,
                "Survey ID is required");
        this.respondentId = Preconditions.requireNonBlank(theRespondentId,
                "Respondent ID is required");
        this.visited = theVisited != null
                ? new ArrayList<>(theVisited) : new ArrayList<>();
        this.startedAt = theStartedAt != null ? theStartedAt : Instant.now();
    }

    /**
     * Starts a new response.
     *
     * @param surveyId the survey being answered
     * @param respondentId who answers it
     * @return a new, incomplete Response
     */
    public static Response start(final String surveyId,
            final String respondentId) {
        return new Response(UUID.randomUUID().toString(), surveyId,
                respondentId, List.of(), Instant.now());
    }

    /**
     * Reconstitutes a response from persistence.
     *
     * @param id the response ID
     * @param surveyId the survey ID
     * @param respondentId the respondent ID
     * @param complete whether the response is complete
     * @param visited the visited question ids in order
     * @param startedAt when started
     * @param submittedAt when completed, may be null
     * @return the reconstituted Response
     */
    public static Response reconstitute(final String id, final String surveyId,
            final String respondentId, final boolean complete,
            final List<String> visited, final Instant startedAt,
            final Instant submittedAt) {
        final Response response = new Response(id, surveyId, respondentId,
                visited, startedAt);
        response.complete = complete;
        response.submittedAt = submittedAt;
        return response;
    }

    /**
     * Records that a question was answered.
     *
     * <p>Re-answering a question does not add it twice.</p>
     *
     * @param questionId the answered question
     * @throws InvalidStateException if the response is already complete
     */
    public void recordVisited(final String questionId) {
        requireOpen();
        Preconditions.requireNonBlank(questionId, "Question ID is required");
        if (!visited.contains(questionId)) {
            visited.add(questionId);
        }
    }

    /**
     * Marks the response as complete.
     *
     * @return true if the state changed, false if it was already complete
     */
    public boolean markComplete() {
        if (complete) {
            return false;
        }
        complete = true;
        submittedAt = Instant.now();
        return true;
    }

    /**
     * Fails when the response no longer accepts answers.
     *
     * @throws InvalidStateException if the response is complete
     */
    public void requireOpen() {
        if (complete) {
            throw new InvalidStateException("Response " + id
                    + " is already complete");
        }
    }

    public String id() {
        return id;
    }

    public String surveyId() {
        return surveyId;
    }

    public String respondentId() {
        return respondentId;
    }

    public boolean isComplete() {
        return complete;
    }

    public List<String> visited() {
        return Collections.unmodifiableList(visited);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

}
