package co.fanki.surveyflow.response.application;

import co.fanki.surveyflow.flow.domain.AnswerSelection;
import co.fanki.surveyflow.flow.domain.FlowReferenceException;
import co.fanki.surveyflow.flow.domain.NavigationDeterminant;
import co.fanki.surveyflow.flow.domain.NavigationResolver;
import co.fanki.surveyflow.response.domain.Answer;
import co.fanki.surveyflow.response.domain.AnswerPayload;
import co.fanki.surveyflow.response.domain.AnswerRepository;
import co.fanki.surveyflow.response.domain.InvalidAnswerException;
import co.fanki.surveyflow.response.domain.Response;
import co.fanki.surveyflow.response.domain.ResponseRepository;
import co.fanki.surveyflow.shared.DomainException;
import co.fanki.surveyflow.shared.InvalidStateException;
import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.shared.Preconditions;
import co.fanki.surveyflow.shared.TransactionAbortedException;
import co.fanki.surveyflow.survey.domain.Question;
import co.fanki.surveyflow.survey.domain.QuestionRepository;
import co.fanki.surveyflow.survey.domain.Survey;
import co.fanki.surveyflow.survey.domain.SurveyRepository;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Application service for a respondent's pass through a survey.
 *
 * <p>Every answer is stamped with the step it resolved to. Moving forward
 * reads that stamp back; it is never recomputed, so a flow edited after the
 * answer was given does not change where that answer leads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ResponseService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ResponseService.class);

    private final Jdbi jdbi;
    private final SurveyRepository surveyRepository;
    private final QuestionRepository questionRepository;
    private final ResponseRepository responseRepository;
    private final AnswerRepository answerRepository;
    private final NavigationResolver navigationResolver;

    /**
     * Creates a new ResponseService.
     *
     * @param theJdbi the JDBI instance used to open transactions
     * @param theSurveyRepository the survey repository
     * @param theQuestionRepository the question repository
     * @param theResponseRepository the response repository
     * @param theAnswerRepository the answer repository
     * @param theNavigationResolver the navigation resolver
     */
    public ResponseService(final Jdbi theJdbi,
            final SurveyRepository theSurveyRepository,
            final QuestionRepository theQuestionRepository,
            final ResponseRepository theResponseRepository,
            final AnswerRepository theAnswerRepository,
            final NavigationResolver theNavigationResolver) {
        this.jdbi = theJdbi;
        this.surveyRepository = theSurveyRepository;
        this.questionRepository = theQuestionRepository;
        this.responseRepository = theResponseRepository;
        this.answerRepository = theAnswerRepository;
        this.navigationResolver = theNavigationResolver;
    }

    /**
     * Starts a response to an active survey.
     *
     * @param surveyId the survey to answer
     * @param respondentId who answers it
     * @return the new response and the first question to show
     * @throws NotFoundException if the survey does not exist
     * @throws InvalidStateException if the survey is inactive or empty
     */
    public StartedResponse start(final String surveyId,
            final String respondentId) {
        Preconditions.requireNonBlank(respondentId,
                "Respondent ID is required");

        final Survey survey = surveyRepository.findById(surveyId)
                .orElseThrow(() -> new NotFoundException("Survey", surveyId));
        if (!survey.isActive()) {
            throw new InvalidStateException("Survey " + surveyId
                    + " is not accepting responses");
        }
        final List<Question> questions = questionRepository.findBySurveyId(
                surveyId);
        if (questions.isEmpty()) {
            throw new InvalidStateException("Survey " + surveyId
                    + " has no questions");
        }

        final Response response = Response.start(surveyId, respondentId);
        responseRepository.save(response);

        LOG.info("Response {} started for survey {}", response.id(),
                surveyId);
        return new StartedResponse(response.id(), questions.get(0).id());
    }

    /**
     * Records an answer and resolves where the respondent goes next.
     *
     * <p>Answering the same question again replaces the earlier answer.
     * When the step is the end of the survey the response is completed in
     * the same transaction.</p>
     *
     * @param responseId the response being filled in
     * @param questionId the question that was answered
     * @param payload what was answered
     * @return the next question, or completion
     * @throws NotFoundException if the response or question does not exist
     * @throws InvalidStateException if the response is already complete
     * @throws InvalidAnswerException if the answer does not fit the question
     * @throws FlowReferenceException if the flow points to a question that
     *         no longer exists; nothing is written in that case
     */
    public NextStep resolveNext(final String responseId,
            final String questionId, final AnswerPayload payload) {
        Preconditions.requireNonNull(payload, "Answer is required");

        final Response response = getResponse(responseId);
        response.requireOpen();

        final Question question = questionRepository.findById(questionId)
                .filter(q -> q.surveyId().equals(response.surveyId()))
                .orElseThrow(() -> new NotFoundException("Question",
                        questionId));

        final AnswerSelection selection;
        try {
            selection = payload.validateFor(question);
        } catch (final InvalidAnswerException e) {
            LOG.warn("Invalid answer to question {} in response {}: {}",
                    questionId, responseId, e.getMessage());
            throw e;
        }

        final NavigationDeterminant<String> step = navigationResolver.resolve(
                questionRepository.findGraphBySurveyId(response.surveyId()),
                questionId, selection);

        final NextStep next = inTransaction(responseId, handle ->
                record(handle, responseId, questionId, payload, step));

        if (next.complete()) {
            LOG.info("Response {} completed", responseId);
        }
        return next;
    }

    /**
     * Reads where a respondent continues, from the step stamped on the most
     * recent answer.
     *
     * @param responseId the response
     * @return the next question, or completion
     * @throws NotFoundException if the response does not exist
     * @throws FlowReferenceException if the stamped question was removed
     */
    public NextStep nextQuestion(final String responseId) {
        final Response response = getResponse(responseId);
        if (response.isComplete()) {
            return NextStep.completed();
        }

        final Optional<Answer> latest = answerRepository
                .findLatestByResponseId(responseId);
        if (latest.isEmpty()) {
            final List<Question> questions = questionRepository
                    .findBySurveyId(response.surveyId());
            if (questions.isEmpty()) {
                throw new InvalidStateException("Survey "
                        + response.surveyId() + " has no questions");
            }
            return NextStep.question(questions.get(0).id());
        }

        final NavigationDeterminant<String> step = latest.get().nextStep();
        if (step.isEndSurvey()) {
            complete(responseId);
            return NextStep.completed();
        }
        final String target = step.target();
        if (questionRepository.findById(target).isEmpty()) {
            LOG.warn("Response {} points to missing question {}",
                    responseId, target);
            throw new FlowReferenceException(
                    "Next question no longer exists in the survey");
        }
        return NextStep.question(target);
    }

    /**
     * Completes a response. Completing it again has no effect.
     *
     * @param responseId the response
     * @return the completed response
     * @throws NotFoundException if the response does not exist
     */
    public Response complete(final String responseId) {
        return inTransaction(responseId, handle -> {
            final Response response = lock(handle, responseId);
            if (response.markComplete()) {
                responseRepository.update(handle, response);
                LOG.info("Response {} completed", responseId);
            }
            return response;
        });
    }

    /**
     * Finds a response by ID, throwing if not found.
     *
     * @param responseId the response ID
     * @return the response
     * @throws NotFoundException if the response is not found
     */
    public Response getResponse(final String responseId) {
        return responseRepository.findById(responseId)
                .orElseThrow(() -> new NotFoundException("Response",
                        responseId));
    }

    /**
     * Lists the answers of a response, oldest first.
     *
     * @param responseId the response ID
     * @return the answers with their stamped steps
     */
    public List<Answer> answers(final String responseId) {
        return answerRepository.findByResponseId(responseId);
    }

    private NextStep record(final Handle handle, final String responseId,
            final String questionId, final AnswerPayload payload,
            final NavigationDeterminant<String> step) {
        final Response response = lock(handle, responseId);
        response.requireOpen();

        answerRepository.deleteByResponseAndQuestion(handle, responseId,
                questionId);
        answerRepository.insert(handle, Answer.create(responseId, questionId,
                payload, step));
        response.recordVisited(questionId);
        if (step.isEndSurvey()) {
            response.markComplete();
        }
        responseRepository.update(handle, response);

        return step.isEndSurvey()
                ? NextStep.completed()
                : NextStep.question(step.target());
    }

    private Response lock(final Handle handle, final String responseId) {
        return responseRepository.lockById(handle, responseId)
                .orElseThrow(() -> new NotFoundException("Response",
                        responseId));
    }

    private <T> T inTransaction(final String responseId,
            final HandleCallback<T, RuntimeException> work) {
        try {
            return jdbi.inTransaction(work);
        } catch (final DomainException e) {
            throw e;
        } catch (final RuntimeException e) {
            LOG.error("Transaction on response {} rolled back", responseId, e);
            throw new TransactionAbortedException(
                    "Response update failed; no changes were applied", e);
        }
    }

}
