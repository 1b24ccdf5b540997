package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.FlowGraph;
import co.fanki.surveyflow.flow.domain.FlowNode;
import co.fanki.surveyflow.flow.domain.FlowValidationException;
import co.fanki.surveyflow.flow.domain.FlowValidationResult;
import co.fanki.surveyflow.flow.domain.GraphValidator;
import co.fanki.surveyflow.response.domain.ResponseRepository;
import co.fanki.surveyflow.shared.DomainException;
import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.shared.Preconditions;
import co.fanki.surveyflow.shared.TransactionAbortedException;
import co.fanki.surveyflow.survey.domain.FieldError;
import co.fanki.surveyflow.survey.domain.Question;
import co.fanki.surveyflow.survey.domain.QuestionRepository;
import co.fanki.surveyflow.survey.domain.StructuralValidationException;
import co.fanki.surveyflow.survey.domain.StructuralValidator;
import co.fanki.surveyflow.survey.domain.Survey;
import co.fanki.surveyflow.survey.domain.SurveyRepository;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the whole question set and flow graph of a survey from an
 * index-addressed draft.
 *
 * <p>Runs in three passes:</p>
 * <ol>
 *   <li>structural checks on every draft question, collecting all field
 *       errors</li>
 *   <li>graph validation of the draft flow graph</li>
 *   <li>one transaction that locks the survey row, deletes its responses
 *       and questions, inserts the new questions in order, translates every
 *       draft index into the new question ids and writes the navigation</li>
 * </ol>
 *
 * <p>The first two passes touch no durable state. Any failure in the third
 * pass rolls the whole transaction back, leaving the survey exactly as it
 * was.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class BatchFlowCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(
            BatchFlowCompiler.class);

    private final Jdbi jdbi;
    private final SurveyRepository surveyRepository;
    private final QuestionRepository questionRepository;
    private final ResponseRepository responseRepository;
    private final StructuralValidator structuralValidator;
    private final GraphValidator graphValidator;

    /**
     * Creates a new BatchFlowCompiler.
     *
     * @param theJdbi the JDBI instance used to open the transaction
     * @param theSurveyRepository the survey repository
     * @param theQuestionRepository the question repository
     * @param theResponseRepository the response repository
     * @param theStructuralValidator the per-field validator
     * @param theGraphValidator the flow graph validator
     */
    public BatchFlowCompiler(final Jdbi theJdbi,
            final SurveyRepository theSurveyRepository,
            final QuestionRepository theQuestionRepository,
            final ResponseRepository theResponseRepository,
            final StructuralValidator theStructuralValidator,
            final GraphValidator theGraphValidator) {
        this.jdbi = theJdbi;
        this.surveyRepository = theSurveyRepository;
        this.questionRepository = theQuestionRepository;
        this.responseRepository = theResponseRepository;
        this.structuralValidator = theStructuralValidator;
        this.graphValidator = theGraphValidator;
    }

    /**
     * Compiles a draft into the persisted questions of a survey.
     *
     * <p>Destructive: every existing response of the survey, with its
     * answers, is deleted together with the old questions.</p>
     *
     * @param surveyId the survey to replace
     * @param command the draft and the metadata changes
     * @return the survey and its new questions
     * @throws StructuralValidationException if any draft field is invalid
     * @throws FlowValidationException if the draft flow graph is invalid
     * @throws NotFoundException if the survey does not exist
     * @throws TransactionAbortedException if the replace failed and was
     *         rolled back
     */
    public CompiledSurvey compile(final String surveyId,
            final CompileCommand command) {
        Preconditions.requireNonBlank(surveyId, "Survey ID is required");
        Preconditions.requireNonNull(command, "Compile command is required");

        final List<DraftQuestion> drafts = command.questions();
        LOG.info("Compiling {} questions for survey {}",
                drafts != null ? drafts.size() : 0, surveyId);

        checkStructure(command);

        final FlowGraph<Integer> draftGraph = FlowGraph.fromDraft(drafts);
        final FlowValidationResult<Integer> validation =
                graphValidator.validate(draftGraph);
        if (!validation.valid()) {
            LOG.warn("Rejected flow for survey {}: {}", surveyId,
                    validation.errors());
            throw FlowValidationException.from(validation);
        }

        final CompiledSurvey compiled;
        try {
            compiled = jdbi.inTransaction(handle ->
                    replace(handle, surveyId, command, draftGraph));
        } catch (final DomainException e) {
            throw e;
        } catch (final RuntimeException e) {
            LOG.error("Flow replace of survey {} rolled back", surveyId, e);
            throw new TransactionAbortedException(
                    "Survey update failed; no changes were applied", e);
        }

        LOG.info("Survey {} compiled to version {} with {} questions",
                surveyId, compiled.survey().version(),
                compiled.questions().size());
        return compiled;
    }

    private void checkStructure(final CompileCommand command) {
        final List<FieldError> errors = new ArrayList<>();
        final String title = command.title();
        if (title != null) {
            final int length = title.trim().length();
            if (length < Survey.TITLE_MIN_LENGTH
                    || length > Survey.TITLE_MAX_LENGTH) {
                errors.add(new FieldError("title", "Survey title must be"
                        + " between " + Survey.TITLE_MIN_LENGTH + " and "
                        + Survey.TITLE_MAX_LENGTH + " characters"));
            }
        }
        errors.addAll(structuralValidator.check(command.questions()));
        if (!errors.isEmpty()) {
            LOG.warn("Rejected survey draft with {} field errors",
                    errors.size());
            throw new StructuralValidationException(errors);
        }
    }

    private CompiledSurvey replace(final Handle handle, final String surveyId,
            final CompileCommand command,
            final FlowGraph<Integer> draftGraph) {
        final Survey survey = surveyRepository.lockById(handle, surveyId)
                .orElseThrow(() -> new NotFoundException("Survey", surveyId));

        final int deletedResponses = responseRepository.deleteBySurveyId(
                handle, surveyId);
        final int deletedQuestions = questionRepository.deleteBySurveyId(
                handle, surveyId);
        LOG.debug("Survey {}: removed {} questions and {} responses",
                surveyId, deletedQuestions, deletedResponses);

        final List<DraftQuestion> drafts = command.questions();
        final List<Question> questions = new ArrayList<>(drafts.size());
        final Map<Integer, String> ids = new HashMap<>();
        for (int i = 0; i < drafts.size(); i++) {
            final Question question = Question.fromDraft(surveyId, i,
                    drafts.get(i));
            questionRepository.insert(handle, question);
            questions.add(question);
            ids.put(i, question.id());
        }

        final FlowGraph<String> persisted = draftGraph.toPersisted(ids);
        for (final Question question : questions) {
            final FlowNode<String> node = persisted.node(
                    question.orderIndex());
            question.assignFlow(node.defaultNext(), node.optionNext());
            questionRepository.updateFlow(handle, question);
        }

        survey.updateMetadata(command.title(), command.description());
        survey.incrementVersion();
        if (command.activateAfterUpdate()) {
            survey.activate();
        }
        surveyRepository.update(handle, survey);

        return new CompiledSurvey(survey, questions);
    }

}
