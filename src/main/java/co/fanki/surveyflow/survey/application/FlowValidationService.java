package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.FlowGraph;
import co.fanki.surveyflow.flow.domain.FlowValidationResult;
import co.fanki.surveyflow.flow.domain.GraphValidator;
import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.survey.domain.QuestionRepository;
import co.fanki.surveyflow.survey.domain.SurveyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates the flow graph a survey currently has in storage.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FlowValidationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowValidationService.class);

    private final SurveyRepository surveyRepository;
    private final QuestionRepository questionRepository;
    private final GraphValidator graphValidator;

    /**
     * Creates a new FlowValidationService.
     *
     * @param theSurveyRepository the survey repository
     * @param theQuestionRepository the question repository
     * @param theGraphValidator the flow graph validator
     */
    public FlowValidationService(final SurveyRepository theSurveyRepository,
            final QuestionRepository theQuestionRepository,
            final GraphValidator theGraphValidator) {
        this.surveyRepository = theSurveyRepository;
        this.questionRepository = theQuestionRepository;
        this.graphValidator = theGraphValidator;
    }

    /**
     * Validates the persisted flow of a survey.
     *
     * @param surveyId the survey ID
     * @return the validation result, addressed by question id
     * @throws NotFoundException if the survey is not found
     */
    public FlowValidationResult<String> validate(final String surveyId) {
        if (surveyRepository.findById(surveyId).isEmpty()) {
            throw new NotFoundException("Survey", surveyId);
        }
        final FlowGraph<String> graph =
                questionRepository.findGraphBySurveyId(surveyId);
        final FlowValidationResult<String> result =
                graphValidator.validate(graph);
        LOG.debug("Survey {} flow valid: {}", surveyId, result.valid());
        return result;
    }

}
