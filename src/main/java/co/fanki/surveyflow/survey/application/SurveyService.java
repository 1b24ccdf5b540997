package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.survey.domain.QuestionRepository;
import co.fanki.surveyflow.survey.domain.Survey;
import co.fanki.surveyflow.survey.domain.SurveyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application service for survey operations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class SurveyService {

    private static final Logger LOG = LoggerFactory.getLogger(
            SurveyService.class);

    private final SurveyRepository surveyRepository;
    private final QuestionRepository questionRepository;

    /**
     * Creates a new SurveyService.
     *
     * @param theSurveyRepository the survey repository
     * @param theQuestionRepository the question repository
     */
    public SurveyService(final SurveyRepository theSurveyRepository,
            final QuestionRepository theQuestionRepository) {
        this.surveyRepository = theSurveyRepository;
        this.questionRepository = theQuestionRepository;
    }

    /**
     * Creates a new, inactive survey without questions.
     *
     * @param title the survey title
     * @param description the optional description
     * @return the created survey
     */
    public Survey createSurvey(final String title, final String description) {
        final Survey survey = Survey.create(title, description);
        surveyRepository.save(survey);
        LOG.info("Survey created with ID: {}", survey.id());
        return survey;
    }

    /**
     * Finds a survey by ID, throwing if not found.
     *
     * @param surveyId the survey ID
     * @return the survey
     * @throws NotFoundException if the survey is not found
     */
    public Survey getById(final String surveyId) {
        return surveyRepository.findById(surveyId)
                .orElseThrow(() -> new NotFoundException("Survey", surveyId));
    }

    /**
     * Loads a survey with its questions in order.
     *
     * @param surveyId the survey ID
     * @return the survey and its questions
     * @throws NotFoundException if the survey is not found
     */
    public CompiledSurvey getWithQuestions(final String surveyId) {
        final Survey survey = getById(surveyId);
        return new CompiledSurvey(survey,
                questionRepository.findBySurveyId(surveyId));
    }

}
