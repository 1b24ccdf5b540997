package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.survey.domain.Question;
import co.fanki.surveyflow.survey.domain.Survey;

import java.util.List;

/**
 * A survey together with its questions in order position.
 *
 * @param survey the survey
 * @param questions the questions, ordered by position
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CompiledSurvey(Survey survey, List<Question> questions) {

    /** Freezes the question list. */
    public CompiledSurvey {
        questions = List.copyOf(questions);
    }

}
