package co.fanki.surveyflow.response.application;

/**
 * Where a respondent goes next.
 *
 * @param complete whether the response is finished
 * @param nextQuestionId the question to show, null when complete
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NextStep(boolean complete, String nextQuestionId) {

    static NextStep question(final String questionId) {
        return new NextStep(false, questionId);
    }

    static NextStep completed() {
        return new NextStep(true, null);
    }

}
