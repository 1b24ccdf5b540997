package co.fanki.surveyflow.survey.domain;

/**
 * Bounds applied to authored questions.
 *
 * @param minTextLength the minimum question text length
 * @param maxTextLength the maximum question text length
 * @param minOptions the minimum option count of a choice question
 * @param maxOptions the maximum option count of a choice question
 * @param maxOptionLength the maximum length of one option text
 * @param maxQuestions the maximum number of questions per survey
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record QuestionLimits(
        int minTextLength,
        int maxTextLength,
        int minOptions,
        int maxOptions,
        int maxOptionLength,
        int maxQuestions) {

    /**
     * The limits used when nothing is configured.
     *
     * @return the default limits
     */
    public static QuestionLimits defaults() {
        return new QuestionLimits(3, 5000, 2, 10, 500, 100);
    }

}
