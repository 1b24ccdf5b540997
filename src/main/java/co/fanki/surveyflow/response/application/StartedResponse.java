package co.fanki.surveyflow.response.application;

/**
 * A freshly started response and the question to show first.
 *
 * @param responseId the new response ID
 * @param firstQuestionId the question at order position 0
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StartedResponse(String responseId, String firstQuestionId) {
}
