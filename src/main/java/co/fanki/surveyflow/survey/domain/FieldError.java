package co.fanki.surveyflow.survey.domain;

/**
 * A problem with one field of an authored survey.
 *
 * @param field the path of the field, e.g. {@code questions[2].options}
 * @param message the author-facing description
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FieldError(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }

}
