package co.fanki.surveyflow.survey.domain;

import co.fanki.surveyflow.shared.DomainException;

import java.util.List;

/**
 * Raised when authored questions break per-field rules.
 *
 * <p>Carries every field error found, not just the first one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StructuralValidationException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final transient List<FieldError> fieldErrors;

    /**
     * Creates a new structural validation exception.
     *
     * @param theFieldErrors the field errors, must not be empty
     */
    public StructuralValidationException(final List<FieldError> theFieldErrors) {
        super("Survey questions are invalid: " + theFieldErrors,
                "STRUCTURAL_VALIDATION_FAILED");
        this.fieldErrors = List.copyOf(theFieldErrors);
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

}
