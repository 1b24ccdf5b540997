package co.fanki.surveyflow.survey.domain;

import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import co.fanki.surveyflow.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-field checks on authored questions, run before any graph is built.
 *
 * <p>Collects every error instead of failing on the first one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class StructuralValidator {

    private final QuestionLimits limits;

    /**
     * Creates a new StructuralValidator.
     *
     * @param theLimits the configured question limits
     */
    public StructuralValidator(final QuestionLimits theLimits) {
        this.limits = Preconditions.requireNonNull(theLimits,
                "Question limits are required");
    }

    /**
     * Checks a draft question list.
     *
     * @param drafts the submitted questions in order
     * @return every field error found, empty if the list is well-formed
     */
    public List<FieldError> check(final List<DraftQuestion> drafts) {
        final List<FieldError> errors = new ArrayList<>();
        if (drafts == null) {
            errors.add(new FieldError("questions", "Questions are required"));
            return errors;
        }
        if (drafts.size() > limits.maxQuestions()) {
            errors.add(new FieldError("questions", "A survey cannot have more"
                    + " than " + limits.maxQuestions() + " questions"));
        }
        for (int i = 0; i < drafts.size(); i++) {
            checkQuestion("questions[" + i + "]", drafts.get(i), errors);
        }
        return errors;
    }

    private void checkQuestion(final String path, final DraftQuestion draft,
            final List<FieldError> errors) {
        if (draft == null) {
            errors.add(new FieldError(path, "Question is required"));
            return;
        }
        checkText(path + ".text", draft.text(), errors);

        final QuestionKind kind = draft.kind();
        if (kind.requiresOptions()) {
            checkOptions(path + ".options", draft.options(), errors);
        } else if (!draft.options().isEmpty()) {
            errors.add(new FieldError(path + ".options",
                    kind + " questions cannot have options"));
        }

        if (draft.hasOptionOverrides() && !kind.supportsBranching()) {
            errors.add(new FieldError(path + ".optionNextIndexes",
                    "Per-option navigation is only allowed on "
                            + QuestionKind.SINGLE_CHOICE + " and "
                            + QuestionKind.RATING + " questions"));
        }
    }

    private void checkText(final String path, final String text,
            final List<FieldError> errors) {
        if (text == null || text.isBlank()) {
            errors.add(new FieldError(path, "Question text is required"));
            return;
        }
        final int length = text.trim().length();
        if (length < limits.minTextLength()) {
            errors.add(new FieldError(path, "Question text must be at least "
                    + limits.minTextLength() + " characters"));
        } else if (length > limits.maxTextLength()) {
            errors.add(new FieldError(path, "Question text cannot exceed "
                    + limits.maxTextLength() + " characters"));
        }
    }

    private void checkOptions(final String path, final List<String> options,
            final List<FieldError> errors) {
        if (options.size() < limits.minOptions()) {
            errors.add(new FieldError(path, "Choice questions must have at"
                    + " least " + limits.minOptions() + " options"));
        } else if (options.size() > limits.maxOptions()) {
            errors.add(new FieldError(path, "Questions cannot have more than "
                    + limits.maxOptions() + " options"));
        }
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < options.size(); i++) {
            final String option = options.get(i);
            if (option == null || option.isBlank()) {
                errors.add(new FieldError(path + "[" + i + "]",
                        "All options must have text"));
            } else if (option.trim().length() > limits.maxOptionLength()) {
                errors.add(new FieldError(path + "[" + i + "]",
                        "Option text cannot exceed "
                                + limits.maxOptionLength() + " characters"));
            } else if (!seen.add(option.trim())) {
                errors.add(new FieldError(path + "[" + i + "]",
                        "Duplicate option: " + option.trim()));
            }
        }
    }

}
