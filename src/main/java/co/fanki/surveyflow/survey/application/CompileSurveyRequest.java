package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import co.fanki.surveyflow.survey.domain.FieldError;
import co.fanki.surveyflow.survey.domain.StructuralValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Body of a batch compile request.
 *
 * @param title the new title, optional
 * @param description the new description, optional
 * @param questions the draft questions in order
 * @param activateAfterUpdate whether to open the survey once replaced
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CompileSurveyRequest(
        String title,
        String description,
        List<DraftQuestionRequest> questions,
        Boolean activateAfterUpdate
) {

    /**
     * Converts the request into a compile command.
     *
     * @return the command
     * @throws StructuralValidationException if a question is missing or has
     *         an unknown kind
     */
    public CompileCommand toCommand() {
        final List<FieldError> errors = new ArrayList<>();
        final List<DraftQuestion> drafts = new ArrayList<>();
        final List<DraftQuestionRequest> source =
                questions != null ? questions : List.of();
        for (int i = 0; i < source.size(); i++) {
            final DraftQuestionRequest request = source.get(i);
            if (request == null) {
                errors.add(new FieldError("questions[" + i + "]",
                        "Question is required"));
                continue;
            }
            final QuestionKind kind = parseKind(request.getKind());
            if (kind == null) {
                errors.add(new FieldError("questions[" + i + "].kind",
                        "Unknown question kind: " + request.getKind()));
                continue;
            }
            DraftQuestion draft = DraftQuestion.of(request.getText(), kind,
                    request.isRequired(), request.getOptions());
            if (request.isDefaultNextIndexSpecified()) {
                draft = draft.withDefaultNext(request.getDefaultNextIndex());
            }
            if (request.getOptionNextIndexes() != null) {
                draft = draft.withOptionNext(request.getOptionNextIndexes());
            }
            drafts.add(draft);
        }
        if (!errors.isEmpty()) {
            throw new StructuralValidationException(errors);
        }
        return new CompileCommand(title, description, drafts,
                Boolean.TRUE.equals(activateAfterUpdate));
    }

    private static QuestionKind parseKind(final String kind) {
        if (kind == null) {
            return null;
        }
        try {
            return QuestionKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            return null;
        }
    }

}
