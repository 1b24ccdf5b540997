package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.DraftQuestion;

import java.util.List;

/**
 * Input of a batch compile.
 *
 * @param title the new title, null keeps the current one
 * @param description the new description, null keeps the current one
 * @param questions the draft questions in order
 * @param activateAfterUpdate whether to open the survey once replaced
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CompileCommand(
        String title,
        String description,
        List<DraftQuestion> questions,
        boolean activateAfterUpdate) {

    /**
     * Creates a command that only replaces questions.
     *
     * @param questions the draft questions in order
     * @return the command
     */
    public static CompileCommand questionsOnly(
            final List<DraftQuestion> questions) {
        return new CompileCommand(null, null, questions, false);
    }

}
