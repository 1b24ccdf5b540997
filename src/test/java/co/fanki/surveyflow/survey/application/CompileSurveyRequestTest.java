package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.NavigationDeterminant;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import co.fanki.surveyflow.survey.domain.FieldError;
import co.fanki.surveyflow.survey.domain.QuestionLimits;
import co.fanki.surveyflow.survey.domain.StructuralValidationException;
import co.fanki.surveyflow.survey.domain.StructuralValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CompileSurveyRequest}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CompileSurveyRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void whenConverting_givenAbsentOrExplicitNullDefault_shouldDiffer()
            throws Exception {
        final CompileSurveyRequest request = mapper.readValue("""
                {
                  "questions": [
                    {"text": "First question", "kind": "TEXT"},
                    {"text": "Second question", "kind": "text",
                     "defaultNextIndex": null},
                    {"text": "Third question", "kind": "TEXT",
                     "defaultNextIndex": -1},
                    {"text": "Pick one", "kind": "SINGLE_CHOICE",
                     "isRequired": true, "options": ["A", "B"],
                     "defaultNextIndex": 1,
                     "optionNextIndexes": {"0": null, "1": 2}}
                  ],
                  "activateAfterUpdate": true
                }
                """, CompileSurveyRequest.class);

        final CompileCommand command = request.toCommand();
        final List<DraftQuestion> drafts = command.questions();

        assertTrue(command.activateAfterUpdate());
        assertTrue(drafts.get(0).defaultDeterminant().isSequential());
        assertTrue(drafts.get(1).defaultDeterminant().isEndSurvey());
        assertTrue(drafts.get(2).defaultDeterminant().isSequential());

        final DraftQuestion choice = drafts.get(3);
        assertEquals(QuestionKind.SINGLE_CHOICE, choice.kind());
        assertTrue(choice.required());
        assertEquals(NavigationDeterminant.goTo(1),
                choice.defaultDeterminant());
        assertTrue(choice.optionDeterminants().get(0).isEndSurvey());
        assertEquals(NavigationDeterminant.goTo(2),
                choice.optionDeterminants().get(1));
    }

    @Test
    void whenConverting_givenUnknownKind_shouldReportField() throws Exception {
        final CompileSurveyRequest request = mapper.readValue("""
                {"questions": [{"text": "First question", "kind": "SLIDER"}]}
                """, CompileSurveyRequest.class);

        final StructuralValidationException e = assertThrows(
                StructuralValidationException.class, request::toCommand);

        assertEquals("questions[0].kind", e.fieldErrors().get(0).field());
    }

    @Test
    void whenConverting_givenNullOption_shouldLeaveItForFieldErrors()
            throws Exception {
        final CompileSurveyRequest request = mapper.readValue("""
                {"questions": [{"text": "Pick one", "kind": "SINGLE_CHOICE",
                                "options": ["A", null]}]}
                """, CompileSurveyRequest.class);

        final CompileCommand command = request.toCommand();
        final List<FieldError> errors = new StructuralValidator(
                QuestionLimits.defaults()).check(command.questions());

        assertEquals(1, errors.size());
        assertEquals("questions[0].options[1]", errors.get(0).field());
    }

    @Test
    void whenConverting_givenNoActivationFlag_shouldNotActivate()
            throws Exception {
        final CompileSurveyRequest request = mapper.readValue("""
                {"title": "Feedback", "questions": []}
                """, CompileSurveyRequest.class);

        final CompileCommand command = request.toCommand();

        assertFalse(command.activateAfterUpdate());
        assertEquals("Feedback", command.title());
        assertTrue(command.questions().isEmpty());
    }

}
