package co.fanki.surveyflow.survey.domain;

import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link StructuralValidator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StructuralValidatorTest {

    private StructuralValidator validator;

    @BeforeEach
    void setUp() {
        validator = new StructuralValidator(QuestionLimits.defaults());
    }

    private static DraftQuestion choice(final String... options) {
        return DraftQuestion.of("Pick one please", QuestionKind.SINGLE_CHOICE,
                true, Arrays.asList(options));
    }

    @Test
    void whenChecking_givenWellFormedQuestions_shouldFindNothing() {
        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("What is your name?", QuestionKind.TEXT,
                        true, null),
                choice("Yes", "No"),
                DraftQuestion.of("Rate us", QuestionKind.RATING, false, null)
                        .withOptionNext(Map.of(0, 0))));

        assertTrue(errors.isEmpty());
    }

    @Test
    void whenChecking_givenShortText_shouldReportTextField() {
        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("Hi", QuestionKind.TEXT, false, null)));

        assertEquals(1, errors.size());
        assertEquals("questions[0].text", errors.get(0).field());
    }

    @Test
    void whenChecking_givenBlankText_shouldReportRequired() {
        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("   ", QuestionKind.TEXT, false, null)));

        assertEquals("Question text is required", errors.get(0).message());
    }

    @Test
    void whenChecking_givenTooFewOptions_shouldReportOptions() {
        final List<FieldError> errors = validator.check(List.of(
                choice("Only")));

        assertEquals("questions[0].options", errors.get(0).field());
    }

    @Test
    void whenChecking_givenTooManyOptions_shouldReportOptions() {
        final List<String> options = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            options.add("Option " + i);
        }

        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("Pick many", QuestionKind.MULTIPLE_CHOICE,
                        false, options)));

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().contains("10"));
    }

    @Test
    void whenChecking_givenDuplicateOptions_shouldReportDuplicate() {
        final List<FieldError> errors = validator.check(List.of(
                choice("Yes", "No", "Yes")));

        assertEquals(1, errors.size());
        assertEquals("questions[0].options[2]", errors.get(0).field());
    }

    @Test
    void whenChecking_givenOptionsOnTextQuestion_shouldReportOptions() {
        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("Your name?", QuestionKind.TEXT, false,
                        List.of("A", "B"))));

        assertEquals("questions[0].options", errors.get(0).field());
    }

    @Test
    void whenChecking_givenOverrideOnMultipleChoice_shouldReportIt() {
        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("Pick many", QuestionKind.MULTIPLE_CHOICE,
                        false, List.of("A", "B"))
                        .withOptionNext(Map.of(0, 0))));

        assertEquals(1, errors.size());
        assertEquals("questions[0].optionNextIndexes", errors.get(0).field());
    }

    @Test
    void whenChecking_givenSeveralBadQuestions_shouldCollectAll() {
        final List<FieldError> errors = validator.check(List.of(
                DraftQuestion.of("Hi", QuestionKind.TEXT, false, null),
                choice("Only"),
                DraftQuestion.of("Ok", QuestionKind.NUMBER, false,
                        List.of("1"))));

        assertEquals(4, errors.size());
    }

    @Test
    void whenChecking_givenMoreQuestionsThanAllowed_shouldReportCount() {
        final StructuralValidator strict = new StructuralValidator(
                new QuestionLimits(3, 5000, 2, 10, 500, 1));

        final List<FieldError> errors = strict.check(List.of(
                DraftQuestion.of("First one", QuestionKind.TEXT, false, null),
                DraftQuestion.of("Second one", QuestionKind.TEXT, false,
                        null)));

        assertEquals("questions", errors.get(0).field());
    }

}
