package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.CycleDetectedException;
import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.FlowValidationResult;
import co.fanki.surveyflow.flow.domain.GraphValidator;
import co.fanki.surveyflow.flow.domain.NavigationDeterminant;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import co.fanki.surveyflow.response.application.NextStep;
import co.fanki.surveyflow.response.application.ResponseService;
import co.fanki.surveyflow.response.application.StartedResponse;
import co.fanki.surveyflow.response.domain.AnswerPayload;
import co.fanki.surveyflow.response.domain.ResponseRepository;
import co.fanki.surveyflow.shared.TransactionAbortedException;
import co.fanki.surveyflow.survey.domain.Question;
import co.fanki.surveyflow.survey.domain.QuestionRepository;
import co.fanki.surveyflow.survey.domain.StructuralValidator;
import co.fanki.surveyflow.survey.domain.Survey;
import co.fanki.surveyflow.survey.domain.SurveyRepository;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for {@link BatchFlowCompiler} and the response flow
 * against PostgreSQL using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class BatchFlowCompilerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private Jdbi jdbi;

    @Autowired
    private BatchFlowCompiler compiler;

    @Autowired
    private SurveyRepository surveyRepository;

    @Autowired
    private QuestionRepository questionRepository;

    @Autowired
    private ResponseRepository responseRepository;

    @Autowired
    private StructuralValidator structuralValidator;

    @Autowired
    private FlowValidationService flowValidationService;

    @Autowired
    private ResponseService responseService;

    private Survey survey;

    @BeforeEach
    void setUp() {
        jdbi.useHandle(handle -> handle.execute("DELETE FROM surveys"));
        survey = Survey.create("Customer feedback", null);
        surveyRepository.save(survey);
    }

    private static DraftQuestion text(final String text) {
        return DraftQuestion.of(text, QuestionKind.TEXT, true, null);
    }

    /** Q0 text, Q1 choice {A: end, B: sequential}, Q2 rating ending. */
    private static List<DraftQuestion> branchingDraft() {
        final Map<Integer, Integer> branches = new HashMap<>();
        branches.put(0, null);
        branches.put(1, -1);
        return List.of(
                text("What is your name?"),
                DraftQuestion.of("Do you want to continue?",
                        QuestionKind.SINGLE_CHOICE, true, List.of("A", "B"))
                        .withOptionNext(branches),
                DraftQuestion.of("Rate us", QuestionKind.RATING, true, null)
                        .withDefaultNext(null));
    }

    @Test
    void whenCompiling_givenValidDraft_shouldPersistTranslatedFlow() {
        compiler.compile(survey.id(), new CompileCommand(null, null,
                List.of(text("First question").withDefaultNext(2),
                        text("Second question").withDefaultNext(null),
                        text("Third question").withDefaultNext(1)),
                false));

        final List<Question> stored = questionRepository.findBySurveyId(
                survey.id());
        assertEquals(3, stored.size());
        assertEquals(NavigationDeterminant.goTo(stored.get(2).id()),
                stored.get(0).defaultNext());
        assertTrue(stored.get(1).defaultNext().isEndSurvey());
        assertEquals(NavigationDeterminant.goTo(stored.get(1).id()),
                stored.get(2).defaultNext());

        final FlowValidationResult<String> result =
                flowValidationService.validate(survey.id());
        assertTrue(result.valid());
        assertEquals(2, surveyRepository.findById(survey.id()).orElseThrow()
                .version());
    }

    @Test
    void whenCompiling_givenCyclicDraft_shouldPersistNothing() {
        compiler.compile(survey.id(), CompileCommand.questionsOnly(
                branchingDraft()));
        final List<String> before = questionRepository.findBySurveyId(
                survey.id()).stream().map(Question::id).toList();

        assertThrows(CycleDetectedException.class,
                () -> compiler.compile(survey.id(), CompileCommand
                        .questionsOnly(List.of(text("First question"),
                                text("Second question"),
                                text("Third question").withDefaultNext(0)))));

        assertEquals(before, questionRepository.findBySurveyId(survey.id())
                .stream().map(Question::id).toList());
    }

    @Test
    void whenCompiling_givenFailureBeforeRewrite_shouldKeepOriginalQuestions() {
        compiler.compile(survey.id(), CompileCommand.questionsOnly(
                branchingDraft()));
        final List<String> before = questionRepository.findBySurveyId(
                survey.id()).stream().map(Question::id).toList();

        final QuestionRepository failingRewrite = new QuestionRepository(jdbi) {
            @Override
            public void updateFlow(final Handle handle,
                    final Question question) {
                throw new IllegalStateException("Simulated failure");
            }
        };
        final BatchFlowCompiler failing = new BatchFlowCompiler(jdbi,
                surveyRepository, failingRewrite, responseRepository,
                structuralValidator, new GraphValidator());

        assertThrows(TransactionAbortedException.class,
                () -> failing.compile(survey.id(), CompileCommand
                        .questionsOnly(List.of(text("Only question")))));

        final List<Question> after = questionRepository.findBySurveyId(
                survey.id());
        assertEquals(before, after.stream().map(Question::id).toList());
        assertTrue(after.get(1).optionNext().get(0).isEndSurvey());
        assertEquals(2, surveyRepository.findById(survey.id()).orElseThrow()
                .version());
    }

    @Test
    void whenRespondingToBranchingSurvey_givenOptionB_shouldReachRating() {
        compiler.compile(survey.id(), new CompileCommand(null, null,
                branchingDraft(), true));
        final List<Question> questions = questionRepository.findBySurveyId(
                survey.id());

        final StartedResponse started = responseService.start(survey.id(),
                "respondent-1");
        assertEquals(questions.get(0).id(), started.firstQuestionId());

        final NextStep afterName = responseService.resolveNext(
                started.responseId(), questions.get(0).id(),
                new AnswerPayload("Ana", null, null, null, null, null, null));
        assertEquals(questions.get(1).id(), afterName.nextQuestionId());

        final NextStep afterChoice = responseService.resolveNext(
                started.responseId(), questions.get(1).id(),
                new AnswerPayload(null, List.of("B"), null, null, null, null,
                        null));
        assertEquals(questions.get(2).id(), afterChoice.nextQuestionId());
        assertEquals(questions.get(2).id(), responseService.nextQuestion(
                started.responseId()).nextQuestionId());

        final NextStep afterRating = responseService.resolveNext(
                started.responseId(), questions.get(2).id(),
                new AnswerPayload(null, null, 4, null, null, null, null));
        assertTrue(afterRating.complete());
        assertTrue(responseService.getResponse(started.responseId())
                .isComplete());
        assertEquals(3, responseService.answers(started.responseId()).size());
    }

    @Test
    void whenRecompiling_givenExistingResponses_shouldDeleteThem() {
        compiler.compile(survey.id(), new CompileCommand(null, null,
                branchingDraft(), true));
        final StartedResponse started = responseService.start(survey.id(),
                "respondent-1");

        compiler.compile(survey.id(), CompileCommand.questionsOnly(
                branchingDraft()));

        assertFalse(responseRepository.findById(started.responseId())
                .isPresent());
    }

}
