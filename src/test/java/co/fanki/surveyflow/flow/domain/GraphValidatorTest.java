package co.fanki.surveyflow.flow.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphValidator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphValidatorTest {

    private GraphValidator validator;

    @BeforeEach
    void setUp() {
        validator = new GraphValidator();
    }

    private static DraftQuestion text(final String text) {
        return DraftQuestion.of(text, QuestionKind.TEXT, false, null);
    }

    private static DraftQuestion choice(final String text) {
        return DraftQuestion.of(text, QuestionKind.SINGLE_CHOICE, true,
                List.of("A", "B"));
    }

    private static Map<Integer, Integer> overrides(final Integer option,
            final Integer target) {
        final Map<Integer, Integer> result = new HashMap<>();
        result.put(option, target);
        return result;
    }

    @Test
    void whenValidating_givenWellFormedBranchingSurvey_shouldBeValid() {
        final Map<Integer, Integer> branches = new HashMap<>();
        branches.put(0, null);
        branches.put(1, -1);
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("What is your name?"),
                choice("Do you want to continue?").withOptionNext(branches),
                DraftQuestion.of("Rate us", QuestionKind.RATING, true, null)
                        .withDefaultNext(null)));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
        assertFalse(result.hasCycle());
    }

    @Test
    void whenValidating_givenSequentialSurvey_shouldBeValid() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"), text("Second question"),
                text("Third question")));

        assertTrue(validator.validate(graph).valid());
    }

    @Test
    void whenDetectingCycle_givenLastPointsToFirst_shouldReturnExactPath() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"), text("Second question"),
                text("Third question").withDefaultNext(0)));

        final Optional<List<Integer>> cycle = validator.detectCycle(graph);

        assertTrue(cycle.isPresent());
        assertEquals(List.of(0, 1, 2, 0), cycle.get());
    }

    @Test
    void whenDetectingCycle_givenCycleAfterPrefix_shouldStartAtRevisitedNode() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"), text("Second question"),
                text("Third question"),
                text("Fourth question").withDefaultNext(1)));

        assertEquals(List.of(1, 2, 3, 1),
                validator.detectCycle(graph).orElseThrow());
    }

    @Test
    void whenValidating_givenCycle_shouldRejectWithCycleException() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"), text("Second question"),
                text("Third question").withDefaultNext(0)));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertFalse(result.valid());
        assertTrue(result.has(FlowIssue.Type.CYCLE));
        assertTrue(result.has(FlowIssue.Type.NO_TERMINAL));
        assertEquals(List.of(0, 1, 2, 0), result.cyclePath());
        assertTrue(result.errors().get(0).startsWith(
                "Cycle detected in question flow: Q0 \"First question\""));

        final FlowValidationException e = FlowValidationException.from(result);
        final CycleDetectedException cycle = assertInstanceOf(
                CycleDetectedException.class, e);
        assertEquals(List.of(0, 1, 2, 0), cycle.cyclePath());
        assertEquals("FLOW_CYCLE_DETECTED", e.getErrorCode());
    }

    @Test
    void whenValidating_givenDefaultLoopBehindOverriddenOptions_shouldReject() {
        final Map<Integer, Integer> branches = new HashMap<>();
        branches.put(0, null);
        branches.put(1, null);
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"),
                DraftQuestion.of("Pick one", QuestionKind.SINGLE_CHOICE,
                        false, List.of("A", "B"))
                        .withOptionNext(branches)
                        .withDefaultNext(0)));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertFalse(result.valid());
        assertTrue(result.has(FlowIssue.Type.CYCLE));
        assertEquals(List.of(0, 1, 0), result.cyclePath());
    }

    @Test
    void whenValidating_givenSkippedQuestion_shouldReportUnreachable() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question").withDefaultNext(2),
                text("Second question"),
                text("Third question").withDefaultNext(null)));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertFalse(result.valid());
        assertEquals(List.of(1), result.unreachable());
        assertEquals(List.of("Q1 \"Second question\" is not reachable"
                + " from the first question"), result.errors());

        final FlowValidationException e = FlowValidationException.from(result);
        assertInstanceOf(UnreachableQuestionException.class, e);
        assertEquals("FLOW_UNREACHABLE_QUESTION", e.getErrorCode());
    }

    @Test
    void whenValidating_givenOverrideOnlyTarget_shouldTreatAsReachable() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                choice("Pick one").withDefaultNext(null)
                        .withOptionNext(overrides(1, 2)),
                text("Never shown").withDefaultNext(null),
                text("Shown after B").withDefaultNext(null)));

        assertEquals(List.of(1), validator.detectUnreachable(graph));
    }

    @Test
    void whenValidating_givenSelfReference_shouldReportIt() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"),
                text("Second question").withDefaultNext(1)));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.has(FlowIssue.Type.SELF_REFERENCE));
        assertTrue(result.errors().contains(
                "Default next of Q1 \"Second question\" points to itself"));
    }

    @Test
    void whenValidating_givenSelfReferencingOverride_shouldReportIt() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                choice("Pick one").withOptionNext(overrides(0, 0)),
                text("Last question")));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.has(FlowIssue.Type.SELF_REFERENCE));
    }

    @Test
    void whenValidating_givenTargetOutOfRange_shouldReportInvalidTarget() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question").withDefaultNext(7),
                text("Second question")));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.has(FlowIssue.Type.INVALID_TARGET));
    }

    @Test
    void whenValidating_givenOverrideForMissingOption_shouldReportOrphan() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                choice("Pick one").withOptionNext(overrides(3, null)),
                text("Last question")));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.has(FlowIssue.Type.ORPHANED_OVERRIDE));
        assertTrue(result.errors().get(0).contains("option 3"));
    }

    @Test
    void whenValidating_givenOverrideOnTextQuestion_shouldReportIt() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question").withOptionNext(overrides(0, null)),
                text("Last question")));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.has(FlowIssue.Type.OVERRIDE_NOT_SUPPORTED));
    }

    @Test
    void whenValidating_givenRatingBranch_shouldAcceptImplicitOptions() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                DraftQuestion.of("Rate us", QuestionKind.RATING, true, null)
                        .withOptionNext(overrides(4, 2)),
                text("Why not five?").withDefaultNext(null),
                text("What did you love?").withDefaultNext(null)));

        assertTrue(validator.validate(graph).valid());
    }

    @Test
    void whenValidating_givenEmptySurvey_shouldReportOnlyEmptiness() {
        final FlowValidationResult<Integer> result = validator.validate(
                FlowGraph.fromDraft(List.of()));

        assertFalse(result.valid());
        assertEquals(1, result.issues().size());
        assertTrue(result.has(FlowIssue.Type.EMPTY_SURVEY));
    }

    @Test
    void whenValidating_givenSeveralProblems_shouldCollectAll() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question").withDefaultNext(9),
                choice("Pick one").withOptionNext(overrides(5, null)),
                text("Third question").withDefaultNext(2)));

        final FlowValidationResult<Integer> result = validator.validate(graph);

        assertTrue(result.has(FlowIssue.Type.INVALID_TARGET));
        assertTrue(result.has(FlowIssue.Type.ORPHANED_OVERRIDE));
        assertTrue(result.has(FlowIssue.Type.SELF_REFERENCE));
        assertTrue(result.has(FlowIssue.Type.UNREACHABLE));
        assertTrue(result.has(FlowIssue.Type.NO_TERMINAL));
        assertEquals("FLOW_INVALID",
                FlowValidationException.from(result).getErrorCode());
    }

    @Test
    void whenDetectingCycle_givenPersistedGraph_shouldReturnIds() {
        final FlowGraph<String> graph = FlowGraph.fromDraft(List.of(
                text("First question"),
                text("Second question").withDefaultNext(0)))
                .toPersisted(Map.of(0, "q-a", 1, "q-b"));

        assertEquals(List.of("q-a", "q-b", "q-a"),
                validator.detectCycle(graph).orElseThrow());
    }

}
