package co.fanki.surveyflow.flow.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FlowGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowGraphTest {

    private static DraftQuestion text(final String text) {
        return DraftQuestion.of(text, QuestionKind.TEXT, false, null);
    }

    private static DraftQuestion choice(final String text,
            final String... options) {
        return DraftQuestion.of(text, QuestionKind.SINGLE_CHOICE, true,
                Arrays.asList(options));
    }

    /** Q0 text, Q1 choice {A: end, B: sequential}, Q2 rating ending. */
    private static List<DraftQuestion> branchingSurvey() {
        final Map<Integer, Integer> overrides = new HashMap<>();
        overrides.put(0, null);
        overrides.put(1, DraftQuestion.SEQUENTIAL_INDEX);
        return List.of(
                text("What is your name?"),
                choice("Do you want to continue?", "A", "B")
                        .withOptionNext(overrides),
                DraftQuestion.of("Rate us", QuestionKind.RATING, true, null)
                        .withDefaultNext(null));
    }

    @Test
    void whenBuildingFromDraft_givenNoExplicitDefault_shouldBeSequential() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"), text("Second question")));

        assertTrue(graph.node(0).defaultNext().isSequential());
        assertTrue(graph.node(1).defaultNext().isSequential());
    }

    @Test
    void whenBuildingFromDraft_givenSentinels_shouldMapIndependentOfPosition() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question").withDefaultNext(null),
                text("Second question").withDefaultNext(-1),
                text("Third question").withDefaultNext(1),
                text("Fourth question").withDefaultNext(-1),
                text("Fifth question").withDefaultNext(null)));

        assertTrue(graph.node(0).defaultNext().isEndSurvey());
        assertTrue(graph.node(1).defaultNext().isSequential());
        assertEquals(NavigationDeterminant.goTo(1),
                graph.node(2).defaultNext());
        assertTrue(graph.node(3).defaultNext().isSequential());
        assertTrue(graph.node(4).defaultNext().isEndSurvey());
    }

    @Test
    void whenBuildingFromDraft_givenOptionOverrides_shouldInterpretSentinels() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(
                branchingSurvey());

        final FlowNode<Integer> node = graph.node(1);
        assertEquals(2, node.optionCount());
        assertTrue(node.optionNext().get(0).isEndSurvey());
        assertTrue(node.optionNext().get(1).isSequential());
    }

    @Test
    void whenBuildingFromDraft_givenRating_shouldHaveFiveImplicitOptions() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(
                branchingSurvey());

        assertEquals(0, graph.node(0).optionCount());
        assertEquals(5, graph.node(2).optionCount());
    }

    @Test
    void whenTranslating_givenFullMapping_shouldKeepStructure() {
        final FlowGraph<Integer> draft = FlowGraph.fromDraft(List.of(
                text("First question").withDefaultNext(2),
                text("Second question"),
                text("Third question").withDefaultNext(1)));

        final FlowGraph<String> persisted = draft.toPersisted(Map.of(
                0, "q-a", 1, "q-b", 2, "q-c"));

        assertEquals(3, persisted.size());
        assertEquals("q-a", persisted.ref(0));
        assertEquals(NavigationDeterminant.goTo("q-c"),
                persisted.node(0).defaultNext());
        assertTrue(persisted.node(1).defaultNext().isSequential());
        assertEquals(NavigationDeterminant.goTo("q-b"),
                persisted.node(2).defaultNext());
        for (int i = 0; i < draft.size(); i++) {
            assertArrayEquals(draft.successors(i), persisted.successors(i));
        }
    }

    @Test
    void whenTranslating_givenMissingNodeMapping_shouldThrow() {
        final FlowGraph<Integer> draft = FlowGraph.fromDraft(List.of(
                text("First question"), text("Second question")));

        assertThrows(FlowReferenceException.class,
                () -> draft.toPersisted(Map.of(0, "q-a")));
    }

    @Test
    void whenComputingOutcomes_givenBranchingQuestion_shouldListDistinct() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(
                branchingSurvey());

        assertEquals(List.of(NavigationDeterminant.endSurvey(),
                NavigationDeterminant.sequential()), graph.outcomes(1));
        assertArrayEquals(new int[] {2}, graph.successors(1));
        assertTrue(graph.terminates(1));
        assertFalse(graph.terminates(0));
        assertTrue(graph.terminates(2));
    }

    @Test
    void whenComputingOutcomes_givenEveryOptionOverridden_shouldKeepDefault() {
        final Map<Integer, Integer> overrides = new HashMap<>();
        overrides.put(0, null);
        overrides.put(1, null);
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("First question"),
                choice("Pick one", "A", "B").withOptionNext(overrides)
                        .withDefaultNext(0)));

        assertEquals(List.of(NavigationDeterminant.endSurvey(),
                NavigationDeterminant.goTo(0)), graph.outcomes(1));
        assertArrayEquals(new int[] {0}, graph.successors(1));
    }

    @Test
    void whenResolvingStepTarget_givenSequentialOnLast_shouldEnd() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("Only question")));

        assertEquals(FlowGraph.END, graph.stepTarget(0,
                NavigationDeterminant.sequential()));
        assertEquals(FlowGraph.UNRESOLVED, graph.stepTarget(0,
                NavigationDeterminant.goTo(9)));
    }

    @Test
    void whenDescribing_givenLongText_shouldTruncate() {
        final FlowGraph<Integer> graph = FlowGraph.fromDraft(List.of(
                text("Which of the following statements best describes you?")));

        assertEquals("Q0 \"Which of the following stateme...\"",
                graph.describe(0));
    }

    @Test
    void whenCreating_givenGapInPositions_shouldThrow() {
        final List<FlowNode<String>> nodes = List.of(
                new FlowNode<>("a", 0, QuestionKind.TEXT, 0, null, null, "A"),
                new FlowNode<>("b", 2, QuestionKind.TEXT, 0, null, null, "B"));

        assertThrows(IllegalArgumentException.class,
                () -> FlowGraph.of(nodes));
    }

}
