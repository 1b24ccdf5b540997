package co.fanki.surveyflow.flow.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link NavigationDeterminant}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NavigationDeterminantTest {

    @Test
    void whenComparing_givenSameTarget_shouldBeEqual() {
        assertEquals(NavigationDeterminant.goTo(2),
                NavigationDeterminant.goTo(2));
        assertEquals(NavigationDeterminant.goTo(2).hashCode(),
                NavigationDeterminant.goTo(2).hashCode());
        assertNotEquals(NavigationDeterminant.goTo(2),
                NavigationDeterminant.goTo(3));
        assertNotEquals(NavigationDeterminant.<Integer>endSurvey(),
                NavigationDeterminant.<Integer>sequential());
    }

    @Test
    void whenCreatingGoTo_givenNullTarget_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> NavigationDeterminant.goTo(null));
    }

    @Test
    void whenTranslating_givenGoTo_shouldRewriteTarget() {
        final NavigationDeterminant<String> translated =
                NavigationDeterminant.goTo(1).translate(Map.of(1, "q-1"));

        assertTrue(translated.isGoTo());
        assertEquals("q-1", translated.target());
    }

    @Test
    void whenTranslating_givenEndOrSequential_shouldKeepVariant() {
        final Map<Integer, String> mapping = Map.of(0, "q-0");

        assertTrue(NavigationDeterminant.<Integer>endSurvey()
                .translate(mapping).isEndSurvey());
        assertTrue(NavigationDeterminant.<Integer>sequential()
                .translate(mapping).isSequential());
        assertNull(NavigationDeterminant.<Integer>sequential()
                .translate(mapping).target());
    }

    @Test
    void whenTranslating_givenUnmappedTarget_shouldThrowFlowReference() {
        final FlowReferenceException e = assertThrows(
                FlowReferenceException.class,
                () -> NavigationDeterminant.goTo(7).translate(Map.of(0, "a")));

        assertEquals("FLOW_REFERENCE_INVALID", e.getErrorCode());
    }

    @Test
    void whenPrinting_givenEachVariant_shouldDescribeIt() {
        assertEquals("GoToQuestion(4)", NavigationDeterminant.goTo(4)
                .toString());
        assertEquals("EndSurvey", NavigationDeterminant.endSurvey()
                .toString());
        assertEquals("Sequential", NavigationDeterminant.sequential()
                .toString());
    }

}
