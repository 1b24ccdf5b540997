package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Decides, at answer time, what comes after a question.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>a branching question whose answer selects exactly one option with
 *       an override follows that override</li>
 *   <li>otherwise the question's default determinant applies</li>
 *   <li>a sequential determinant becomes the question one order position
 *       later, or the end of the survey after the last question</li>
 * </ol>
 *
 * <p>The result is never {@link NavigationDeterminant.Type#SEQUENTIAL}: it is
 * the concrete step that gets stamped onto the answer.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class NavigationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            NavigationResolver.class);

    /**
     * Resolves the next step after answering a question.
     *
     * @param graph the persisted flow graph of the survey
     * @param currentQuestionId the question that was answered
     * @param selection the options the answer selected
     * @return a go-to determinant with a target in the graph, or end survey
     * @throws NotFoundException if the question is not part of the graph
     * @throws FlowReferenceException if the applicable determinant targets
     *         a question that no longer exists
     */
    public NavigationDeterminant<String> resolve(final FlowGraph<String> graph,
            final String currentQuestionId, final AnswerSelection selection) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonBlank(currentQuestionId,
                "Current question id is required");

        final int position = graph.positionOf(currentQuestionId)
                .orElseThrow(() -> new NotFoundException("Question",
                        currentQuestionId));
        final FlowNode<String> node = graph.node(position);

        final NavigationDeterminant<String> determinant = applicable(node,
                selection != null ? selection : AnswerSelection.none());

        final NavigationDeterminant<String> step = concrete(graph, position,
                determinant);
        LOG.debug("Question {} resolved {} to {}", currentQuestionId,
                determinant, step);
        return step;
    }

    private NavigationDeterminant<String> applicable(
            final FlowNode<String> node, final AnswerSelection selection) {
        if (node.kind().supportsBranching()) {
            final OptionalInt option = selection.singleOption();
            if (option.isPresent()) {
                final NavigationDeterminant<String> override =
                        node.optionNext().get(option.getAsInt());
                if (override != null) {
                    return override;
                }
            }
        }
        return node.defaultNext();
    }

    private NavigationDeterminant<String> concrete(
            final FlowGraph<String> graph, final int position,
            final NavigationDeterminant<String> determinant) {
        final int target = graph.stepTarget(position, determinant);
        if (target == FlowGraph.UNRESOLVED) {
            LOG.warn("Question {} points to missing question {}",
                    graph.ref(position), determinant.target());
            throw new FlowReferenceException(
                    "Next question no longer exists in the survey");
        }
        if (target == FlowGraph.END) {
            return NavigationDeterminant.endSurvey();
        }
        if (target == position) {
            throw new FlowReferenceException(
                    "Question cannot lead to itself");
        }
        return NavigationDeterminant.goTo(graph.ref(target));
    }

}
