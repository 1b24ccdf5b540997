package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;

/**
 * Structural soundness checks for a {@link FlowGraph}.
 *
 * <p>Works on either addressing space. All traversals start at order
 * position 0, the start question, and visit successors in ascending order
 * position so results are deterministic.</p>
 *
 * <p>A graph is well-formed when:</p>
 * <ol>
 *   <li>no determinant targets its own question</li>
 *   <li>every go-to target exists in the graph</li>
 *   <li>overrides exist only on branching kinds and only for existing
 *       options</li>
 *   <li>no cycle is reachable from the start question</li>
 *   <li>every question is reachable from the start question</li>
 *   <li>at least one reachable question can end the survey</li>
 * </ol>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphValidator {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphValidator.class);

    /**
     * Runs every check and aggregates all problems found.
     *
     * @param graph the graph to validate
     * @param <R> the question reference type
     * @return the validation result, never null
     */
    public <R> FlowValidationResult<R> validate(final FlowGraph<R> graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<FlowIssue> issues = new ArrayList<>();

        if (graph.isEmpty()) {
            issues.add(new FlowIssue(FlowIssue.Type.EMPTY_SURVEY, null,
                    "Survey must contain at least one question"));
            return new FlowValidationResult<>(issues, List.of(), List.of());
        }

        for (final FlowNode<R> node : graph.nodes()) {
            checkReferences(graph, node, issues);
            checkOverrides(graph, node, issues);
        }

        final Optional<List<R>> cycle = detectCycle(graph);
        cycle.ifPresent(path -> issues.add(new FlowIssue(
                FlowIssue.Type.CYCLE,
                graph.positionOf(path.get(0)).orElse(null),
                "Cycle detected in question flow: " + formatPath(graph,
                        path))));

        final List<R> unreachable = detectUnreachable(graph);
        for (final R ref : unreachable) {
            final int position = graph.positionOf(ref).orElseThrow();
            issues.add(new FlowIssue(FlowIssue.Type.UNREACHABLE, position,
                    graph.describe(position)
                            + " is not reachable from the first question"));
        }

        if (detectNonTerminating(graph)) {
            issues.add(new FlowIssue(FlowIssue.Type.NO_TERMINAL, null,
                    "Survey must have at least one path that leads to"
                            + " completion"));
        }

        if (issues.isEmpty()) {
            LOG.debug("Flow graph with {} questions is valid", graph.size());
        } else {
            LOG.debug("Flow graph with {} questions has {} issue(s)",
                    graph.size(), issues.size());
        }

        return new FlowValidationResult<>(issues,
                cycle.orElse(List.of()), unreachable);
    }

    /**
     * Finds the first cycle reachable from the start question.
     *
     * <p>Depth-first traversal keeping the current path on a stack. When a
     * successor is still on the stack the path from that successor back to
     * itself is the cycle.</p>
     *
     * @param graph the graph to inspect
     * @param <R> the question reference type
     * @return the cycle as references, first and last element equal
     */
    public <R> Optional<List<R>> detectCycle(final FlowGraph<R> graph) {
        if (graph.isEmpty()) {
            return Optional.empty();
        }
        final boolean[] visited = new boolean[graph.size()];
        final boolean[] onStack = new boolean[graph.size()];
        final List<Integer> path = new ArrayList<>();

        final List<Integer> cycle = dfs(graph, 0, visited, onStack, path);
        if (cycle == null) {
            return Optional.empty();
        }
        final List<R> refs = cycle.stream().map(graph::ref).toList();
        LOG.debug("Cycle found: {}", refs);
        return Optional.of(refs);
    }

    private <R> List<Integer> dfs(final FlowGraph<R> graph, final int position,
            final boolean[] visited, final boolean[] onStack,
            final List<Integer> path) {
        visited[position] = true;
        onStack[position] = true;
        path.add(position);

        for (final int next : graph.successors(position)) {
            if (onStack[next]) {
                final List<Integer> cycle = new ArrayList<>(
                        path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (!visited[next]) {
                final List<Integer> found = dfs(graph, next, visited, onStack,
                        path);
                if (found != null) {
                    return found;
                }
            }
        }

        onStack[position] = false;
        path.remove(path.size() - 1);
        return null;
    }

    /**
     * Finds the questions that no path from the start question reaches.
     *
     * @param graph the graph to inspect
     * @param <R> the question reference type
     * @return unreachable references in order position
     */
    public <R> List<R> detectUnreachable(final FlowGraph<R> graph) {
        final boolean[] seen = reachable(graph);
        final List<R> result = new ArrayList<>();
        for (int i = 0; i < seen.length; i++) {
            if (!seen[i]) {
                result.add(graph.ref(i));
            }
        }
        return result;
    }

    /**
     * Checks whether no reachable question can end the survey.
     *
     * <p>Cycles are reported by {@link #detectCycle(FlowGraph)}; together the
     * two checks guarantee every path from the start terminates.</p>
     *
     * @param graph the graph to inspect
     * @param <R> the question reference type
     * @return true if the survey can never complete
     */
    public <R> boolean detectNonTerminating(final FlowGraph<R> graph) {
        final boolean[] seen = reachable(graph);
        for (int i = 0; i < seen.length; i++) {
            if (seen[i] && graph.terminates(i)) {
                return false;
            }
        }
        return true;
    }

    private <R> boolean[] reachable(final FlowGraph<R> graph) {
        final boolean[] seen = new boolean[graph.size()];
        if (graph.isEmpty()) {
            return seen;
        }
        final Queue<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        seen[0] = true;
        while (!queue.isEmpty()) {
            final int current = queue.poll();
            for (final int next : graph.successors(current)) {
                if (!seen[next]) {
                    seen[next] = true;
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    private <R> void checkReferences(final FlowGraph<R> graph,
            final FlowNode<R> node, final List<FlowIssue> issues) {
        checkReference(graph, node, node.defaultNext(), "Default next",
                issues);
        for (final Map.Entry<Integer, NavigationDeterminant<R>> entry
                : node.optionNext().entrySet()) {
            checkReference(graph, node, entry.getValue(),
                    "Option " + entry.getKey() + " next", issues);
        }
    }

    private <R> void checkReference(final FlowGraph<R> graph,
            final FlowNode<R> node,
            final NavigationDeterminant<R> determinant, final String what,
            final List<FlowIssue> issues) {
        if (!determinant.isGoTo()) {
            return;
        }
        final String source = graph.describe(node.position());
        if (determinant.target().equals(node.ref())) {
            issues.add(new FlowIssue(FlowIssue.Type.SELF_REFERENCE,
                    node.position(),
                    what + " of " + source + " points to itself"));
        } else if (!graph.contains(determinant.target())) {
            issues.add(new FlowIssue(FlowIssue.Type.INVALID_TARGET,
                    node.position(),
                    what + " of " + source + " points to a question that"
                            + " does not exist"));
        }
    }

    private <R> void checkOverrides(final FlowGraph<R> graph,
            final FlowNode<R> node, final List<FlowIssue> issues) {
        if (!node.hasOverrides()) {
            return;
        }
        final String source = graph.describe(node.position());
        if (!node.kind().supportsBranching()) {
            issues.add(new FlowIssue(FlowIssue.Type.OVERRIDE_NOT_SUPPORTED,
                    node.position(),
                    source + " is a " + node.kind()
                            + " question and cannot branch per option"));
            return;
        }
        for (final Integer option : node.optionNext().keySet()) {
            if (option < 0 || option >= node.optionCount()) {
                issues.add(new FlowIssue(FlowIssue.Type.ORPHANED_OVERRIDE,
                        node.position(),
                        source + " has a branch for option " + option
                                + " which does not exist (valid range 0-"
                                + (node.optionCount() - 1) + ")"));
            }
        }
    }

    private <R> String formatPath(final FlowGraph<R> graph,
            final List<R> path) {
        final List<String> parts = new ArrayList<>(path.size());
        for (final R ref : path) {
            parts.add(graph.positionOf(ref).map(graph::describe)
                    .orElse(String.valueOf(ref)));
        }
        return String.join(" -> ", parts);
    }

}
