package co.fanki.surveyflow.flow.domain;

import java.util.List;

/**
 * Outcome of {@link GraphValidator#validate(FlowGraph)}.
 *
 * @param issues every problem found, empty when the graph is valid
 * @param cyclePath the questions forming the first cycle found, starting and
 *                  ending at the same reference; empty when acyclic
 * @param unreachable references of the questions not reachable from the
 *                    start question
 * @param <R> the question reference type
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowValidationResult<R>(
        List<FlowIssue> issues,
        List<R> cyclePath,
        List<R> unreachable) {

    /** Freezes the collections. */
    public FlowValidationResult {
        issues = List.copyOf(issues);
        cyclePath = List.copyOf(cyclePath);
        unreachable = List.copyOf(unreachable);
    }

    public boolean valid() {
        return issues.isEmpty();
    }

    public boolean hasCycle() {
        return !cyclePath.isEmpty();
    }

    /**
     * Checks whether the given category is among the issues.
     *
     * @param type the category
     * @return true if at least one issue has that category
     */
    public boolean has(final FlowIssue.Type type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }

    /**
     * Returns the issue messages in discovery order.
     *
     * @return the messages
     */
    public List<String> errors() {
        return issues.stream().map(FlowIssue::message).toList();
    }

}
