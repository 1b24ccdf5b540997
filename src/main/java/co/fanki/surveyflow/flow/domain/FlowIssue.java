package co.fanki.surveyflow.flow.domain;

/**
 * A single problem found while validating a flow graph.
 *
 * @param type the category of the problem
 * @param position the order position of the offending question, or null
 *                 when the problem concerns the graph as a whole
 * @param message the author-facing description
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowIssue(Type type, Integer position, String message) {

    /** Problem categories. */
    public enum Type {
        EMPTY_SURVEY,
        SELF_REFERENCE,
        INVALID_TARGET,
        OVERRIDE_NOT_SUPPORTED,
        ORPHANED_OVERRIDE,
        CYCLE,
        UNREACHABLE,
        NO_TERMINAL
    }

}
