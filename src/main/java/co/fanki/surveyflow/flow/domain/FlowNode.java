package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.Preconditions;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One question inside a {@link FlowGraph}: its reference, its order position
 * and its navigation.
 *
 * @param ref the question reference (draft index or persisted id)
 * @param position the 0-based dense order position
 * @param kind the question kind
 * @param optionCount the number of options navigation is keyed by
 * @param defaultNext the default determinant
 * @param optionNext option index to override determinant
 * @param label the question text, used for diagnostics only
 * @param <R> the question reference type
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowNode<R>(
        R ref,
        int position,
        QuestionKind kind,
        int optionCount,
        NavigationDeterminant<R> defaultNext,
        Map<Integer, NavigationDeterminant<R>> optionNext,
        String label) {

    /** Validates and freezes the node. */
    public FlowNode {
        Preconditions.requireNonNull(ref, "Question reference is required");
        Preconditions.requireNonNegative(position,
                "Order position must be non-negative");
        Preconditions.requireNonNull(kind, "Question kind is required");
        Preconditions.requireNonNegative(optionCount,
                "Option count must be non-negative");
        defaultNext = defaultNext != null
                ? defaultNext : NavigationDeterminant.sequential();
        optionNext = optionNext != null
                ? Collections.unmodifiableMap(new TreeMap<>(optionNext))
                : Map.of();
    }

    /**
     * Checks whether this node carries any per-option override.
     *
     * @return true if at least one override exists
     */
    public boolean hasOverrides() {
        return !optionNext.isEmpty();
    }

    /**
     * Returns the determinant that applies when the given option is the
     * single selected option.
     *
     * @param optionIndex the selected option index
     * @return the override when the kind branches and one exists, otherwise
     *         the default
     */
    public NavigationDeterminant<R> determinantFor(final int optionIndex) {
        if (kind.supportsBranching()) {
            final NavigationDeterminant<R> override = optionNext.get(
                    optionIndex);
            if (override != null) {
                return override;
            }
        }
        return defaultNext;
    }

}
