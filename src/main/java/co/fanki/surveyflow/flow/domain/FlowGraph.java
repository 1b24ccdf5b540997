package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The directed structure of questions and navigation determinants for one
 * survey.
 *
 * <p>Stored as a flat arena: nodes sit in a list indexed by order position
 * and edges are resolved to positions on demand. The same structure exists
 * in two addressing spaces, draft indexes ({@code FlowGraph<Integer>}) and
 * persisted ids ({@code FlowGraph<String>}); {@link #toPersisted(Map)} is the
 * only way from one to the other.</p>
 *
 * <p>Pure data: no I/O and no validation beyond construction invariants.
 * Well-formedness is the job of {@link GraphValidator}.</p>
 *
 * @param <R> the question reference type
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowGraph<R> {

    /** Step target meaning the survey ends. */
    public static final int END = -1;

    /** Step target meaning the go-to reference is not part of the graph. */
    public static final int UNRESOLVED = -2;

    private final List<FlowNode<R>> nodes;
    private final Map<R, Integer> positions;

    private FlowGraph(final List<FlowNode<R>> theNodes) {
        final List<FlowNode<R>> sorted = new ArrayList<>(theNodes);
        sorted.sort((a, b) -> Integer.compare(a.position(), b.position()));

        final Map<R, Integer> index = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            final FlowNode<R> node = sorted.get(i);
            Preconditions.require(node.position() == i,
                    "Order positions must be dense and start at 0, found "
                            + node.position() + " at " + i);
            Preconditions.require(index.put(node.ref(), i) == null,
                    "Duplicate question reference: " + node.ref());
        }
        this.nodes = Collections.unmodifiableList(sorted);
        this.positions = Collections.unmodifiableMap(index);
    }

    /**
     * Creates a graph from nodes that already carry their references.
     *
     * @param nodes the nodes, positions must be dense from 0
     * @param <R> the question reference type
     * @return the graph
     */
    public static <R> FlowGraph<R> of(final List<FlowNode<R>> nodes) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        return new FlowGraph<>(nodes);
    }

    /**
     * Builds the draft graph of an author's submission.
     *
     * <p>Each question is addressed by its array index, which is also its
     * order position. Sentinels are interpreted by
     * {@link DraftQuestion#defaultDeterminant()} and
     * {@link DraftQuestion#optionDeterminants()}.</p>
     *
     * @param drafts the submitted questions in order
     * @return the index-addressed graph
     */
    public static FlowGraph<Integer> fromDraft(final List<DraftQuestion> drafts) {
        Preconditions.requireNonNull(drafts, "Draft questions are required");
        final List<FlowNode<Integer>> nodes = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            final DraftQuestion draft = drafts.get(i);
            nodes.add(new FlowNode<>(
                    i,
                    i,
                    draft.kind(),
                    draft.kind().branchOptionCount(draft.options().size()),
                    draft.defaultDeterminant(),
                    draft.optionDeterminants(),
                    draft.text()));
        }
        return new FlowGraph<>(nodes);
    }

    /**
     * Rewrites every reference of this graph into another addressing space.
     *
     * @param idMapping old reference to new reference, must cover every node
     * @param <T> the new reference type
     * @return the translated graph with identical structure
     * @throws FlowReferenceException if a node or go-to target is unmapped
     */
    public <T> FlowGraph<T> toPersisted(final Map<R, T> idMapping) {
        Preconditions.requireNonNull(idMapping, "Id mapping is required");
        final List<FlowNode<T>> translated = new ArrayList<>(nodes.size());
        for (final FlowNode<R> node : nodes) {
            final T ref = idMapping.get(node.ref());
            if (ref == null) {
                throw new FlowReferenceException(
                        "No persisted question for draft reference "
                                + node.ref());
            }
            final Map<Integer, NavigationDeterminant<T>> overrides =
                    new HashMap<>();
            for (final Map.Entry<Integer, NavigationDeterminant<R>> entry
                    : node.optionNext().entrySet()) {
                overrides.put(entry.getKey(),
                        entry.getValue().translate(idMapping));
            }
            translated.add(new FlowNode<>(
                    ref,
                    node.position(),
                    node.kind(),
                    node.optionCount(),
                    node.defaultNext().translate(idMapping),
                    overrides,
                    node.label()));
        }
        return new FlowGraph<>(translated);
    }

    /**
     * Returns the distinct determinants that can apply after answering the
     * question at a position.
     *
     * <p>A branching question with options yields the effective determinant
     * of every option followed by its default, which applies when no single
     * option is selected. Any other question yields only its default.</p>
     *
     * @param position the order position
     * @return the effective determinants, in option order, default last
     */
    public List<NavigationDeterminant<R>> outcomes(final int position) {
        final FlowNode<R> node = node(position);
        if (!node.kind().supportsBranching() || node.optionCount() == 0) {
            return List.of(node.defaultNext());
        }
        final Set<NavigationDeterminant<R>> result = new LinkedHashSet<>();
        for (int option = 0; option < node.optionCount(); option++) {
            result.add(node.determinantFor(option));
        }
        result.add(node.defaultNext());
        return List.copyOf(result);
    }

    /**
     * Resolves a determinant taken at a position into the position it leads
     * to.
     *
     * @param position the source order position
     * @param determinant the determinant taken
     * @return the target position, {@link #END} or {@link #UNRESOLVED}
     */
    public int stepTarget(final int position,
            final NavigationDeterminant<R> determinant) {
        return switch (determinant.type()) {
            case END_SURVEY -> END;
            case SEQUENTIAL -> position + 1 < nodes.size() ? position + 1 : END;
            case GO_TO_QUESTION -> positions.getOrDefault(
                    determinant.target(), UNRESOLVED);
        };
    }

    /**
     * Returns the resolvable successor positions of a question in ascending
     * order.
     *
     * @param position the order position
     * @return successor positions, excluding end and unresolved targets
     */
    public int[] successors(final int position) {
        final Set<Integer> result = new TreeSet<>();
        for (final NavigationDeterminant<R> outcome : outcomes(position)) {
            final int target = stepTarget(position, outcome);
            if (target >= 0) {
                result.add(target);
            }
        }
        return result.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Checks whether answering the question at a position can end the
     * survey.
     *
     * @param position the order position
     * @return true if any outcome resolves to {@link #END}
     */
    public boolean terminates(final int position) {
        for (final NavigationDeterminant<R> outcome : outcomes(position)) {
            if (stepTarget(position, outcome) == END) {
                return true;
            }
        }
        return false;
    }

    /**
     * Describes a question for diagnostics without exposing its reference.
     *
     * @param position the order position
     * @return a short label such as {@code Q2 "How old are you?"}
     */
    public String describe(final int position) {
        final String label = node(position).label();
        if (label == null || label.isBlank()) {
            return "Q" + position;
        }
        final String trimmed = label.strip();
        return "Q" + position + " \"" + (trimmed.length() <= 30
                ? trimmed : trimmed.substring(0, 30) + "...") + "\"";
    }

    /**
     * Finds the order position of a reference.
     *
     * @param ref the question reference
     * @return the position if the reference belongs to this graph
     */
    public Optional<Integer> positionOf(final R ref) {
        return Optional.ofNullable(positions.get(ref));
    }

    public boolean contains(final R ref) {
        return positions.containsKey(ref);
    }

    public FlowNode<R> node(final int position) {
        return nodes.get(position);
    }

    public R ref(final int position) {
        return nodes.get(position).ref();
    }

    public List<FlowNode<R>> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

}
