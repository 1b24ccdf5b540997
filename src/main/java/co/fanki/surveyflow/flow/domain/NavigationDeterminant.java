package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.Preconditions;
import co.fanki.surveyflow.shared.ValueObject;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * What happens after a question is answered.
 *
 * <p>Immutable, value-equal tagged union of three variants:</p>
 * <ul>
 *   <li>{@link Type#GO_TO_QUESTION}: jump to the question identified by
 *       {@link #target()}</li>
 *   <li>{@link Type#END_SURVEY}: the response is complete</li>
 *   <li>{@link Type#SEQUENTIAL}: continue with the next question by order
 *       position</li>
 * </ul>
 *
 * <p>The target type {@code R} is the addressing space of the graph the
 * determinant belongs to: {@code Integer} draft indexes before persistence,
 * {@code String} question ids after. The compiler translates between the two
 * with {@link #translate(Map)}.</p>
 *
 * @param <R> the question reference type
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NavigationDeterminant<R> implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** The variant of a determinant. */
    public enum Type {
        GO_TO_QUESTION,
        END_SURVEY,
        SEQUENTIAL
    }

    private final Type type;
    private final R target;

    private NavigationDeterminant(final Type theType, final R theTarget) {
        this.type = theType;
        this.target = theTarget;
    }

    /**
     * Creates a determinant that jumps to a specific question.
     *
     * @param target the target question reference
     * @param <R> the question reference type
     * @return the determinant
     */
    public static <R> NavigationDeterminant<R> goTo(final R target) {
        Preconditions.requireNonNull(target, "Target question is required");
        return new NavigationDeterminant<>(Type.GO_TO_QUESTION, target);
    }

    /**
     * Creates a determinant that ends the survey.
     *
     * @param <R> the question reference type
     * @return the determinant
     */
    public static <R> NavigationDeterminant<R> endSurvey() {
        return new NavigationDeterminant<>(Type.END_SURVEY, null);
    }

    /**
     * Creates a determinant that falls through to the next question by order.
     *
     * @param <R> the question reference type
     * @return the determinant
     */
    public static <R> NavigationDeterminant<R> sequential() {
        return new NavigationDeterminant<>(Type.SEQUENTIAL, null);
    }

    /**
     * Rewrites the target of a go-to determinant into another addressing
     * space. End and sequential determinants are returned unchanged in
     * meaning.
     *
     * @param mapping the reference translation
     * @param <T> the new reference type
     * @return the translated determinant
     * @throws FlowReferenceException if the target has no mapping
     */
    public <T> NavigationDeterminant<T> translate(final Map<R, T> mapping) {
        return map(ref -> {
            final T translated = mapping.get(ref);
            if (translated == null) {
                throw new FlowReferenceException(
                        "No persisted question for draft reference " + ref);
            }
            return translated;
        });
    }

    /**
     * Applies a function to the target of a go-to determinant.
     *
     * @param fn the function to apply
     * @param <T> the new reference type
     * @return the mapped determinant
     */
    public <T> NavigationDeterminant<T> map(final Function<R, T> fn) {
        return switch (type) {
            case GO_TO_QUESTION -> goTo(fn.apply(target));
            case END_SURVEY -> endSurvey();
            case SEQUENTIAL -> sequential();
        };
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the target reference.
     *
     * @return the target, null unless this is a go-to determinant
     */
    public R target() {
        return target;
    }

    public boolean isGoTo() {
        return type == Type.GO_TO_QUESTION;
    }

    public boolean isEndSurvey() {
        return type == Type.END_SURVEY;
    }

    public boolean isSequential() {
        return type == Type.SEQUENTIAL;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final NavigationDeterminant<?> that = (NavigationDeterminant<?>) obj;
        return type == that.type && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, target);
    }

    @Override
    public String toString() {
        return switch (type) {
            case GO_TO_QUESTION -> "GoToQuestion(" + target + ")";
            case END_SURVEY -> "EndSurvey";
            case SEQUENTIAL -> "Sequential";
        };
    }

}
