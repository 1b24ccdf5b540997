package co.fanki.surveyflow.flow.domain;

import co.fanki.surveyflow.shared.Preconditions;
import co.fanki.surveyflow.shared.ValueObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A question as an author submits it, before it has a persisted id.
 *
 * <p>Navigation is expressed with draft array indexes and sentinels:</p>
 * <ul>
 *   <li>no explicit default, or {@value #SEQUENTIAL_INDEX}: sequential</li>
 *   <li>explicit {@code null}: end of survey</li>
 *   <li>any other integer {@code i}: go to the question at draft index
 *       {@code i}</li>
 * </ul>
 *
 * <p>Option overrides use the same encoding; their map values may be
 * {@code null}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DraftQuestion implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Draft index sentinel meaning "next question by order". */
    public static final int SEQUENTIAL_INDEX = -1;

    private final String text;
    private final QuestionKind kind;
    private final boolean required;
    private final List<String> options;
    private final boolean defaultNextSpecified;
    private final Integer defaultNextIndex;
    private final Map<Integer, Integer> optionNextIndexes;

    private DraftQuestion(final String theText, final QuestionKind theKind,
            final boolean isRequired, final List<String> theOptions,
            final boolean isDefaultNextSpecified,
            final Integer theDefaultNextIndex,
            final Map<Integer, Integer> theOptionNextIndexes) {
        this.text = theText;
        this.kind = Preconditions.requireNonNull(theKind,
                "Question kind is required");
        this.required = isRequired;
        // Null options are kept so structural checks can report them.
        this.options = theOptions != null
                ? Collections.unmodifiableList(new ArrayList<>(theOptions))
                : List.of();
        this.defaultNextSpecified = isDefaultNextSpecified;
        this.defaultNextIndex = theDefaultNextIndex;
        // HashMap because null values mean "end survey".
        this.optionNextIndexes = theOptionNextIndexes != null
                ? Collections.unmodifiableMap(
                        new HashMap<>(theOptionNextIndexes))
                : Map.of();
    }

    /**
     * Creates a draft question without an explicit default determinant.
     *
     * @param text the question text
     * @param kind the question kind
     * @param required whether an answer is mandatory
     * @param options the option texts, may be null for non-choice kinds
     * @return the draft question, navigating sequentially by default
     */
    public static DraftQuestion of(final String text, final QuestionKind kind,
            final boolean required, final List<String> options) {
        return new DraftQuestion(text, kind, required, options, false, null,
                null);
    }

    /**
     * Returns a copy with an explicit default next index.
     *
     * @param index the draft index, {@value #SEQUENTIAL_INDEX}, or null to
     *              end the survey
     * @return a new draft question
     */
    public DraftQuestion withDefaultNext(final Integer index) {
        return new DraftQuestion(text, kind, required, options, true, index,
                optionNextIndexes);
    }

    /**
     * Returns a copy with per-option next indexes.
     *
     * @param indexes option index to draft index, {@value #SEQUENTIAL_INDEX}
     *                or null
     * @return a new draft question
     */
    public DraftQuestion withOptionNext(final Map<Integer, Integer> indexes) {
        return new DraftQuestion(text, kind, required, options,
                defaultNextSpecified, defaultNextIndex, indexes);
    }

    /**
     * Interprets the default navigation sentinels.
     *
     * @return the default determinant in draft index space
     */
    public NavigationDeterminant<Integer> defaultDeterminant() {
        if (!defaultNextSpecified) {
            return NavigationDeterminant.sequential();
        }
        return fromIndex(defaultNextIndex);
    }

    /**
     * Interprets the per-option navigation sentinels.
     *
     * @return option index to determinant, ordered by option index
     */
    public Map<Integer, NavigationDeterminant<Integer>> optionDeterminants() {
        final Map<Integer, NavigationDeterminant<Integer>> result =
                new TreeMap<>();
        for (final Map.Entry<Integer, Integer> entry
                : optionNextIndexes.entrySet()) {
            result.put(entry.getKey(), fromIndex(entry.getValue()));
        }
        return result;
    }

    static NavigationDeterminant<Integer> fromIndex(final Integer index) {
        if (index == null) {
            return NavigationDeterminant.endSurvey();
        }
        if (index == SEQUENTIAL_INDEX) {
            return NavigationDeterminant.sequential();
        }
        return NavigationDeterminant.goTo(index);
    }

    public String text() {
        return text;
    }

    public QuestionKind kind() {
        return kind;
    }

    public boolean required() {
        return required;
    }

    public List<String> options() {
        return options;
    }

    public boolean hasOptionOverrides() {
        return !optionNextIndexes.isEmpty();
    }

    public Map<Integer, Integer> optionNextIndexes() {
        return optionNextIndexes;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final DraftQuestion that = (DraftQuestion) obj;
        return required == that.required
                && defaultNextSpecified == that.defaultNextSpecified
                && Objects.equals(text, that.text)
                && kind == that.kind
                && options.equals(that.options)
                && Objects.equals(defaultNextIndex, that.defaultNextIndex)
                && optionNextIndexes.equals(that.optionNextIndexes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, kind, required, options,
                defaultNextSpecified, defaultNextIndex, optionNextIndexes);
    }

}
