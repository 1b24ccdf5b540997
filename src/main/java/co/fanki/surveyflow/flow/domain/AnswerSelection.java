package co.fanki.surveyflow.flow.domain;

import java.util.List;
import java.util.OptionalInt;

/**
 * The options an answer selected, as seen by navigation.
 *
 * <p>Only a selection of exactly one option can trigger a branching
 * override. Free-form answers carry no selection.</p>
 *
 * @param optionIndexes the selected option indexes, in selection order
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnswerSelection(List<Integer> optionIndexes) {

    /** Freezes the selection. */
    public AnswerSelection {
        optionIndexes = optionIndexes != null
                ? List.copyOf(optionIndexes) : List.of();
    }

    /**
     * Selection for answers that do not pick options.
     *
     * @return an empty selection
     */
    public static AnswerSelection none() {
        return new AnswerSelection(List.of());
    }

    /**
     * Selection of explicit option indexes.
     *
     * @param indexes the selected option indexes
     * @return the selection
     */
    public static AnswerSelection options(final List<Integer> indexes) {
        return new AnswerSelection(indexes);
    }

    /**
     * Selection for a rating answer: the value maps to its implicit option.
     *
     * @param value the rating value
     * @return the selection of option {@code value - RATING_MIN}
     */
    public static AnswerSelection rating(final int value) {
        return new AnswerSelection(List.of(value - QuestionKind.RATING_MIN));
    }

    /**
     * Returns the selected option when exactly one was selected.
     *
     * @return the single option index, empty otherwise
     */
    public OptionalInt singleOption() {
        return optionIndexes.size() == 1
                ? OptionalInt.of(optionIndexes.get(0)) : OptionalInt.empty();
    }

}
