package co.fanki.surveyflow.response.domain;

import co.fanki.surveyflow.flow.domain.AnswerSelection;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import co.fanki.surveyflow.survey.domain.Question;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The value a respondent submitted for one question.
 *
 * <p>Only the fields that match the question kind are read; the rest are
 * ignored. The payload is stored as-is on the answer row.</p>
 *
 * @param text the free text, for TEXT questions
 * @param selectedOptions the chosen option texts, for choice questions
 * @param rating the rating value, for RATING questions
 * @param number the numeric value as text, for NUMBER questions
 * @param date the ISO-8601 date, for DATE questions
 * @param latitude the latitude, for LOCATION questions
 * @param longitude the longitude, for LOCATION questions
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerPayload(
        String text,
        List<String> selectedOptions,
        Integer rating,
        String number,
        String date,
        Double latitude,
        Double longitude) {

    /** Maximum length of a free-text answer. */
    public static final int MAX_TEXT_LENGTH = 5000;

    /**
     * Checks whether nothing was answered.
     *
     * @return true if every field is empty
     */
    @JsonIgnore
    public boolean isEmpty() {
        return (text == null || text.isBlank())
                && (selectedOptions == null || selectedOptions.isEmpty())
                && rating == null
                && (number == null || number.isBlank())
                && (date == null || date.isBlank())
                && latitude == null
                && longitude == null;
    }

    /**
     * Checks this payload against the question and extracts the options it
     * selected.
     *
     * @param question the question being answered
     * @return the selection seen by navigation
     * @throws InvalidAnswerException if the payload does not fit the question
     */
    public AnswerSelection validateFor(final Question question) {
        if (isEmpty()) {
            if (question.required()) {
                throw new InvalidAnswerException("Answer is required");
            }
            return AnswerSelection.none();
        }
        return switch (question.kind()) {
            case TEXT -> validateText();
            case SINGLE_CHOICE -> validateChoice(question, true);
            case MULTIPLE_CHOICE -> validateChoice(question, false);
            case RATING -> validateRating();
            case NUMBER -> validateNumber();
            case DATE -> validateDate();
            case LOCATION -> validateLocation();
        };
    }

    private AnswerSelection validateText() {
        if (text == null || text.isBlank()) {
            throw new InvalidAnswerException("Text answer is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new InvalidAnswerException("Text answer cannot exceed "
                    + MAX_TEXT_LENGTH + " characters");
        }
        return AnswerSelection.none();
    }

    private AnswerSelection validateChoice(final Question question,
            final boolean single) {
        if (selectedOptions == null || selectedOptions.isEmpty()) {
            throw new InvalidAnswerException("At least one option must be"
                    + " selected");
        }
        if (single && selectedOptions.size() != 1) {
            throw new InvalidAnswerException("Single choice questions accept"
                    + " exactly one option");
        }
        final List<Integer> indexes = new ArrayList<>();
        final Set<Integer> seen = new HashSet<>();
        for (String option : selectedOptions) {
            final int index = question.optionIndex(option);
            if (index < 0) {
                throw new InvalidAnswerException("Unknown option: " + option);
            }
            if (!seen.add(index)) {
                throw new InvalidAnswerException("Option selected twice: "
                        + option);
            }
            indexes.add(index);
        }
        return AnswerSelection.options(indexes);
    }

    private AnswerSelection validateRating() {
        if (rating == null || rating < QuestionKind.RATING_MIN
                || rating > QuestionKind.RATING_MAX) {
            throw new InvalidAnswerException("Rating must be between "
                    + QuestionKind.RATING_MIN + " and "
                    + QuestionKind.RATING_MAX);
        }
        return AnswerSelection.rating(rating);
    }

    private AnswerSelection validateNumber() {
        try {
            new BigDecimal(number == null ? "" : number.trim());
        } catch (final NumberFormatException e) {
            throw new InvalidAnswerException("Not a number: " + number);
        }
        return AnswerSelection.none();
    }

    private AnswerSelection validateDate() {
        try {
            LocalDate.parse(date == null ? "" : date.trim());
        } catch (final DateTimeParseException e) {
            throw new InvalidAnswerException("Date must be ISO-8601"
                    + " (yyyy-MM-dd): " + date);
        }
        return AnswerSelection.none();
    }

    private AnswerSelection validateLocation() {
        if (latitude == null || longitude == null) {
            throw new InvalidAnswerException("Location requires latitude and"
                    + " longitude");
        }
        if (latitude < -90 || latitude > 90) {
            throw new InvalidAnswerException("Latitude out of range: "
                    + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new InvalidAnswerException("Longitude out of range: "
                    + longitude);
        }
        return AnswerSelection.none();
    }

}
