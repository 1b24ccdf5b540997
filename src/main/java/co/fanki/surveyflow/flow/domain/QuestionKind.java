package co.fanki.surveyflow.flow.domain;

/**
 * Closed catalog of question kinds a survey can contain.
 *
 * <p>The kind decides two things for the flow engine: whether the question
 * carries an option list, and whether individual options may override the
 * question's default navigation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum QuestionKind {

    /** Free-text answer. */
    TEXT,

    /** Exactly one option out of an explicit list; branches per option. */
    SINGLE_CHOICE,

    /** Any number of options out of an explicit list. */
    MULTIPLE_CHOICE,

    /**
     * A value on the rating scale; branches per rating value.
     *
     * <p>Ratings carry no explicit options. Each value on the scale is an
     * implicit option whose index is {@code value - RATING_MIN}.</p>
     */
    RATING,

    /** Numeric answer. */
    NUMBER,

    /** ISO-8601 date answer. */
    DATE,

    /** Latitude and longitude pair. */
    LOCATION;

    /** Lowest value on the rating scale. */
    public static final int RATING_MIN = 1;

    /** Highest value on the rating scale. */
    public static final int RATING_MAX = 5;

    /**
     * Checks whether options of this kind may carry their own determinant.
     *
     * @return true for single-choice and rating
     */
    public boolean supportsBranching() {
        return this == SINGLE_CHOICE || this == RATING;
    }

    /**
     * Checks whether this kind requires an explicit option list.
     *
     * @return true for the choice kinds
     */
    public boolean requiresOptions() {
        return this == SINGLE_CHOICE || this == MULTIPLE_CHOICE;
    }

    /**
     * Number of options a branching override can be keyed by.
     *
     * @param explicitOptions the number of explicit options on the question
     * @return the option count navigation works against
     */
    public int branchOptionCount(final int explicitOptions) {
        if (this == RATING) {
            return RATING_MAX - RATING_MIN + 1;
        }
        return requiresOptions() ? explicitOptions : 0;
    }

}
