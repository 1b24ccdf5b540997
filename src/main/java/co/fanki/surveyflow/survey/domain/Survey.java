package co.fanki.surveyflow.survey.domain;

import co.fanki.surveyflow.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root for a survey.
 *
 * <p>The question set and its flow graph are owned by the survey but
 * replaced wholesale through the batch compiler; the survey itself only
 * tracks metadata and a version that increases on every replace.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Survey {

    /** Minimum title length. */
    public static final int TITLE_MIN_LENGTH = 3;

    /** Maximum title length. */
    public static final int TITLE_MAX_LENGTH = 500;

    private final String id;
    private String title;
    private String description;
    private boolean active;
    private int version;
    private final Instant createdAt;
    private Instant updatedAt;

    private Survey(final String theId, final String theTitle,
            final String theDescription, final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Survey ID is required");
        this.title = requireTitle(theTitle);
        this.description = theDescription;
        this.version = 1;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Creates a new, inactive survey without questions.
     *
     * @param title the survey title
     * @param description the optional description
     * @return a new Survey instance
     */
    public static Survey create(final String title, final String description) {
        return new Survey(UUID.randomUUID().toString(), title, description,
                Instant.now());
    }

    /**
     * Reconstitutes a survey from persistence.
     *
     * @param id the survey ID
     * @param title the title
     * @param description the description
     * @param active whether respondents may start it
     * @param version the flow version
     * @param createdAt when created
     * @param updatedAt when last updated
     * @return the reconstituted Survey
     */
    public static Survey reconstitute(final String id, final String title,
            final String description, final boolean active, final int version,
            final Instant createdAt, final Instant updatedAt) {
        final Survey survey = new Survey(id, title, description, createdAt);
        survey.active = active;
        survey.version = version;
        survey.updatedAt = updatedAt;
        return survey;
    }

    /**
     * Updates title and description.
     *
     * @param newTitle the new title, null keeps the current one
     * @param newDescription the new description, null keeps the current one
     */
    public void updateMetadata(final String newTitle,
            final String newDescription) {
        if (newTitle != null) {
            this.title = requireTitle(newTitle);
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        this.updatedAt = Instant.now();
    }

    /**
     * Marks the question set as replaced.
     */
    public void incrementVersion() {
        this.version++;
        this.updatedAt = Instant.now();
    }

    /**
     * Opens the survey to respondents.
     */
    public void activate() {
        this.active = true;
        this.updatedAt = Instant.now();
    }

    private static String requireTitle(final String value) {
        return Preconditions.requireLength(value, TITLE_MIN_LENGTH,
                TITLE_MAX_LENGTH, "Survey title must be between "
                        + TITLE_MIN_LENGTH + " and " + TITLE_MAX_LENGTH
                        + " characters");
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public boolean isActive() {
        return active;
    }

    public int version() {
        return version;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
