package co.fanki.surveyflow.shared;

/**
 * Raised when a survey, question or response does not exist.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NotFoundException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final String entityId;

    /**
     * Creates a new not-found exception.
     *
     * @param theEntity the kind of entity that was looked up, e.g. "Survey"
     * @param theEntityId the identifier that did not resolve
     */
    public NotFoundException(final String theEntity, final String theEntityId) {
        super(theEntity + " not found: " + theEntityId,
                theEntity.toUpperCase() + "_NOT_FOUND");
        this.entity = theEntity;
        this.entityId = theEntityId;
    }

    public String entity() {
        return entity;
    }

    public String entityId() {
        return entityId;
    }

}
