package co.fanki.surveyflow.shared;

/**
 * Raised when a transactional unit of work failed and was rolled back.
 *
 * <p>Receiving this exception guarantees that none of the unit's writes
 * are visible.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TransactionAbortedException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new transaction-aborted exception.
     *
     * @param message the error message
     * @param cause the failure that triggered the rollback
     */
    public TransactionAbortedException(final String message,
            final Throwable cause) {
        super(message, "TRANSACTION_ABORTED", cause);
    }

}
