package fun.fengwk.mah.core.service.fetch;

/**
 * Base class of fetch failures, carries the failure reason.
 *
 * @author fengwk
 */
public abstract class FetchException extends RuntimeException {

    private final FailureReason reason;

    protected FetchException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected FetchException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    public abstract boolean isRetryable();

}
