package fun.fengwk.mah.core.service.fetch;

/**
 * Timeout, navigation error or detected soft-block, the attempt may be retried with another session.
 *
 * @author fengwk
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(FailureReason reason, String message) {
        super(reason, message);
    }

    public TransientFetchException(FailureReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

}
