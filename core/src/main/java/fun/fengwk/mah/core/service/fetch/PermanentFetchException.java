package fun.fengwk.mah.core.service.fetch;

/**
 * Not-found or confirmed removal, retrying cannot help.
 *
 * @author fengwk
 */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(FailureReason reason, String message) {
        super(reason, message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

}
