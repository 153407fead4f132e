package fun.fengwk.mah.core.service.fetch;

/**
 * Why one candidate attempt failed.
 *
 * @author fengwk
 */
public enum FailureReason {

    TIMEOUT(true),
    NAVIGATION_ERROR(true),
    SOFT_BLOCK(true),
    SESSION_UNAVAILABLE(true),
    UNEXPECTED(true),
    NOT_FOUND(false),
    REMOVED(false),
    EXTRACTION_FAILED(false),
    STORAGE_ERROR(false);

    private final boolean transientFailure;

    FailureReason(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

}
