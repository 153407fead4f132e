package fun.fengwk.mah.core.service.browser.runtime;

/**
 * Outcome reported when a session is released back to the pool.
 *
 * @author fengwk
 */
public enum SessionOutcome {

    SUCCESS,

    /**
     * Timeout or navigation error, the proxy is charged with a failure.
     */
    FAILURE,

    /**
     * Block or verification page, the session is retired and the proxy is charged with a failure.
     */
    DETECTED,

    /**
     * The page is gone, which says nothing bad about the proxy.
     */
    NOT_FOUND,

    /**
     * The session was acquired but no request was made.
     */
    UNUSED;

    public boolean countsAsRequest() {
        return this != UNUSED;
    }

    public boolean isProxyFailure() {
        return this == FAILURE || this == DETECTED;
    }

}
