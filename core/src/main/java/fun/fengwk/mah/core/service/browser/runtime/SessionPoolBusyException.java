package fun.fengwk.mah.core.service.browser.runtime;

/**
 * Exception thrown when no browser session becomes idle within the acquire timeout.
 */
public class SessionPoolBusyException extends RuntimeException {

    public SessionPoolBusyException(String message) {
        super(message);
    }

    public SessionPoolBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
