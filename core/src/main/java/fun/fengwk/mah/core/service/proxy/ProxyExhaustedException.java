package fun.fengwk.mah.core.service.proxy;

/**
 * Exception thrown when every known proxy is blocked.
 *
 * @author fengwk
 */
public class ProxyExhaustedException extends RuntimeException {

    public ProxyExhaustedException(String message) {
        super(message);
    }

}
