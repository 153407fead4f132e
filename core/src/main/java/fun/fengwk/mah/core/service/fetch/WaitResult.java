package fun.fengwk.mah.core.service.fetch;

/**
 * Outcome of {@link ContentWaiter#until}.
 *
 * @author fengwk
 */
public record WaitResult(boolean satisfied, int checks, long elapsedMs) {

    public boolean timedOut() {
        return !satisfied;
    }

}
