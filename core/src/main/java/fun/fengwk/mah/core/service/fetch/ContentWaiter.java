package fun.fengwk.mah.core.service.fetch;

import java.util.function.BooleanSupplier;
import java.util.function.LongConsumer;

/**
 * Wait until a predicate holds or a timeout elapses.
 *
 * <p>The pause function decides how a worker yields between checks, e.g. {@code page::waitForTimeout}
 * lets the browser keep processing events while waiting.
 *
 * @author fengwk
 */
public final class ContentWaiter {

    private ContentWaiter() {
    }

    public static WaitResult until(BooleanSupplier condition, long timeoutMs, long intervalMs, LongConsumer pause) {
        long startAt = System.currentTimeMillis();
        long deadlineAt = startAt + Math.max(0, timeoutMs);
        long interval = Math.max(1, intervalMs);
        int checks = 0;
        while (true) {
            checks++;
            if (condition.getAsBoolean()) {
                return new WaitResult(true, checks, System.currentTimeMillis() - startAt);
            }
            long remainingMs = deadlineAt - System.currentTimeMillis();
            if (remainingMs <= 0) {
                return new WaitResult(false, checks, System.currentTimeMillis() - startAt);
            }
            pause.accept(Math.min(interval, remainingMs));
        }
    }

}
