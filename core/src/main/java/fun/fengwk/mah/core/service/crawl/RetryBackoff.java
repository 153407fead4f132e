package fun.fengwk.mah.core.service.crawl;

import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * @author fengwk
 */
public class RetryBackoff {

    private final long baseMs;
    private final long maxMs;
    private final double jitter;
    private final DoubleSupplier random;

    public RetryBackoff(long baseMs, long maxMs, double jitter, DoubleSupplier random) {
        this.baseMs = Math.max(0, baseMs);
        this.maxMs = Math.max(this.baseMs, maxMs);
        this.jitter = Math.min(1D, Math.max(0D, jitter));
        this.random = random;
    }

    /**
     * Delay before the next attempt after {@code attempts} failed attempts.
     */
    public long delayMs(int attempts) {
        int exponent = Math.min(30, Math.max(0, attempts - 1));
        long delay = Math.min(maxMs, baseMs * (1L << exponent));
        if (delay == 0 || jitter == 0) {
            return delay;
        }
        double factor = 1D + jitter * (random.getAsDouble() * 2D - 1D);
        return Math.min(maxMs, Math.max(0L, Math.round(delay * factor)));
    }

}
