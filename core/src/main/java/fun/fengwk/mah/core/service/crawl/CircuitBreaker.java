package fun.fengwk.mah.core.service.crawl;

/**
 * Failure rate over a sliding window of the most recent fetch attempts of one job. Once tripped it
 * stays tripped.
 *
 * @author fengwk
 */
public class CircuitBreaker {

    private final boolean[] window;
    private final int minSamples;
    private final double failureRateThreshold;
    private int next;
    private int samples;
    private int failures;
    private boolean tripped;

    public CircuitBreaker(int windowSize, int minSamples, double failureRateThreshold) {
        this.window = new boolean[Math.max(1, windowSize)];
        this.minSamples = Math.max(1, Math.min(minSamples, window.length));
        this.failureRateThreshold = failureRateThreshold;
    }

    /**
     * Record one attempt.
     *
     * @return {@code true} when this attempt tripped the breaker
     */
    public synchronized boolean record(boolean success) {
        if (samples == window.length && !window[next]) {
            failures--;
        }
        window[next] = success;
        if (!success) {
            failures++;
        }
        next = (next + 1) % window.length;
        samples = Math.min(window.length, samples + 1);

        if (!tripped && samples >= minSamples && failureRate() >= failureRateThreshold) {
            tripped = true;
            return true;
        }
        return false;
    }

    public synchronized boolean isTripped() {
        return tripped;
    }

    public synchronized double failureRate() {
        return samples == 0 ? 0D : failures / (double) samples;
    }

    public synchronized int samples() {
        return samples;
    }

}
