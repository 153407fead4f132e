package fun.fengwk.mah.core.service.crawl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Spaces requests through the same network identity at least {@code politenessDelayMs} apart, independent
 * of how many workers share it.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PolitenessGate {

    private final long delayMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, Long> nextSlots = new HashMap<>();

    @Autowired
    public PolitenessGate(CrawlProperties crawlProperties) {
        this(crawlProperties.getPolitenessDelayMs(), Clock.systemUTC(), Thread::sleep);
    }

    PolitenessGate(long delayMs, Clock clock, Sleeper sleeper) {
        this.delayMs = Math.max(0, delayMs);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Reserve the next request slot of {@code identity} and wait for it.
     *
     * @return milliseconds waited
     */
    public long await(String identity) throws InterruptedException {
        long waitMs = reserve(identity);
        if (waitMs > 0) {
            log.debug("politeness wait, identity={}, waitMs={}", identity, waitMs);
            sleeper.sleep(waitMs);
        }
        return waitMs;
    }

    synchronized long reserve(String identity) {
        long now = clock.millis();
        long slot = Math.max(now, nextSlots.getOrDefault(identity, now));
        nextSlots.put(identity, slot + delayMs);
        return slot - now;
    }

    @FunctionalInterface
    interface Sleeper {

        void sleep(long millis) throws InterruptedException;

    }

}
