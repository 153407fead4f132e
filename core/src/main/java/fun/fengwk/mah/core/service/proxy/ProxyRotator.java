package fun.fengwk.mah.core.service.proxy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supplies outbound network identities and tracks their health.
 *
 * <p>Health transitions: HEALTHY -> DEGRADED on the first failure, DEGRADED -> BLOCKED after
 * {@code blockThreshold} consecutive failures, BLOCKED -> HEALTHY once the cooldown has elapsed and one
 * probe request succeeds. A failed probe restarts the cooldown. All transitions are serialized by one lock
 * because the rotator is shared by every running job.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ProxyRotator {

    private static final double PROBE_WEIGHT = 0.1;

    private static final long MAX_AVAILABILITY_POLL_MS = 1000;

    private final ProxyProperties proxyProperties;
    private final Clock clock;
    private final Random random;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition selectable = lock.newCondition();
    private final Map<String, ProxyRecord> records = new LinkedHashMap<>();

    @Autowired
    public ProxyRotator(ProxyProperties proxyProperties) {
        this(proxyProperties, loadRecords(proxyProperties), Clock.systemUTC(), new Random());
    }

    ProxyRotator(ProxyProperties proxyProperties, List<ProxyRecord> initialRecords, Clock clock, Random random) {
        this.proxyProperties = proxyProperties;
        this.clock = clock;
        this.random = random;
        for (ProxyRecord record : initialRecords) {
            records.putIfAbsent(record.getId(), record.toBuilder().build());
        }
        if (records.isEmpty()) {
            ProxyRecord direct = ProxyRecord.direct();
            records.put(direct.getId(), direct);
        }
        log.info("proxy rotator initialized, proxies={}, blockThreshold={}, cooldownMs={}",
            records.size(), proxyProperties.getBlockThreshold(), proxyProperties.getCooldownMs());
    }

    /**
     * Pick a proxy weighted by health and reliability, blocked proxies are excluded until their cooldown elapses.
     *
     * @throws ProxyExhaustedException when no proxy is selectable
     */
    public ProxyRecord select() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ProxyRecord> candidates = new ArrayList<>();
            List<Double> weights = new ArrayList<>();
            double totalWeight = 0;
            for (ProxyRecord record : records.values()) {
                double weight = weightOf(record, now);
                if (weight > 0) {
                    candidates.add(record);
                    weights.add(weight);
                    totalWeight += weight;
                }
            }
            if (candidates.isEmpty()) {
                throw new ProxyExhaustedException("no selectable proxy, total=" + records.size());
            }

            ProxyRecord picked = candidates.get(candidates.size() - 1);
            double point = random.nextDouble() * totalWeight;
            for (int i = 0; i < candidates.size(); i++) {
                point -= weights.get(i);
                if (point < 0) {
                    picked = candidates.get(i);
                    break;
                }
            }
            if (picked.getHealthState() == ProxyHealthState.BLOCKED) {
                picked.setProbeStartedAt(now);
                log.info("proxy cooldown elapsed, probing, proxyId={}", picked.getId());
            }
            return picked.toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record the outcome of one request made through a proxy. Unknown ids are ignored.
     */
    public void report(String proxyId, boolean success) {
        lock.lock();
        try {
            ProxyRecord record = records.get(proxyId);
            if (record == null) {
                log.debug("report for unknown proxy ignored, proxyId={}", proxyId);
                return;
            }
            if (success) {
                onSuccess(record);
            } else {
                onFailure(record);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the proxy can still carry traffic, blocked proxies cannot.
     */
    public boolean isUsable(String proxyId) {
        lock.lock();
        try {
            ProxyRecord record = records.get(proxyId);
            return record != null && record.getHealthState() != ProxyHealthState.BLOCKED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until some proxy is selectable.
     *
     * @return {@code true} when a proxy became selectable before the timeout elapsed
     */
    public boolean awaitAvailable(long timeoutMs) {
        long deadlineAt = clock.millis() + Math.max(0, timeoutMs);
        lock.lock();
        try {
            while (true) {
                Instant now = clock.instant();
                if (hasSelectable(now)) {
                    return true;
                }
                long remainingMs = deadlineAt - now.toEpochMilli();
                if (remainingMs <= 0) {
                    return false;
                }
                selectable.await(Math.min(remainingMs, MAX_AVAILABILITY_POLL_MS), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("wait for selectable proxy interrupted");
            return false;
        } finally {
            lock.unlock();
        }
    }

    public ProxyRecord get(String proxyId) {
        lock.lock();
        try {
            ProxyRecord record = records.get(proxyId);
            return record == null ? null : record.toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    public List<ProxyRecord> snapshot() {
        lock.lock();
        try {
            List<ProxyRecord> snapshot = new ArrayList<>(records.size());
            for (ProxyRecord record : records.values()) {
                snapshot.add(record.toBuilder().build());
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(ProxyRecord record) {
        ProxyHealthState previous = record.getHealthState();
        record.setSuccessCount(record.getSuccessCount() + 1);
        record.setConsecutiveFailures(0);
        record.setProbeStartedAt(null);
        record.setHealthState(ProxyHealthState.HEALTHY);
        if (previous != ProxyHealthState.HEALTHY) {
            log.info("proxy recovered, proxyId={}, from={}", record.getId(), previous);
        }
        selectable.signalAll();
    }

    private void onFailure(ProxyRecord record) {
        record.setFailureCount(record.getFailureCount() + 1);
        record.setConsecutiveFailures(record.getConsecutiveFailures() + 1);
        record.setLastFailureAt(clock.instant());

        if (record.getHealthState() == ProxyHealthState.BLOCKED) {
            // The cooldown restarts from this failure.
            record.setProbeStartedAt(null);
            log.info("proxy probe failed, proxyId={}, consecutiveFailures={}", record.getId(), record.getConsecutiveFailures());
            return;
        }
        if (record.getConsecutiveFailures() >= Math.max(1, proxyProperties.getBlockThreshold())) {
            record.setHealthState(ProxyHealthState.BLOCKED);
            log.warn("proxy blocked, proxyId={}, consecutiveFailures={}, cooldownMs={}",
                record.getId(), record.getConsecutiveFailures(), proxyProperties.getCooldownMs());
            return;
        }
        if (record.getHealthState() == ProxyHealthState.HEALTHY) {
            log.info("proxy degraded, proxyId={}", record.getId());
        }
        record.setHealthState(ProxyHealthState.DEGRADED);
    }

    private boolean hasSelectable(Instant now) {
        for (ProxyRecord record : records.values()) {
            if (weightOf(record, now) > 0) {
                return true;
            }
        }
        return false;
    }

    private double weightOf(ProxyRecord record, Instant now) {
        double reliabilityFactor = 0.5 + record.reliability();
        switch (record.getHealthState()) {
            case HEALTHY:
                return reliabilityFactor;
            case DEGRADED:
                return Math.max(0.01, proxyProperties.getDegradedWeight()) * reliabilityFactor;
            case BLOCKED:
                return isProbeAllowed(record, now) ? PROBE_WEIGHT : 0;
            default:
                return 0;
        }
    }

    private boolean isProbeAllowed(ProxyRecord record, Instant now) {
        Duration cooldown = Duration.ofMillis(Math.max(0, proxyProperties.getCooldownMs()));
        if (record.isProbing()) {
            // A probe that never reported back is reissued after another cooldown.
            return !now.isBefore(record.getProbeStartedAt().plus(cooldown));
        }
        Instant lastFailureAt = record.getLastFailureAt();
        return lastFailureAt == null || !now.isBefore(lastFailureAt.plus(cooldown));
    }

    private static List<ProxyRecord> loadRecords(ProxyProperties proxyProperties) {
        List<ProxyRecord> loaded = new ArrayList<>();
        if (!proxyProperties.isEnabled()) {
            loaded.add(ProxyRecord.direct());
            return loaded;
        }
        loaded.addAll(ProxyListParser.parseLines(proxyProperties.getProxies()));
        if (StringUtils.hasText(proxyProperties.getProxyListFile())) {
            loaded.addAll(ProxyListParser.parseFile(Paths.get(proxyProperties.getProxyListFile())));
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("proxy is enabled but no proxy is configured");
        }
        return loaded;
    }

}
