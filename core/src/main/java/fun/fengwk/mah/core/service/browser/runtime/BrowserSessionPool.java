package fun.fengwk.mah.core.service.browser.runtime;

import fun.fengwk.mah.core.service.browser.BrowserProperties;
import fun.fengwk.mah.core.service.browser.FingerprintProfile;
import fun.fengwk.mah.core.service.proxy.ProxyExhaustedException;
import fun.fengwk.mah.core.service.proxy.ProxyRecord;
import fun.fengwk.mah.core.service.proxy.ProxyRotator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns browser session lifecycles, shared by all running jobs.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>Create sessions lazily up to {@code sessionPoolSize}, each bound to a proxy picked by the rotator.</li>
 *     <li>Acquire session -> one fetch -> release with an outcome.</li>
 *     <li>Retire sessions on detection, on an exhausted request budget, or when their proxy got blocked.</li>
 *     <li>Track all sessions in {@code allSessions} so shutdown can close both idle and in-flight sessions.</li>
 * </ul>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserSessionPool {

    private static final long ACQUIRE_POLL_SLICE_MS = 200;

    private final BrowserProperties browserProperties;
    private final ProxyRotator proxyRotator;
    private final BrowserSessionFactory browserSessionFactory;

    /**
     * Idle session queue.
     */
    private final BlockingQueue<BrowserSession> idleSessions = new LinkedBlockingQueue<>();

    /**
     * Global session registry for deterministic shutdown.
     */
    private final Set<BrowserSession> allSessions = ConcurrentHashMap.newKeySet();

    /**
     * Number of created sessions (idle + busy).
     */
    private final AtomicInteger activeSessionCount = new AtomicInteger(0);

    private final AtomicInteger sessionCounter = new AtomicInteger(1);

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public BrowserSessionPool(
        BrowserProperties browserProperties,
        ProxyRotator proxyRotator,
        BrowserSessionFactory browserSessionFactory
    ) {
        this.browserProperties = browserProperties;
        this.proxyRotator = proxyRotator;
        this.browserSessionFactory = browserSessionFactory;
    }

    /**
     * Acquire a session, blocking while the pool is at capacity.
     *
     * @throws SessionPoolBusyException when no session frees up within the acquire timeout
     * @throws ProxyExhaustedException when a new session is needed but every proxy is blocked
     */
    public BrowserSession acquire() {
        if (shutdown.get()) {
            throw new IllegalStateException("browser session pool is shutdown");
        }

        long timeoutMs = Math.max(1L, browserProperties.getAcquireTimeoutMs());
        long deadlineAt = System.currentTimeMillis() + timeoutMs;
        while (true) {
            // Fast path: reuse an idle session.
            BrowserSession session = pollUsableIdleSession();
            if (session != null) {
                return session;
            }

            // Try to scale out if capacity allows.
            session = tryCreateSession();
            if (session != null) {
                return session;
            }

            // Capacity reached: wait for a returned or retired session.
            long remainingMs = deadlineAt - System.currentTimeMillis();
            if (remainingMs <= 0) {
                log.info(
                    "session acquire timeout, timeoutMs={}, activeSessions={}, idleSessions={}",
                    timeoutMs,
                    activeSessionCount.get(),
                    idleSessions.size()
                );
                throw new SessionPoolBusyException("browser session pool is busy");
            }
            try {
                session = idleSessions.poll(Math.min(remainingMs, ACQUIRE_POLL_SLICE_MS), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("session acquire interrupted");
                throw new IllegalStateException("interrupted while waiting for browser session", ex);
            }
            if (session != null) {
                if (isReusable(session) && session.markAcquired()) {
                    return session;
                }
                retire(session, "unusable");
            }
        }
    }

    /**
     * Release a session after one fetch, reporting the outcome against its proxy.
     */
    public void release(BrowserSession session, SessionOutcome outcome) {
        if (session == null) {
            return;
        }
        if (outcome.countsAsRequest()) {
            session.recordRequest();
            proxyRotator.report(session.getProxyId(), !outcome.isProxyFailure());
        }

        if (shutdown.get()) {
            retire(session, "shutdown");
            return;
        }
        if (outcome == SessionOutcome.DETECTED) {
            retire(session, "detected");
            return;
        }
        if (session.getRequestCount() >= Math.max(1, browserProperties.getSessionRequestBudget())) {
            retire(session, "request budget exhausted");
            return;
        }
        if (!isReusable(session)) {
            retire(session, "proxy unusable");
            return;
        }

        session.markReleased();
        if (!idleSessions.offer(session)) {
            retire(session, "idle queue full");
        }
    }

    public int getActiveSessionCount() {
        return activeSessionCount.get();
    }

    public int getIdleSessionCount() {
        return idleSessions.size();
    }

    @PreDestroy
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("shutting down browser session pool");

            BrowserSession session;
            while ((session = idleSessions.poll()) != null) {
                closeSessionAndReleaseSlot(session);
            }

            // Then close remaining sessions that may still be in-flight.
            for (BrowserSession remaining : List.copyOf(allSessions)) {
                closeSessionAndReleaseSlot(remaining);
            }

            log.info("browser session pool shutdown completed");
        }
    }

    private BrowserSession pollUsableIdleSession() {
        BrowserSession session;
        while ((session = idleSessions.poll()) != null) {
            if (isReusable(session) && session.markAcquired()) {
                return session;
            }
            retire(session, "unusable");
        }
        return null;
    }

    private boolean isReusable(BrowserSession session) {
        return !session.isClosed() && proxyRotator.isUsable(session.getProxyId());
    }

    private BrowserSession tryCreateSession() {
        // Reserve slot first to guarantee the capacity boundary under concurrency.
        if (!reserveSessionSlot()) {
            return null;
        }
        String contextId = "session-" + sessionCounter.getAndIncrement();
        try {
            ProxyRecord proxy = proxyRotator.select();
            FingerprintProfile profile = pickFingerprintProfile();
            BrowserSession session = browserSessionFactory.create(contextId, proxy, profile);
            allSessions.add(session);
            session.markAcquired();
            log.debug("created browser session, contextId={}, proxyId={}", contextId, proxy.getId());
            return session;
        } catch (ProxyExhaustedException ex) {
            log.debug("create session skipped, contextId={}, error={}", contextId, ex.getMessage());
            releaseSessionSlot();
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("create session runtime failure, contextId={}, error={}", contextId, ex.getMessage(), ex);
            releaseSessionSlot();
            throw ex;
        } catch (Exception ex) {
            log.warn("create session checked failure, contextId={}, error={}", contextId, ex.getMessage(), ex);
            releaseSessionSlot();
            throw new IllegalStateException("failed to create browser session: " + ex.getMessage(), ex);
        }
    }

    private FingerprintProfile pickFingerprintProfile() {
        List<FingerprintProfile> profiles = browserProperties.getFingerprintProfiles();
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalStateException("no fingerprint profile configured");
        }
        return profiles.get(ThreadLocalRandom.current().nextInt(profiles.size()));
    }

    private boolean reserveSessionSlot() {
        int capacity = Math.max(1, browserProperties.getSessionPoolSize());
        while (true) {
            int currentCount = activeSessionCount.get();
            if (currentCount >= capacity) {
                return false;
            }
            if (activeSessionCount.compareAndSet(currentCount, currentCount + 1)) {
                return true;
            }
        }
    }

    private void releaseSessionSlot() {
        activeSessionCount.decrementAndGet();
    }

    private void retire(BrowserSession session, String reason) {
        log.debug("retire browser session, contextId={}, proxyId={}, requests={}, reason={}",
            session.getContextId(), session.getProxyId(), session.getRequestCount(), reason);
        session.markReleased();
        closeSessionAndReleaseSlot(session);
    }

    private void closeSessionAndReleaseSlot(BrowserSession session) {
        // Idempotent close guard: only first caller removes and closes the session.
        if (!allSessions.remove(session)) {
            return;
        }
        try {
            session.close();
        } finally {
            releaseSessionSlot();
        }
    }

}
