package fun.fengwk.mah.core.service.browser.runtime;

import fun.fengwk.mah.core.service.browser.FingerprintProfile;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Browser session handle: one isolated browser context bound to one proxy and fingerprint.
 *
 * <p>A session serves at most one in-flight fetch, the pool flips {@code inUse} on acquire and release.
 * Close is idempotent and releases resources in strict order.
 *
 * @author fengwk
 */
public class BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);

    private final String contextId;
    private final String proxyId;
    private final FingerprintProfile fingerprintProfile;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private final AtomicBoolean inUse = new AtomicBoolean(false);
    private final AtomicInteger requestCount = new AtomicInteger(0);
    private volatile Instant lastUsedAt;
    private volatile boolean closed = false;

    public BrowserSession(
        String contextId,
        String proxyId,
        FingerprintProfile fingerprintProfile,
        Playwright playwright,
        Browser browser,
        BrowserContext browserContext
    ) {
        this.contextId = contextId;
        this.proxyId = proxyId;
        this.fingerprintProfile = fingerprintProfile;
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
        this.lastUsedAt = Instant.now();
    }

    public String getContextId() {
        return contextId;
    }

    public String getProxyId() {
        return proxyId;
    }

    public FingerprintProfile getFingerprintProfile() {
        return fingerprintProfile;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    public boolean isInUse() {
        return inUse.get();
    }

    public boolean isClosed() {
        return closed;
    }

    public Page newPage() {
        if (closed) {
            throw new IllegalStateException("session is closed: " + contextId);
        }
        if (!inUse.get()) {
            throw new IllegalStateException("session is not acquired: " + contextId);
        }
        return browserContext.newPage();
    }

    boolean markAcquired() {
        return inUse.compareAndSet(false, true);
    }

    void markReleased() {
        inUse.set(false);
    }

    int recordRequest() {
        lastUsedAt = Instant.now();
        return requestCount.incrementAndGet();
    }

    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            if (browserContext != null) {
                browserContext.close();
            }
        } catch (Exception ex) {
            logCloseFailure("browser context", ex);
        }

        try {
            if (browser != null) {
                browser.close();
            }
        } catch (Exception ex) {
            logCloseFailure("browser", ex);
        }

        try {
            if (playwright != null) {
                playwright.close();
            }
        } catch (Exception ex) {
            logCloseFailure("playwright", ex);
        }
    }

    private void logCloseFailure(String resource, Exception ex) {
        if (isExpectedCloseException(ex)) {
            log.debug("{} already closed for session {}, skip close", resource, contextId);
        } else {
            log.warn("failed to close {} for session {}", resource, contextId, ex);
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
