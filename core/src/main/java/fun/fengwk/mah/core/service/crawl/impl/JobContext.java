package fun.fengwk.mah.core.service.crawl.impl;

import fun.fengwk.mah.core.service.crawl.CircuitBreaker;
import fun.fengwk.mah.core.service.crawl.CrawlFrontier;
import fun.fengwk.mah.core.service.crawl.model.CrawlJob;
import fun.fengwk.mah.core.service.crawl.model.JobStatus;
import fun.fengwk.mah.core.service.fetch.FailureReason;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Mutable state of one running job. Job fields are only changed through this class, under its lock.
 *
 * @author fengwk
 */
class JobContext {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 300;

    private final CrawlJob job;
    private final CrawlFrontier frontier;
    private final CircuitBreaker circuitBreaker;
    private final int recentErrorLimit;
    private final Deque<String> recentErrors = new ArrayDeque<>();
    private final Map<FailureReason, Integer> failureCounts = new EnumMap<>(FailureReason.class);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private Future<?> timeoutFuture;
    private Long proxyExhaustedSince;

    JobContext(CrawlJob job, CrawlFrontier frontier, CircuitBreaker circuitBreaker, int recentErrorLimit) {
        this.job = job;
        this.frontier = frontier;
        this.circuitBreaker = circuitBreaker;
        this.recentErrorLimit = Math.max(1, recentErrorLimit);
    }

    String jobId() {
        return job.getId();
    }

    CrawlFrontier frontier() {
        return frontier;
    }

    CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    synchronized JobStatus status() {
        return job.getStatus();
    }

    synchronized boolean isTerminal() {
        return job.getStatus().isTerminal();
    }

    /**
     * Whether results of in-flight fetches must be dropped.
     */
    synchronized boolean isAbandoned(boolean abandonInFlightOnCancel) {
        return abandonInFlightOnCancel && job.getStatus() == JobStatus.CANCELLED;
    }

    /**
     * Move to {@code target} if allowed: QUEUED to RUNNING, any non-terminal state to a terminal one.
     *
     * @return {@code true} when the status changed
     */
    synchronized boolean transition(JobStatus target, String summary) {
        JobStatus current = job.getStatus();
        if (current.isTerminal() || current == target) {
            return false;
        }
        if (target == JobStatus.QUEUED || (target == JobStatus.RUNNING && current != JobStatus.QUEUED)) {
            return false;
        }
        job.setStatus(target);
        job.setUpdatedAt(Instant.now());
        if (summary != null) {
            job.setErrorSummary(summary);
        }
        if (target.isTerminal()) {
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            terminated.countDown();
        }
        return true;
    }

    synchronized void setTimeoutFuture(Future<?> timeoutFuture) {
        this.timeoutFuture = timeoutFuture;
        if (job.getStatus().isTerminal()) {
            timeoutFuture.cancel(false);
        }
    }

    synchronized void incrementFound() {
        job.setArticlesFound(job.getArticlesFound() + 1);
        job.setUpdatedAt(Instant.now());
    }

    synchronized void incrementFailed() {
        job.setArticlesFailed(job.getArticlesFailed() + 1);
        job.setUpdatedAt(Instant.now());
    }

    synchronized void incrementSkipped() {
        job.setArticlesSkipped(job.getArticlesSkipped() + 1);
        job.setUpdatedAt(Instant.now());
    }

    /**
     * Attribute an error to a candidate url, or to the job when {@code url} is null.
     */
    synchronized void recordError(String url, FailureReason reason, String message) {
        failureCounts.merge(reason, 1, Integer::sum);
        String detail = message == null ? "" : message;
        if (detail.length() > MAX_ERROR_MESSAGE_LENGTH) {
            detail = detail.substring(0, MAX_ERROR_MESSAGE_LENGTH) + "...";
        }
        String entry = reason + " " + (url == null ? "job" : url) + (detail.isEmpty() ? "" : ": " + detail);
        recentErrors.addLast(entry);
        while (recentErrors.size() > recentErrorLimit) {
            recentErrors.removeFirst();
        }
    }

    /**
     * Most frequent failure reason with its count, such as {@code SOFT_BLOCK x12}, or {@code none}.
     */
    synchronized String dominantFailure() {
        FailureReason dominant = null;
        int count = 0;
        for (Map.Entry<FailureReason, Integer> entry : failureCounts.entrySet()) {
            if (entry.getValue() > count) {
                dominant = entry.getKey();
                count = entry.getValue();
            }
        }
        return dominant == null ? "none" : dominant + " x" + count;
    }

    synchronized Long proxyExhaustedSince() {
        return proxyExhaustedSince;
    }

    /**
     * @return {@code true} when this call started the pause
     */
    synchronized boolean pauseForProxies(long nowMs) {
        if (proxyExhaustedSince != null) {
            return false;
        }
        proxyExhaustedSince = nowMs;
        return true;
    }

    synchronized void resumeFromProxyPause() {
        proxyExhaustedSince = null;
    }

    synchronized CrawlJob snapshot() {
        return job.toBuilder().recentErrors(new ArrayList<>(recentErrors)).build();
    }

    boolean awaitTerminal(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

}
