package fun.fengwk.mah.core.service.crawl.impl;

import fun.fengwk.mah.core.service.browser.runtime.BrowserSession;
import fun.fengwk.mah.core.service.browser.runtime.BrowserSessionPool;
import fun.fengwk.mah.core.service.browser.runtime.SessionOutcome;
import fun.fengwk.mah.core.service.browser.runtime.SessionPoolBusyException;
import fun.fengwk.mah.core.service.crawl.CircuitBreaker;
import fun.fengwk.mah.core.service.crawl.CrawlFrontier;
import fun.fengwk.mah.core.service.crawl.CrawlJobService;
import fun.fengwk.mah.core.service.crawl.CrawlProperties;
import fun.fengwk.mah.core.service.crawl.PolitenessGate;
import fun.fengwk.mah.core.service.crawl.RetryBackoff;
import fun.fengwk.mah.core.service.crawl.model.ArticleEvent;
import fun.fengwk.mah.core.service.crawl.model.CrawlJob;
import fun.fengwk.mah.core.service.crawl.model.JobStatus;
import fun.fengwk.mah.core.service.discovery.DiscoveryEngine;
import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.CandidateKind;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.extract.ArticleExtractor;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.extract.model.ExtractionResult;
import fun.fengwk.mah.core.service.fetch.FailureReason;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import fun.fengwk.mah.core.service.fetch.PageFetcher;
import fun.fengwk.mah.core.service.fetch.PermanentFetchException;
import fun.fengwk.mah.core.service.fetch.TransientFetchException;
import fun.fengwk.mah.core.service.proxy.ProxyExhaustedException;
import fun.fengwk.mah.core.service.proxy.ProxyProperties;
import fun.fengwk.mah.core.service.proxy.ProxyRotator;
import fun.fengwk.mah.core.service.storage.ArticleStore;
import fun.fengwk.mah.core.service.storage.RawContentArchive;
import fun.fengwk.mah.core.service.storage.SaveResult;
import fun.fengwk.mah.core.service.storage.StorageProperties;
import fun.fengwk.mah.core.service.support.ArticleUrls;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Job orchestrator.
 *
 * <p>Each job runs {@code workersPerJob} cooperative worker loops on the shared crawl executor. One loop
 * step takes a single candidate from the job frontier and drives it through session acquisition,
 * politeness wait, fetch, extraction, storage and expansion, then yields the thread by resubmitting
 * itself; a loop with nothing ready reschedules itself instead of blocking.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlJobServiceImpl implements CrawlJobService {

    private static final Duration EMIT_TIMEOUT = Duration.ofSeconds(1);

    private final CrawlProperties crawlProperties;
    private final ProxyProperties proxyProperties;
    private final StorageProperties storageProperties;
    private final DiscoveryEngine discoveryEngine;
    private final BrowserSessionPool sessionPool;
    private final ProxyRotator proxyRotator;
    private final PageFetcher pageFetcher;
    private final ArticleExtractor articleExtractor;
    private final ArticleStore articleStore;
    private final RawContentArchive rawContentArchive;
    private final PolitenessGate politenessGate;
    private final RetryBackoff retryBackoff;
    private final ScheduledExecutorService crawlExecutor;

    private final Map<String, JobContext> jobs = new ConcurrentHashMap<>();
    private final Sinks.Many<ArticleEvent> articleSink = Sinks.many().multicast().directBestEffort();

    @Override
    public String submit(String seedUrl, StrategyType strategy, Integer maxArticles) {
        if (!StringUtils.hasText(seedUrl)) {
            throw new IllegalArgumentException("seedUrl is required");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        int budget = maxArticles == null ? crawlProperties.getDefaultMaxArticles() : maxArticles;
        if (budget <= 0) {
            throw new IllegalArgumentException("maxArticles must be positive, got " + budget);
        }
        List<Candidate> seeds = discoveryEngine.seed(strategy, seedUrl.trim());

        Instant now = Instant.now();
        CrawlJob job = CrawlJob.builder()
            .id(UUID.randomUUID().toString())
            .seedUrl(seedUrl.trim())
            .strategy(strategy)
            .status(JobStatus.QUEUED)
            .maxArticles(budget)
            .createdAt(now)
            .updatedAt(now)
            .build();
        CircuitBreaker circuitBreaker = new CircuitBreaker(
            crawlProperties.getCircuitBreakerWindowSize(),
            crawlProperties.getCircuitBreakerMinSamples(),
            crawlProperties.getCircuitBreakerFailureRate()
        );
        JobContext context = new JobContext(job, new CrawlFrontier(budget), circuitBreaker,
            crawlProperties.getRecentErrorLimit());
        for (Candidate seed : seeds) {
            context.frontier().offer(seed);
        }
        jobs.put(job.getId(), context);

        try {
            if (crawlProperties.getJobTimeoutMs() > 0) {
                context.setTimeoutFuture(crawlExecutor.schedule(
                    () -> failJob(context, "job timeout after " + crawlProperties.getJobTimeoutMs() + "ms"),
                    crawlProperties.getJobTimeoutMs(), TimeUnit.MILLISECONDS));
            }
            int workers = Math.max(1, crawlProperties.getWorkersPerJob());
            for (int i = 0; i < workers; i++) {
                crawlExecutor.execute(() -> step(context));
            }
        } catch (RejectedExecutionException ex) {
            context.transition(JobStatus.FAILED, "crawl executor unavailable");
            throw new IllegalStateException("crawl executor unavailable", ex);
        }
        log.info("crawl job submitted, jobId={}, strategy={}, seedUrl={}, maxArticles={}",
            job.getId(), strategy, job.getSeedUrl(), budget);
        return job.getId();
    }

    @Override
    public CrawlJob status(String jobId) {
        return requireJob(jobId).snapshot();
    }

    @Override
    public boolean cancel(String jobId) {
        JobContext context = requireJob(jobId);
        if (!context.transition(JobStatus.CANCELLED, "cancelled on request")) {
            return false;
        }
        int dropped = context.frontier().discard();
        log.info("crawl job cancelled, jobId={}, droppedCandidates={}, abandonInFlight={}",
            jobId, dropped, crawlProperties.isAbandonInFlightOnCancel());
        return true;
    }

    @Override
    public Flux<ArticleEvent> articles() {
        return articleSink.asFlux();
    }

    @Override
    public CrawlJob awaitTermination(String jobId, Duration timeout) throws InterruptedException {
        JobContext context = requireJob(jobId);
        context.awaitTerminal(timeout);
        return context.snapshot();
    }

    @PreDestroy
    public void shutdown() {
        for (JobContext context : jobs.values()) {
            if (context.transition(JobStatus.CANCELLED, "service shutdown")) {
                context.frontier().discard();
                log.info("crawl job cancelled by shutdown, jobId={}", context.jobId());
            }
        }
        articleSink.tryEmitComplete();
    }

    private JobContext requireJob(String jobId) {
        JobContext context = jobId == null ? null : jobs.get(jobId);
        if (context == null) {
            throw new IllegalArgumentException("unknown job: " + jobId);
        }
        return context;
    }

    private void step(JobContext context) {
        if (context.isTerminal()) {
            return;
        }
        try {
            if (context.transition(JobStatus.RUNNING, null)) {
                log.info("crawl job running, jobId={}", context.jobId());
            }
            if (!checkProxyPause(context)) {
                return;
            }
            CrawlFrontier frontier = context.frontier();
            long now = System.currentTimeMillis();
            Candidate candidate = frontier.take(now);
            if (candidate == null) {
                if (frontier.isExhausted()) {
                    completeJob(context);
                    return;
                }
                long delayMs = Math.min(crawlProperties.getIdlePollMs(), frontier.nextDelayMs(now));
                reschedule(context, Math.max(1, delayMs));
                return;
            }
            process(context, candidate);
            reschedule(context, 0);
        } catch (RuntimeException ex) {
            log.warn("crawl worker step failed, jobId={}", context.jobId(), ex);
            reschedule(context, crawlProperties.getIdlePollMs());
        }
    }

    private boolean checkProxyPause(JobContext context) {
        Long pausedSince = context.proxyExhaustedSince();
        if (pausedSince == null) {
            return true;
        }
        if (proxyRotator.awaitAvailable(0)) {
            context.resumeFromProxyPause();
            log.info("proxy available again, job resumed, jobId={}", context.jobId());
            return true;
        }
        long waitedMs = System.currentTimeMillis() - pausedSince;
        if (waitedMs >= proxyProperties.getExhaustionWaitTimeoutMs()) {
            context.recordError(null, FailureReason.SESSION_UNAVAILABLE, "no selectable proxy");
            failJob(context, "proxy exhausted, no selectable proxy within "
                + proxyProperties.getExhaustionWaitTimeoutMs() + "ms");
            return false;
        }
        reschedule(context, crawlProperties.getIdlePollMs());
        return false;
    }

    private void process(JobContext context, Candidate candidate) {
        Settlement settlement = Settlement.done(false);
        try {
            settlement = handle(context, candidate);
        } catch (RuntimeException ex) {
            log.warn("candidate processing failed, jobId={}, url={}", context.jobId(), candidate.getUrl(), ex);
            context.recordError(candidate.getUrl(), FailureReason.UNEXPECTED, ex.getMessage());
            context.incrementFailed();
        } finally {
            settle(context, candidate, settlement);
        }
    }

    private Settlement handle(JobContext context, Candidate candidate) {
        // Stored pages the strategy traverses through are still fetched for their links, leaves are skipped.
        if (candidate.getKind() == CandidateKind.ARTICLE && candidate.getDepth() > 0
            && crawlProperties.isCrossJobDedup() && !discoveryEngine.expands(candidate)
            && articleStore.exists(candidate.getUrl())) {
            context.incrementSkipped();
            log.debug("candidate already harvested, jobId={}, url={}", context.jobId(), candidate.getUrl());
            return Settlement.done(false);
        }

        BrowserSession session;
        try {
            session = sessionPool.acquire();
        } catch (ProxyExhaustedException ex) {
            if (context.pauseForProxies(System.currentTimeMillis())) {
                log.info("no selectable proxy, job paused, jobId={}, waitTimeoutMs={}",
                    context.jobId(), proxyProperties.getExhaustionWaitTimeoutMs());
            }
            return Settlement.requeue();
        } catch (SessionPoolBusyException ex) {
            candidate.setAttempts(candidate.getAttempts() + 1);
            return transientFailure(context, candidate, FailureReason.SESSION_UNAVAILABLE, ex.getMessage(), false);
        }

        candidate.setAttempts(candidate.getAttempts() + 1);
        SessionOutcome outcome = SessionOutcome.UNUSED;
        try {
            politenessGate.await(session.getProxyId());
            if (context.isAbandoned(crawlProperties.isAbandonInFlightOnCancel())) {
                return Settlement.done(false);
            }
            FetchResult result = pageFetcher.fetch(session, candidate.getUrl());
            outcome = SessionOutcome.SUCCESS;
            recordAttempt(context, true);
            return handleFetched(context, candidate, result);
        } catch (TransientFetchException ex) {
            outcome = ex.getReason() == FailureReason.SOFT_BLOCK ? SessionOutcome.DETECTED : SessionOutcome.FAILURE;
            return transientFailure(context, candidate, ex.getReason(), ex.getMessage(), true);
        } catch (PermanentFetchException ex) {
            outcome = SessionOutcome.NOT_FOUND;
            context.incrementFailed();
            context.recordError(candidate.getUrl(), ex.getReason(), ex.getMessage());
            log.info("candidate failed permanently, jobId={}, url={}, reason={}",
                context.jobId(), candidate.getUrl(), ex.getReason());
            return Settlement.done(false);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            candidate.setAttempts(candidate.getAttempts() - 1);
            log.info("candidate interrupted, jobId={}, url={}", context.jobId(), candidate.getUrl());
            return Settlement.requeue();
        } finally {
            sessionPool.release(session, outcome);
        }
    }

    private Settlement transientFailure(JobContext context, Candidate candidate, FailureReason reason,
                                        String message, boolean countsForBreaker) {
        context.recordError(candidate.getUrl(), reason, message);
        if (countsForBreaker) {
            recordAttempt(context, false);
        }
        if (candidate.getAttempts() > crawlProperties.getMaxRetries()) {
            context.incrementFailed();
            log.info("candidate failed after retries, jobId={}, url={}, attempts={}, reason={}",
                context.jobId(), candidate.getUrl(), candidate.getAttempts(), reason);
            return Settlement.done(false);
        }
        long delayMs = retryBackoff.delayMs(candidate.getAttempts());
        log.debug("candidate retry scheduled, jobId={}, url={}, attempts={}, reason={}, delayMs={}",
            context.jobId(), candidate.getUrl(), candidate.getAttempts(), reason, delayMs);
        return Settlement.retry(System.currentTimeMillis() + delayMs);
    }

    private void recordAttempt(JobContext context, boolean success) {
        CircuitBreaker circuitBreaker = context.circuitBreaker();
        if (circuitBreaker.record(success)) {
            failJob(context, String.format(Locale.ROOT, "circuit breaker tripped, failureRate=%.2f, samples=%d",
                circuitBreaker.failureRate(), circuitBreaker.samples()));
        }
    }

    private Settlement handleFetched(JobContext context, Candidate candidate, FetchResult result) {
        if (context.isAbandoned(crawlProperties.isAbandonInFlightOnCancel())) {
            log.debug("in-flight result abandoned, jobId={}, url={}", context.jobId(), candidate.getUrl());
            return Settlement.done(false);
        }
        String finalUrl = StringUtils.hasText(result.getFinalUrl()) ? result.getFinalUrl() : candidate.getUrl();
        String finalCanonicalUrl = ArticleUrls.canonicalize(finalUrl);
        boolean redirectedToVisited = finalCanonicalUrl != null
            && !finalCanonicalUrl.equals(candidate.getCanonicalUrl())
            && !context.frontier().markVisited(finalCanonicalUrl);
        if (redirectedToVisited) {
            context.incrementSkipped();
            log.debug("redirect target already visited, jobId={}, url={}, finalUrl={}",
                context.jobId(), candidate.getUrl(), finalUrl);
            return Settlement.done(false);
        }

        ArticleRecord record = null;
        boolean produced = false;
        if (candidate.getKind() == CandidateKind.ARTICLE) {
            if (crawlProperties.isCrossJobDedup() && articleStore.exists(finalUrl)) {
                context.incrementSkipped();
                log.info("article already harvested, expanding only, jobId={}, url={}, depth={}",
                    context.jobId(), finalUrl, candidate.getDepth());
            } else {
                ExtractionResult extraction = articleExtractor.extract(result.getContent(), result.getPayload(), finalUrl);
                if (extraction.isSuccess()) {
                    record = extraction.getRecord();
                    produced = persist(context, record, result);
                } else {
                    String rawContentRef = rawContentArchive.store(finalUrl, result.getContent());
                    context.incrementFailed();
                    context.recordError(candidate.getUrl(), FailureReason.EXTRACTION_FAILED,
                        extraction.getFailureReason() + ", rawContentRef=" + rawContentRef);
                    log.info("article extraction failed, jobId={}, url={}, reason={}, rawContentRef={}",
                        context.jobId(), candidate.getUrl(), extraction.getFailureReason(), rawContentRef);
                }
            }
        }
        expand(context, candidate, record, result);
        return Settlement.done(produced);
    }

    private boolean persist(JobContext context, ArticleRecord record, FetchResult result) {
        record.setCrawlTime(Instant.now());
        if (storageProperties.isArchiveSuccessfulContent()) {
            record.setRawContentRef(rawContentArchive.store(record.getUrl(), result.getContent()));
        }
        if (context.isAbandoned(crawlProperties.isAbandonInFlightOnCancel())) {
            return false;
        }

        SaveResult saveResult;
        try {
            saveResult = articleStore.save(record);
        } catch (RuntimeException ex) {
            log.warn("article store failed, jobId={}, url={}", context.jobId(), record.getUrl(), ex);
            saveResult = SaveResult.ERROR;
        }
        switch (saveResult) {
            case SUCCESS:
                context.incrementFound();
                articleSink.emitNext(new ArticleEvent(context.jobId(), record),
                    Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
                log.info("article harvested, jobId={}, url={}, title={}, strategy={}",
                    context.jobId(), record.getUrl(), record.getTitle(), record.getExtractionStrategy());
                return true;
            case DUPLICATE:
                context.incrementSkipped();
                log.debug("article already stored, jobId={}, url={}", context.jobId(), record.getUrl());
                return false;
            default:
                context.incrementFailed();
                context.recordError(record.getUrl(), FailureReason.STORAGE_ERROR, "article store rejected the record");
                return false;
        }
    }

    private void expand(JobContext context, Candidate candidate, ArticleRecord record, FetchResult result) {
        CrawlFrontier frontier = context.frontier();
        if (frontier.isClosed() || !discoveryEngine.expands(candidate)) {
            return;
        }
        List<Candidate> children;
        try {
            children = discoveryEngine.expand(candidate, record, result);
        } catch (RuntimeException ex) {
            log.warn("candidate expansion failed, jobId={}, url={}", context.jobId(), candidate.getUrl(), ex);
            context.recordError(candidate.getUrl(), FailureReason.UNEXPECTED, "expansion failed: " + ex.getMessage());
            return;
        }
        int newArticles = 0;
        int newListings = 0;
        for (Candidate child : children) {
            if (frontier.offer(child)) {
                if (child.isListing()) {
                    newListings++;
                } else {
                    newArticles++;
                }
            }
        }
        int dropped = frontier.recordExpansion(newArticles, crawlProperties.getIdleExpansionLimit());
        if (dropped > 0) {
            log.info("idle expansion limit reached, listing candidates dropped, jobId={}, dropped={}",
                context.jobId(), dropped);
        }
        log.debug("candidate expanded, jobId={}, url={}, found={}, newArticles={}, newListings={}",
            context.jobId(), candidate.getUrl(), children.size(), newArticles, newListings);
    }

    private void settle(JobContext context, Candidate candidate, Settlement settlement) {
        CrawlFrontier frontier = context.frontier();
        switch (settlement.type()) {
            case RETRY:
                frontier.retry(candidate, settlement.readyAtMs());
                break;
            case REQUEUE:
                frontier.retry(candidate, System.currentTimeMillis());
                break;
            default:
                frontier.complete(candidate, settlement.articleProduced());
                break;
        }
    }

    private void completeJob(JobContext context) {
        CrawlFrontier frontier = context.frontier();
        String summary = frontier.isBudgetMet() ? "article budget met" : "frontier exhausted";
        if (context.transition(JobStatus.COMPLETED, summary)) {
            CrawlJob job = context.snapshot();
            log.info("crawl job completed, jobId={}, reason={}, found={}, failed={}, skipped={}",
                job.getId(), summary, job.getArticlesFound(), job.getArticlesFailed(), job.getArticlesSkipped());
        }
    }

    private void failJob(JobContext context, String reason) {
        String summary = reason + ", dominantFailure=" + context.dominantFailure();
        if (context.transition(JobStatus.FAILED, summary)) {
            int dropped = context.frontier().discard();
            CrawlJob job = context.snapshot();
            log.warn("crawl job failed, jobId={}, summary={}, found={}, failed={}, droppedCandidates={}",
                job.getId(), summary, job.getArticlesFound(), job.getArticlesFailed(), dropped);
        }
    }

    private void reschedule(JobContext context, long delayMs) {
        if (context.isTerminal()) {
            return;
        }
        try {
            if (delayMs <= 0) {
                crawlExecutor.execute(() -> step(context));
            } else {
                crawlExecutor.schedule(() -> step(context), delayMs, TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException ex) {
            log.warn("crawl worker rejected, jobId={}, error={}", context.jobId(), ex.getMessage());
            failJob(context, "crawl executor unavailable");
        }
    }

    private record Settlement(Type type, boolean articleProduced, long readyAtMs) {

        static Settlement done(boolean articleProduced) {
            return new Settlement(Type.DONE, articleProduced, 0L);
        }

        static Settlement retry(long readyAtMs) {
            return new Settlement(Type.RETRY, false, readyAtMs);
        }

        static Settlement requeue() {
            return new Settlement(Type.REQUEUE, false, 0L);
        }

        enum Type {
            DONE,
            RETRY,
            REQUEUE
        }

    }

}
