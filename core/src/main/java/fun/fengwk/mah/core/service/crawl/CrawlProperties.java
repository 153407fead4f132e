package fun.fengwk.mah.core.service.crawl;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Job orchestration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mah.crawl")
public class CrawlProperties {

    /**
     * Worker threads shared by all jobs.
     */
    private int workerPoolSize = 4;

    /**
     * Concurrent worker loops per job.
     */
    private int workersPerJob = 2;

    /**
     * Retries after the first attempt for transient failures.
     */
    private int maxRetries = 3;

    /**
     * Backoff before the first retry, doubled per further retry.
     */
    private long backoffBaseMs = 2000;

    private long backoffMaxMs = 60000;

    /**
     * Random spread applied to each backoff, 0.3 means +-30%.
     */
    private double backoffJitter = 0.3;

    /**
     * Minimum delay between two requests through the same network identity.
     */
    private long politenessDelayMs = 3000;

    /**
     * Overall job timeout, 0 disables it.
     */
    private long jobTimeoutMs = 3600000;

    /**
     * Consecutive expansions without a new article after which queued listing pages are dropped.
     */
    private int idleExpansionLimit = 5;

    /**
     * Fetch attempts kept in the failure rate window.
     */
    private int circuitBreakerWindowSize = 20;

    /**
     * Attempts needed in the window before the breaker may trip.
     */
    private int circuitBreakerMinSamples = 10;

    /**
     * Failure rate at or above which the breaker trips.
     */
    private double circuitBreakerFailureRate = 0.8;

    /**
     * Error reasons kept per job for status.
     */
    private int recentErrorLimit = 20;

    /**
     * Discard the results of fetches still running when a job is cancelled.
     */
    private boolean abandonInFlightOnCancel = false;

    /**
     * Skip urls the article store already has, across jobs.
     */
    private boolean crossJobDedup = true;

    /**
     * Budget used when a job is submitted without one.
     */
    private int defaultMaxArticles = 100;

    /**
     * Recheck interval of a worker whose frontier has nothing ready.
     */
    private long idlePollMs = 200;

}
