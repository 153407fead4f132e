package fun.fengwk.mah.core.service.crawl;

import fun.fengwk.mah.core.service.crawl.model.ArticleEvent;
import fun.fengwk.mah.core.service.crawl.model.CrawlJob;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Harvesting job orchestration.
 *
 * @author fengwk
 */
public interface CrawlJobService {

    /**
     * Submit a job.
     *
     * @param seedUrl article or listing url the job starts from
     * @param strategy discovery strategy
     * @param maxArticles article budget, {@code null} for the configured default
     * @return job id
     * @throws IllegalArgumentException when the seed, the strategy or the budget is not acceptable
     */
    String submit(String seedUrl, StrategyType strategy, Integer maxArticles);

    /**
     * @throws IllegalArgumentException when the job is unknown
     */
    CrawlJob status(String jobId);

    /**
     * Cancel a job that has not terminated yet.
     *
     * @return {@code true} when the job transitioned to cancelled
     * @throws IllegalArgumentException when the job is unknown
     */
    boolean cancel(String jobId);

    /**
     * Hot stream of harvested articles of all jobs, subscribers only see articles stored after subscribing.
     */
    Flux<ArticleEvent> articles();

    /**
     * Wait until the job reaches a terminal state or the timeout elapses.
     *
     * @return job status at return
     * @throws IllegalArgumentException when the job is unknown
     */
    CrawlJob awaitTermination(String jobId, Duration timeout) throws InterruptedException;

}
