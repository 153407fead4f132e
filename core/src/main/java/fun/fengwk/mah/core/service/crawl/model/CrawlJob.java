package fun.fengwk.mah.core.service.crawl.model;

import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Status view of a harvesting job.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CrawlJob {

    private String id;

    private String seedUrl;

    private StrategyType strategy;

    private JobStatus status;

    private int maxArticles;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Aggregate failure summary of a failed job, or the completion reason of a finished one.
     */
    private String errorSummary;

    /**
     * Articles extracted and stored.
     */
    private int articlesFound;

    /**
     * Candidates that failed permanently or ran out of retries.
     */
    private int articlesFailed;

    /**
     * Candidates skipped because they were already harvested.
     */
    private int articlesSkipped;

    /**
     * Most recent error reasons, oldest first.
     */
    @Builder.Default
    private List<String> recentErrors = new ArrayList<>();

}
