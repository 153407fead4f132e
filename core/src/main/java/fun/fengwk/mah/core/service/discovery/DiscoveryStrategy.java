package fun.fengwk.mah.core.service.discovery;

import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.fetch.FetchResult;

import java.util.List;

/**
 * Generates and expands the candidate frontier of a job.
 *
 * @author fengwk
 */
public interface DiscoveryStrategy {

    StrategyType type();

    /**
     * Initial candidates for a seed url.
     *
     * @throws IllegalArgumentException when the seed url is not usable
     */
    List<Candidate> seed(String url);

    /**
     * Candidates reachable from a fetched page.
     *
     * @param source fetched candidate
     * @param record extracted article, {@code null} for listing pages and failed extractions
     * @param result rendered page
     */
    List<Candidate> expand(Candidate source, ArticleRecord record, FetchResult result);

    /**
     * Whether pages of {@code candidate} are expanded at all, pages that are not are only extracted.
     */
    default boolean expands(Candidate candidate) {
        return true;
    }

}
