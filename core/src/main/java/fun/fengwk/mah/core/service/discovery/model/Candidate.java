package fun.fengwk.mah.core.service.discovery.model;

import fun.fengwk.mah.core.service.support.ArticleUrls;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A url waiting in a job's frontier.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candidate {

    private String url;

    /**
     * Dedup key, see {@link ArticleUrls#canonicalize(String)}.
     */
    private String canonicalUrl;

    /**
     * Strategy that discovered this url.
     */
    private StrategyType strategy;

    /**
     * Page this url was found on, null for seeds.
     */
    private String parentUrl;

    private int depth;

    private CandidateKind kind;

    /**
     * Fetch attempts made so far.
     */
    private int attempts;

    /**
     * @return candidate, or {@code null} when the url cannot be canonicalized
     */
    public static Candidate of(String url, StrategyType strategy, String parentUrl, int depth, CandidateKind kind) {
        String canonicalUrl = ArticleUrls.canonicalize(url);
        if (canonicalUrl == null) {
            return null;
        }
        return Candidate.builder()
            .url(url)
            .canonicalUrl(canonicalUrl)
            .strategy(strategy)
            .parentUrl(parentUrl)
            .depth(depth)
            .kind(kind)
            .build();
    }

    public boolean isListing() {
        return kind == CandidateKind.LISTING;
    }

}
