package fun.fengwk.mah.core.service.discovery.strategy;

import fun.fengwk.mah.core.service.discovery.DiscoveryStrategy;
import fun.fengwk.mah.core.service.discovery.LinkCollector;
import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.CandidateKind;
import fun.fengwk.mah.core.service.fetch.PageLink;
import fun.fengwk.mah.core.service.support.ArticleUrls;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeding and candidate bookkeeping shared by the discovery strategies.
 *
 * @author fengwk
 */
public abstract class AbstractDiscoveryStrategy implements DiscoveryStrategy {

    protected final LinkCollector linkCollector;

    protected AbstractDiscoveryStrategy(LinkCollector linkCollector) {
        this.linkCollector = linkCollector;
    }

    @Override
    public List<Candidate> seed(String url) {
        CandidateKind kind = ArticleUrls.isListingUrl(url) ? CandidateKind.LISTING : CandidateKind.ARTICLE;
        Candidate candidate = Candidate.of(url == null ? null : url.trim(), type(), null, 0, kind);
        if (candidate == null) {
            throw new IllegalArgumentException("invalid seed url: " + url);
        }
        return List.of(candidate);
    }

    protected CandidateBuffer newBuffer(Candidate source) {
        return new CandidateBuffer(source);
    }

    /**
     * Candidates found on one page, in insertion order, deduplicated by canonical url, never the page itself.
     */
    protected class CandidateBuffer {

        private final Candidate source;
        private final Map<String, Candidate> candidates = new LinkedHashMap<>();

        CandidateBuffer(Candidate source) {
            this.source = source;
        }

        public void article(String url) {
            if (ArticleUrls.isArticleUrl(url)) {
                add(url, CandidateKind.ARTICLE);
            }
        }

        public void articles(List<PageLink> links) {
            for (PageLink link : links) {
                article(link.url());
            }
        }

        public void listing(String url) {
            if (ArticleUrls.isListingUrl(url)) {
                add(url, CandidateKind.LISTING);
            }
        }

        public List<Candidate> toList() {
            return new ArrayList<>(candidates.values());
        }

        private void add(String url, CandidateKind kind) {
            Candidate candidate = Candidate.of(url, type(), source.getUrl(), source.getDepth() + 1, kind);
            if (candidate == null || candidate.getCanonicalUrl().equals(source.getCanonicalUrl())) {
                return;
            }
            candidates.putIfAbsent(candidate.getCanonicalUrl(), candidate);
        }

    }

}
