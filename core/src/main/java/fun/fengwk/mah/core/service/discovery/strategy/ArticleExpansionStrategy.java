package fun.fengwk.mah.core.service.discovery.strategy;

import fun.fengwk.mah.core.service.discovery.DiscoveryProperties;
import fun.fengwk.mah.core.service.discovery.LinkCollector;
import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Breadth-first expansion from a single article: in-page article links, links revealed by scrolling
 * and recommendation/related entries mined from the embedded payload, up to a depth limit.
 *
 * @author fengwk
 */
@Component
public class ArticleExpansionStrategy extends AbstractDiscoveryStrategy {

    private final DiscoveryProperties discoveryProperties;

    public ArticleExpansionStrategy(LinkCollector linkCollector, DiscoveryProperties discoveryProperties) {
        super(linkCollector);
        this.discoveryProperties = discoveryProperties;
    }

    @Override
    public StrategyType type() {
        return StrategyType.DISCOVER;
    }

    @Override
    public boolean expands(Candidate candidate) {
        return candidate.getDepth() < discoveryProperties.getDiscoverMaxDepth();
    }

    @Override
    public List<Candidate> expand(Candidate source, ArticleRecord record, FetchResult result) {
        if (!expands(source)) {
            return List.of();
        }
        String baseUrl = linkCollector.baseUrl(result);
        Document document = linkCollector.parse(result);
        EmbeddedPayload payload = result.getPayload();
        CandidateBuffer buffer = newBuffer(source);
        buffer.articles(linkCollector.anchors(document));
        buffer.articles(result.getScrollLinks());
        buffer.articles(linkCollector.payloadLinks(payload, EmbeddedPayload.KEY_RELATED, baseUrl));
        buffer.articles(linkCollector.payloadLinks(payload, EmbeddedPayload.KEY_ALBUM, baseUrl));
        return buffer.toList();
    }

}
