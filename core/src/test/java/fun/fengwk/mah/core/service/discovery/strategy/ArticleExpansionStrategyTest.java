package fun.fengwk.mah.core.service.discovery.strategy;

import fun.fengwk.mah.core.service.discovery.DiscoveryProperties;
import fun.fengwk.mah.core.service.discovery.LinkCollector;
import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.CandidateKind;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import fun.fengwk.mah.core.service.fetch.PageLink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ArticleExpansionStrategyTest {

    private static final String SOURCE = "https://mp.weixin.qq.com/s/root";

    private final DiscoveryProperties discoveryProperties = new DiscoveryProperties();
    private final ArticleExpansionStrategy strategy = new ArticleExpansionStrategy(new LinkCollector(), discoveryProperties);

    @Test
    public void shouldCollectArticleLinksFromAllSources() {
        FetchResult result = FetchResult.builder()
            .url(SOURCE)
            .content("<a href=\"/s/a\">a</a><a href=\"https://example.com/x\">x</a><a href=\"/s/a#top\">a again</a>")
            .scrollLinks(List.of(new PageLink("https://mp.weixin.qq.com/s/b", "b")))
            .payload(EmbeddedPayload.of(Map.of(EmbeddedPayload.KEY_RELATED,
                List.of(Map.of(EmbeddedPayload.LINK_URL, "/s/c", EmbeddedPayload.LINK_TITLE, "c")))))
            .build();

        List<Candidate> candidates = strategy.expand(candidate(0), null, result);

        assertThat(candidates).extracting(Candidate::getCanonicalUrl).containsExactly(
            "https://mp.weixin.qq.com/s/a",
            "https://mp.weixin.qq.com/s/b",
            "https://mp.weixin.qq.com/s/c"
        );
        assertThat(candidates).allSatisfy(candidate -> assertThat(candidate.getStrategy()).isEqualTo(StrategyType.DISCOVER));
    }

    @Test
    public void shouldStopAtMaxDepth() {
        discoveryProperties.setDiscoverMaxDepth(2);
        FetchResult result = FetchResult.builder().url(SOURCE).content("<a href=\"/s/a\">a</a>").build();

        assertThat(strategy.expands(candidate(1))).isTrue();
        assertThat(strategy.expands(candidate(2))).isFalse();
        assertThat(strategy.expand(candidate(2), null, result)).isEmpty();
    }

    private Candidate candidate(int depth) {
        return Candidate.of(SOURCE, StrategyType.DISCOVER, null, depth, CandidateKind.ARTICLE);
    }

}
