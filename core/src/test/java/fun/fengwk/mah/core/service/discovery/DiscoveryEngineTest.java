package fun.fengwk.mah.core.service.discovery;

import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.discovery.strategy.ArticleExpansionStrategy;
import fun.fengwk.mah.core.service.discovery.strategy.HistoryPaginationStrategy;
import fun.fengwk.mah.core.service.discovery.strategy.SeriesTraversalStrategy;
import fun.fengwk.mah.core.service.extract.ExtractProperties;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class DiscoveryEngineTest {

    private final DiscoveryProperties discoveryProperties = new DiscoveryProperties();
    private final LinkCollector linkCollector = new LinkCollector();

    @Test
    public void shouldRouteToStrategyOfCandidate() {
        DiscoveryEngine engine = newEngine();

        Candidate seed = engine.seed(StrategyType.DISCOVER, "https://mp.weixin.qq.com/s/root").get(0);
        List<Candidate> children = engine.expand(seed, null, FetchResult.builder()
            .url(seed.getUrl()).content("<a href=\"/s/child\">child</a>").build());

        assertThat(seed.getStrategy()).isEqualTo(StrategyType.DISCOVER);
        assertThat(children).extracting(Candidate::getStrategy).containsExactly(StrategyType.DISCOVER);
    }

    @Test
    public void shouldRejectDisabledStrategy() {
        discoveryProperties.setHistoryEnabled(false);
        DiscoveryEngine engine = newEngine();

        assertThat(engine.isEnabled(StrategyType.HISTORY)).isFalse();
        assertThat(engine.isEnabled(StrategyType.SERIES)).isTrue();
        assertThatThrownBy(() -> engine.seed(StrategyType.HISTORY, "https://mp.weixin.qq.com/s/root"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("disabled");
    }

    @Test
    public void shouldRejectDuplicateStrategies() {
        assertThatThrownBy(() -> new DiscoveryEngine(List.of(
            new ArticleExpansionStrategy(linkCollector, discoveryProperties),
            new ArticleExpansionStrategy(linkCollector, discoveryProperties)
        ), discoveryProperties)).isInstanceOf(IllegalStateException.class);
    }

    private DiscoveryEngine newEngine() {
        return new DiscoveryEngine(List.of(
            new SeriesTraversalStrategy(linkCollector, discoveryProperties),
            new HistoryPaginationStrategy(linkCollector, discoveryProperties, new ExtractProperties()),
            new ArticleExpansionStrategy(linkCollector, discoveryProperties)
        ), discoveryProperties);
    }

}
