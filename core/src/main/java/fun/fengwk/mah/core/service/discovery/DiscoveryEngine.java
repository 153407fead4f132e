package fun.fengwk.mah.core.service.discovery;

import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes seeding and expansion to the job's strategy, honoring the strategy feature flags.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DiscoveryEngine {

    private final Map<StrategyType, DiscoveryStrategy> strategies = new EnumMap<>(StrategyType.class);
    private final DiscoveryProperties discoveryProperties;

    public DiscoveryEngine(List<DiscoveryStrategy> strategies, DiscoveryProperties discoveryProperties) {
        for (DiscoveryStrategy strategy : strategies) {
            DiscoveryStrategy previous = this.strategies.put(strategy.type(), strategy);
            if (previous != null) {
                throw new IllegalStateException("duplicate discovery strategy: " + strategy.type());
            }
        }
        this.discoveryProperties = discoveryProperties;
    }

    public boolean isEnabled(StrategyType type) {
        if (!strategies.containsKey(type)) {
            return false;
        }
        switch (type) {
            case SERIES:
                return discoveryProperties.isSeriesEnabled();
            case HISTORY:
                return discoveryProperties.isHistoryEnabled();
            case DISCOVER:
                return discoveryProperties.isDiscoverEnabled();
            default:
                return false;
        }
    }

    public List<Candidate> seed(StrategyType type, String url) {
        return strategy(type).seed(url);
    }

    /**
     * Whether pages of {@code candidate} are expanded by its strategy.
     */
    public boolean expands(Candidate candidate) {
        return strategy(candidate.getStrategy()).expands(candidate);
    }

    public List<Candidate> expand(Candidate source, ArticleRecord record, FetchResult result) {
        DiscoveryStrategy strategy = strategy(source.getStrategy());
        if (!strategy.expands(source)) {
            return List.of();
        }
        List<Candidate> candidates = strategy.expand(source, record, result);
        log.debug("page expanded, url={}, strategy={}, depth={}, candidates={}",
            source.getUrl(), strategy.type(), source.getDepth(), candidates.size());
        return candidates;
    }

    /**
     * @throws IllegalArgumentException when the strategy is disabled or unknown
     */
    public DiscoveryStrategy strategy(StrategyType type) {
        if (!isEnabled(type)) {
            throw new IllegalArgumentException("discovery strategy disabled: " + type);
        }
        return strategies.get(type);
    }

}
