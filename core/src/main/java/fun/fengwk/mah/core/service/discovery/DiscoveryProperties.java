package fun.fengwk.mah.core.service.discovery;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovery strategy configuration and feature flags.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mah.discovery")
public class DiscoveryProperties {

    private boolean seriesEnabled = true;

    private boolean historyEnabled = true;

    private boolean discoverEnabled = true;

    /**
     * Accept sibling articles inferred from numbered or dated titles.
     */
    private boolean seriesTitleHeuristic = true;

    /**
     * Link texts of explicit previous/next navigation.
     */
    private List<String> navigationTexts = new ArrayList<>(List.of(
        "上一篇", "下一篇", "上一期", "下一期", "上一章", "下一章", "previous", "next"
    ));

    /**
     * Max link depth from the seed for single article expansion.
     */
    private int discoverMaxDepth = 2;

    /**
     * Max history listing pages walked per job.
     */
    private int historyMaxPages = 100;

    /**
     * Listing entries published before this time are not followed, e.g. {@code 2023-01-01}; empty walks
     * back to the earliest article.
     */
    private String historyTimeFloor;

}
