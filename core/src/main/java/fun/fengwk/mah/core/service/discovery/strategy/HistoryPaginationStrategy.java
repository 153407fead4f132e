package fun.fengwk.mah.core.service.discovery.strategy;

import fun.fengwk.mah.core.service.discovery.DiscoveryProperties;
import fun.fengwk.mah.core.service.discovery.LinkCollector;
import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.extract.ExtractProperties;
import fun.fengwk.mah.core.service.extract.PublishTimeParser;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import fun.fengwk.mah.core.service.fetch.PageLink;
import fun.fengwk.mah.core.service.support.ArticleUrls;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Walks an account's chronological listing page by page, newest first, until the listing reports no
 * further page or its entries fall before the configured time floor.
 *
 * <p>Only the seed and listing pages are expanded, articles found on listings are extracted and never
 * followed further.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class HistoryPaginationStrategy extends AbstractDiscoveryStrategy {

    private static final String BIZ_PARAMETER = "__biz";

    private static final String NEXT_PAGE_SELECTOR = "a[rel=next], a.next_page, a.js_next_page";

    private final DiscoveryProperties discoveryProperties;
    private final Instant timeFloor;

    public HistoryPaginationStrategy(LinkCollector linkCollector, DiscoveryProperties discoveryProperties,
                                     ExtractProperties extractProperties) {
        super(linkCollector);
        this.discoveryProperties = discoveryProperties;
        this.timeFloor = parseTimeFloor(discoveryProperties.getHistoryTimeFloor(), extractProperties.getZoneId());
    }

    @Override
    public StrategyType type() {
        return StrategyType.HISTORY;
    }

    @Override
    public boolean expands(Candidate candidate) {
        return candidate.getDepth() == 0 || candidate.isListing();
    }

    @Override
    public List<Candidate> expand(Candidate source, ArticleRecord record, FetchResult result) {
        CandidateBuffer buffer = newBuffer(source);
        Document document = linkCollector.parse(result);
        if (!source.isListing()) {
            String biz = resolveBiz(source, result);
            if (biz != null) {
                buffer.listing(ArticleUrls.historyListingUrl(biz, 0));
            } else {
                for (PageLink anchor : linkCollector.anchors(document)) {
                    if (ArticleUrls.isListingUrl(anchor.url()) && !ArticleUrls.isAlbumUrl(anchor.url())) {
                        buffer.listing(anchor.url());
                    }
                }
            }
            return buffer.toList();
        }

        String baseUrl = linkCollector.baseUrl(result);
        EmbeddedPayload payload = result.getPayload();
        boolean reachedFloor = false;
        List<Map<String, Object>> entries = payload.getLinks(EmbeddedPayload.KEY_LISTING);
        for (Map<String, Object> entry : entries) {
            Instant publishTime = toInstant(entry.get(EmbeddedPayload.LINK_PUBLISH_TIME));
            if (timeFloor != null && publishTime != null && publishTime.isBefore(timeFloor)) {
                reachedFloor = true;
                continue;
            }
            buffer.article(ArticleUrls.resolve(baseUrl, String.valueOf(entry.get(EmbeddedPayload.LINK_URL))));
        }
        if (entries.isEmpty()) {
            // Rendered listing without a script payload, publish times are unknown here.
            buffer.articles(linkCollector.anchors(document));
            buffer.articles(result.getScrollLinks());
        }

        if (reachedFloor) {
            log.debug("history time floor reached, url={}, floor={}", source.getUrl(), timeFloor);
            return buffer.toList();
        }
        if (source.getDepth() >= discoveryProperties.getHistoryMaxPages()) {
            log.debug("history page limit reached, url={}, depth={}", source.getUrl(), source.getDepth());
            return buffer.toList();
        }

        Long nextOffset = payload.getLong(EmbeddedPayload.KEY_NEXT_OFFSET);
        String biz = ArticleUrls.queryParameter(source.getUrl(), BIZ_PARAMETER);
        if (payload.getBoolean(EmbeddedPayload.KEY_CAN_CONTINUE) && nextOffset != null && biz != null) {
            buffer.listing(ArticleUrls.historyListingUrl(biz, nextOffset.intValue()));
        } else if (!payload.asMap().containsKey(EmbeddedPayload.KEY_CAN_CONTINUE)) {
            for (PageLink next : linkCollector.anchors(document, NEXT_PAGE_SELECTOR)) {
                buffer.listing(next.url());
            }
        }
        return buffer.toList();
    }

    private String resolveBiz(Candidate source, FetchResult result) {
        String biz = result.getPayload().getString(EmbeddedPayload.KEY_BIZ);
        if (biz == null) {
            biz = ArticleUrls.queryParameter(result.getFinalUrl(), BIZ_PARAMETER);
        }
        if (biz == null) {
            biz = ArticleUrls.queryParameter(source.getUrl(), BIZ_PARAMETER);
        }
        return StringUtils.hasText(biz) ? biz : null;
    }

    private Instant toInstant(Object value) {
        Long epochSeconds = EmbeddedPayload.toLong(value);
        if (epochSeconds != null) {
            return epochSeconds > 100_000_000_000L ? Instant.ofEpochMilli(epochSeconds) : Instant.ofEpochSecond(epochSeconds);
        }
        return null;
    }

    private static Instant parseTimeFloor(String value, String zoneId) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        Instant floor = new PublishTimeParser(ZoneId.of(zoneId)).parse(value);
        if (floor == null) {
            throw new IllegalArgumentException("invalid history time floor: " + value);
        }
        return floor;
    }

}
