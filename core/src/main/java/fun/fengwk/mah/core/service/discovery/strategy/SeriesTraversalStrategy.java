package fun.fengwk.mah.core.service.discovery.strategy;

import fun.fengwk.mah.core.service.discovery.DiscoveryProperties;
import fun.fengwk.mah.core.service.discovery.LinkCollector;
import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import fun.fengwk.mah.core.service.fetch.PageLink;
import fun.fengwk.mah.core.service.support.ArticleUrls;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Follows a series in both directions: explicit previous/next navigation, album containers and
 * sibling titles that differ only in their number or date.
 *
 * <p>Links are taken in this order: page navigation and in-page links, links revealed by scrolling,
 * then links mined from the embedded payload. Cycles end at the job's visited set.
 *
 * @author fengwk
 */
@Component
public class SeriesTraversalStrategy extends AbstractDiscoveryStrategy {

    private static final String NAVIGATION_SELECTOR = "a[rel=prev], a[rel=next], .album_read_nav_prev a, "
        + ".album_read_nav_next a, .js_album_prev a, .js_album_next a";

    private static final String ALBUM_ITEM_SELECTOR = ".album__list-item[data-link], [data-album-link]";

    private final DiscoveryProperties discoveryProperties;

    public SeriesTraversalStrategy(LinkCollector linkCollector, DiscoveryProperties discoveryProperties) {
        super(linkCollector);
        this.discoveryProperties = discoveryProperties;
    }

    @Override
    public StrategyType type() {
        return StrategyType.SERIES;
    }

    @Override
    public List<Candidate> expand(Candidate source, ArticleRecord record, FetchResult result) {
        String baseUrl = linkCollector.baseUrl(result);
        Document document = linkCollector.parse(result);
        EmbeddedPayload payload = result.getPayload();
        CandidateBuffer buffer = newBuffer(source);
        List<PageLink> anchors = linkCollector.anchors(document);

        if (source.isListing()) {
            // Album directory: every article on it belongs to the series.
            buffer.articles(anchors);
            buffer.articles(linkCollector.attributeLinks(document, ALBUM_ITEM_SELECTOR, "data-link"));
            buffer.articles(result.getScrollLinks());
            buffer.articles(linkCollector.payloadLinks(payload, EmbeddedPayload.KEY_ALBUM, baseUrl));
            return buffer.toList();
        }

        buffer.articles(linkCollector.anchors(document, NAVIGATION_SELECTOR));
        for (PageLink anchor : anchors) {
            if (isNavigationText(anchor.text())) {
                buffer.article(anchor.url());
            }
        }
        buffer.articles(linkCollector.attributeLinks(document, "[data-prev-link]", "data-prev-link"));
        buffer.articles(linkCollector.attributeLinks(document, "[data-next-link]", "data-next-link"));
        buffer.articles(linkCollector.attributeLinks(document, ALBUM_ITEM_SELECTOR, "data-link"));
        for (PageLink anchor : anchors) {
            if (ArticleUrls.isAlbumUrl(anchor.url())) {
                buffer.listing(anchor.url());
            }
        }

        SeriesTitlePattern.SeriesKey seriesKey = discoveryProperties.isSeriesTitleHeuristic() && record != null
            ? SeriesTitlePattern.parse(record.getTitle())
            : null;
        buffer.articles(SeriesTitlePattern.selectSiblings(seriesKey, anchors));
        buffer.articles(SeriesTitlePattern.selectSiblings(seriesKey, result.getScrollLinks()));
        for (PageLink link : result.getScrollLinks()) {
            if (ArticleUrls.isAlbumUrl(link.url())) {
                buffer.listing(link.url());
            }
        }

        buffer.article(linkCollector.payloadLink(payload, EmbeddedPayload.KEY_PREV_URL, baseUrl));
        buffer.article(linkCollector.payloadLink(payload, EmbeddedPayload.KEY_NEXT_URL, baseUrl));
        buffer.articles(linkCollector.payloadLinks(payload, EmbeddedPayload.KEY_ALBUM, baseUrl));
        List<PageLink> minedLinks = new ArrayList<>(linkCollector.payloadLinks(payload, EmbeddedPayload.KEY_RELATED,
            baseUrl));
        buffer.articles(SeriesTitlePattern.selectSiblings(seriesKey, minedLinks));
        return buffer.toList();
    }

    private boolean isNavigationText(String text) {
        if (text == null || text.isEmpty() || text.length() > 40) {
            return false;
        }
        String lowerCaseText = text.toLowerCase(Locale.ROOT);
        for (String marker : discoveryProperties.getNavigationTexts()) {
            if (lowerCaseText.startsWith(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

}
