package fun.fengwk.mah.core.service.discovery;

import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import fun.fengwk.mah.core.service.fetch.FetchResult;
import fun.fengwk.mah.core.service.fetch.PageLink;
import fun.fengwk.mah.core.service.support.ArticleUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects links from rendered pages and embedded payloads.
 *
 * @author fengwk
 */
@Component
public class LinkCollector {

    public Document parse(FetchResult result) {
        String content = result.getContent();
        return Jsoup.parse(content == null ? "" : content, baseUrl(result));
    }

    public String baseUrl(FetchResult result) {
        return StringUtils.hasText(result.getFinalUrl()) ? result.getFinalUrl()
            : (result.getUrl() == null ? "" : result.getUrl());
    }

    /**
     * All anchors in document order, absolute and deduplicated by url.
     */
    public List<PageLink> anchors(Document document) {
        return anchors(document, "a[href]");
    }

    public List<PageLink> anchors(Document document, String selector) {
        Map<String, PageLink> links = new LinkedHashMap<>();
        for (Element element : document.select(selector)) {
            String href = ArticleUrls.resolve(document.location(), element.attr("href"));
            if (href != null) {
                links.putIfAbsent(href, new PageLink(href, element.text()));
            }
        }
        return new ArrayList<>(links.values());
    }

    /**
     * Links stored in an attribute, such as {@code data-link}, of elements matching {@code selector}.
     */
    public List<PageLink> attributeLinks(Document document, String selector, String attribute) {
        Map<String, PageLink> links = new LinkedHashMap<>();
        for (Element element : document.select(selector)) {
            String href = ArticleUrls.resolve(document.location(), element.attr(attribute));
            if (href != null) {
                String text = element.hasAttr("data-title") ? element.attr("data-title") : element.text();
                links.putIfAbsent(href, new PageLink(href, text));
            }
        }
        return new ArrayList<>(links.values());
    }

    public List<PageLink> payloadLinks(EmbeddedPayload payload, String key, String baseUrl) {
        List<PageLink> links = new ArrayList<>();
        for (Map<String, Object> entry : payload.getLinks(key)) {
            String href = ArticleUrls.resolve(baseUrl, String.valueOf(entry.get(EmbeddedPayload.LINK_URL)));
            if (href != null) {
                Object title = entry.get(EmbeddedPayload.LINK_TITLE);
                links.add(new PageLink(href, title == null ? "" : String.valueOf(title)));
            }
        }
        return links;
    }

    public String payloadLink(EmbeddedPayload payload, String key, String baseUrl) {
        return ArticleUrls.resolve(baseUrl, payload.getString(key));
    }

}
