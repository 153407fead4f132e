package fun.fengwk.mah.core.service.extract.strategy;

import fun.fengwk.mah.core.service.extract.model.ArticleDraft;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads html5 semantic elements, schema.org attributes and open graph meta tags.
 *
 * @author fengwk
 */
@Order(1)
@Component
public class SemanticStructureStrategy implements ArticleExtractionStrategy {

    public static final String NAME = "semantic";

    private static final int MIN_BODY_TEXT_LENGTH = 20;

    private static final List<String> TITLE_SELECTORS = List.of(
        "[itemprop=headline]",
        "article h1",
        "main h1",
        "meta[property=og:title]"
    );

    private static final List<String> BODY_SELECTORS = List.of(
        "[itemprop=articleBody]",
        "article",
        "main",
        "[role=main]"
    );

    private static final List<String> AUTHOR_SELECTORS = List.of(
        "[itemprop=author] [itemprop=name]",
        "[itemprop=author]",
        "[rel=author]",
        "meta[name=author]",
        "meta[property=article:author]"
    );

    private static final List<String> PUBLISHER_SELECTORS = List.of(
        "[itemprop=publisher] [itemprop=name]",
        "meta[property=og:site_name]"
    );

    private static final List<String> DESCRIPTION_SELECTORS = List.of(
        "meta[property=og:description]",
        "meta[name=description]"
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<ArticleDraft> apply(ExtractionInput input) {
        Document document = input.document();
        ArticleDraft draft = new ArticleDraft();
        draft.setTitle(StrategySupport.firstText(document, TITLE_SELECTORS));
        Element body = selectBody(document);
        if (body != null) {
            draft.setContentHtml(body.html());
        }
        draft.setAuthor(StrategySupport.firstText(document, AUTHOR_SELECTORS));
        draft.setAccountName(StrategySupport.firstText(document, PUBLISHER_SELECTORS));
        String publishTime = StrategySupport.firstAttribute(document,
            List.of("article time[datetime]", "[itemprop=datePublished][datetime]"), "datetime");
        if (publishTime == null) {
            publishTime = StrategySupport.firstAttribute(document,
                List.of("meta[property=article:published_time]", "meta[itemprop=datePublished]"), "content");
        }
        draft.setPublishTime(publishTime);
        draft.setCoverImage(StrategySupport.firstAttribute(document, List.of("meta[property=og:image]"), "content"));
        draft.setDescription(StrategySupport.firstText(document, DESCRIPTION_SELECTORS));
        return draft.isEmpty() ? Optional.empty() : Optional.of(draft);
    }

    private Element selectBody(Document document) {
        Set<Element> candidates = new LinkedHashSet<>();
        for (String selector : BODY_SELECTORS) {
            candidates.addAll(document.select(selector));
        }
        Element best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Element candidate : candidates) {
            double score = score(candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best == null || normalizedTextLength(best.text()) < MIN_BODY_TEXT_LENGTH) {
            return null;
        }
        return best;
    }

    private double score(Element candidate) {
        int textLength = normalizedTextLength(candidate.text());
        if (textLength <= 0) {
            return Double.NEGATIVE_INFINITY;
        }
        int linkTextLength = 0;
        for (Element link : candidate.select("a")) {
            linkTextLength += normalizedTextLength(link.text());
        }
        double linkDensity = linkTextLength / (double) Math.max(1, textLength);
        int blockCount = candidate.select("p, h2, h3, h4, li, pre, blockquote, section").size();
        double score = textLength * (1D - Math.min(0.95D, linkDensity));
        score += Math.min(80, blockCount) * 12D;
        if (candidate.hasAttr("itemprop")) {
            score += 200D;
        }
        return score;
    }

    private int normalizedTextLength(String value) {
        return value == null ? 0 : value.replaceAll("\\s+", " ").trim().length();
    }

}
