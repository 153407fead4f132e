package fun.fengwk.mah.core.service.extract;

import fun.fengwk.mah.core.service.extract.model.ArticleDraft;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.extract.model.ExtractionResult;
import fun.fengwk.mah.core.service.extract.strategy.ArticleExtractionStrategy;
import fun.fengwk.mah.core.service.extract.strategy.ExtractionInput;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import fun.fengwk.mah.core.service.support.ArticleUrls;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the ordered extraction strategies over a rendered page.
 *
 * <p>The first strategy that finds both title and body wins and its name is recorded on the article.
 * Fields it misses are filled from the other strategies in chain order, then the result is normalized.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ArticleExtractor {

    private final List<ArticleExtractionStrategy> strategies;
    private final ContentNormalizer contentNormalizer;
    private final PublishTimeParser publishTimeParser;

    public ArticleExtractor(List<ArticleExtractionStrategy> strategies, ExtractProperties extractProperties) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.contentNormalizer = new ContentNormalizer(extractProperties.getBoilerplatePatterns());
        this.publishTimeParser = new PublishTimeParser(ZoneId.of(extractProperties.getZoneId()));
    }

    public ExtractionResult extract(String content, EmbeddedPayload payload, String url) {
        Document document = Jsoup.parse(content == null ? "" : content, url == null ? "" : url);
        ExtractionInput input = new ExtractionInput(document, payload, url);

        List<ArticleDraft> drafts = new ArrayList<>(strategies.size());
        int winner = -1;
        for (int i = 0; i < strategies.size(); i++) {
            ArticleExtractionStrategy strategy = strategies.get(i);
            Optional<ArticleDraft> draft = strategy.apply(input);
            drafts.add(draft.orElse(null));
            if (winner < 0 && draft.isPresent() && draft.get().hasTitleAndBody()) {
                winner = i;
            }
        }
        if (winner < 0) {
            log.debug("no extraction strategy matched, url={}, strategies={}", url, strategyNames());
            return ExtractionResult.failure("no strategy found both title and body");
        }

        ArticleDraft merged = drafts.get(winner).copy();
        for (ArticleDraft draft : drafts) {
            merged.fillMissingFrom(draft);
        }

        String strategyName = strategies.get(winner).name();
        ArticleRecord record = normalize(merged, url, strategyName);
        if (!StringUtils.hasText(record.getContent()) && record.getImages().isEmpty()) {
            log.debug("article body empty after normalization, url={}, strategy={}", url, strategyName);
            return ExtractionResult.failure("article body empty after normalization");
        }
        log.debug("article extracted, url={}, strategy={}, title={}", url, strategyName, record.getTitle());
        return ExtractionResult.success(record, strategyName);
    }

    private ArticleRecord normalize(ArticleDraft draft, String url, String strategyName) {
        String canonicalUrl = ArticleUrls.canonicalize(url);
        String coverImage = ArticleUrls.resolve(url, draft.getCoverImage());
        List<String> images = contentNormalizer.extractImages(draft.getContentHtml(), url);
        return ArticleRecord.builder()
            .url(canonicalUrl == null ? url : canonicalUrl)
            .title(contentNormalizer.normalizeLine(draft.getTitle()))
            .author(emptyToNull(contentNormalizer.normalizeLine(draft.getAuthor())))
            .accountName(emptyToNull(contentNormalizer.normalizeLine(draft.getAccountName())))
            .publishTime(publishTimeParser.parse(draft.getPublishTime()))
            .content(contentNormalizer.normalizeText(draft.getContentHtml()))
            .images(images)
            .coverImage(coverImage != null ? coverImage : (images.isEmpty() ? null : images.get(0)))
            .readCount(draft.getReadCount())
            .likeCount(draft.getLikeCount())
            .description(emptyToNull(contentNormalizer.normalizeLine(draft.getDescription())))
            .extractionStrategy(strategyName)
            .build();
    }

    private List<String> strategyNames() {
        List<String> names = new ArrayList<>(strategies.size());
        for (ArticleExtractionStrategy strategy : strategies) {
            names.add(strategy.name());
        }
        return names;
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

}
