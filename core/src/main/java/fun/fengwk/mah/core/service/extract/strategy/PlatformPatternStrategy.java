package fun.fengwk.mah.core.service.extract.strategy;

import fun.fengwk.mah.core.service.extract.model.ArticleDraft;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Known element ids and classes of the article platform's rendered pages.
 *
 * @author fengwk
 */
@Order(2)
@Component
public class PlatformPatternStrategy implements ArticleExtractionStrategy {

    public static final String NAME = "platform";

    private static final List<String> TITLE_SELECTORS = List.of(
        "#activity-name",
        ".rich_media_title",
        "#js_text_title",
        ".common-webchat-title"
    );

    private static final List<String> BODY_SELECTORS = List.of(
        "#js_content",
        ".rich_media_content",
        "#js_text_desc"
    );

    private static final List<String> AUTHOR_SELECTORS = List.of(
        "#js_author_name",
        ".rich_media_meta_text.rich_media_meta_nickname ~ .rich_media_meta_text",
        "#meta_content .rich_media_meta_text:not(#js_name):not(#publish_time)"
    );

    private static final List<String> ACCOUNT_SELECTORS = List.of(
        "#js_name",
        "strong#profileBt a",
        ".profile_nickname",
        ".wx_follow_nickname"
    );

    private static final List<String> PUBLISH_TIME_SELECTORS = List.of(
        "#publish_time",
        ".publish_time"
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
        for (String selector : BODY_SELECTORS) {
            Element body = document.selectFirst(selector);
            if (StrategySupport.hasText(body) || (body != null && !body.select("img").isEmpty())) {
                draft.setContentHtml(body.html());
                break;
            }
        }
        String author = StrategySupport.firstText(document, AUTHOR_SELECTORS);
        draft.setAuthor(author == null ? null : author.replaceFirst("^作者[:：]\\s*", ""));
        draft.setAccountName(StrategySupport.firstText(document, ACCOUNT_SELECTORS));
        draft.setPublishTime(StrategySupport.firstText(document, PUBLISH_TIME_SELECTORS));
        draft.setCoverImage(StrategySupport.firstAttribute(document,
            List.of("meta[property=og:image]", "meta[property=twitter:image]"), "content"));
        draft.setDescription(StrategySupport.firstAttribute(document,
            List.of("meta[name=description]"), "content"));
        draft.setReadCount(StrategySupport.parseCount(StrategySupport.firstText(document,
            List.of("#readNum3", "#js_read_area3 .read_num"))));
        draft.setLikeCount(StrategySupport.parseCount(StrategySupport.firstText(document,
            List.of("#likeNum3", "#js_like_area .like_num"))));
        return draft.isEmpty() ? Optional.empty() : Optional.of(draft);
    }

}
