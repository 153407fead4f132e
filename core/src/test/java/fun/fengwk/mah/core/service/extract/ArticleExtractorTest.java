package fun.fengwk.mah.core.service.extract;

import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.extract.model.ExtractionResult;
import fun.fengwk.mah.core.service.extract.strategy.EmbeddedPayloadStrategy;
import fun.fengwk.mah.core.service.extract.strategy.PlatformPatternStrategy;
import fun.fengwk.mah.core.service.extract.strategy.SemanticStructureStrategy;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ArticleExtractorTest {

    private static final String URL = "https://mp.weixin.qq.com/s/series-3?scene=21#wechat_redirect";

    private final ArticleExtractor extractor = new ArticleExtractor(
        List.of(new SemanticStructureStrategy(), new PlatformPatternStrategy(), new EmbeddedPayloadStrategy()),
        new ExtractProperties()
    );

    @Test
    public void shouldExtractPlatformPage() {
        String html = "<html><head><meta property=\"og:image\" content=\"https://img.example.com/cover.jpg\"></head><body>"
            + "<h1 id=\"activity-name\"> 第3期 技术周报 </h1>"
            + "<div id=\"meta_content\"><span id=\"js_author_name\">作者：张三</span>"
            + "<a id=\"js_name\">技术公众号</a><em id=\"publish_time\">2024-03-05 08:30</em></div>"
            + "<div id=\"js_content\"><p>本期内容</p><p><img data-src=\"https://img.example.com/1.png\"></p>"
            + "<p>微信不支持外部链接</p></div>"
            + "<span id=\"readNum3\">1.2万</span>"
            + "</body></html>";

        ExtractionResult result = extractor.extract(html, EmbeddedPayload.empty(), URL);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(PlatformPatternStrategy.NAME);
        ArticleRecord record = result.getRecord();
        assertThat(record.getUrl()).isEqualTo("https://mp.weixin.qq.com/s/series-3");
        assertThat(record.getTitle()).isEqualTo("第3期 技术周报");
        assertThat(record.getAuthor()).isEqualTo("张三");
        assertThat(record.getAccountName()).isEqualTo("技术公众号");
        assertThat(record.getPublishTime()).isEqualTo(Instant.parse("2024-03-05T00:30:00Z"));
        assertThat(record.getContent()).isEqualTo("本期内容");
        assertThat(record.getImages()).containsExactly("https://img.example.com/1.png");
        assertThat(record.getCoverImage()).isEqualTo("https://img.example.com/cover.jpg");
        assertThat(record.getReadCount()).isEqualTo(12000L);
        assertThat(record.getExtractionStrategy()).isEqualTo(PlatformPatternStrategy.NAME);
    }

    @Test
    public void shouldPreferSemanticStructureAndFillGapsFromLaterStrategies() {
        String html = "<html><body><article><h1>Semantic Title</h1>"
            + "<p>This body is long enough to count as the article body.</p></article></body></html>";
        EmbeddedPayload payload = EmbeddedPayload.of(Map.of(
            EmbeddedPayload.KEY_NICKNAME, "Payload Account",
            EmbeddedPayload.KEY_PUBLISH_TIME, "1704067200",
            EmbeddedPayload.KEY_LIKE_COUNT, 42
        ));

        ExtractionResult result = extractor.extract(html, payload, URL);

        assertThat(result.getStrategy()).isEqualTo(SemanticStructureStrategy.NAME);
        ArticleRecord record = result.getRecord();
        assertThat(record.getTitle()).isEqualTo("Semantic Title");
        assertThat(record.getContent()).contains("This body is long enough");
        assertThat(record.getAccountName()).isEqualTo("Payload Account");
        assertThat(record.getPublishTime()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(record.getLikeCount()).isEqualTo(42L);
    }

    @Test
    public void shouldFallBackToEmbeddedPayload() {
        EmbeddedPayload payload = EmbeddedPayload.of(Map.of(
            EmbeddedPayload.KEY_TITLE, "Payload Title",
            EmbeddedPayload.KEY_CONTENT, "<p>payload body</p>",
            EmbeddedPayload.KEY_ACCOUNT_NAME, "Account"
        ));

        ExtractionResult result = extractor.extract("<html><body><div>loading</div></body></html>", payload, URL);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(EmbeddedPayloadStrategy.NAME);
        assertThat(result.getRecord().getContent()).isEqualTo("payload body");
        assertThat(result.getRecord().getAccountName()).isEqualTo("Account");
    }

    @Test
    public void shouldFailWhenTitleAndBodyAreMissing() {
        ExtractionResult result = extractor.extract(
            "<html><body><div class=\"nav\">menu</div></body></html>", EmbeddedPayload.empty(), URL);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRecord()).isNull();
        assertThat(result.getFailureReason()).isEqualTo("no strategy found both title and body");
    }

    @Test
    public void shouldFailWhenBodyIsOnlyBoilerplate() {
        String html = "<html><body><h1 id=\"activity-name\">Title</h1>"
            + "<div id=\"js_content\"><p>微信不支持外部链接</p></div></body></html>";

        ExtractionResult result = extractor.extract(html, null, URL);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo("article body empty after normalization");
    }

    @Test
    public void shouldRequireAtLeastOneStrategy() {
        assertThatThrownBy(() -> new ArticleExtractor(List.of(), new ExtractProperties()))
            .isInstanceOf(IllegalArgumentException.class);
    }

}
