package fun.fengwk.mah.core.service.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ContentNormalizerTest {

    private final ContentNormalizer normalizer = new ContentNormalizer(new ExtractProperties().getBoilerplatePatterns());

    @Test
    public void shouldKeepOneParagraphPerLine() {
        String html = "<section><p>第一段  内容</p><p>第二段<br>换行</p></section>"
            + "<script>var x = 1;</script><p>​</p><p>  最后一段　 </p>";

        assertThat(normalizer.normalizeText(html)).isEqualTo("第一段 内容\n第二段\n换行\n最后一段");
    }

    @Test
    public void shouldDropBoilerplateLines() {
        String html = "<p>正文</p><p>微信不支持外部链接</p><p>点击下方阅读原文</p>"
            + "<p>长按识别下方二维码</p><p>-----</p><p>结尾</p>";

        assertThat(normalizer.normalizeText(html)).isEqualTo("正文\n结尾");
    }

    @Test
    public void shouldReturnEmptyTextForBlankHtml() {
        assertThat(normalizer.normalizeText(null)).isEmpty();
        assertThat(normalizer.normalizeText("<div> </div>")).isEmpty();
    }

    @Test
    public void shouldPreferLazyImageSourceAndResolveUrls() {
        String html = "<p><img data-src=\"https://img.example.com/a.png\" src=\"data:image/gif;base64,xx\"></p>"
            + "<p><img src=\"/b.png\"></p>"
            + "<p><img data-src=\"https://img.example.com/a.png\"></p>";

        assertThat(normalizer.extractImages(html, "https://mp.weixin.qq.com/s/abc"))
            .containsExactly("https://img.example.com/a.png", "https://mp.weixin.qq.com/b.png");
    }

    @Test
    public void shouldCollapseWhitespaceInLine() {
        assertThat(normalizer.normalizeLine("  a \t b​ c ")).isEqualTo("a b c");
        assertThat(normalizer.normalizeLine(null)).isEmpty();
    }

}
