package fun.fengwk.mah.core.service.fetch;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class DetectionInspectorTest {

    private final DetectionInspector inspector = new DetectionInspector(new FetchProperties());

    @Test
    public void shouldFlagVerificationUrlAsSoftBlock() {
        PageVerdict verdict = inspector.inspect(
            "https://mp.weixin.qq.com/mp/wappoc_appmsgcaptcha?poc_token=x", "", "<html></html>");

        assertThat(verdict).isEqualTo(PageVerdict.SOFT_BLOCK);
    }

    @Test
    public void shouldFlagShortVerificationPageAsSoftBlock() {
        PageVerdict verdict = inspector.inspect("https://mp.weixin.qq.com/s/abc", "",
            "<html><body><p>环境异常</p><p>完成验证后即可继续访问</p></body></html>");

        assertThat(verdict).isEqualTo(PageVerdict.SOFT_BLOCK);
    }

    @Test
    public void shouldRecognizeRemovedArticle() {
        PageVerdict verdict = inspector.inspect("https://mp.weixin.qq.com/s/abc", "",
            "<html><body><div class=\"weui-msg\">该内容已被发布者删除</div></body></html>");

        assertThat(verdict).isEqualTo(PageVerdict.REMOVED);
    }

    @Test
    public void shouldRecognizeNotFoundTitle() {
        assertThat(inspector.inspect("https://mp.weixin.qq.com/s/abc", "Page Not Found", "<html></html>"))
            .isEqualTo(PageVerdict.NOT_FOUND);
    }

    @Test
    public void shouldIgnoreMarkersInsideLongArticleBody() {
        String body = "正文".repeat(1000) + "验证码";

        PageVerdict verdict = inspector.inspect("https://mp.weixin.qq.com/s/abc", "如何设计验证系统",
            "<html><body><div id=\"js_content\">" + body + "</div></body></html>");

        assertThat(verdict).isEqualTo(PageVerdict.OK);
    }

    @Test
    public void shouldTreatNormalArticleAsOk() {
        PageVerdict verdict = inspector.inspect("https://mp.weixin.qq.com/s/abc", "第3期 周报",
            "<html><body><h1 id=\"activity-name\">第3期 周报</h1><div id=\"js_content\">hello</div></body></html>");

        assertThat(verdict).isEqualTo(PageVerdict.OK);
    }

}
