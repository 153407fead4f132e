package fun.fengwk.mah.core.service.fetch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Page fetch configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mah.fetch")
public class FetchProperties {

    /**
     * Hard navigation timeout in milliseconds.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * Max wait for the content-ready signal after navigation.
     */
    private long contentReadyTimeoutMs = 15000;

    /**
     * Interval between content-ready checks.
     */
    private long readyCheckIntervalMs = 500;

    /**
     * Consecutive unchanged text checks treated as a settled DOM when no marker element shows up.
     */
    private int stableThreshold = 3;

    /**
     * Marker elements whose presence signals rendered content.
     */
    private List<String> contentReadySelectors = new ArrayList<>(List.of(
        "#js_content",
        ".rich_media_content",
        "#activity-name",
        ".album__list",
        ".weui_msg_card_list",
        "article"
    ));

    /**
     * Scroll rounds used to trigger lazily injected links, 0 disables scrolling.
     */
    private int scrollRounds = 3;

    /**
     * Pause after each scroll round.
     */
    private long scrollIntervalMs = 800;

    /**
     * Url fragments of verification or block pages.
     */
    private List<String> blockUrlMarkers = new ArrayList<>(List.of(
        "wappoc_appmsgcaptcha",
        "mp/verifycode",
        "secitptpage/verify",
        "antispam"
    ));

    /**
     * Title or visible text fragments of verification or block pages.
     */
    private List<String> blockTextMarkers = new ArrayList<>(List.of(
        "环境异常",
        "完成验证后即可继续访问",
        "访问过于频繁",
        "操作频繁",
        "请在微信客户端打开链接",
        "验证码",
        "captcha"
    ));

    /**
     * Visible text fragments confirming the article was removed.
     */
    private List<String> removalTextMarkers = new ArrayList<>(List.of(
        "该内容已被发布者删除",
        "此内容因违规无法查看",
        "此内容被投诉且经审核涉嫌侵权",
        "此内容被多人投诉",
        "该公众号已迁移",
        "The content has been deleted by the author"
    ));

    /**
     * Title or visible text fragments of not-found pages.
     */
    private List<String> notFoundTextMarkers = new ArrayList<>(List.of(
        "页面不存在",
        "链接已过期",
        "Page Not Found"
    ));

    /**
     * Text markers are only trusted on pages whose visible text is at most this long, article bodies
     * may legitimately mention them.
     */
    private int shortPageTextLength = 1500;

}
