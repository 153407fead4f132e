package fun.fengwk.mah.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Browser session pool configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mah.browser")
public class BrowserProperties {

    /**
     * Max concurrently open browser sessions, shared by all jobs.
     */
    private int sessionPoolSize = 3;

    /**
     * Timeout when waiting for an idle session.
     */
    private long acquireTimeoutMs = 30000;

    /**
     * Requests served by one session before it is retired.
     */
    private int sessionRequestBudget = 20;

    /**
     * Whether sessions run in headless mode.
     */
    private boolean headless = true;

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of(
        "--disable-blink-features=AutomationControlled",
        "--no-sandbox",
        "--disable-dev-shm-usage"
    );

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Ignore all default args for browser launch.
     */
    private boolean ignoreAllDefaultArgs = false;

    /**
     * Optional fixed user agent, overrides the fingerprint profile user agent.
     */
    private String userAgent = "";

    /**
     * Mobile fingerprint profiles, one is picked at random per session.
     */
    private List<FingerprintProfile> fingerprintProfiles = new ArrayList<>(List.of(
        new FingerprintProfile(
            "iphone-13",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 16_6 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Mobile/15E148 MicroMessenger/8.0.42(0x18002a2f) NetType/WIFI Language/zh_CN",
            390, 844, 3.0, true, true
        ),
        new FingerprintProfile(
            "pixel-7",
            "Mozilla/5.0 (Linux; Android 13; Pixel 7 Build/TQ3A.230805.001; wv) AppleWebKit/537.36 (KHTML, like Gecko) Version/4.0 Chrome/116.0.0.0 Mobile Safari/537.36 XWEB/1160083 MMWEBSDK/20230805 MicroMessenger/8.0.42.2460(0x28002A3B) WeChat/arm64 Weixin NetType/WIFI Language/zh_CN ABI/arm64",
            412, 915, 2.625, true, true
        ),
        new FingerprintProfile(
            "xiaomi-13",
            "Mozilla/5.0 (Linux; Android 13; 2211133C Build/TKQ1.220905.001; wv) AppleWebKit/537.36 (KHTML, like Gecko) Version/4.0 Chrome/111.0.5563.116 Mobile Safari/537.36 XWEB/5279 MMWEBSDK/20230701 MicroMessenger/8.0.40.2420(0x28002851) WeChat/arm64 Weixin NetType/5G Language/zh_CN ABI/arm64",
            393, 873, 2.75, true, true
        )
    ));

    /**
     * Accept-Language header value.
     */
    private String acceptLanguage = "zh-CN,zh;q=0.9";

    /**
     * Locale for browser context.
     */
    private String locale = "zh-CN";

    /**
     * Timezone id for browser context.
     */
    private String timezoneId = "Asia/Shanghai";

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Lower bound of the randomized pause between simulated interactions.
     */
    private long interactionDelayMinMs = 300;

    /**
     * Upper bound of the randomized pause between simulated interactions.
     */
    private long interactionDelayMaxMs = 1200;

    /**
     * Whether to enable stealth script.
     */
    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty generates one from the session's fingerprint profile.
     */
    private String stealthScript = "";

}
