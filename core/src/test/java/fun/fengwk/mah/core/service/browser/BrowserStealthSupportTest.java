package fun.fengwk.mah.core.service.browser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class BrowserStealthSupportTest {

    @Test
    public void shouldFollowFingerprintProfile() {
        BrowserProperties properties = new BrowserProperties();
        properties.setAcceptLanguage("zh-CN,zh;q=0.9,en;q=0.8");
        FingerprintProfile profile = new FingerprintProfile("iphone",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X)", 390, 844, 3.0, true, true);

        String script = BrowserStealthSupport.script(properties, profile);

        assertThat(script).contains("['zh-CN', 'zh', 'en']");
        assertThat(script).contains("get: () => 'iPhone'");
        assertThat(script).contains("'maxTouchPoints', { get: () => 5 }");
        assertThat(script).contains("'webdriver', { get: () => undefined }");
    }

    @Test
    public void shouldPreferConfiguredScript() {
        BrowserProperties properties = new BrowserProperties();
        properties.setStealthScript("window.__custom = true;");

        assertThat(BrowserStealthSupport.script(properties, null)).isEqualTo("window.__custom = true;");
    }

    @Test
    public void shouldReturnEmptyWhenDisabled() {
        BrowserProperties properties = new BrowserProperties();
        properties.setStealthEnabled(false);

        assertThat(BrowserStealthSupport.script(properties, null)).isEmpty();
    }

    @Test
    public void shouldDetectPlatformFromUserAgent() {
        assertThat(BrowserStealthSupport.platform("Mozilla/5.0 (Linux; Android 14; Pixel 8)")).isEqualTo("Linux armv8l");
        assertThat(BrowserStealthSupport.platform("Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0)")).isEqualTo("MacIntel");
        assertThat(BrowserStealthSupport.platform(null)).isEqualTo("Win32");
        assertThat(BrowserStealthSupport.languages("")).isEqualTo("'zh-CN'");
    }

}
