package fun.fengwk.mah.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Init script that hides automation markers and keeps navigator fields consistent with the session's
 * fingerprint profile.
 *
 * @author fengwk
 */
public final class BrowserStealthSupport {

    private static final String TEMPLATE = """
        (() => {
          try {
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'languages', { get: () => [%s] });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'platform', { get: () => '%s' });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'hardwareConcurrency', { get: () => %d });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'maxTouchPoints', { get: () => %d });
          } catch (e) {}
          try {
            window.chrome = window.chrome || { runtime: {} };
          } catch (e) {}
          try {
            const originalQuery = window.navigator.permissions && window.navigator.permissions.query;
            if (originalQuery) {
              window.navigator.permissions.query = (parameters) => (
                parameters && parameters.name === 'notifications'
                  ? Promise.resolve({ state: Notification.permission })
                  : originalQuery(parameters)
              );
            }
          } catch (e) {}
        })();
        """;

    private BrowserStealthSupport() {
    }

    public static void apply(BrowserContext context, BrowserProperties properties, FingerprintProfile profile) {
        String script = script(properties, profile);
        if (!StringUtils.hasText(script)) {
            return;
        }
        context.addInitScript(script);
    }

    /**
     * @return configured script, the generated profile script, or empty when stealth is disabled
     */
    static String script(BrowserProperties properties, FingerprintProfile profile) {
        if (!properties.isStealthEnabled()) {
            return "";
        }
        if (StringUtils.hasText(properties.getStealthScript())) {
            return properties.getStealthScript();
        }
        return String.format(Locale.ROOT, TEMPLATE,
            languages(properties.getAcceptLanguage()),
            platform(profile == null ? null : profile.getUserAgent()),
            profile != null && profile.isMobile() ? 8 : 4,
            profile != null && profile.isTouch() ? 5 : 0);
    }

    /**
     * Quoted js array items from an Accept-Language header, quality values dropped.
     */
    static String languages(String acceptLanguage) {
        List<String> items = new ArrayList<>();
        if (StringUtils.hasText(acceptLanguage)) {
            for (String part : acceptLanguage.split(",")) {
                String tag = part.split(";")[0].trim();
                if (tag.matches("[A-Za-z]{1,8}(-[A-Za-z0-9]{1,8})*")) {
                    items.add("'" + tag + "'");
                }
            }
        }
        if (items.isEmpty()) {
            items.add("'zh-CN'");
        }
        return String.join(", ", items);
    }

    static String platform(String userAgent) {
        if (userAgent == null) {
            return "Win32";
        }
        if (userAgent.contains("iPhone")) {
            return "iPhone";
        }
        if (userAgent.contains("iPad")) {
            return "iPad";
        }
        if (userAgent.contains("Android")) {
            return "Linux armv8l";
        }
        if (userAgent.contains("Mac OS X")) {
            return "MacIntel";
        }
        return "Win32";
    }

}
