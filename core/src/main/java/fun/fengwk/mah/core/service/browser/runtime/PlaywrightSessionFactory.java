package fun.fengwk.mah.core.service.browser.runtime;

import fun.fengwk.mah.core.service.browser.BrowserProperties;
import fun.fengwk.mah.core.service.browser.BrowserStealthSupport;
import fun.fengwk.mah.core.service.browser.FingerprintProfile;
import fun.fengwk.mah.core.service.proxy.ProxyRecord;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Launches one chromium instance per session with mobile emulation and suppressed automation fingerprints.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightSessionFactory implements BrowserSessionFactory {

    private final BrowserProperties browserProperties;

    @Override
    public BrowserSession create(String contextId, ProxyRecord proxy, FingerprintProfile fingerprintProfile) {
        Playwright playwright = null;
        Browser browser = null;
        BrowserContext browserContext = null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(buildLaunchOptions(proxy));
            browserContext = browser.newContext(buildContextOptions(fingerprintProfile));
            BrowserStealthSupport.apply(browserContext, browserProperties, fingerprintProfile);
            log.debug("created browser session, contextId={}, proxyId={}, profile={}",
                contextId, proxy.getId(), fingerprintProfile.getName());
            return new BrowserSession(contextId, proxy.getId(), fingerprintProfile, playwright, browser, browserContext);
        } catch (RuntimeException ex) {
            // Creation failure must release all partially initialized resources.
            closeQuietly(browserContext, contextId);
            closeQuietly(browser, contextId);
            closeQuietly(playwright, contextId);
            throw ex;
        }
    }

    private BrowserType.LaunchOptions buildLaunchOptions(ProxyRecord proxyRecord) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());

        if (browserProperties.isIgnoreAllDefaultArgs()) {
            options.setIgnoreAllDefaultArgs(true);
        } else if (browserProperties.getIgnoreDefaultArgs() != null
            && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }

        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }

        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }

        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }

        if (proxyRecord != null && !proxyRecord.isDirect()) {
            Proxy proxy = new Proxy(proxyRecord.getAddress());
            if (StringUtils.hasText(proxyRecord.getUsername())) {
                proxy.setUsername(proxyRecord.getUsername());
            }
            if (StringUtils.hasText(proxyRecord.getPassword())) {
                proxy.setPassword(proxyRecord.getPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions(FingerprintProfile profile) {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(profile.getViewportWidth(), profile.getViewportHeight())
            .setDeviceScaleFactor(profile.getDeviceScaleFactor())
            .setIsMobile(profile.isMobile())
            .setHasTouch(profile.isTouch())
            .setIgnoreHTTPSErrors(true);

        String userAgent = StringUtils.hasText(browserProperties.getUserAgent())
            ? browserProperties.getUserAgent()
            : profile.getUserAgent();
        if (StringUtils.hasText(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    private void closeQuietly(AutoCloseable closeable, String contextId) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close resource failed, contextId={}", contextId, ex);
        }
    }

}
