package fun.fengwk.mah.core.service.fetch;

import fun.fengwk.mah.core.service.browser.BrowserProperties;
import fun.fengwk.mah.core.service.browser.runtime.BrowserSession;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Playwright page fetcher: navigate, wait for a content-ready signal, simulate scrolling, then collect the
 * rendered html, the embedded script payload and the links revealed by scrolling.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightPageFetcher implements PageFetcher {

    static final String PAYLOAD_SCRIPT = """
        () => {
          const data = {};
          const seen = new Set();
          const pick = (name) => {
            try {
              const value = window[name];
              return value === undefined || value === null ? undefined : value;
            } catch (e) {
              return undefined;
            }
          };
          const assign = (key, value) => {
            if (value === undefined || value === null) return;
            const text = String(value).trim();
            if (text !== '' && data[key] === undefined) data[key] = text;
          };
          const pushLink = (list, url, title, publishTime) => {
            if (!url) return;
            const normalized = String(url).replace(/&amp;/g, '&').trim();
            if (normalized === '' || seen.has(normalized)) return;
            seen.add(normalized);
            list.push({ url: normalized, title: title ? String(title).trim() : '', publishTime: publishTime || null });
          };

          assign('title', pick('msg_title'));
          assign('description', pick('msg_desc'));
          assign('publishTime', pick('ct') || pick('publish_time'));
          assign('nickname', pick('nickname'));
          assign('accountName', pick('user_name'));
          assign('author', pick('author'));
          assign('coverUrl', pick('msg_cdn_url') || pick('cdn_url_1_1'));
          assign('biz', pick('biz') || pick('__biz'));
          assign('readCount', pick('read_num'));
          assign('likeCount', pick('like_num'));

          const cgi = pick('cgiData');
          if (cgi && typeof cgi === 'object') {
            assign('title', cgi.title);
            assign('content', cgi.content_noencode);
            assign('nickname', cgi.nick_name);
            assign('publishTime', cgi.create_time);
            assign('author', cgi.author);
            assign('biz', cgi.biz);
          }

          try {
            const prev = document.querySelector('[data-prev-link], .album_read_nav_prev [data-link]');
            if (prev) assign('prevUrl', prev.getAttribute('data-prev-link') || prev.getAttribute('data-link'));
            const next = document.querySelector('[data-next-link], .album_read_nav_next [data-link]');
            if (next) assign('nextUrl', next.getAttribute('data-next-link') || next.getAttribute('data-link'));
          } catch (e) {}

          const album = [];
          try {
            document.querySelectorAll('.album__list-item[data-link], [data-album-link]').forEach((el) => {
              pushLink(album, el.getAttribute('data-link') || el.getAttribute('data-album-link'),
                el.getAttribute('data-title') || el.textContent);
            });
          } catch (e) {}
          if (album.length > 0) data.album = album;

          const related = [];
          try {
            document.querySelectorAll('[data-url], [data-article-url]').forEach((el) => {
              pushLink(related, el.getAttribute('data-url') || el.getAttribute('data-article-url'),
                el.getAttribute('data-title') || el.textContent);
            });
          } catch (e) {}
          if (related.length > 0) data.related = related;

          let msgList = pick('msgList');
          if (typeof msgList === 'string') {
            try {
              msgList = JSON.parse(msgList.replace(/&quot;/g, '"'));
            } catch (e) {
              msgList = null;
            }
          }
          if (!msgList) {
            try {
              const body = JSON.parse(document.body.innerText);
              if (body && body.general_msg_list) {
                msgList = JSON.parse(body.general_msg_list);
                data.nextOffset = body.next_offset;
                data.canContinue = body.can_msg_continue;
              }
            } catch (e) {}
          }
          if (msgList && Array.isArray(msgList.list)) {
            const listing = [];
            msgList.list.forEach((item) => {
              const datetime = item.comm_msg_info && item.comm_msg_info.datetime;
              const main = item.app_msg_ext_info;
              if (!main) return;
              pushLink(listing, main.content_url, main.title, datetime);
              (main.multi_app_msg_item_list || []).forEach((sub) => pushLink(listing, sub.content_url, sub.title, datetime));
            });
            data.listing = listing;
          }
          return data;
        }
        """;

    static final String ANCHORS_SCRIPT = """
        () => Array.from(document.querySelectorAll('a[href]'))
          .map((a) => ({ url: a.href, text: (a.textContent || '').trim() }))
        """;

    static final String SCROLL_SCRIPT = "() => window.scrollTo(0, document.body.scrollHeight)";

    static final String TEXT_LENGTH_SCRIPT = "() => document.body ? document.body.innerText.length : 0";

    private final FetchProperties fetchProperties;
    private final BrowserProperties browserProperties;
    private final DetectionInspector detectionInspector;

    @Override
    public FetchResult fetch(BrowserSession session, String url) {
        long startAt = System.currentTimeMillis();
        Page page = session.newPage();
        try {
            Response response = page.navigate(url,
                new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout((double) fetchProperties.getNavigateTimeoutMs())
            );
            int statusCode = response == null ? 0 : response.status();
            checkStatus(url, statusCode);

            WaitResult ready = waitForContentReady(page);
            pauseLikeHuman(page);
            List<PageLink> scrollLinks = scrollAndCollectLinks(page);

            String finalUrl = page.url();
            String title = page.title();
            String content = page.content();

            PageVerdict verdict = detectionInspector.inspect(finalUrl, title, content);
            switch (verdict) {
                case SOFT_BLOCK:
                    throw new TransientFetchException(FailureReason.SOFT_BLOCK, "detected block page: " + finalUrl);
                case REMOVED:
                    throw new PermanentFetchException(FailureReason.REMOVED, "content removed: " + finalUrl);
                case NOT_FOUND:
                    throw new PermanentFetchException(FailureReason.NOT_FOUND, "page not found: " + finalUrl);
                default:
                    break;
            }
            if (ready.timedOut()) {
                throw new TransientFetchException(FailureReason.TIMEOUT,
                    "content not ready within " + fetchProperties.getContentReadyTimeoutMs() + "ms: " + url);
            }

            FetchResult result = FetchResult.builder()
                .url(url)
                .finalUrl(finalUrl)
                .statusCode(statusCode)
                .title(title)
                .content(content)
                .payload(readPayload(page, url))
                .scrollLinks(scrollLinks)
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
            log.debug("page fetched, url={}, finalUrl={}, status={}, readyChecks={}, scrollLinks={}, elapsedMs={}",
                url, finalUrl, statusCode, ready.checks(), scrollLinks.size(), result.getElapsedMs());
            return result;
        } catch (FetchException ex) {
            throw ex;
        } catch (TimeoutError ex) {
            throw new TransientFetchException(FailureReason.TIMEOUT, "navigation timeout: " + url, ex);
        } catch (PlaywrightException ex) {
            throw new TransientFetchException(FailureReason.NAVIGATION_ERROR,
                "navigation failed: " + url + ", error=" + ex.getMessage(), ex);
        } finally {
            closeQuietly(page, url);
        }
    }

    private void checkStatus(String url, int statusCode) {
        if (statusCode == 404 || statusCode == 410) {
            throw new PermanentFetchException(FailureReason.NOT_FOUND, "http " + statusCode + ": " + url);
        }
        if (statusCode == 429 || statusCode == 403) {
            throw new TransientFetchException(FailureReason.SOFT_BLOCK, "http " + statusCode + ": " + url);
        }
        if (statusCode >= 500) {
            throw new TransientFetchException(FailureReason.NAVIGATION_ERROR, "http " + statusCode + ": " + url);
        }
    }

    private WaitResult waitForContentReady(Page page) {
        int stableThreshold = Math.max(1, fetchProperties.getStableThreshold());
        int[] lastTextLength = {-1};
        int[] stableRounds = {0};
        return ContentWaiter.until(
            () -> {
                if (hasMarkerElement(page)) {
                    return true;
                }
                // No marker: fall back to DOM settling, measured by unchanged visible text length.
                int textLength = evaluateInt(page, TEXT_LENGTH_SCRIPT);
                if (textLength > 0 && textLength == lastTextLength[0]) {
                    stableRounds[0]++;
                } else {
                    stableRounds[0] = 0;
                }
                lastTextLength[0] = textLength;
                return stableRounds[0] >= stableThreshold;
            },
            fetchProperties.getContentReadyTimeoutMs(),
            fetchProperties.getReadyCheckIntervalMs(),
            page::waitForTimeout
        );
    }

    private boolean hasMarkerElement(Page page) {
        for (String selector : fetchProperties.getContentReadySelectors()) {
            try {
                ElementHandle element = page.querySelector(selector);
                if (element != null && !element.innerText().isBlank()) {
                    return true;
                }
            } catch (PlaywrightException ex) {
                log.debug("marker check failed, selector={}, error={}", selector, ex.getMessage());
            }
        }
        return false;
    }

    private List<PageLink> scrollAndCollectLinks(Page page) {
        int rounds = Math.max(0, fetchProperties.getScrollRounds());
        if (rounds == 0) {
            return List.of();
        }
        Set<String> initialUrls = new LinkedHashSet<>();
        for (PageLink link : readAnchors(page)) {
            initialUrls.add(link.url());
        }

        int previousCount = initialUrls.size();
        Map<String, PageLink> revealed = new LinkedHashMap<>();
        for (int i = 0; i < rounds; i++) {
            page.evaluate(SCROLL_SCRIPT);
            page.waitForTimeout(fetchProperties.getScrollIntervalMs() + randomInteractionDelay());
            List<PageLink> anchors = readAnchors(page);
            for (PageLink link : anchors) {
                if (!initialUrls.contains(link.url())) {
                    revealed.putIfAbsent(link.url(), link);
                }
            }
            if (anchors.size() <= previousCount) {
                break;
            }
            previousCount = anchors.size();
        }
        return new ArrayList<>(revealed.values());
    }

    private List<PageLink> readAnchors(Page page) {
        Object raw = page.evaluate(ANCHORS_SCRIPT);
        List<PageLink> links = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map && map.get("url") != null) {
                    Object text = map.get("text");
                    links.add(new PageLink(String.valueOf(map.get("url")), text == null ? "" : String.valueOf(text)));
                }
            }
        }
        return links;
    }

    @SuppressWarnings("unchecked")
    private EmbeddedPayload readPayload(Page page, String url) {
        try {
            Object raw = page.evaluate(PAYLOAD_SCRIPT);
            if (raw instanceof Map<?, ?> map) {
                return EmbeddedPayload.of((Map<String, Object>) map);
            }
        } catch (PlaywrightException ex) {
            log.debug("payload script failed, url={}, error={}", url, ex.getMessage());
        }
        return EmbeddedPayload.empty();
    }

    private int evaluateInt(Page page, String script) {
        Object value = page.evaluate(script);
        return value instanceof Number n ? n.intValue() : 0;
    }

    private void pauseLikeHuman(Page page) {
        page.waitForTimeout(randomInteractionDelay());
    }

    private long randomInteractionDelay() {
        long min = Math.max(0, browserProperties.getInteractionDelayMinMs());
        long max = Math.max(min, browserProperties.getInteractionDelayMaxMs());
        return min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
    }

    private void closeQuietly(Page page, String url) {
        try {
            page.close();
        } catch (PlaywrightException ex) {
            log.debug("close page failed, url={}, error={}", url, ex.getMessage());
        }
    }

}
