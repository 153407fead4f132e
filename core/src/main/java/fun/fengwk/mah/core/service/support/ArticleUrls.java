package fun.fengwk.mah.core.service.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Url helpers for the article platform: canonical keys, article/listing classification and listing urls.
 *
 * @author fengwk
 */
@Slf4j
public final class ArticleUrls {

    public static final String ARTICLE_HOST = "mp.weixin.qq.com";

    private static final String LISTING_PATH = "/mp/profile_ext";

    private static final String ALBUM_PATH = "/mp/appmsgalbum";

    /**
     * Query parameters that only carry share/session tracking and never identify content.
     */
    private static final Set<String> TRACKING_PARAMETERS = Set.of(
        "chksm", "scene", "subscene", "srcid", "sharer_sharetime", "sharer_shareid", "sharer_shareinfo",
        "sharer_shareinfo_first", "from", "isappinstalled", "clicktime", "enterid", "ascene", "devicetype",
        "version", "nettype", "lang", "exportkey", "pass_ticket", "wx_header", "sessionid", "key", "uin",
        "poc_token", "abtest_cookie", "countrycode", "realreporttime", "fontscale", "mpshare", "rd2werd",
        "payreadticket", "share_source", "fasttmpl_type", "fasttmpl_fullversion", "ptlang", "login_type"
    );

    private static final String TRACKING_PREFIX = "utm_";

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    /**
     * Ascii characters that are illegal in a uri but show up in hand-written hrefs.
     */
    private static final String UNSAFE_ASCII = "\"<>\\^`{|}";

    private static final List<String> NON_ARTICLE_MARKERS = List.of("action=profile", "action=follow", "tempkey=");

    private ArticleUrls() {
    }

    /**
     * Canonical dedup key: lower-case host, no fragment, tracking parameters removed, remaining parameters sorted.
     *
     * @return canonical url, or {@code null} when the url is not an absolute http(s) url
     */
    public static String canonicalize(String url) {
        URI uri = parse(url);
        if (uri == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (ARTICLE_HOST.equals(host)) {
            scheme = "https";
        }

        StringBuilder builder = new StringBuilder();
        builder.append(scheme).append("://").append(host);
        if (uri.getPort() != -1 && !isDefaultPort(scheme, uri.getPort())) {
            builder.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath();
        builder.append(StringUtils.hasText(path) ? path : "/");

        List<String> parameters = new ArrayList<>();
        String rawQuery = uri.getRawQuery();
        if (StringUtils.hasText(rawQuery)) {
            for (String parameter : rawQuery.split("&")) {
                if (parameter.isEmpty() || isTrackingParameter(parameterName(parameter))) {
                    continue;
                }
                parameters.add(parameter);
            }
        }
        if (!parameters.isEmpty()) {
            parameters.sort(null);
            builder.append('?').append(String.join("&", parameters));
        }
        return builder.toString();
    }

    /**
     * Resolve a possibly relative reference against a base url.
     *
     * @return absolute url, or {@code null} for blank, script or fragment-only references
     */
    public static String resolve(String baseUrl, String reference) {
        if (!StringUtils.hasText(reference)) {
            return null;
        }
        String trimmed = encodeUnsafeCharacters(unescapeAmpersands(reference.trim()));
        String lowerCase = trimmed.toLowerCase(Locale.ROOT);
        if (lowerCase.startsWith("javascript:") || lowerCase.startsWith("#") || lowerCase.startsWith("data:")) {
            return null;
        }
        try {
            URI resolved = StringUtils.hasText(baseUrl)
                ? new URI(encodeUnsafeCharacters(unescapeAmpersands(baseUrl.trim()))).resolve(trimmed)
                : new URI(trimmed);
            if (resolved.getScheme() == null || resolved.getHost() == null) {
                return null;
            }
            return resolved.toString();
        } catch (URISyntaxException | IllegalArgumentException ex) {
            log.debug("unresolvable link dropped, baseUrl={}, reference={}, error={}", baseUrl, reference, ex.getMessage());
            return null;
        }
    }

    public static boolean isArticleUrl(String url) {
        URI uri = parse(url);
        if (uri == null || !ARTICLE_HOST.equalsIgnoreCase(uri.getHost())) {
            return false;
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String query = uri.getRawQuery() == null ? "" : uri.getRawQuery();
        for (String marker : NON_ARTICLE_MARKERS) {
            if (query.contains(marker)) {
                return false;
            }
        }
        if (path.startsWith("/s/")) {
            return path.length() > 3;
        }
        return "/s".equals(path) && query.contains("__biz=") && (query.contains("mid=") || query.contains("sn="));
    }

    public static boolean isListingUrl(String url) {
        URI uri = parse(url);
        if (uri == null || !ARTICLE_HOST.equalsIgnoreCase(uri.getHost())) {
            return false;
        }
        String path = uri.getRawPath();
        return LISTING_PATH.equals(path) || ALBUM_PATH.equals(path);
    }

    public static boolean isAlbumUrl(String url) {
        URI uri = parse(url);
        return uri != null && ARTICLE_HOST.equalsIgnoreCase(uri.getHost()) && ALBUM_PATH.equals(uri.getRawPath());
    }

    /**
     * Raw value of the first query parameter with the given name.
     */
    public static String queryParameter(String url, String name) {
        URI uri = parse(url);
        if (uri == null || uri.getRawQuery() == null) {
            return null;
        }
        for (String parameter : uri.getRawQuery().split("&")) {
            if (name.equals(parameterName(parameter))) {
                int index = parameter.indexOf('=');
                return index < 0 ? "" : parameter.substring(index + 1);
            }
        }
        return null;
    }

    /**
     * Chronological listing page of an account, newest first, starting at {@code offset}.
     */
    public static String historyListingUrl(String biz, int offset) {
        return "https://" + ARTICLE_HOST + LISTING_PATH
            + "?action=getmsg&__biz=" + encodeParameter(biz)
            + "&count=10&f=json&offset=" + Math.max(0, offset);
    }

    private static String encodeParameter(String value) {
        // Account keys are usually already url-safe base64, keep them as they appear in article urls.
        if (value.contains("%") || value.matches("[A-Za-z0-9=_.-]+")) {
            return value;
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static URI parse(String url) {
        if (!StringUtils.hasText(url)) {
            return null;
        }
        try {
            URI uri = new URI(encodeUnsafeCharacters(unescapeAmpersands(url.trim())));
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            String lowerCaseScheme = scheme.toLowerCase(Locale.ROOT);
            if (!"http".equals(lowerCaseScheme) && !"https".equals(lowerCaseScheme)) {
                return null;
            }
            return uri;
        } catch (URISyntaxException ex) {
            log.debug("malformed url dropped, url={}, error={}", url, ex.getMessage());
            return null;
        }
    }

    /**
     * Percent-encode, as utf-8, non-ascii characters, whitespace and ascii characters a uri cannot hold.
     * Existing escapes are kept, so encoded and unencoded forms of a link share one canonical key.
     */
    static String encodeUnsafeCharacters(String url) {
        StringBuilder builder = null;
        int index = 0;
        while (index < url.length()) {
            int codePoint = url.codePointAt(index);
            int next = index + Character.charCount(codePoint);
            if (isUnsafe(codePoint)) {
                if (builder == null) {
                    builder = new StringBuilder(url.length() + 16).append(url, 0, index);
                }
                for (byte b : url.substring(index, next).getBytes(StandardCharsets.UTF_8)) {
                    builder.append('%').append(HEX_DIGITS[(b >> 4) & 0xF]).append(HEX_DIGITS[b & 0xF]);
                }
            } else if (builder != null) {
                builder.appendCodePoint(codePoint);
            }
            index = next;
        }
        return builder == null ? url : builder.toString();
    }

    private static boolean isUnsafe(int codePoint) {
        return codePoint <= 0x20 || codePoint >= 0x7F || UNSAFE_ASCII.indexOf(codePoint) >= 0;
    }

    private static String unescapeAmpersands(String url) {
        // Payload json embeds urls html-escaped.
        return url.replace("&amp;", "&");
    }

    private static String parameterName(String parameter) {
        int index = parameter.indexOf('=');
        String name = index < 0 ? parameter : parameter.substring(0, index);
        return name.toLowerCase(Locale.ROOT);
    }

    private static boolean isTrackingParameter(String name) {
        return TRACKING_PARAMETERS.contains(name) || name.startsWith(TRACKING_PREFIX);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

}
