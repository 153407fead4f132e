package fun.fengwk.mah.core.service.fetch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Classifies rendered pages as normal, soft-blocked, not found or removed.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectionInspector {

    private final FetchProperties fetchProperties;

    public PageVerdict inspect(String finalUrl, String title, String content) {
        String lowerCaseUrl = finalUrl == null ? "" : finalUrl.toLowerCase(Locale.ROOT);
        if (containsAny(lowerCaseUrl, fetchProperties.getBlockUrlMarkers())) {
            log.debug("block marker in url, url={}", finalUrl);
            return PageVerdict.SOFT_BLOCK;
        }

        String safeTitle = title == null ? "" : title;
        if (containsAny(safeTitle, fetchProperties.getBlockTextMarkers())) {
            log.debug("block marker in title, url={}, title={}", finalUrl, safeTitle);
            return PageVerdict.SOFT_BLOCK;
        }

        String visibleText = visibleText(content);
        boolean shortPage = visibleText.length() <= fetchProperties.getShortPageTextLength();
        if (shortPage && containsAny(visibleText, fetchProperties.getBlockTextMarkers())) {
            log.debug("block marker in text, url={}", finalUrl);
            return PageVerdict.SOFT_BLOCK;
        }
        if (shortPage && containsAny(visibleText, fetchProperties.getRemovalTextMarkers())) {
            return PageVerdict.REMOVED;
        }
        if (containsAny(safeTitle, fetchProperties.getNotFoundTextMarkers())
            || (shortPage && containsAny(visibleText, fetchProperties.getNotFoundTextMarkers()))) {
            return PageVerdict.NOT_FOUND;
        }
        return PageVerdict.OK;
    }

    private String visibleText(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        return Jsoup.parse(content).text();
    }

    private boolean containsAny(String text, List<String> markers) {
        if (text.isEmpty() || markers == null) {
            return false;
        }
        String lowerCaseText = text.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (marker != null && !marker.isEmpty() && lowerCaseText.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

}
