package fun.fengwk.mah.core.service.extract.strategy;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Selector helpers shared by the dom based strategies.
 *
 * @author fengwk
 */
final class StrategySupport {

    private StrategySupport() {
    }

    /**
     * Text of the first matching element with text, meta elements yield their {@code content} attribute.
     */
    static String firstText(Document document, List<String> selectors) {
        for (String selector : selectors) {
            for (Element element : document.select(selector)) {
                String value = "meta".equals(element.normalName())
                    ? element.attr("content").trim()
                    : element.text().trim();
                if (StringUtils.hasText(value)) {
                    return value;
                }
            }
        }
        return null;
    }

    static String firstAttribute(Document document, List<String> selectors, String attribute) {
        for (String selector : selectors) {
            for (Element element : document.select(selector)) {
                String value = element.attr(attribute).trim();
                if (StringUtils.hasText(value)) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * Parse display counts such as {@code 1,234}, {@code 1.2万} or {@code 10万+}.
     */
    static Long parseCount(String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String normalized = text.replace(",", "").replace("+", "").trim();
        long multiplier = 1;
        if (normalized.endsWith("万") || normalized.endsWith("w") || normalized.endsWith("W")) {
            multiplier = 10000;
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        } else if (normalized.endsWith("k") || normalized.endsWith("K")) {
            multiplier = 1000;
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        try {
            return Math.round(Double.parseDouble(normalized) * multiplier);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static boolean hasText(Element element) {
        return element != null && StringUtils.hasText(element.text());
    }

}
