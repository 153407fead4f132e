package fun.fengwk.mah.core.service.extract;

import fun.fengwk.mah.core.service.support.ArticleUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns body html into canonical plain text and absolute image urls.
 *
 * @author fengwk
 */
public class ContentNormalizer {

    private static final Set<String> BLOCK_TAGS = Set.of(
        "p", "div", "section", "article", "h1", "h2", "h3", "h4", "h5", "h6", "li", "ul", "ol",
        "blockquote", "pre", "table", "tr", "figure", "figcaption", "hr"
    );

    private static final List<String> IMAGE_ATTRIBUTES = List.of("data-src", "src", "data-backup-src");

    private static final Pattern INVISIBLE_CHARACTERS = Pattern.compile("[\\u200B-\\u200D\\uFEFF]");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\s\\u00A0\\u3000]+");

    private final List<Pattern> boilerplatePatterns;

    public ContentNormalizer(List<String> boilerplatePatterns) {
        List<Pattern> patterns = new ArrayList<>();
        if (boilerplatePatterns != null) {
            for (String pattern : boilerplatePatterns) {
                if (StringUtils.hasText(pattern)) {
                    patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
                }
            }
        }
        this.boilerplatePatterns = patterns;
    }

    /**
     * Plain text of {@code html}: one paragraph per line, whitespace collapsed, template lines removed.
     */
    public String normalizeText(String html) {
        if (!StringUtils.hasText(html)) {
            return "";
        }
        Document document = Jsoup.parseBodyFragment(html);
        document.select("script, style, noscript, iframe").remove();

        StringBuilder builder = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    builder.append(textNode.getWholeText());
                } else if (node instanceof Element element && "br".equals(element.normalName())) {
                    builder.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && BLOCK_TAGS.contains(element.normalName())) {
                    builder.append('\n');
                }
            }
        }, document.body());

        List<String> lines = new ArrayList<>();
        for (String rawLine : builder.toString().split("\n")) {
            String line = normalizeLine(rawLine);
            if (!line.isEmpty() && !isBoilerplate(line)) {
                lines.add(line);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Whitespace collapsed single line.
     */
    public String normalizeLine(String value) {
        if (value == null) {
            return "";
        }
        String text = INVISIBLE_CHARACTERS.matcher(value).replaceAll("");
        return HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Absolute image urls of {@code html} in document order, {@code data-src} preferred over {@code src}.
     */
    public List<String> extractImages(String html, String baseUrl) {
        if (!StringUtils.hasText(html)) {
            return new ArrayList<>();
        }
        Document document = Jsoup.parseBodyFragment(html);
        Set<String> images = new LinkedHashSet<>();
        for (Element image : document.select("img")) {
            for (String attribute : IMAGE_ATTRIBUTES) {
                String absolute = ArticleUrls.resolve(baseUrl, image.attr(attribute));
                if (absolute != null) {
                    images.add(absolute);
                    break;
                }
            }
        }
        return new ArrayList<>(images);
    }

    private boolean isBoilerplate(String line) {
        for (Pattern pattern : boilerplatePatterns) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

}
