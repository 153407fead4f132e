package fun.fengwk.mah.core.service.fetch;

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values mined from the page's script variables and data attributes.
 *
 * <p>Keys are the ones produced by the fetcher's payload script, see the {@code KEY_*} constants.
 * Link lists hold maps with {@code url}, {@code title} and optionally {@code publishTime}.
 *
 * @author fengwk
 */
public class EmbeddedPayload {

    public static final String KEY_TITLE = "title";
    public static final String KEY_DESCRIPTION = "description";
    public static final String KEY_PUBLISH_TIME = "publishTime";
    public static final String KEY_AUTHOR = "author";
    public static final String KEY_NICKNAME = "nickname";
    public static final String KEY_ACCOUNT_NAME = "accountName";
    public static final String KEY_COVER_URL = "coverUrl";
    public static final String KEY_CONTENT = "content";
    public static final String KEY_READ_COUNT = "readCount";
    public static final String KEY_LIKE_COUNT = "likeCount";
    public static final String KEY_BIZ = "biz";
    public static final String KEY_PREV_URL = "prevUrl";
    public static final String KEY_NEXT_URL = "nextUrl";
    public static final String KEY_RELATED = "related";
    public static final String KEY_ALBUM = "album";
    public static final String KEY_LISTING = "listing";
    public static final String KEY_NEXT_OFFSET = "nextOffset";
    public static final String KEY_CAN_CONTINUE = "canContinue";

    public static final String LINK_URL = "url";
    public static final String LINK_TITLE = "title";
    public static final String LINK_PUBLISH_TIME = "publishTime";

    private static final EmbeddedPayload EMPTY = new EmbeddedPayload(Map.of());

    private final Map<String, Object> values;

    private EmbeddedPayload(Map<String, Object> values) {
        this.values = values;
    }

    public static EmbeddedPayload empty() {
        return EMPTY;
    }

    public static EmbeddedPayload of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new EmbeddedPayload(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return StringUtils.hasText(text) ? text : null;
    }

    public Long getLong(String key) {
        return toLong(values.get(key));
    }

    public boolean getBoolean(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return value != null && ("true".equalsIgnoreCase(value.toString()) || "1".equals(value.toString()));
    }

    /**
     * Link entries under {@code key}, entries that are not objects or have no url are dropped.
     */
    public List<Map<String, Object>> getLinks(String key) {
        Object value = values.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> links = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map && map.get(LINK_URL) != null) {
                Map<String, Object> link = new LinkedHashMap<>();
                map.forEach((k, v) -> link.put(String.valueOf(k), v));
                links.add(link);
            }
        }
        return links;
    }

    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

}
