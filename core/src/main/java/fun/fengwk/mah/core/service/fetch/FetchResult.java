package fun.fengwk.mah.core.service.fetch;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Rendered page returned by a fetch.
 *
 * @author fengwk
 */
@Data
@Builder
public class FetchResult {

    /**
     * Requested url.
     */
    private String url;

    /**
     * Url after redirects.
     */
    private String finalUrl;

    private int statusCode;

    private String title;

    /**
     * Rendered html.
     */
    private String content;

    @Builder.Default
    private EmbeddedPayload payload = EmbeddedPayload.empty();

    /**
     * Links that only appeared after scroll-triggered loading.
     */
    @Builder.Default
    private List<PageLink> scrollLinks = List.of();

    private long elapsedMs;

}
