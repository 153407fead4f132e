package fun.fengwk.mah.core.service.extract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured article.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArticleRecord {

    /**
     * Canonical article url, unique.
     */
    private String url;

    private String title;

    private String author;

    private String accountName;

    private Instant publishTime;

    /**
     * Normalized plain text body, paragraphs separated by new lines.
     */
    private String content;

    @Builder.Default
    private List<String> images = new ArrayList<>();

    private String coverImage;

    private Long readCount;

    private Long likeCount;

    /**
     * Reference into the raw content archive, null when the raw page was not archived.
     */
    private String rawContentRef;

    private Instant crawlTime;

    /**
     * Name of the extraction strategy that produced title and body.
     */
    private String extractionStrategy;

    private String description;

}
