package fun.fengwk.mah.core.service.extract.model;

import lombok.Data;
import org.springframework.util.StringUtils;

/**
 * Raw, unnormalized fields found by one extraction strategy.
 *
 * @author fengwk
 */
@Data
public class ArticleDraft {

    private String title;

    /**
     * Body html.
     */
    private String contentHtml;

    private String author;

    private String accountName;

    /**
     * Publish time as found, epoch number or formatted text.
     */
    private String publishTime;

    private String coverImage;

    private String description;

    private Long readCount;

    private Long likeCount;

    public boolean hasTitleAndBody() {
        return StringUtils.hasText(title) && StringUtils.hasText(contentHtml);
    }

    public boolean isEmpty() {
        return !StringUtils.hasText(title)
            && !StringUtils.hasText(contentHtml)
            && !StringUtils.hasText(author)
            && !StringUtils.hasText(accountName)
            && !StringUtils.hasText(publishTime)
            && !StringUtils.hasText(coverImage)
            && !StringUtils.hasText(description)
            && readCount == null
            && likeCount == null;
    }

    /**
     * Fill blank fields of this draft from {@code other}, present fields are kept.
     */
    public void fillMissingFrom(ArticleDraft other) {
        if (other == null) {
            return;
        }
        title = firstText(title, other.title);
        contentHtml = firstText(contentHtml, other.contentHtml);
        author = firstText(author, other.author);
        accountName = firstText(accountName, other.accountName);
        publishTime = firstText(publishTime, other.publishTime);
        coverImage = firstText(coverImage, other.coverImage);
        description = firstText(description, other.description);
        readCount = readCount != null ? readCount : other.readCount;
        likeCount = likeCount != null ? likeCount : other.likeCount;
    }

    public ArticleDraft copy() {
        ArticleDraft copy = new ArticleDraft();
        copy.fillMissingFrom(this);
        return copy;
    }

    private static String firstText(String current, String fallback) {
        return StringUtils.hasText(current) ? current : fallback;
    }

}
