package fun.fengwk.mah.core.service.extract.strategy;

import fun.fengwk.mah.core.service.extract.model.ArticleDraft;
import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the values mined from the page's script variables.
 *
 * @author fengwk
 */
@Order(3)
@Component
public class EmbeddedPayloadStrategy implements ArticleExtractionStrategy {

    public static final String NAME = "payload";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<ArticleDraft> apply(ExtractionInput input) {
        EmbeddedPayload payload = input.payload();
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        ArticleDraft draft = new ArticleDraft();
        draft.setTitle(payload.getString(EmbeddedPayload.KEY_TITLE));
        draft.setContentHtml(payload.getString(EmbeddedPayload.KEY_CONTENT));
        draft.setAuthor(payload.getString(EmbeddedPayload.KEY_AUTHOR));
        String accountName = payload.getString(EmbeddedPayload.KEY_NICKNAME);
        draft.setAccountName(accountName != null ? accountName : payload.getString(EmbeddedPayload.KEY_ACCOUNT_NAME));
        draft.setPublishTime(payload.getString(EmbeddedPayload.KEY_PUBLISH_TIME));
        draft.setCoverImage(payload.getString(EmbeddedPayload.KEY_COVER_URL));
        draft.setDescription(payload.getString(EmbeddedPayload.KEY_DESCRIPTION));
        draft.setReadCount(payload.getLong(EmbeddedPayload.KEY_READ_COUNT));
        draft.setLikeCount(payload.getLong(EmbeddedPayload.KEY_LIKE_COUNT));
        return draft.isEmpty() ? Optional.empty() : Optional.of(draft);
    }

}
