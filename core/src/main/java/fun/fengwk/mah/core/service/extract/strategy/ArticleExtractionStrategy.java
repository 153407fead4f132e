package fun.fengwk.mah.core.service.extract.strategy;

import fun.fengwk.mah.core.service.extract.model.ArticleDraft;

import java.util.Optional;

/**
 * One way of reading article fields out of a page. Implementations are pure: no state, no side effects.
 *
 * @author fengwk
 */
public interface ArticleExtractionStrategy {

    /**
     * Name recorded on the article when this strategy supplies title and body.
     */
    String name();

    /**
     * @return fields this strategy recognized, empty when it found nothing
     */
    Optional<ArticleDraft> apply(ExtractionInput input);

}
