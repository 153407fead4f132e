package fun.fengwk.mah.core.service.storage;

import fun.fengwk.mah.core.service.extract.model.ArticleRecord;

/**
 * Persistence collaborator of the harvester.
 *
 * @author fengwk
 */
public interface ArticleStore {

    /**
     * Persist a record, keyed by its canonical url.
     *
     * @return {@link SaveResult#DUPLICATE} when the url is already stored, {@link SaveResult#ERROR} when it
     * could not be persisted
     */
    SaveResult save(ArticleRecord record);

    /**
     * Whether an article with the same canonical url has already been harvested.
     */
    boolean exists(String url);

}
