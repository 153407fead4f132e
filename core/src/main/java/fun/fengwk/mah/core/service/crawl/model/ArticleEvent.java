package fun.fengwk.mah.core.service.crawl.model;

import fun.fengwk.mah.core.service.extract.model.ArticleRecord;

/**
 * Published once per article as soon as it is extracted and stored.
 *
 * @param jobId job that harvested the article
 * @param record stored article
 * @author fengwk
 */
public record ArticleEvent(String jobId, ArticleRecord record) {

}
