package fun.fengwk.mah.core.service.storage.impl;

import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.storage.ArticleStore;
import fun.fengwk.mah.core.service.storage.SaveResult;
import fun.fengwk.mah.core.service.support.ArticleUrls;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Article store backed by a concurrent map, lost on restart.
 *
 * @author fengwk
 */
public class InMemoryArticleStore implements ArticleStore {

    private final Map<String, ArticleRecord> records = new ConcurrentHashMap<>();

    @Override
    public SaveResult save(ArticleRecord record) {
        String key = key(record == null ? null : record.getUrl());
        if (key == null) {
            return SaveResult.ERROR;
        }
        return records.putIfAbsent(key, record) == null ? SaveResult.SUCCESS : SaveResult.DUPLICATE;
    }

    @Override
    public boolean exists(String url) {
        String key = key(url);
        return key != null && records.containsKey(key);
    }

    public List<ArticleRecord> list() {
        return new ArrayList<>(records.values());
    }

    public int size() {
        return records.size();
    }

    private String key(String url) {
        return ArticleUrls.canonicalize(url);
    }

}
