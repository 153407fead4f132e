package fun.fengwk.mah.core.service.storage.impl;

import fun.fengwk.mah.core.service.storage.RawContentArchive;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Raw content archive keeping the most recent pages in memory.
 *
 * @author fengwk
 */
public class InMemoryRawContentArchive implements RawContentArchive {

    private final Map<String, String> contents;

    public InMemoryRawContentArchive(int maxEntries) {
        int capacity = Math.max(1, maxEntries);
        this.contents = new LinkedHashMap<>(16, 0.75F, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public synchronized String store(String url, String content) {
        String ref = "mem:" + UUID.randomUUID();
        contents.put(ref, content == null ? "" : content);
        return ref;
    }

    @Override
    public synchronized String load(String ref) {
        return contents.get(ref);
    }

}
