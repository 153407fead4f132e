package fun.fengwk.mah.core.service.storage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.storage.ArticleStore;
import fun.fengwk.mah.core.service.storage.SaveResult;
import fun.fengwk.mah.core.service.support.ArticleUrls;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Appends one json document per article to a file; urls already in the file are loaded at startup so
 * {@link #exists(String)} survives restarts.
 *
 * @author fengwk
 */
@Slf4j
public class JsonLinesArticleStore implements ArticleStore {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Set<String> urls = ConcurrentHashMap.newKeySet();

    public JsonLinesArticleStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    @Override
    public synchronized SaveResult save(ArticleRecord record) {
        String key = record == null ? null : ArticleUrls.canonicalize(record.getUrl());
        if (key == null) {
            return SaveResult.ERROR;
        }
        if (urls.contains(key)) {
            return SaveResult.DUPLICATE;
        }
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            Files.writeString(path, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            urls.add(key);
            return SaveResult.SUCCESS;
        } catch (IOException ex) {
            log.warn("save article failed, url={}, path={}, error={}", record.getUrl(), path, ex.getMessage());
            return SaveResult.ERROR;
        }
    }

    @Override
    public boolean exists(String url) {
        String key = ArticleUrls.canonicalize(url);
        return key != null && urls.contains(key);
    }

    private void load() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(path)) {
                log.info("article store created, path={}", path);
                return;
            }
            int lineNumber = 0;
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    loadLine(line, lineNumber);
                }
            }
            log.info("article store loaded, path={}, articles={}", path, urls.size());
        } catch (IOException ex) {
            throw new IllegalStateException("failed to load article store: " + path, ex);
        }
    }

    private void loadLine(String line, int lineNumber) {
        try {
            JsonNode node = objectMapper.readTree(line);
            String key = ArticleUrls.canonicalize(node.path("url").asText(null));
            if (key != null) {
                urls.add(key);
            }
        } catch (IOException ex) {
            log.warn("skip malformed article line, path={}, line={}, error={}", path, lineNumber, ex.getMessage());
        }
    }

}
