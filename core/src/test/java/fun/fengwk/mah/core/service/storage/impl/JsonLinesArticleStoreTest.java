package fun.fengwk.mah.core.service.storage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.storage.SaveResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class JsonLinesArticleStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void shouldAppendOneLinePerArticle() throws IOException {
        Path file = tempDir.resolve("nested/articles.jsonl");
        JsonLinesArticleStore store = new JsonLinesArticleStore(file, objectMapper);

        assertThat(store.save(record("https://mp.weixin.qq.com/s/a", "A"))).isEqualTo(SaveResult.SUCCESS);
        assertThat(store.save(record("https://mp.weixin.qq.com/s/b", "B"))).isEqualTo(SaveResult.SUCCESS);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.path("url").asText()).isEqualTo("https://mp.weixin.qq.com/s/a");
        assertThat(first.path("title").asText()).isEqualTo("A");
        assertThat(first.path("publishTime").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    public void shouldReportDuplicateByCanonicalUrl() {
        JsonLinesArticleStore store = new JsonLinesArticleStore(tempDir.resolve("articles.jsonl"), objectMapper);
        store.save(record("https://mp.weixin.qq.com/s/a", "A"));

        assertThat(store.save(record("https://mp.weixin.qq.com/s/a?scene=21#rd", "A again"))).isEqualTo(SaveResult.DUPLICATE);
        assertThat(store.exists("http://mp.weixin.qq.com/s/a?from=timeline")).isTrue();
        assertThat(store.exists("https://mp.weixin.qq.com/s/b")).isFalse();
    }

    @Test
    public void shouldReloadExistingUrlsAndSkipMalformedLines() throws IOException {
        Path file = tempDir.resolve("articles.jsonl");
        new JsonLinesArticleStore(file, objectMapper).save(record("https://mp.weixin.qq.com/s/a", "A"));
        Files.writeString(file, "not json\n\n", java.nio.file.StandardOpenOption.APPEND);

        JsonLinesArticleStore reopened = new JsonLinesArticleStore(file, objectMapper);

        assertThat(reopened.exists("https://mp.weixin.qq.com/s/a")).isTrue();
        assertThat(reopened.save(record("https://mp.weixin.qq.com/s/a", "A"))).isEqualTo(SaveResult.DUPLICATE);
    }

    @Test
    public void shouldRejectRecordWithoutUrl() {
        JsonLinesArticleStore store = new JsonLinesArticleStore(tempDir.resolve("articles.jsonl"), objectMapper);

        assertThat(store.save(ArticleRecord.builder().title("no url").build())).isEqualTo(SaveResult.ERROR);
        assertThat(store.save(null)).isEqualTo(SaveResult.ERROR);
    }

    private ArticleRecord record(String url, String title) {
        return ArticleRecord.builder()
            .url(url)
            .title(title)
            .content("body")
            .publishTime(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    }

}
