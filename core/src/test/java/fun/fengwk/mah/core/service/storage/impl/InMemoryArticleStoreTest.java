package fun.fengwk.mah.core.service.storage.impl;

import fun.fengwk.mah.core.service.extract.model.ArticleRecord;
import fun.fengwk.mah.core.service.storage.SaveResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class InMemoryArticleStoreTest {

    @Test
    public void shouldKeepFirstRecordPerCanonicalUrl() {
        InMemoryArticleStore store = new InMemoryArticleStore();

        assertThat(store.save(ArticleRecord.builder().url("https://mp.weixin.qq.com/s/a").title("first").build()))
            .isEqualTo(SaveResult.SUCCESS);
        assertThat(store.save(ArticleRecord.builder().url("https://mp.weixin.qq.com/s/a?chksm=1").title("second").build()))
            .isEqualTo(SaveResult.DUPLICATE);

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.list()).extracting(ArticleRecord::getTitle).containsExactly("first");
        assertThat(store.exists("https://mp.weixin.qq.com/s/a#x")).isTrue();
        assertThat(store.exists(null)).isFalse();
        assertThat(store.save(ArticleRecord.builder().url("bad").build())).isEqualTo(SaveResult.ERROR);
    }

}
