package fun.fengwk.mah.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mah.core.service.storage.ArticleStore;
import fun.fengwk.mah.core.service.storage.RawContentArchive;
import fun.fengwk.mah.core.service.storage.StorageProperties;
import fun.fengwk.mah.core.service.storage.impl.FileRawContentArchive;
import fun.fengwk.mah.core.service.storage.impl.InMemoryArticleStore;
import fun.fengwk.mah.core.service.storage.impl.InMemoryRawContentArchive;
import fun.fengwk.mah.core.service.storage.impl.JsonLinesArticleStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Storage beans selected by {@code mah.storage.*}.
 *
 * @author fengwk
 */
@Configuration
public class StorageConfiguration {

    @Bean
    @ConditionalOnMissingBean(ArticleStore.class)
    @ConditionalOnProperty(prefix = "mah.storage", name = "type", havingValue = "jsonl")
    public ArticleStore jsonLinesArticleStore(StorageProperties storageProperties,
                                              ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        return new JsonLinesArticleStore(Path.of(storageProperties.getJsonlPath()), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(ArticleStore.class)
    @ConditionalOnProperty(prefix = "mah.storage", name = "type", havingValue = "memory", matchIfMissing = true)
    public ArticleStore inMemoryArticleStore() {
        return new InMemoryArticleStore();
    }

    @Bean
    @ConditionalOnMissingBean(RawContentArchive.class)
    public RawContentArchive rawContentArchive(StorageProperties storageProperties) {
        if (StringUtils.hasText(storageProperties.getRawContentDir())) {
            return new FileRawContentArchive(Path.of(storageProperties.getRawContentDir()));
        }
        return new InMemoryRawContentArchive(storageProperties.getRawContentMaxEntries());
    }

}
