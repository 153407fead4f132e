package fun.fengwk.mah.core.service.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Article store and raw content archive configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mah.storage")
public class StorageProperties {

    /**
     * Store type, {@code memory} or {@code jsonl}.
     */
    private String type = "memory";

    /**
     * Json lines file of the {@code jsonl} store, existing records are loaded at startup.
     */
    private String jsonlPath = "data/articles.jsonl";

    /**
     * Raw content archive directory, empty keeps raw content in memory.
     */
    private String rawContentDir;

    /**
     * Max entries kept by the in-memory raw content archive.
     */
    private int rawContentMaxEntries = 200;

    /**
     * Also archive the raw page of successfully extracted articles, failures are always archived.
     */
    private boolean archiveSuccessfulContent = false;

}
