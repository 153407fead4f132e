package fun.fengwk.mah.core.service.storage;

/**
 * Keeps raw page content for offline diagnosis of extraction failures.
 *
 * @author fengwk
 */
public interface RawContentArchive {

    /**
     * @return reference to the stored content, {@code null} when it could not be stored
     */
    String store(String url, String content);

    /**
     * @return stored content, {@code null} when the reference is unknown
     */
    String load(String ref);

}
