package fun.fengwk.mah.core.service.storage.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class RawContentArchiveTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldStoreAndLoadFileContent() {
        FileRawContentArchive archive = new FileRawContentArchive(tempDir.resolve("raw"));

        String ref = archive.store("https://mp.weixin.qq.com/s/a", "<html>raw</html>");

        assertThat(ref).endsWith(".html");
        assertThat(Files.exists(tempDir.resolve("raw").resolve(ref))).isTrue();
        assertThat(archive.load(ref)).isEqualTo("<html>raw</html>");
    }

    @Test
    public void shouldRejectRefsOutsideArchive() {
        FileRawContentArchive archive = new FileRawContentArchive(tempDir.resolve("raw"));

        assertThat(archive.load("../secret.html")).isNull();
        assertThat(archive.load("a/b.html")).isNull();
        assertThat(archive.load("missing.html")).isNull();
        assertThat(archive.load(null)).isNull();
    }

    @Test
    public void shouldEvictOldestInMemoryEntries() {
        InMemoryRawContentArchive archive = new InMemoryRawContentArchive(2);

        String first = archive.store("u1", "one");
        String second = archive.store("u2", "two");
        String third = archive.store("u3", "three");

        assertThat(archive.load(first)).isNull();
        assertThat(archive.load(second)).isEqualTo("two");
        assertThat(archive.load(third)).isEqualTo("three");
    }

}
