package fun.fengwk.mah.core.service.storage.impl;

import fun.fengwk.mah.core.service.storage.RawContentArchive;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Raw content archive writing one html file per page into a directory, the file name is the reference.
 *
 * @author fengwk
 */
@Slf4j
public class FileRawContentArchive implements RawContentArchive {

    private final Path directory;

    public FileRawContentArchive(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new IllegalStateException("failed to create raw content directory: " + directory, ex);
        }
    }

    @Override
    public String store(String url, String content) {
        String ref = System.currentTimeMillis() + "-" + UUID.randomUUID() + ".html";
        try {
            String document = "<!-- " + (url == null ? "" : url.replace("--", "%2D%2D")) + " -->\n"
                + (content == null ? "" : content);
            Files.writeString(directory.resolve(ref), document, StandardCharsets.UTF_8);
            return ref;
        } catch (IOException ex) {
            log.warn("archive raw content failed, url={}, directory={}, error={}", url, directory, ex.getMessage());
            return null;
        }
    }

    @Override
    public String load(String ref) {
        if (ref == null || ref.contains("/") || ref.contains("\\") || ref.contains("..")) {
            return null;
        }
        try {
            String document = Files.readString(directory.resolve(ref), StandardCharsets.UTF_8);
            int headerEnd = document.indexOf('\n');
            return headerEnd < 0 ? "" : document.substring(headerEnd + 1);
        } catch (NoSuchFileException ex) {
            return null;
        } catch (IOException ex) {
            throw new IllegalStateException("failed to read raw content: " + ref, ex);
        }
    }

}
