package fun.fengwk.mah.core.service.proxy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses proxy list lines.
 *
 * @author fengwk
 */
@Slf4j
public final class ProxyListParser {

    private static final String DEFAULT_PROTOCOL = "http";

    private ProxyListParser() {
    }

    public static List<ProxyRecord> parseLines(List<String> lines) {
        List<ProxyRecord> records = new ArrayList<>();
        if (lines == null) {
            return records;
        }
        for (String line : lines) {
            ProxyRecord record = parseLine(line);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    public static List<ProxyRecord> parseFile(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("proxy list file not found, file={}", file);
            return new ArrayList<>();
        }
        try {
            return parseLines(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("failed to read proxy list file: " + file, ex);
        }
    }

    /**
     * Parse one line.
     *
     * @return proxy record, or {@code null} for blank lines, comments and malformed entries
     */
    public static ProxyRecord parseLine(String line) {
        if (!StringUtils.hasText(line)) {
            return null;
        }
        String trimmed = line.trim();
        if (trimmed.startsWith("#")) {
            return null;
        }

        String protocol = DEFAULT_PROTOCOL;
        String rest = trimmed;
        int schemeIndex = rest.indexOf("://");
        if (schemeIndex >= 0) {
            protocol = rest.substring(0, schemeIndex).toLowerCase();
            rest = rest.substring(schemeIndex + 3);
        }

        String username = null;
        String password = null;
        int atIndex = rest.lastIndexOf('@');
        if (atIndex >= 0) {
            String credentials = rest.substring(0, atIndex);
            rest = rest.substring(atIndex + 1);
            int colonIndex = credentials.indexOf(':');
            if (colonIndex <= 0) {
                log.warn("skip malformed proxy line, reason=credentials, line={}", mask(trimmed));
                return null;
            }
            username = credentials.substring(0, colonIndex);
            password = credentials.substring(colonIndex + 1);
        }

        int portIndex = rest.lastIndexOf(':');
        if (portIndex <= 0 || portIndex == rest.length() - 1) {
            log.warn("skip malformed proxy line, reason=address, line={}", mask(trimmed));
            return null;
        }
        String host = rest.substring(0, portIndex);
        int port;
        try {
            port = Integer.parseInt(rest.substring(portIndex + 1));
        } catch (NumberFormatException ex) {
            log.warn("skip malformed proxy line, reason=port, line={}", mask(trimmed));
            return null;
        }
        if (port <= 0 || port > 65535) {
            log.warn("skip malformed proxy line, reason=port, line={}", mask(trimmed));
            return null;
        }

        String address = protocol + "://" + host + ":" + port;
        return ProxyRecord.builder()
            .id(address)
            .address(address)
            .username(username)
            .password(password)
            .build();
    }

    private static String mask(String line) {
        int atIndex = line.lastIndexOf('@');
        return atIndex < 0 ? line : "***" + line.substring(atIndex);
    }

}
