package fun.fengwk.mah.core.service.proxy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ProxyListParserTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldParseAddressWithCredentials() {
        ProxyRecord record = ProxyListParser.parseLine("socks5://user:p@ss@10.0.0.1:1080");

        assertThat(record).isNotNull();
        assertThat(record.getId()).isEqualTo("socks5://10.0.0.1:1080");
        assertThat(record.getAddress()).isEqualTo("socks5://10.0.0.1:1080");
        assertThat(record.getUsername()).isEqualTo("user");
        assertThat(record.getPassword()).isEqualTo("p@ss");
        assertThat(record.getHealthState()).isEqualTo(ProxyHealthState.HEALTHY);
    }

    @Test
    public void shouldDefaultToHttpProtocol() {
        ProxyRecord record = ProxyListParser.parseLine("  proxy.local:8080 ");

        assertThat(record.getAddress()).isEqualTo("http://proxy.local:8080");
        assertThat(record.getUsername()).isNull();
    }

    @Test
    public void shouldSkipCommentsBlankAndMalformedLines() {
        List<ProxyRecord> records = ProxyListParser.parseLines(List.of(
            "# comment",
            "",
            "no-port",
            "host:99999",
            "host:abc",
            ":user@host:1",
            "http://ok:3128"
        ));

        assertThat(records).extracting(ProxyRecord::getId).containsExactly("http://ok:3128");
    }

    @Test
    public void shouldParseFileAndToleratesMissingFile() throws IOException {
        Path file = tempDir.resolve("proxies.txt");
        Files.writeString(file, "http://a:1\n# skip\nhttp://b:2\n");

        assertThat(ProxyListParser.parseFile(file)).hasSize(2);
        assertThat(ProxyListParser.parseFile(tempDir.resolve("missing.txt"))).isEmpty();
    }

}
