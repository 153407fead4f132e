package fun.fengwk.mah.core.service.extract;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class PublishTimeParserTest {

    private final PublishTimeParser parser = new PublishTimeParser(ZoneId.of("Asia/Shanghai"));

    @Test
    public void shouldParseEpochSecondsAndMillis() {
        assertThat(parser.parse("1704067200")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(parser.parse("1704067200000")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    public void shouldParseLocalFormatsInConfiguredZone() {
        Instant expected = Instant.parse("2024-03-05T00:30:00Z");

        assertThat(parser.parse("2024-03-05 08:30")).isEqualTo(expected);
        assertThat(parser.parse("2024-3-5 8:30:00")).isEqualTo(expected);
        assertThat(parser.parse("2024/03/05 08:30")).isEqualTo(expected);
        assertThat(parser.parse("2024年3月5日 08:30")).isEqualTo(expected);
        assertThat(parser.parse("2024-03-05T08:30:00")).isEqualTo(expected);
    }

    @Test
    public void shouldParseDateOnlyFormatsAtStartOfDay() {
        Instant expected = Instant.parse("2024-03-04T16:00:00Z");

        assertThat(parser.parse("2024-03-05")).isEqualTo(expected);
        assertThat(parser.parse("2024/3/5")).isEqualTo(expected);
        assertThat(parser.parse("2024年3月5日")).isEqualTo(expected);
        assertThat(parser.parse("20240305")).isEqualTo(expected);
    }

    @Test
    public void shouldHonorExplicitOffset() {
        assertThat(parser.parse("2024-03-05T08:30:00+00:00")).isEqualTo(Instant.parse("2024-03-05T08:30:00Z"));
    }

    @Test
    public void shouldReturnNullForUnknownFormats() {
        assertThat(parser.parse(null)).isNull();
        assertThat(parser.parse(" ")).isNull();
        assertThat(parser.parse("昨天")).isNull();
        assertThat(parser.parse("12345")).isNull();
        assertThat(parser.parse("20241399")).isNull();
    }

}
