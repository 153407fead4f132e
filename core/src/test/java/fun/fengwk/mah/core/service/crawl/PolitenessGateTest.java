package fun.fengwk.mah.core.service.crawl;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class PolitenessGateTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    public void shouldSpaceRequestsOfSameIdentity() throws InterruptedException {
        List<Long> sleeps = new ArrayList<>();
        PolitenessGate gate = new PolitenessGate(3000, clock, sleeps::add);

        assertThat(gate.await("proxy-a")).isZero();
        assertThat(gate.await("proxy-a")).isEqualTo(3000);
        assertThat(gate.await("proxy-a")).isEqualTo(6000);

        assertThat(sleeps).containsExactly(3000L, 6000L);
    }

    @Test
    public void shouldNotDelayOtherIdentities() throws InterruptedException {
        PolitenessGate gate = new PolitenessGate(3000, clock, millis -> { });

        gate.await("proxy-a");

        assertThat(gate.await("proxy-b")).isZero();
    }

    @Test
    public void shouldNotWaitWhenDelayDisabled() throws InterruptedException {
        PolitenessGate gate = new PolitenessGate(0, clock, millis -> { });

        assertThat(gate.await("direct")).isZero();
        assertThat(gate.await("direct")).isZero();
    }

}
