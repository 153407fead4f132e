package fun.fengwk.mah.core.service.crawl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class RetryBackoffTest {

    @Test
    public void shouldDoubleUpToMaximumWithoutJitter() {
        RetryBackoff backoff = new RetryBackoff(1000, 5000, 0, () -> 0.5);

        assertThat(backoff.delayMs(1)).isEqualTo(1000);
        assertThat(backoff.delayMs(2)).isEqualTo(2000);
        assertThat(backoff.delayMs(3)).isEqualTo(4000);
        assertThat(backoff.delayMs(4)).isEqualTo(5000);
        assertThat(backoff.delayMs(60)).isEqualTo(5000);
    }

    @Test
    public void shouldApplyJitterWithinBounds() {
        assertThat(new RetryBackoff(1000, 60000, 0.3, () -> 0D).delayMs(1)).isEqualTo(700);
        assertThat(new RetryBackoff(1000, 60000, 0.3, () -> 1D).delayMs(1)).isEqualTo(1300);
        assertThat(new RetryBackoff(1000, 60000, 0.3, () -> 0.5D).delayMs(2)).isEqualTo(2000);
    }

    @Test
    public void shouldNeverExceedMaximumWithJitter() {
        assertThat(new RetryBackoff(1000, 1000, 0.5, () -> 1D).delayMs(5)).isEqualTo(1000);
    }

}
