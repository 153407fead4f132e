package fun.fengwk.mah.core.service.crawl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class CircuitBreakerTest {

    @Test
    public void shouldWaitForMinimumSamples() {
        CircuitBreaker breaker = new CircuitBreaker(10, 4, 0.5);

        assertThat(breaker.record(false)).isFalse();
        assertThat(breaker.record(false)).isFalse();
        assertThat(breaker.record(false)).isFalse();
        assertThat(breaker.record(false)).isTrue();
        assertThat(breaker.isTripped()).isTrue();
    }

    @Test
    public void shouldReportTripOnlyOnce() {
        CircuitBreaker breaker = new CircuitBreaker(4, 2, 0.5);

        breaker.record(false);
        assertThat(breaker.record(false)).isTrue();
        assertThat(breaker.record(false)).isFalse();
        assertThat(breaker.isTripped()).isTrue();
    }

    @Test
    public void shouldSlideWindow() {
        CircuitBreaker breaker = new CircuitBreaker(4, 4, 0.75);
        breaker.record(false);
        breaker.record(false);
        breaker.record(true);
        breaker.record(true);
        assertThat(breaker.failureRate()).isEqualTo(0.5);

        breaker.record(true);
        breaker.record(true);

        assertThat(breaker.samples()).isEqualTo(4);
        assertThat(breaker.failureRate()).isZero();
        assertThat(breaker.isTripped()).isFalse();
    }

    @Test
    public void shouldStayClosedWhenSuccessesDominate() {
        CircuitBreaker breaker = new CircuitBreaker(20, 10, 0.8);
        for (int i = 0; i < 100; i++) {
            assertThat(breaker.record(i % 2 == 0)).isFalse();
        }
        assertThat(breaker.failureRate()).isEqualTo(0.5);
    }

}
