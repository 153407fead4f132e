package fun.fengwk.mah.core.service.browser.runtime;

import fun.fengwk.mah.core.service.browser.BrowserProperties;
import fun.fengwk.mah.core.service.proxy.ProxyExhaustedException;
import fun.fengwk.mah.core.service.proxy.ProxyRecord;
import fun.fengwk.mah.core.service.proxy.ProxyRotator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class BrowserSessionPoolTest {

    private BrowserProperties browserProperties;
    private ProxyRotator proxyRotator;
    private List<BrowserSession> created;
    private BrowserSessionPool pool;

    @BeforeEach
    public void setUp() {
        browserProperties = new BrowserProperties();
        browserProperties.setSessionPoolSize(2);
        browserProperties.setAcquireTimeoutMs(50);
        browserProperties.setSessionRequestBudget(3);
        proxyRotator = mock(ProxyRotator.class);
        when(proxyRotator.select()).thenReturn(ProxyRecord.builder().id("http://p:1").address("http://p:1").build());
        when(proxyRotator.isUsable(anyString())).thenReturn(true);
        created = new ArrayList<>();
        pool = new BrowserSessionPool(browserProperties, proxyRotator, (contextId, proxy, profile) -> {
            BrowserSession session = new BrowserSession(contextId, proxy.getId(), profile, null, null, null);
            created.add(session);
            return session;
        });
    }

    @AfterEach
    public void tearDown() {
        pool.shutdown();
    }

    @Test
    public void shouldReuseReleasedSession() {
        BrowserSession first = pool.acquire();
        pool.release(first, SessionOutcome.SUCCESS);

        BrowserSession second = pool.acquire();

        assertThat(second).isSameAs(first);
        assertThat(second.isInUse()).isTrue();
        assertThat(created).hasSize(1);
        verify(proxyRotator).report("http://p:1", true);
    }

    @Test
    public void shouldThrowBusyWhenCapacityReached() {
        pool.acquire();
        pool.acquire();

        assertThatThrownBy(pool::acquire).isInstanceOf(SessionPoolBusyException.class);
        assertThat(pool.getActiveSessionCount()).isEqualTo(2);
    }

    @Test
    public void shouldRetireDetectedSessionAndReportProxyFailure() {
        BrowserSession session = pool.acquire();

        pool.release(session, SessionOutcome.DETECTED);

        assertThat(session.isClosed()).isTrue();
        assertThat(pool.getActiveSessionCount()).isZero();
        verify(proxyRotator).report("http://p:1", false);
        assertThat(pool.acquire()).isNotSameAs(session);
    }

    @Test
    public void shouldNotChargeProxyForUnusedOrNotFound() {
        BrowserSession session = pool.acquire();
        pool.release(session, SessionOutcome.UNUSED);
        verify(proxyRotator, never()).report(anyString(), anyBoolean());

        session = pool.acquire();
        pool.release(session, SessionOutcome.NOT_FOUND);
        verify(proxyRotator).report("http://p:1", true);
        assertThat(session.getRequestCount()).isEqualTo(1);
    }

    @Test
    public void shouldRetireSessionWhenRequestBudgetExhausted() {
        BrowserSession session = null;
        for (int i = 0; i < 3; i++) {
            session = pool.acquire();
            pool.release(session, SessionOutcome.SUCCESS);
        }

        assertThat(session.isClosed()).isTrue();
        assertThat(pool.getIdleSessionCount()).isZero();
    }

    @Test
    public void shouldRetireIdleSessionWhoseProxyGotBlocked() {
        BrowserSession session = pool.acquire();
        pool.release(session, SessionOutcome.SUCCESS);
        when(proxyRotator.isUsable("http://p:1")).thenReturn(false);

        BrowserSession next = pool.acquire();

        assertThat(session.isClosed()).isTrue();
        assertThat(next).isNotSameAs(session);
    }

    @Test
    public void shouldPropagateProxyExhaustionAndFreeSlot() {
        when(proxyRotator.select()).thenThrow(new ProxyExhaustedException("no selectable proxy"));

        assertThatThrownBy(pool::acquire).isInstanceOf(ProxyExhaustedException.class);
        assertThat(pool.getActiveSessionCount()).isZero();
    }

    @Test
    public void shouldCloseAllSessionsOnShutdown() {
        BrowserSession idle = pool.acquire();
        BrowserSession busy = pool.acquire();
        pool.release(idle, SessionOutcome.SUCCESS);

        pool.shutdown();

        assertThat(idle.isClosed()).isTrue();
        assertThat(busy.isClosed()).isTrue();
        assertThatThrownBy(pool::acquire).isInstanceOf(IllegalStateException.class);
    }

}
