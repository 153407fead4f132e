package fun.fengwk.mah.core.service.proxy;

/**
 * Health of one outbound network identity.
 *
 * @author fengwk
 */
public enum ProxyHealthState {

    HEALTHY,

    /**
     * At least one recent failure, still selectable with a lower weight.
     */
    DEGRADED,

    /**
     * Excluded from selection until the cooldown elapses and a probe succeeds.
     */
    BLOCKED

}
