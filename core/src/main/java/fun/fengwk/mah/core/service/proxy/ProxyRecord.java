package fun.fengwk.mah.core.service.proxy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound network identity tracked by {@link ProxyRotator}.
 *
 * <p>Instances handed out by the rotator are snapshots, mutating them has no effect on rotation.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProxyRecord {

    public static final String DIRECT_ID = "direct";

    /**
     * Stable identity, the server address or {@link #DIRECT_ID}.
     */
    private String id;

    /**
     * Proxy server, for example http://host:port. Null for direct connections.
     */
    private String address;

    private String username;

    private String password;

    @Builder.Default
    private ProxyHealthState healthState = ProxyHealthState.HEALTHY;

    private Instant lastFailureAt;

    private int consecutiveFailures;

    private long successCount;

    private long failureCount;

    /**
     * Set while a blocked proxy is handed out as a cooldown probe and awaits its report.
     */
    private Instant probeStartedAt;

    public boolean isProbing() {
        return probeStartedAt != null;
    }

    public boolean isDirect() {
        return address == null;
    }

    /**
     * Success ratio, 0.5 for a proxy without history.
     */
    public double reliability() {
        long total = successCount + failureCount;
        if (total == 0) {
            return 0.5;
        }
        return (double) successCount / total;
    }

    public static ProxyRecord direct() {
        return ProxyRecord.builder().id(DIRECT_ID).build();
    }

}
