package fun.fengwk.mah.core.service.discovery.model;

import java.util.Locale;

/**
 * Discovery strategies a job can be submitted with.
 *
 * @author fengwk
 */
public enum StrategyType {

    SERIES,
    HISTORY,
    DISCOVER;

    public static StrategyType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown strategy: " + value, ex);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

}
