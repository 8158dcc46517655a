package net.spookly.stateprox.balancer;

/**
 * Coarse health of a cluster member derived from its health score.
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String configValue;

    HealthStatus(String configValue) {
        this.configValue = configValue;
    }

    public static HealthStatus fromConfig(String value) {
        if (value == null) {
            return null;
        }
        for (HealthStatus status : values()) {
            if (status.configValue.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
