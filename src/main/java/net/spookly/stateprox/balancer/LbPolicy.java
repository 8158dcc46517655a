package net.spookly.stateprox.balancer;

/**
 * Default backend selection algorithm of a cluster.
 */
public enum LbPolicy {
    ROUND_ROBIN("round_robin"),
    WEIGHTED("weighted"),
    LEAST_REQUEST("least_request"),
    RANDOM("random");

    private final String configValue;

    LbPolicy(String configValue) {
        this.configValue = configValue;
    }

    public static LbPolicy fromConfig(String value) {
        if (value == null) {
            return ROUND_ROBIN;
        }
        for (LbPolicy policy : values()) {
            if (policy.configValue.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        return ROUND_ROBIN;
    }
}
