package net.spookly.stateprox.balancer;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Backend selection outcome for a request.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class SelectionResult {
    public static final String OVERRIDE_HOST = "override_host";
    public static final String SELECTED = "selected";
    public static final String NO_ENDPOINTS = "no_endpoints";
    public static final String NO_CLUSTER = "no_cluster";

    private final String cluster;
    private final Endpoint endpoint;
    private final String reason;

    public boolean isOverride() {
        return OVERRIDE_HOST.equals(reason);
    }
}
