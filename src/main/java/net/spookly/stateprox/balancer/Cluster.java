package net.spookly.stateprox.balancer;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Named group of backends with a fixed, immutable member list.
 */
public final class Cluster {
    private static final Set<HealthStatus> DEFAULT_OVERRIDE_STATUSES =
            Set.copyOf(EnumSet.of(HealthStatus.HEALTHY, HealthStatus.DEGRADED));

    @Getter
    @Accessors(fluent = true)
    private final String name;
    @Getter
    @Accessors(fluent = true)
    private final LbPolicy policy;
    @Getter
    @Accessors(fluent = true)
    private final Set<HealthStatus> overrideStatuses;
    @Getter
    @Accessors(fluent = true)
    private final Integer healthIntervalSeconds;
    @Getter
    @Accessors(fluent = true)
    private final Integer healthTimeoutMs;
    private final List<Endpoint> endpoints;

    public Cluster(String name,
                   LbPolicy policy,
                   Set<HealthStatus> overrideStatuses,
                   List<Endpoint> endpoints,
                   Integer healthIntervalSeconds,
                   Integer healthTimeoutMs) {
        this.name = Objects.requireNonNull(name, "name");
        this.policy = policy == null ? LbPolicy.ROUND_ROBIN : policy;
        this.overrideStatuses = overrideStatuses == null || overrideStatuses.isEmpty()
                ? DEFAULT_OVERRIDE_STATUSES
                : Set.copyOf(overrideStatuses);
        this.endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        this.healthIntervalSeconds = healthIntervalSeconds;
        this.healthTimeoutMs = healthTimeoutMs;
    }

    public Cluster(String name, LbPolicy policy, List<Endpoint> endpoints) {
        this(name, policy, null, endpoints, null, null);
    }

    public List<Endpoint> endpoints() {
        return endpoints;
    }

    public boolean hasHealthCheck() {
        return healthIntervalSeconds != null && healthIntervalSeconds > 0;
    }

    /**
     * Read the current members and health without blocking.
     */
    public ClusterSnapshot snapshot(BackendHealthTracker healthTracker) {
        return new ClusterSnapshot(name, endpoints, healthTracker, overrideStatuses);
    }
}
