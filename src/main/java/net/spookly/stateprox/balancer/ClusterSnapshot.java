package net.spookly.stateprox.balancer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.session.BackendAddress;

/**
 * Point-in-time view of a cluster's members and their health, taken without locking.
 */
@Getter
@Accessors(fluent = true)
public final class ClusterSnapshot {
    private final String cluster;
    private final List<Endpoint> endpoints;
    private final List<Endpoint> healthy;
    private final Set<HealthStatus> overrideStatuses;
    private final Map<BackendAddress, Endpoint> byAddress;
    private final Map<Endpoint, HealthStatus> statuses;

    ClusterSnapshot(String cluster,
                    List<Endpoint> endpoints,
                    BackendHealthTracker healthTracker,
                    Set<HealthStatus> overrideStatuses) {
        this.cluster = cluster;
        this.endpoints = endpoints;
        this.overrideStatuses = overrideStatuses;
        Map<BackendAddress, Endpoint> addresses = new HashMap<>();
        Map<Endpoint, HealthStatus> health = new IdentityHashMap<>();
        List<Endpoint> eligible = new ArrayList<>(endpoints.size());
        for (Endpoint endpoint : endpoints) {
            addresses.putIfAbsent(endpoint.address(), endpoint);
            HealthStatus status = healthTracker == null ? HealthStatus.HEALTHY : healthTracker.status(endpoint);
            health.put(endpoint, status);
            if (status != HealthStatus.UNHEALTHY) {
                eligible.add(endpoint);
            }
        }
        this.byAddress = addresses;
        this.statuses = health;
        this.healthy = Collections.unmodifiableList(eligible);
    }

    /**
     * Member with the given address, or {@code null}.
     */
    public Endpoint find(BackendAddress address) {
        return address == null ? null : byAddress.get(address);
    }

    public HealthStatus status(Endpoint endpoint) {
        HealthStatus status = statuses.get(endpoint);
        return status == null ? HealthStatus.UNHEALTHY : status;
    }

    public boolean isEmpty() {
        return endpoints.isEmpty();
    }
}
