package net.spookly.stateprox.balancer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.stateprox.config.StateproxConfig;
import net.spookly.stateprox.session.BackendAddress;

/**
 * Holds the clusters built from config, keyed by name.
 */
public final class ClusterManager {
    private final Map<String, Cluster> clusters;

    public ClusterManager(Collection<Cluster> clusters) {
        Map<String, Cluster> byName = new LinkedHashMap<>();
        if (clusters != null) {
            for (Cluster cluster : clusters) {
                byName.put(cluster.name(), cluster);
            }
        }
        this.clusters = Map.copyOf(byName);
    }

    /**
     * Build clusters from validated config.
     */
    public static ClusterManager fromConfig(StateproxConfig config) {
        List<Cluster> clusters = new ArrayList<>();
        if (config != null && config.clusters != null) {
            for (Map.Entry<String, StateproxConfig.ClusterConfig> entry : config.clusters.entrySet()) {
                StateproxConfig.ClusterConfig cluster = entry.getValue();
                if (cluster == null) {
                    continue;
                }
                clusters.add(new Cluster(
                        entry.getKey(),
                        LbPolicy.fromConfig(cluster.policy),
                        overrideStatuses(cluster.overrideHostStatus),
                        endpoints(entry.getKey(), cluster.endpoints),
                        cluster.health == null ? null : cluster.health.intervalSeconds,
                        cluster.health == null ? null : cluster.health.timeoutMs
                ));
            }
        }
        return new ClusterManager(clusters);
    }

    /**
     * Cluster by name, or {@code null}.
     */
    public Cluster get(String name) {
        return name == null ? null : clusters.get(name);
    }

    public Collection<Cluster> clusters() {
        return clusters.values();
    }

    private static Set<HealthStatus> overrideStatuses(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Set<HealthStatus> statuses = EnumSet.noneOf(HealthStatus.class);
        for (String value : raw) {
            HealthStatus status = HealthStatus.fromConfig(value);
            if (status != null) {
                statuses.add(status);
            }
        }
        return statuses;
    }

    private static List<Endpoint> endpoints(String cluster, List<StateproxConfig.EndpointConfig> raw) {
        if (raw == null) {
            return List.of();
        }
        List<Endpoint> endpoints = new ArrayList<>(raw.size());
        for (StateproxConfig.EndpointConfig endpoint : raw) {
            if (endpoint == null) {
                continue;
            }
            BackendAddress address = BackendAddress.of(endpoint.host.trim(), endpoint.port);
            String id = endpoint.id == null || endpoint.id.isBlank() ? address.toString() : endpoint.id;
            int weight = endpoint.weight == null || endpoint.weight <= 0 ? 1 : endpoint.weight;
            endpoints.add(new Endpoint(id, cluster, address, weight));
        }
        return endpoints;
    }
}
