package net.spookly.stateprox.proxy;

import java.util.List;
import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.balancer.BackendHealthTracker;
import net.spookly.stateprox.balancer.ClusterManager;
import net.spookly.stateprox.balancer.LoadBalancer;
import net.spookly.stateprox.filter.HttpFilter;
import net.spookly.stateprox.route.RouteTable;

/**
 * Shared, immutable collaborators the data path needs for every exchange.
 */
@Getter
@Accessors(fluent = true)
public final class ProxyRouting {
    private final RouteTable routes;
    private final ClusterManager clusters;
    private final LoadBalancer loadBalancer;
    private final BackendHealthTracker healthTracker;
    private final List<HttpFilter> filters;

    public ProxyRouting(RouteTable routes,
                        ClusterManager clusters,
                        LoadBalancer loadBalancer,
                        BackendHealthTracker healthTracker,
                        List<HttpFilter> filters) {
        this.routes = Objects.requireNonNull(routes, "routes");
        this.clusters = Objects.requireNonNull(clusters, "clusters");
        this.loadBalancer = Objects.requireNonNull(loadBalancer, "loadBalancer");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
