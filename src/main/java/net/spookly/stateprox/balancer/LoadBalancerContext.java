package net.spookly.stateprox.balancer;

import java.util.Optional;

/**
 * Request scoped view the balancer reads while choosing a backend.
 */
public interface LoadBalancerContext {
    LoadBalancerContext EMPTY = Optional::empty;

    /**
     * Backend preferred for this request, if any. Read-only to the balancer.
     */
    Optional<OverrideHint> overrideHint();
}
