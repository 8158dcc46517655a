package net.spookly.stateprox.balancer;

import java.util.Optional;

/**
 * Decides whether a request's override hint can be honoured against the current cluster view.
 * An empty result is not an error; the balancer then runs its default algorithm.
 * Implementations must not block.
 */
@FunctionalInterface
public interface HostOverrideSelector {
    HostOverrideSelector NONE = (hint, snapshot) -> Optional.empty();

    Optional<Endpoint> select(OverrideHint hint, ClusterSnapshot snapshot);
}
