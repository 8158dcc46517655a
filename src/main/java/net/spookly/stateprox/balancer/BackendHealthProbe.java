package net.spookly.stateprox.balancer;

import java.util.concurrent.CompletableFuture;

/**
 * Executes an active probe against a backend to determine reachability.
 */
public interface BackendHealthProbe extends AutoCloseable {
    /**
     * Probe the backend and complete with true when the probe succeeds.
     */
    CompletableFuture<Boolean> probe(Endpoint endpoint, int timeoutMs);

    @Override
    default void close() {
    }
}
