package net.spookly.stateprox.balancer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks a backend for a request. An override hint is tried first; when it cannot be honoured
 * the cluster's default policy runs over the healthy members, or over all members when none
 * is healthy.
 */
public final class LoadBalancer {
    private final BackendHealthTracker healthTracker;
    private final EndpointLoadTracker loadTracker;
    private final HostOverrideSelector overrideSelector;
    private final Map<String, AtomicInteger> roundRobinCounters = new ConcurrentHashMap<>();

    public LoadBalancer(BackendHealthTracker healthTracker,
                        EndpointLoadTracker loadTracker,
                        HostOverrideSelector overrideSelector) {
        this.healthTracker = healthTracker;
        this.loadTracker = loadTracker;
        this.overrideSelector = overrideSelector == null ? HostOverrideSelector.NONE : overrideSelector;
    }

    public LoadBalancer(BackendHealthTracker healthTracker) {
        this(healthTracker, new EndpointLoadTracker(), AddressOverrideSelector.INSTANCE);
    }

    /**
     * Choose a backend in {@code cluster} for the request described by {@code context}.
     */
    public SelectionResult choose(Cluster cluster, LoadBalancerContext context) {
        if (cluster == null) {
            return new SelectionResult(null, null, SelectionResult.NO_CLUSTER);
        }
        ClusterSnapshot snapshot = cluster.snapshot(healthTracker);
        if (snapshot.isEmpty()) {
            return new SelectionResult(cluster.name(), null, SelectionResult.NO_ENDPOINTS);
        }
        Optional<OverrideHint> hint = context == null ? Optional.empty() : context.overrideHint();
        if (hint.isPresent()) {
            Optional<Endpoint> override = overrideSelector.select(hint.get(), snapshot);
            if (override.isPresent()) {
                return new SelectionResult(cluster.name(), override.get(), SelectionResult.OVERRIDE_HOST);
            }
        }
        List<Endpoint> candidates = snapshot.healthy().isEmpty() ? snapshot.endpoints() : snapshot.healthy();
        Endpoint selected = select(cluster, candidates);
        if (selected == null) {
            return new SelectionResult(cluster.name(), null, SelectionResult.NO_ENDPOINTS);
        }
        return new SelectionResult(cluster.name(), selected, SelectionResult.SELECTED);
    }

    public EndpointLoadTracker loadTracker() {
        return loadTracker;
    }

    private Endpoint select(Cluster cluster, List<Endpoint> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        switch (cluster.policy()) {
            case WEIGHTED:
                return selectWeightedRandom(candidates);
            case LEAST_REQUEST:
                return selectLeastRequest(candidates);
            case RANDOM:
                return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
            case ROUND_ROBIN:
            default:
                return selectRoundRobin(cluster.name(), candidates);
        }
    }

    private Endpoint selectRoundRobin(String cluster, List<Endpoint> candidates) {
        AtomicInteger counter = roundRobinCounters.computeIfAbsent(cluster, key -> new AtomicInteger());
        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return candidates.get(index);
    }

    private Endpoint selectWeightedRandom(List<Endpoint> candidates) {
        int totalWeight = 0;
        for (Endpoint candidate : candidates) {
            totalWeight += weightFor(candidate);
        }
        if (totalWeight <= 0) {
            return null;
        }
        int target = ThreadLocalRandom.current().nextInt(totalWeight);
        int running = 0;
        for (Endpoint candidate : candidates) {
            running += weightFor(candidate);
            if (target < running) {
                return candidate;
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    /**
     * Power of two choices over in-flight request counts.
     */
    private Endpoint selectLeastRequest(List<Endpoint> candidates) {
        if (candidates.size() == 1 || loadTracker == null) {
            return candidates.get(0);
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int first = random.nextInt(candidates.size());
        int second = random.nextInt(candidates.size() - 1);
        if (second >= first) {
            second++;
        }
        Endpoint a = candidates.get(first);
        Endpoint b = candidates.get(second);
        return loadTracker.activeRequests(b) < loadTracker.activeRequests(a) ? b : a;
    }

    private int weightFor(Endpoint candidate) {
        int baseWeight = Math.max(1, candidate.weight());
        if (healthTracker == null) {
            return baseWeight;
        }
        int adjusted = (baseWeight * healthTracker.score(candidate)) / 100;
        return Math.max(1, adjusted);
    }
}
