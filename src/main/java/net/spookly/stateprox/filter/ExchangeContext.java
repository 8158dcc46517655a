package net.spookly.stateprox.filter;

import java.util.Optional;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.balancer.Endpoint;
import net.spookly.stateprox.balancer.LoadBalancerContext;
import net.spookly.stateprox.balancer.OverrideHint;
import net.spookly.stateprox.route.Route;

/**
 * Processing context of a single HTTP exchange. Created when the request arrives and dropped
 * when the response is written; never shared between requests.
 */
public final class ExchangeContext implements LoadBalancerContext {
    @Getter
    @Accessors(fluent = true)
    private final Route route;
    @Getter
    @Accessors(fluent = true)
    private final SessionFilterState sessionState = new SessionFilterState();
    private OverrideHint overrideHint;
    private Endpoint selectedBackend;
    private boolean upstreamFailed;

    public ExchangeContext(Route route) {
        this.route = route;
    }

    @Override
    public Optional<OverrideHint> overrideHint() {
        return Optional.ofNullable(overrideHint);
    }

    /**
     * Attach the preferred backend for this request. Write-once.
     */
    public void publishOverrideHint(OverrideHint hint) {
        if (this.overrideHint != null) {
            throw new IllegalStateException("Override hint already published");
        }
        this.overrideHint = hint;
    }

    /**
     * Backend that served the request, or {@code null} before selection or when none was found.
     */
    public Endpoint selectedBackend() {
        return selectedBackend;
    }

    /**
     * Record the backend the balancer picked. Set once per request.
     */
    public void selectBackend(Endpoint endpoint) {
        if (this.selectedBackend != null) {
            throw new IllegalStateException("Backend already selected: " + selectedBackend.address());
        }
        this.selectedBackend = endpoint;
    }

    /**
     * True when the selected backend could not produce a response and the proxy answered locally.
     */
    public boolean upstreamFailed() {
        return upstreamFailed;
    }

    public void markUpstreamFailed() {
        this.upstreamFailed = true;
    }
}
