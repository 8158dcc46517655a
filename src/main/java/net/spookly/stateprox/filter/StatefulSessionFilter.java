package net.spookly.stateprox.filter;

import java.time.Instant;
import java.util.Optional;

import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import net.spookly.stateprox.balancer.Endpoint;
import net.spookly.stateprox.balancer.OverrideHint;
import net.spookly.stateprox.route.EffectiveSessionPolicy;
import net.spookly.stateprox.route.RouteSessionResolver;
import net.spookly.stateprox.session.BackendAddress;

/**
 * Pins clients to the backend that last served them.
 *
 * <p>On the request path the route's session policy is resolved and any client token is turned
 * into an {@link OverrideHint} for the balancer. On the response path a fresh token is written
 * only when the request carried none or carried one for a different backend. A hint the client
 * already holds is never re-sent, and no token is issued for a backend that failed to answer.</p>
 *
 * <p>The filter is stateless and shared across requests; all per-request state lives in
 * {@link ExchangeContext#sessionState()}.</p>
 */
public final class StatefulSessionFilter implements HttpFilter {
    private final RouteSessionResolver resolver;
    private final SessionEventListener listener;

    public StatefulSessionFilter(RouteSessionResolver resolver, SessionEventListener listener) {
        this.resolver = resolver;
        this.listener = listener == null ? SessionEventListener.NOOP : listener;
    }

    public StatefulSessionFilter(RouteSessionResolver resolver) {
        this(resolver, SessionEventListener.NOOP);
    }

    @Override
    public void onRequestHeaders(ExchangeContext exchange, HttpRequest request) {
        SessionFilterState state = exchange.sessionState();
        if (state.phase() != SessionPhase.INIT) {
            return;
        }
        EffectiveSessionPolicy policy = resolver.resolve(exchange.route());
        state.policyResolved(policy);
        if (!policy.isActive()) {
            state.inactive();
            return;
        }
        Optional<BackendAddress> pinned = policy.codec().decode(request.headers());
        OverrideHint hint = pinned.map(OverrideHint::new).orElse(null);
        if (hint != null) {
            exchange.publishOverrideHint(hint);
        }
        state.hintExtracted(hint);
    }

    @Override
    public void onResponseHeaders(ExchangeContext exchange, HttpResponse response) {
        SessionFilterState state = exchange.sessionState();
        switch (state.phase()) {
            case INACTIVE:
                state.done();
                emit(exchange, SessionEventType.SKIPPED, null, null);
                return;
            case HINT_EXTRACTED:
                break;
            default:
                // never ran the request path, or already answered
                return;
        }
        Endpoint selected = exchange.selectedBackend();
        if (selected == null || exchange.upstreamFailed()) {
            state.done();
            return;
        }
        state.backendSelected(selected);
        OverrideHint hint = state.hint();
        BackendAddress hinted = hint == null ? null : hint.address();
        if (selected.address().equals(hinted)) {
            state.responseEmitted(false);
            state.done();
            emit(exchange, SessionEventType.HONORED, hinted, selected);
            return;
        }
        state.policy().codec().encode(selected.address(), response.headers());
        state.responseEmitted(true);
        state.done();
        emit(exchange,
                hinted == null ? SessionEventType.ISSUED : SessionEventType.REISSUED,
                hinted,
                selected);
    }

    private void emit(ExchangeContext exchange,
                      SessionEventType type,
                      BackendAddress hinted,
                      Endpoint selected) {
        EffectiveSessionPolicy policy = exchange.sessionState().policy();
        listener.onEvent(new SessionEvent(
                type,
                Instant.now(),
                exchange.route() == null ? null : exchange.route().name(),
                exchange.route() == null ? null : exchange.route().cluster(),
                policy == null || !policy.isActive() ? null : policy.codec().type(),
                hinted == null ? null : hinted.toString(),
                selected == null ? null : selected.address().toString(),
                policy == null ? null : policy.source().name().toLowerCase()
        ));
    }
}
