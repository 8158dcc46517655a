package net.spookly.stateprox.route;

import net.spookly.stateprox.session.SessionStateCodec;

/**
 * Combines the filter level codec with a route's policy. Immutable and shared.
 */
public final class RouteSessionResolver {
    private final EffectiveSessionPolicy inherited;

    /**
     * @param globalCodec filter level codec, or {@code null} when only route overrides enable sessions
     */
    public RouteSessionResolver(SessionStateCodec globalCodec) {
        this.inherited = globalCodec == null
                ? EffectiveSessionPolicy.inactive(RoutePolicy.Kind.INHERIT)
                : EffectiveSessionPolicy.active(globalCodec, RoutePolicy.Kind.INHERIT);
    }

    /**
     * Resolve the policy for the matched route. A request without a route gets the filter default.
     */
    public EffectiveSessionPolicy resolve(Route route) {
        RoutePolicy policy = route == null ? RoutePolicy.inherit() : route.sessionPolicy();
        switch (policy.kind()) {
            case DISABLED:
                return EffectiveSessionPolicy.INACTIVE;
            case OVERRIDE:
                return EffectiveSessionPolicy.active(policy.override(), RoutePolicy.Kind.OVERRIDE);
            case INHERIT:
                return inherited;
            default:
                throw new IllegalStateException("Unhandled route policy: " + policy.kind());
        }
    }
}
