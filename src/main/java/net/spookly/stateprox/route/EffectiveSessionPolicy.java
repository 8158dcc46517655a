package net.spookly.stateprox.route;

import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.session.SessionStateCodec;

/**
 * Session policy in force for one request after route and filter config are combined.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EffectiveSessionPolicy {
    public static final EffectiveSessionPolicy INACTIVE = new EffectiveSessionPolicy(null, RoutePolicy.Kind.DISABLED);

    private final SessionStateCodec codec;
    private final RoutePolicy.Kind source;

    static EffectiveSessionPolicy inactive(RoutePolicy.Kind source) {
        return source == RoutePolicy.Kind.DISABLED ? INACTIVE : new EffectiveSessionPolicy(null, source);
    }

    static EffectiveSessionPolicy active(SessionStateCodec codec, RoutePolicy.Kind source) {
        return new EffectiveSessionPolicy(Objects.requireNonNull(codec, "codec"), source);
    }

    public boolean isActive() {
        return codec != null;
    }
}
