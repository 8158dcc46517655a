package net.spookly.stateprox.route;

import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.config.StateproxConfig;
import net.spookly.stateprox.session.SessionStateCodec;
import net.spookly.stateprox.session.SessionStateCodecs;

/**
 * Session policy attached to one route: inherit the filter config, disable session logic,
 * or replace the filter config wholesale.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RoutePolicy {
    private static final RoutePolicy INHERIT = new RoutePolicy(Kind.INHERIT, null);
    private static final RoutePolicy DISABLED = new RoutePolicy(Kind.DISABLED, null);

    private final Kind kind;
    /**
     * Replacement codec, set only for {@link Kind#OVERRIDE}.
     */
    private final SessionStateCodec override;

    public enum Kind {
        INHERIT,
        DISABLED,
        OVERRIDE
    }

    public static RoutePolicy inherit() {
        return INHERIT;
    }

    public static RoutePolicy disabled() {
        return DISABLED;
    }

    public static RoutePolicy override(SessionStateCodec codec) {
        return new RoutePolicy(Kind.OVERRIDE, Objects.requireNonNull(codec, "codec"));
    }

    /**
     * Map a validated per-route block to a policy. Absent config inherits.
     */
    public static RoutePolicy fromConfig(StateproxConfig.PerRouteSessionConfig config, String field) {
        if (config == null) {
            return INHERIT;
        }
        if (Boolean.TRUE.equals(config.disabled)) {
            return DISABLED;
        }
        if (config.statefulSession != null) {
            return override(SessionStateCodecs.create(
                    config.statefulSession.sessionState,
                    field + ".stateful_session.session_state"
            ));
        }
        return INHERIT;
    }
}
