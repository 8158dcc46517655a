package net.spookly.stateprox.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects non-fatal configuration warnings, such as session cookies sent without {@code Secure}.
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(StateproxConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        String globalCookie = null;
        if (config.statefulSession != null) {
            StateproxConfig.SessionStateConfig global = config.statefulSession.sessionState;
            warnOnSessionState(warnings, global, "stateful_session.session_state");
            if (global != null && global.cookie != null && "cookie".equalsIgnoreCase(trim(global.codec))) {
                globalCookie = global.cookie.name;
            }
        }
        if (config.routes == null) {
            return warnings;
        }
        for (int i = 0; i < config.routes.size(); i++) {
            StateproxConfig.RouteConfig route = config.routes.get(i);
            if (route == null || route.statefulSession == null || route.statefulSession.statefulSession == null) {
                continue;
            }
            String field = "routes[" + i + "].stateful_session.stateful_session.session_state";
            StateproxConfig.SessionStateConfig override = route.statefulSession.statefulSession.sessionState;
            warnOnSessionState(warnings, override, field);
            if (globalCookie != null && override != null && override.cookie != null
                    && globalCookie.equals(override.cookie.name)) {
                warnings.add(field + ".cookie.name reuses the global cookie name " + globalCookie
                        + "; clients will share one token across both scopes");
            }
        }
        return warnings;
    }

    private static void warnOnSessionState(List<String> warnings,
                                           StateproxConfig.SessionStateConfig state,
                                           String field) {
        if (state == null || state.cookie == null || !"cookie".equalsIgnoreCase(trim(state.codec))) {
            return;
        }
        StateproxConfig.CookieConfig cookie = state.cookie;
        if (Boolean.FALSE.equals(cookie.secure)) {
            warnings.add(field + ".cookie.secure is false; the session cookie will be sent over plain HTTP");
        }
        Duration ttl;
        try {
            ttl = ConfigDurations.parse(cookie.ttl, field + ".cookie.ttl");
        } catch (ConfigException ignored) {
            // reported by the validator
            return;
        }
        if (ttl.isZero()) {
            warnings.add(field + ".cookie.ttl is zero; the session cookie lasts only for the browser session");
        }
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
