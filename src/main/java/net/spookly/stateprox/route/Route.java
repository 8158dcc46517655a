package net.spookly.stateprox.route;

import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable routing rule: request match, target cluster and session policy.
 */
@Getter
@Accessors(fluent = true)
public final class Route {
    private final String name;
    /**
     * Host to match without port, lowercase; {@code null} matches any authority.
     */
    private final String authority;
    private final String pathPrefix;
    private final String cluster;
    private final RoutePolicy sessionPolicy;

    public Route(String name, String authority, String pathPrefix, String cluster, RoutePolicy sessionPolicy) {
        this.name = name;
        this.authority = authority == null || authority.isBlank() ? null : stripPort(authority.trim().toLowerCase());
        this.pathPrefix = pathPrefix == null || pathPrefix.isBlank() ? "/" : pathPrefix;
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.sessionPolicy = sessionPolicy == null ? RoutePolicy.inherit() : sessionPolicy;
    }

    /**
     * True when the request authority and path match this route.
     */
    public boolean matches(String requestAuthority, String path) {
        if (authority != null) {
            if (requestAuthority == null) {
                return false;
            }
            if (!authority.equals(stripPort(requestAuthority.trim().toLowerCase()))) {
                return false;
            }
        }
        String requestPath = path == null || path.isEmpty() ? "/" : path;
        return requestPath.startsWith(pathPrefix);
    }

    static String stripPort(String authority) {
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            return close < 0 ? authority : authority.substring(0, close + 1);
        }
        int colon = authority.indexOf(':');
        return colon < 0 ? authority : authority.substring(0, colon);
    }
}
