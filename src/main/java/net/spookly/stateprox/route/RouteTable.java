package net.spookly.stateprox.route;

import java.util.ArrayList;
import java.util.List;

import net.spookly.stateprox.config.StateproxConfig;

/**
 * Ordered route list; the first matching route wins.
 */
public final class RouteTable {
    private final List<Route> routes;

    public RouteTable(List<Route> routes) {
        this.routes = routes == null ? List.of() : List.copyOf(routes);
    }

    /**
     * Build routes and their session policies from validated config.
     */
    public static RouteTable fromConfig(StateproxConfig config) {
        List<Route> routes = new ArrayList<>();
        if (config != null && config.routes != null) {
            for (int i = 0; i < config.routes.size(); i++) {
                StateproxConfig.RouteConfig route = config.routes.get(i);
                if (route == null) {
                    continue;
                }
                String name = route.name == null || route.name.isBlank() ? "route-" + i : route.name;
                String field = "routes[" + i + "].stateful_session";
                routes.add(new Route(
                        name,
                        route.match == null ? null : route.match.authority,
                        route.match == null ? null : route.match.pathPrefix,
                        route.cluster,
                        RoutePolicy.fromConfig(route.statefulSession, field)
                ));
            }
        }
        return new RouteTable(routes);
    }

    /**
     * Find the route for a request, or {@code null} when none matches.
     */
    public Route match(String authority, String path) {
        String pathOnly = stripQuery(path);
        for (Route route : routes) {
            if (route.matches(authority, pathOnly)) {
                return route;
            }
        }
        return null;
    }

    public List<Route> routes() {
        return routes;
    }

    private static String stripQuery(String uri) {
        if (uri == null) {
            return "/";
        }
        int query = uri.indexOf('?');
        return query < 0 ? uri : uri.substring(0, query);
    }
}
