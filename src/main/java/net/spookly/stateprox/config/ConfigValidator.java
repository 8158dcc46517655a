package net.spookly.stateprox.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.stateprox.session.BackendAddress;
import net.spookly.stateprox.util.ListenAddress;

public final class ConfigValidator {
    private static final String[] CLUSTER_POLICIES = {"round_robin", "weighted", "least_request", "random"};
    private static final String[] HOST_STATUSES = {"healthy", "degraded", "unhealthy"};
    private static final String[] SESSION_CODECS = {"cookie", "header"};

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(StateproxConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateProxy(config, errors);
        if (config.statefulSession != null) {
            validateSessionState(config.statefulSession.sessionState, "stateful_session.session_state", errors);
        }
        validateClusters(config, errors);
        validateRoutes(config, errors);

        throwIfErrors(errors);
    }

    private static void validateProxy(StateproxConfig config, List<String> errors) {
        StateproxConfig.ProxyConfig proxy = config.proxy;
        if (proxy == null) {
            errors.add("proxy section is required");
            return;
        }
        if (isBlank(proxy.listen)) {
            errors.add("proxy.listen is required");
        } else {
            try {
                ListenAddress listen = ListenAddress.parse(proxy.listen);
                if (listen.port() == 0) {
                    errors.add("proxy.listen port must be between 1 and 65535");
                }
            } catch (IllegalArgumentException e) {
                errors.add("proxy.listen " + e.getMessage());
            }
        }
        if (proxy.timeouts != null) {
            requirePositive(errors, proxy.timeouts.connectMs, "proxy.timeouts.connect_ms");
            requirePositive(errors, proxy.timeouts.requestMs, "proxy.timeouts.request_ms");
        }
        if (proxy.maxRequestBytes != null && proxy.maxRequestBytes <= 0) {
            errors.add("proxy.max_request_bytes must be greater than 0");
        }
    }

    private static void validateSessionState(StateproxConfig.SessionStateConfig state,
                                             String field,
                                             List<String> errors) {
        if (state == null) {
            errors.add(field + " is required");
            return;
        }
        requireNonBlank(errors, state.codec, field + ".codec");
        if (!isBlank(state.codec) && !isOneOf(state.codec, SESSION_CODECS)) {
            errors.add(field + ".codec must be cookie or header");
            return;
        }
        if (isOneOf(state.codec, "cookie")) {
            StateproxConfig.CookieConfig cookie = state.cookie;
            if (cookie == null) {
                errors.add(field + ".cookie is required when codec is cookie");
                return;
            }
            requireNonBlank(errors, cookie.name, field + ".cookie.name");
            if (!isBlank(cookie.name) && !isToken(cookie.name)) {
                errors.add(field + ".cookie.name must be a valid cookie name: " + cookie.name);
            }
            if (!isBlank(cookie.path) && !cookie.path.startsWith("/")) {
                errors.add(field + ".cookie.path must start with '/'");
            }
            if (!isBlank(cookie.path) && containsControlOrSemicolon(cookie.path)) {
                errors.add(field + ".cookie.path must not contain ';' or control characters");
            }
            try {
                ConfigDurations.parse(cookie.ttl, field + ".cookie.ttl");
            } catch (ConfigException e) {
                errors.add(e.getMessage());
            }
        } else if (isOneOf(state.codec, "header")) {
            StateproxConfig.HeaderConfig header = state.header;
            if (header == null) {
                errors.add(field + ".header is required when codec is header");
                return;
            }
            requireNonBlank(errors, header.name, field + ".header.name");
            if (!isBlank(header.name) && !isToken(header.name.trim())) {
                errors.add(field + ".header.name must be a valid header name: " + header.name);
            }
        }
    }

    private static void validateRoutes(StateproxConfig config, List<String> errors) {
        if (config.routes == null || config.routes.isEmpty()) {
            errors.add("routes must include at least one route");
            return;
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < config.routes.size(); i++) {
            StateproxConfig.RouteConfig route = config.routes.get(i);
            String field = "routes[" + i + "]";
            if (route == null) {
                errors.add(field + " is required");
                continue;
            }
            if (!isBlank(route.name) && !names.add(route.name)) {
                errors.add("route name must be unique: " + route.name);
            }
            requireNonBlank(errors, route.cluster, field + ".cluster");
            if (!isBlank(route.cluster) && (config.clusters == null || !config.clusters.containsKey(route.cluster))) {
                errors.add(field + ".cluster must reference an existing cluster: " + route.cluster);
            }
            if (route.match != null && !isBlank(route.match.pathPrefix) && !route.match.pathPrefix.startsWith("/")) {
                errors.add(field + ".match.path_prefix must start with '/'");
            }
            validatePerRoute(route.statefulSession, field + ".stateful_session", errors);
        }
    }

    private static void validatePerRoute(StateproxConfig.PerRouteSessionConfig perRoute,
                                         String field,
                                         List<String> errors) {
        if (perRoute == null) {
            return;
        }
        boolean disabled = isTrue(perRoute.disabled);
        boolean override = perRoute.statefulSession != null;
        if (disabled && override) {
            errors.add(field + " must set only one of disabled or stateful_session");
            return;
        }
        if (!disabled && !override) {
            errors.add(field + " must set disabled: true or stateful_session");
            return;
        }
        if (override) {
            validateSessionState(perRoute.statefulSession.sessionState, field + ".stateful_session.session_state", errors);
        }
    }

    private static void validateClusters(StateproxConfig config, List<String> errors) {
        if (config.clusters == null || config.clusters.isEmpty()) {
            errors.add("clusters must include at least one cluster");
            return;
        }
        for (Map.Entry<String, StateproxConfig.ClusterConfig> entry : config.clusters.entrySet()) {
            String name = entry.getKey();
            String field = "clusters." + name;
            StateproxConfig.ClusterConfig cluster = entry.getValue();
            if (cluster == null) {
                errors.add(field + " is required");
                continue;
            }
            if (!isBlank(cluster.policy) && !isOneOf(cluster.policy, CLUSTER_POLICIES)) {
                errors.add(field + ".policy must be one of: round_robin, weighted, least_request, random");
            }
            if (cluster.overrideHostStatus != null) {
                if (cluster.overrideHostStatus.isEmpty()) {
                    errors.add(field + ".override_host_status must include at least one status");
                }
                for (String status : cluster.overrideHostStatus) {
                    if (!isOneOf(status, HOST_STATUSES)) {
                        errors.add(field + ".override_host_status must contain healthy, degraded or unhealthy");
                    }
                }
            }
            if (cluster.endpoints == null || cluster.endpoints.isEmpty()) {
                errors.add(field + ".endpoints must include at least one endpoint");
            } else {
                validateEndpoints(cluster.endpoints, field, errors);
            }
            if (cluster.health != null) {
                requirePositive(errors, cluster.health.intervalSeconds, field + ".health.interval_seconds");
                requirePositive(errors, cluster.health.timeoutMs, field + ".health.timeout_ms");
            }
        }
    }

    private static void validateEndpoints(List<StateproxConfig.EndpointConfig> endpoints,
                                          String field,
                                          List<String> errors) {
        Set<BackendAddress> addresses = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (StateproxConfig.EndpointConfig endpoint : endpoints) {
            if (endpoint == null) {
                continue;
            }
            requireNonBlank(errors, endpoint.host, field + ".endpoints.host");
            requirePort(errors, endpoint.port, field + ".endpoints.port");
            if (endpoint.weight != null && endpoint.weight <= 0) {
                errors.add(field + ".endpoints.weight must be greater than 0");
            }
            if (!isBlank(endpoint.id) && !ids.add(endpoint.id)) {
                errors.add(field + " endpoint id must be unique: " + endpoint.id);
            }
            if (isBlank(endpoint.host) || endpoint.port == null || endpoint.port < 1 || endpoint.port > 65535) {
                continue;
            }
            try {
                BackendAddress address = BackendAddress.of(endpoint.host.trim(), endpoint.port);
                if (!addresses.add(address)) {
                    errors.add(field + " endpoint address must be unique: " + address);
                }
            } catch (IllegalArgumentException e) {
                errors.add(field + ".endpoints.host must be an IP literal: " + endpoint.host);
            }
        }
    }

    private static boolean isToken(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c <= 0x20 || c >= 0x7f) {
                return false;
            }
            if ("()<>@,;:\\\"/[]?={}".indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsControlOrSemicolon(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c == 0x7f || c == ';') {
                return true;
            }
        }
        return false;
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.trim().equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
