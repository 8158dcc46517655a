package net.spookly.stateprox.config;

import java.util.List;
import java.util.Map;

/**
 * Raw configuration tree bound from YAML. Keys are snake_case on disk.
 */
public class StateproxConfig {
    public ProxyConfig proxy;
    public StatefulSessionConfig statefulSession;
    public List<RouteConfig> routes;
    public Map<String, ClusterConfig> clusters;
    public ObservabilityConfig observability;

    public static class ProxyConfig {
        /**
         * Listen address in {@code host:port} form.
         */
        public String listen;
        public TimeoutsConfig timeouts;
        public Integer maxRequestBytes;
    }

    public static class TimeoutsConfig {
        public Integer connectMs;
        public Integer requestMs;
    }

    /**
     * Filter level session configuration, also reused inside a route override.
     */
    public static class StatefulSessionConfig {
        public SessionStateConfig sessionState;
    }

    public static class SessionStateConfig {
        /**
         * Codec type tag: {@code cookie} or {@code header}.
         */
        public String codec;
        public CookieConfig cookie;
        public HeaderConfig header;
    }

    public static class CookieConfig {
        public String name;
        public String path;
        /**
         * Cookie lifetime such as {@code 120s}; zero or absent yields a browser session cookie.
         */
        public String ttl;
        public Boolean secure;
    }

    public static class HeaderConfig {
        public String name;
    }

    public static class RouteConfig {
        public String name;
        public MatchConfig match;
        public String cluster;
        public PerRouteSessionConfig statefulSession;
    }

    public static class MatchConfig {
        public String authority;
        public String pathPrefix;
    }

    /**
     * Per-route session policy: either {@code disabled: true} or a nested override.
     */
    public static class PerRouteSessionConfig {
        public Boolean disabled;
        public StatefulSessionConfig statefulSession;
    }

    public static class ClusterConfig {
        public String policy;
        public List<String> overrideHostStatus;
        public List<EndpointConfig> endpoints;
        public HealthConfig health;
    }

    public static class EndpointConfig {
        public String id;
        public String host;
        public Integer port;
        public Integer weight;
    }

    public static class HealthConfig {
        public Integer intervalSeconds;
        public Integer timeoutMs;
    }

    public static class ObservabilityConfig {
        public LoggingConfig logging;
    }

    public static class LoggingConfig {
        public Boolean sessionEvents;
    }
}
