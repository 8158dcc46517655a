package net.spookly.stateprox.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default Stateprox config.
            proxy:
              listen: 0.0.0.0:%d
              timeouts:
                connect_ms: 5000
                request_ms: 30000
              max_request_bytes: 1048576

            stateful_session:
              session_state:
                codec: cookie
                cookie:
                  name: %s
                  path: /
                  ttl: 3600s
                  secure: true

            routes:
              - name: default
                match:
                  path_prefix: /
                cluster: backend

            clusters:
              backend:
                policy: round_robin
                endpoints:
                  - host: 127.0.0.1
                    port: 8081
                  - host: 127.0.0.1
                    port: 8082
                health:
                  interval_seconds: 5
                  timeout_ms: 1000

            observability:
              logging:
                session_events: false
            """;

    public static final int DEFAULT_LISTEN_PORT = 10000;
    public static final String DEFAULT_COOKIE_NAME = "stateprox-session";

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return defaultYaml(DEFAULT_LISTEN_PORT, DEFAULT_COOKIE_NAME);
    }

    static String defaultYaml(int listenPort, String cookieName) {
        if (cookieName == null || cookieName.isBlank()) {
            throw new ConfigException("Cookie name is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(listenPort, cookieName);
    }
}
