package net.spookly.stateprox.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("config").resolve("stateprox.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("stateful_session:"));
        assertTrue(content.contains(ConfigDefaults.DEFAULT_COOKIE_NAME));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void generatedDefaultLoadsCleanly(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("stateprox.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8);

        StateproxConfig config = ConfigLoader.load(configPath);

        assertEquals("0.0.0.0:10000", config.proxy.listen);
        assertEquals("cookie", config.statefulSession.sessionState.codec);
        assertEquals("3600s", config.statefulSession.sessionState.cookie.ttl);
        assertEquals(2, config.clusters.get("backend").endpoints.size());
        assertEquals("default", config.routes.get(0).name);
    }

    @Test
    void bindsSnakeCaseRouteOverrides() {
        StateproxConfig config = ConfigLoader.parse("""
                proxy:
                  listen: 127.0.0.1:10000
                stateful_session:
                  session_state:
                    codec: cookie
                    cookie: { name: global-session-cookie, path: /path, ttl: 120s }
                routes:
                  - name: disabled
                    match: { path_prefix: /disabled }
                    cluster: cluster_0
                    stateful_session: { disabled: true }
                  - name: override
                    match: { path_prefix: /override }
                    cluster: cluster_0
                    stateful_session:
                      stateful_session:
                        session_state:
                          codec: cookie
                          cookie: { name: route-session-cookie, path: /path, ttl: 120s }
                clusters:
                  cluster_0:
                    override_host_status: [healthy]
                    endpoints:
                      - { host: 127.0.0.1, port: 50001 }
                """, null);

        assertEquals("/path", config.statefulSession.sessionState.cookie.path);
        assertEquals(Boolean.TRUE, config.routes.get(0).statefulSession.disabled);
        assertNull(config.routes.get(0).statefulSession.statefulSession);
        assertEquals("route-session-cookie",
                config.routes.get(1).statefulSession.statefulSession.sessionState.cookie.name);
        assertEquals("healthy", config.clusters.get("cluster_0").overrideHostStatus.get(0));
    }

    @Test
    void expandsPathValuesRelativeToConfig(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("cookie-name"), "from-file\n", StandardCharsets.UTF_8);
        Path configPath = tempDir.resolve("stateprox.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml(10000, "path:cookie-name"), StandardCharsets.UTF_8);

        StateproxConfig config = ConfigLoader.load(configPath);

        assertEquals("from-file", config.statefulSession.sessionState.cookie.name);
    }

    @Test
    void bundledExampleIsValid(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("stateprox.yaml");
        try (InputStream example = ConfigLoaderTest.class.getResourceAsStream("/stateprox-example.yaml")) {
            assertNotNull(example);
            Files.copy(example, configPath);
        }

        StateproxConfig config = ConfigLoader.load(configPath);

        assertEquals(4, config.routes.size());
        assertEquals("header", config.routes.get(2).statefulSession.statefulSession.sessionState.codec);
        assertEquals("fd00::13", config.clusters.get("cluster_0").endpoints.get(2).host);
        assertTrue(ConfigWarnings.collect(config).isEmpty());
    }

    @Test
    void rejectsUnknownProperties() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.parse(
                ConfigDefaults.defaultYaml() + "\nunknown_section: true\n", null));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void rejectsEmptyDocument() {
        assertThrows(ConfigException.class, () -> ConfigLoader.parse("", null));
    }
}
