package net.spookly.stateprox.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigPrinterTest {
    @Test
    void printsSnakeCaseKeysAndSkipsUnsetValues() {
        StateproxConfig config = ConfigLoader.parse(ConfigDefaults.defaultYaml(), null);

        String yaml = ConfigPrinter.toYaml(config);

        assertTrue(yaml.contains("stateful_session:"));
        assertTrue(yaml.contains("max_request_bytes: 1048576"));
        assertFalse(yaml.contains("null"));
        assertFalse(yaml.contains("statefulSession"));
    }

    @Test
    void printedConfigLoadsBackToTheSameValues() {
        StateproxConfig config = ConfigLoader.parse(ConfigDefaults.defaultYaml(), null);

        StateproxConfig reparsed = ConfigLoader.parse(ConfigPrinter.toYaml(config), null);

        assertEquals(config.proxy.listen, reparsed.proxy.listen);
        assertEquals(config.statefulSession.sessionState.cookie.name, reparsed.statefulSession.sessionState.cookie.name);
    }
}
