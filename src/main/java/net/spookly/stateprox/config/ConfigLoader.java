package net.spookly.stateprox.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the Stateprox YAML configuration.
     */
    public static StateproxConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (RuntimeException e) {
            throw new ConfigException("Failed to parse YAML: " + path, e);
        }
        return bind(raw, path.toString(), path.getParent());
    }

    /**
     * Parse and validate configuration from an in-memory YAML document.
     */
    public static StateproxConfig parse(String yamlText, Path baseDir) {
        Object raw;
        try (Reader reader = new StringReader(yamlText == null ? "" : yamlText)) {
            raw = new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read inline config", e);
        } catch (RuntimeException e) {
            throw new ConfigException("Failed to parse inline YAML", e);
        }
        return bind(raw, "<inline>", baseDir);
    }

    private static StateproxConfig bind(Object raw, String source, Path baseDir) {
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + source);
        }
        Object expanded = EnvExpander.expand(raw, baseDir);
        StateproxConfig config;
        try {
            config = MAPPER.convertValue(expanded, StateproxConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + source, e);
        }
        ConfigValidator.validate(config);
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
