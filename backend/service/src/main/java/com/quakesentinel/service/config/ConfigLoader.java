package com.quakesentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.quakesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    public static final String CONFIG_DIR_ENV = "MONITOR_CONFIG_DIR";
    public static final String CONFIG_FILE = "monitor.json";
    static final String DEFAULTS_RESOURCE = "monitor-defaults.json";

    private ConfigLoader() {
    }

    public static Path resolveConfigDir(Map<String, String> env) {
        String dir = env.get(CONFIG_DIR_ENV);
        return dir == null || dir.isBlank() ? Path.of("config") : Path.of(dir);
    }

    public static MonitorConfig load(Path configDir) {
        Path path = configDir.resolve(CONFIG_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + " found; using bundled defaults");
            return loadDefaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static MonitorConfig loadDefaults() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return JsonUtils.objectMapper().readValue(in, MonitorConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from classpath " + DEFAULTS_RESOURCE, e);
        }
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
