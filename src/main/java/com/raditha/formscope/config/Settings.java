package com.raditha.formscope.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide property map loaded from a YAML file.
 * <p>
 * The command line loads {@code formscope.yml} once at startup and may
 * override individual properties with {@link #setProperty(String, Object)}.
 * The analysis engines never read from here; they receive their
 * configuration records explicitly.
 */
public final class Settings {
    private static final Logger logger = LoggerFactory.getLogger(Settings.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "formscope.yml";

    private static final Map<String, Object> props = new HashMap<>();

    private Settings() {
    }

    /**
     * Load properties from the {@code formscope.yml} resource on the
     * classpath. A missing resource leaves the settings empty.
     *
     * @throws IOException if the resource cannot be read
     */
    public static synchronized void loadConfigMap() throws IOException {
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_CONFIG_RESOURCE);
                props.clear();
                return;
            }
            load(in);
        }
    }

    /**
     * Load properties from a YAML file, replacing any loaded before.
     *
     * @param configFile YAML file
     * @throws IOException if the file cannot be read
     */
    public static synchronized void loadConfigMap(File configFile) throws IOException {
        if (!configFile.isFile()) {
            throw new IOException("Configuration file not found: " + configFile);
        }
        try (InputStream in = new FileInputStream(configFile)) {
            load(in);
        }
        logger.info("Loaded configuration from {}", configFile);
    }

    private static void load(InputStream in) throws IOException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new IOException("Invalid YAML configuration: " + e.getMessage(), e);
        }

        props.clear();
        if (loaded instanceof Map<?, ?> map) {
            map.forEach((k, v) -> props.put(String.valueOf(k), v));
        } else if (loaded != null) {
            throw new IOException("YAML configuration must be a mapping");
        }
    }

    public static synchronized Object getProperty(String key) {
        return props.get(key);
    }

    public static synchronized void setProperty(String key, Object value) {
        props.put(key, value);
    }

    /**
     * Forget all loaded and overridden properties.
     */
    public static synchronized void clear() {
        props.clear();
    }
}
