package com.dailystatus.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Classpath {@code config.properties} defaults, overridden by a properties file from the
 * working directory. Typed access goes through {@link #asMap()} and the property binder.
 */
public final class Config {

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, workingDir.resolve("config.properties"));
    }

    /**
     * A missing override file is not an error; an unreadable one is.
     */
    public static Config load(Path workingDir, Path overrideFile) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("failed to read classpath config.properties: " + e.getMessage(), e);
        }

        if (overrideFile != null && Files.exists(overrideFile)) {
            Properties override = new Properties();
            try (InputStream in = Files.newInputStream(overrideFile)) {
                override.load(in);
            } catch (IOException e) {
                throw new IllegalStateException("failed to read " + overrideFile + ": " + e.getMessage(), e);
            }
            config.props.putAll(override);
        }

        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    /**
     * Flat snapshot of every configured key, sorted, for property binding.
     */
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            out.put(key, props.getProperty(key));
        }
        return out;
    }
}
