package com.dailystatus.clients;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads {@code clients.yaml} (client id -> metadata); only the top-level keys are used.
 */
public final class ClientRegistry {

    private ClientRegistry() {
    }

    public static Set<String> loadClientIds(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IOException("client info file not found: " + file);
        }
        Object root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new IOException("invalid YAML in " + file + ": " + e.getMessage(), e);
        }
        if (root == null) {
            return Set.of();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new IOException("client info file must be a mapping of client id to metadata: " + file);
        }
        Set<String> ids = new TreeSet<>();
        for (Object key : map.keySet()) {
            if (key != null && !key.toString().isBlank()) {
                ids.add(key.toString().trim());
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
