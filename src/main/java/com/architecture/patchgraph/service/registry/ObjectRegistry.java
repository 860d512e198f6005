package com.architecture.patchgraph.service.registry;

import com.architecture.patchgraph.model.graph.PortCounts;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of inlet/outlet counts per object class name.
 *
 * <p>Loaded from YAML of the form {@code objects: {osc~: [2, 1], trigger: [1, ~]}}, where
 * {@code ~} marks a count that depends on creation arguments.</p>
 */
@Slf4j
public final class ObjectRegistry {

    public static final String BUNDLED_RESOURCE = "object-registry.yml";

    private static volatile ObjectRegistry standard;

    private final Map<String, PortCounts> entries;

    public ObjectRegistry(Map<String, PortCounts> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * The table bundled on the classpath, loaded once.
     */
    public static ObjectRegistry standard() {
        ObjectRegistry registry = standard;
        if (registry == null) {
            synchronized (ObjectRegistry.class) {
                registry = standard;
                if (registry == null) {
                    registry = loadBundled();
                    standard = registry;
                }
            }
        }
        return registry;
    }

    public static ObjectRegistry empty() {
        return new ObjectRegistry(Map.of());
    }

    public static ObjectRegistry fromYaml(InputStream in) {
        Map<String, Object> root = new Yaml().load(in);
        Map<String, PortCounts> entries = new LinkedHashMap<>();
        if (root != null && root.get("objects") instanceof Map<?, ?> objects) {
            for (Map.Entry<?, ?> entry : objects.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), toCounts(entry.getKey(), entry.getValue()));
            }
        }
        log.debug("[Registry] Loaded {} object classes", entries.size());
        return new ObjectRegistry(entries);
    }

    public Optional<PortCounts> lookup(String className) {
        return Optional.ofNullable(entries.get(className));
    }

    public boolean contains(String className) {
        return entries.containsKey(className);
    }

    public int size() {
        return entries.size();
    }

    private static ObjectRegistry loadBundled() {
        try (InputStream in = ObjectRegistry.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + BUNDLED_RESOURCE);
            }
            ObjectRegistry registry = fromYaml(in);
            log.info("[Registry] Bundled object registry: {} classes", registry.size());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUNDLED_RESOURCE, e);
        }
    }

    private static PortCounts toCounts(Object key, Object value) {
        if (!(value instanceof List<?> pair) || pair.size() != 2) {
            throw new IllegalArgumentException("Registry entry '" + key + "' must be [inlets, outlets], got " + value);
        }
        return new PortCounts(toCount(key, pair.get(0)), toCount(key, pair.get(1)));
    }

    private static Integer toCount(Object key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer count) {
            return count;
        }
        throw new IllegalArgumentException("Registry entry '" + key + "' has a non-integer count: " + value);
    }
}
