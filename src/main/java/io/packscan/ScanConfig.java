package io.packscan;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loaded from a YAML file.
 * Contains limits, scores and rule settings for scanning.
 * <p>
 * Every instance keeps the raw settings it was built from, so a user file can be overlaid on
 * the bundled defaults with {@link #merge(ScanConfig)}.
 */
public class ScanConfig {

    public static final String DEFAULT_RESOURCE = "pack-scan.yaml";

    static final int DEFAULT_MAX_DEPTH = 3;
    static final int DEFAULT_REWRITE_PASSES = 10;
    static final int DEFAULT_MIN_KEY_SIZE = 2048;

    private final Map<String, Object> raw;
    private final Long maxArchiveSize;
    private final int maxDepth;
    private final int minScore;
    private final Map<String, Integer> scores;
    private final Map<String, Integer> minKeySizes;
    private final int rewritePasses;
    private final Set<String> taintSources;

    private ScanConfig(Map<String, Object> raw) {
        this.raw = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        this.maxArchiveSize = toLong(raw, "maxArchiveSize");
        this.maxDepth = toInt(raw, "maxDepth", DEFAULT_MAX_DEPTH);
        this.minScore = toInt(raw, "minScore", 0);
        this.scores = toIntMap(raw, "scores", Map.of());
        this.minKeySizes = toIntMap(raw, "minKeySizes",
                Map.of("rsa", DEFAULT_MIN_KEY_SIZE, "dsa", DEFAULT_MIN_KEY_SIZE));
        this.rewritePasses = toInt(raw, "rewritePasses", DEFAULT_REWRITE_PASSES);
        this.taintSources = toSet(raw, "taintSources");

        if (maxArchiveSize != null && maxArchiveSize < 0) {
            throw new IllegalArgumentException("'maxArchiveSize' cannot be negative");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("'maxDepth' cannot be negative");
        }
        if (rewritePasses < 1) {
            throw new IllegalArgumentException("'rewritePasses' must be at least 1");
        }
    }

    /**
     * Built-in settings: no archive size limit, depth 3, RSA and DSA minimum 2048 bits.
     */
    public static ScanConfig defaults() {
        return new ScanConfig(Map.of());
    }

    /**
     * Load configuration from a YAML file.
     */
    public static ScanConfig load(Path configPath) throws IOException {
        try (InputStream in = Files.newInputStream(configPath)) {
            return parse(in, configPath.toString());
        }
    }

    /**
     * Load the configuration bundled on the classpath, falling back to the built-in defaults
     * if the resource is absent.
     */
    public static ScanConfig loadDefault() throws IOException {
        try (InputStream in = ScanConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            return parse(in, "classpath:" + DEFAULT_RESOURCE);
        }
    }

    private static ScanConfig parse(InputStream in, String origin) throws IOException {
        Object data;
        try {
            data = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new IOException("Invalid YAML in config file " + origin + ": " + e.getMessage(), e);
        }
        if (data == null) {
            throw new IOException("Empty or invalid config file: " + origin);
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new IOException("Config file must contain a mapping: " + origin);
        }
        Map<String, Object> settings = new LinkedHashMap<>();
        map.forEach((key, value) -> settings.put(String.valueOf(key), value));
        try {
            return new ScanConfig(settings);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid config file " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns a configuration where every key set in {@code other} replaces this one's value.
     * Score and key size tables are merged per entry.
     */
    public ScanConfig merge(ScanConfig other) {
        Map<String, Object> merged = new LinkedHashMap<>(raw);
        other.raw.forEach((key, value) -> {
            if (value instanceof Map<?, ?> overrides && merged.get(key) instanceof Map<?, ?> base) {
                Map<Object, Object> table = new LinkedHashMap<>(base);
                table.putAll(overrides);
                merged.put(key, table);
            } else {
                merged.put(key, value);
            }
        });
        return new ScanConfig(merged);
    }

    public ScanConfig withMaxArchiveSize(Long limit) {
        return with("maxArchiveSize", limit);
    }

    public ScanConfig withMinScore(int score) {
        return with("minScore", score);
    }

    public ScanConfig withMaxDepth(int depth) {
        return with("maxDepth", depth);
    }

    private ScanConfig with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(raw);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new ScanConfig(copy);
    }

    /**
     * Maximum uncompressed size of an archive entry, or null for no limit.
     */
    public Long maximumArchiveSize() {
        return maxArchiveSize;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int minScore() {
        return minScore;
    }

    /**
     * Configured score of a rule, or the given default.
     */
    public int scoreOrDefault(String ruleName, int defaultScore) {
        return scores.getOrDefault(ruleName, defaultScore);
    }

    /**
     * Minimum safe key size in bits for a key family ({@code rsa}, {@code dsa}).
     */
    public int minKeySize(String family) {
        return minKeySizes.getOrDefault(family, DEFAULT_MIN_KEY_SIZE);
    }

    public int rewritePasses() {
        return rewritePasses;
    }

    public Set<String> taintSources() {
        return taintSources;
    }

    private static Long toLong(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value);
    }

    private static int toInt(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer i) {
            return i;
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value);
    }

    private static Map<String, Integer> toIntMap(Map<String, Object> data, String key, Map<String, Integer> defaults) {
        Map<String, Integer> result = new LinkedHashMap<>(defaults);
        Object value = data.get(key);
        if (value == null) {
            return Collections.unmodifiableMap(result);
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping");
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getValue() instanceof Integer number)) {
                throw new IllegalArgumentException("'" + key + "." + entry.getKey() + "' must be an integer");
            }
            result.put(String.valueOf(entry.getKey()).trim(), number);
        }
        return Collections.unmodifiableMap(result);
    }

    private static Set<String> toSet(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
