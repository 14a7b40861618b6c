package com.platform.datakeeper.data;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * A stored dataset as seen by the engine: address and metadata, never the samples.
 *
 * @param path normalized absolute path
 * @param dataType lower-case type, the file extension for the bundled store
 * @param timestamp acquisition start time, used for age and window computations
 * @param attributes free-form metadata ({@code priority}, {@code sample_rate_hz}, ...)
 */
public record DataUnit(
    String path,
    String dataType,
    Set<String> tags,
    Map<String, Object> attributes,
    Instant timestamp,
    long sizeBytes
) {
    
    public static final String SAMPLE_RATE_HZ = "sample_rate_hz";
    public static final String CHANNEL_SPACING_M = "channel_spacing_m";
    public static final String CHANNEL_ORIGIN_M = "channel_origin_m";
    
    public DataUnit {
        path = normalize(path);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
    
    /**
     * Context handed to retention exception conditions. Tags are also visible as
     * {@code metadata.tags}.
     */
    public Map<String, Object> conditionContext() {
        Map<String, Object> metadata = new HashMap<>(attributes);
        metadata.putIfAbsent("tags", String.join(",", tags));
        metadata.putIfAbsent("data_type", dataType);
        return Map.of("metadata", metadata);
    }
    
    public double attributeAsDouble(String key, double fallback) {
        Object value = attributes.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
    
    public static String normalize(String path) {
        return Path.of(path).toAbsolutePath().normalize().toString();
    }
}
