package com.platform.datakeeper.scheduler;

import java.time.Instant;
import java.util.Map;

/**
 * An event from an external feed, e.g. a vessel entering a geofence over the fiber.
 *
 * @param positionM position along the fiber the event is closest to, in meters
 * @param attributes feed-specific fields, visible to trigger filters as {@code event.<key>}
 */
public record ExternalEvent(
    String source,
    double positionM,
    Instant eventTime,
    Map<String, Object> attributes
) {
    
    public ExternalEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
    
    public Map<String, Object> conditionContext() {
        return Map.of("event", attributes);
    }
}
