package com.platform.datakeeper.job;

import java.time.Instant;

/**
 * Spatial/temporal window around an external event that event-proximity actions protect.
 *
 * @param positionM position of the event along the fiber, in meters
 * @param radiusKm half-width of the protected channel range
 * @param windowSeconds half-width of the protected time range
 */
public record EventWindow(
    String source,
    double positionM,
    Instant eventTime,
    double radiusKm,
    long windowSeconds
) {
    
    public double fromM() {
        return positionM - radiusKm * 1000.0;
    }
    
    public double toM() {
        return positionM + radiusKm * 1000.0;
    }
    
    public Instant from() {
        return eventTime.minusSeconds(windowSeconds);
    }
    
    public Instant to() {
        return eventTime.plusSeconds(windowSeconds);
    }
}
