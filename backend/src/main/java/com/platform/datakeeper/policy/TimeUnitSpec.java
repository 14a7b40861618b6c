package com.platform.datakeeper.policy;

import java.time.Duration;
import java.util.Locale;

/**
 * Time unit used by retention thresholds and interval schedules.
 */
public enum TimeUnitSpec {
    SECOND(1),
    MINUTE(60),
    HOUR(3_600),
    DAY(86_400);
    
    private final long seconds;
    
    TimeUnitSpec(long seconds) {
        this.seconds = seconds;
    }
    
    public long seconds() {
        return seconds;
    }
    
    /**
     * @throws ArithmeticException if the amount does not fit a duration in seconds
     */
    public Duration toDuration(long amount) {
        return Duration.ofSeconds(Math.multiplyExact(amount, seconds));
    }
    
    /**
     * Largest amount of this unit that {@link #toDuration} accepts.
     */
    public long maxAmount() {
        return Long.MAX_VALUE / seconds;
    }
    
    /**
     * Expresses a duration in this unit, keeping the fraction.
     */
    public double amountOf(Duration duration) {
        return duration.toMillis() / (seconds * 1000.0);
    }
    
    /**
     * Accepts singular and plural forms, case-insensitive ("minute", "minutes", "DAY").
     */
    public static TimeUnitSpec fromText(String text) {
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return TimeUnitSpec.valueOf(normalized);
    }
}
