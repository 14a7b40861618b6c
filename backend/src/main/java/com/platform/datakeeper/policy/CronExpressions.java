package com.platform.datakeeper.policy;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Cron helpers over Spring's {@link CronExpression}. Policy documents use the classic
 * five-field form; Spring expects a leading seconds field.
 */
public final class CronExpressions {
    
    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    
    private CronExpressions() {
    }
    
    /**
     * Converts a five-field expression to six fields and validates the result.
     *
     * @throws IllegalArgumentException if the expression is empty or does not parse
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }
        
        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");
        
        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("expected 5 or 6 fields, got " + parts.length);
        }
        
        CronExpression.parse(sixFieldCron);
        return sixFieldCron;
    }
    
    /**
     * Next fire time strictly after {@code after}, evaluated in UTC, or null if none.
     */
    public static Instant next(String sixFieldCron, Instant after) {
        CronExpression cron = CronExpression.parse(sixFieldCron);
        LocalDateTime next = cron.next(LocalDateTime.ofInstant(after, ZoneOffset.UTC));
        return next == null ? null : next.toInstant(ZoneOffset.UTC);
    }
}
