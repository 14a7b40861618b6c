package com.platform.datakeeper.policy;

import java.time.Duration;
import java.util.List;

/**
 * Parsed policy file. Policies carry no id yet; the registry assigns them.
 */
public record PolicyDocument(
    String apiVersion,
    String name,
    String version,
    Settings settings,
    List<Policy> policies
) {
    
    /**
     * @param evaluationInterval scheduler tick cadence, null when the document does not set one
     */
    public record Settings(
        String logLevel,
        Duration evaluationInterval,
        Integer auditRetentionDays
    ) {
        public static final Settings EMPTY = new Settings(null, null, null);
    }
}
