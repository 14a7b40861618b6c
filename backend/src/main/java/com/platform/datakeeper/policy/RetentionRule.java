package com.platform.datakeeper.policy;

/**
 * Retention exception: when {@code condition} holds for a unit, {@code retentionTime}
 * (in {@code timeUnit}) replaces the action's base retention. {@code -1} means never delete.
 */
public record RetentionRule(
    String condition,
    long retentionTime,
    TimeUnitSpec timeUnit
) {
    
    public static final long NEVER_DELETE = -1;
    
    public PolicyCondition compiled() {
        return ConditionParser.parse(condition);
    }
}
