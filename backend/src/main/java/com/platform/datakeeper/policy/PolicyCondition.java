package com.platform.datakeeper.policy;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Predicate over a context map, used by retention exceptions
 * ({@code metadata.priority == 'high'}) and condition triggers ({@code storage.utilization > 80}).
 */
public interface PolicyCondition {
    
    /**
     * Evaluates this condition against the given context.
     * Keys are either flat dotted names or nested maps.
     */
    boolean evaluate(Map<String, ?> context);
    
    /**
     * Returns a human-readable description of this condition.
     */
    String describe();
    
    /**
     * Context paths this condition reads.
     */
    Set<String> paths();
    
    enum Operator {
        EQ("=="), NE("!="), GT(">"), GE(">="), LT("<"), LE("<=");
        
        private final String symbol;
        
        Operator(String symbol) {
            this.symbol = symbol;
        }
        
        public String symbol() {
            return symbol;
        }
    }
    
    /**
     * Single comparison of a context value against a literal.
     * A missing context value never matches.
     */
    record Comparison(
        String path,
        Operator operator,
        Object literal
    ) implements PolicyCondition {
        
        @Override
        public boolean evaluate(Map<String, ?> context) {
            Object actual = resolve(context, path);
            if (actual == null) {
                return false;
            }
            
            int cmp;
            if (literal instanceof BigDecimal expected) {
                BigDecimal value = toNumber(actual);
                if (value == null) {
                    return false;
                }
                cmp = value.compareTo(expected);
            } else {
                cmp = String.valueOf(actual).compareTo(String.valueOf(literal));
            }
            
            return switch (operator) {
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
                case GT -> cmp > 0;
                case GE -> cmp >= 0;
                case LT -> cmp < 0;
                case LE -> cmp <= 0;
            };
        }
        
        @Override
        public Set<String> paths() {
            return Set.of(path);
        }
        
        @Override
        public String describe() {
            String rendered = literal instanceof BigDecimal ? literal.toString() : "'" + literal + "'";
            return path + " " + operator.symbol() + " " + rendered;
        }
        
        private static BigDecimal toNumber(Object value) {
            if (value instanceof BigDecimal bd) {
                return bd;
            }
            if (value instanceof Number n) {
                return new BigDecimal(n.toString());
            }
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        
        private static Object resolve(Map<String, ?> context, String path) {
            if (context.containsKey(path)) {
                return context.get(path);
            }
            Object current = context;
            for (String part : path.split("\\.")) {
                if (!(current instanceof Map<?, ?> map)) {
                    return null;
                }
                current = map.get(part);
            }
            return current;
        }
    }
    
    /**
     * Combined condition - all sub-conditions must be true (AND logic).
     */
    record AndCondition(
        PolicyCondition... conditions
    ) implements PolicyCondition {
        
        @Override
        public boolean evaluate(Map<String, ?> context) {
            for (PolicyCondition condition : conditions) {
                if (!condition.evaluate(context)) {
                    return false;
                }
            }
            return true;
        }
        
        @Override
        public Set<String> paths() {
            Set<String> paths = new LinkedHashSet<>();
            for (PolicyCondition condition : conditions) {
                paths.addAll(condition.paths());
            }
            return paths;
        }
        
        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < conditions.length; i++) {
                if (i > 0) sb.append(" AND ");
                sb.append(conditions[i].describe());
            }
            sb.append(")");
            return sb.toString();
        }
    }
}
