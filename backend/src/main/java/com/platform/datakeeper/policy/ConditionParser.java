package com.platform.datakeeper.policy;

import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;
import com.platform.datakeeper.policy.PolicyCondition.AndCondition;
import com.platform.datakeeper.policy.PolicyCondition.Comparison;
import com.platform.datakeeper.policy.PolicyCondition.Operator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses condition expressions of the form {@code path OP literal [and path OP literal ...]}.
 * 
 * Paths are dotted identifiers, operators are {@code == != > >= < <=}, literals are
 * single- or double-quoted strings or decimal numbers.
 */
public final class ConditionParser {
    
    private static final Pattern COMPARISON = Pattern.compile(
        "^\\s*([A-Za-z_][\\w]*(?:\\.[A-Za-z_][\\w]*)*)\\s*(==|!=|>=|<=|>|<)\\s*" +
        "('([^']*)'|\"([^\"]*)\"|(-?\\d+(?:\\.\\d+)?))\\s*$");
    
    private static final Pattern AND = Pattern.compile("\\s+(?i:and)\\s+|\\s*&&\\s*");
    
    private ConditionParser() {
    }
    
    /**
     * Parses an expression.
     *
     * @throws ValidationException when the expression does not follow the grammar
     */
    public static PolicyCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_CONDITION, "condition", expression,
                "condition expression is empty");
        }
        
        String[] clauses = AND.split(expression.trim());
        List<PolicyCondition> parsed = new ArrayList<>(clauses.length);
        for (String clause : clauses) {
            parsed.add(parseComparison(clause, expression));
        }
        
        return parsed.size() == 1 
            ? parsed.get(0) 
            : new AndCondition(parsed.toArray(PolicyCondition[]::new));
    }
    
    private static Comparison parseComparison(String clause, String expression) {
        Matcher m = COMPARISON.matcher(clause);
        if (!m.matches()) {
            throw new ValidationException(ErrorCode.INVALID_CONDITION, "condition", expression,
                "expected <path> <op> <literal>, got '" + clause.trim() + "'");
        }
        
        Operator operator = switch (m.group(2)) {
            case "==" -> Operator.EQ;
            case "!=" -> Operator.NE;
            case ">" -> Operator.GT;
            case ">=" -> Operator.GE;
            case "<" -> Operator.LT;
            default -> Operator.LE;
        };
        
        Object literal;
        if (m.group(4) != null) {
            literal = m.group(4);
        } else if (m.group(5) != null) {
            literal = m.group(5);
        } else {
            literal = new BigDecimal(m.group(6));
        }
        
        return new Comparison(m.group(1), operator, literal);
    }
}
