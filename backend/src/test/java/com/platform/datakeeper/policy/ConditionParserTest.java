package com.platform.datakeeper.policy;

import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class ConditionParserTest {

    private static Map<String, Object> metadata(Map<String, Object> values) {
        return Map.of("metadata", values);
    }

    // ===== Comparisons =====

    @Test
    void shouldMatchQuotedStringEquality() {
        PolicyCondition condition = ConditionParser.parse("metadata.priority == 'high'");

        assertTrue(condition.evaluate(metadata(Map.of("priority", "high"))));
        assertFalse(condition.evaluate(metadata(Map.of("priority", "low"))));
    }

    @Test
    void shouldAcceptDoubleQuotedLiterals() {
        PolicyCondition condition = ConditionParser.parse("metadata.tagged != \"preserve\"");

        assertTrue(condition.evaluate(metadata(Map.of("tagged", "archive"))));
        assertFalse(condition.evaluate(metadata(Map.of("tagged", "preserve"))));
    }

    @Test
    void shouldCompareNumbersNumerically() {
        PolicyCondition condition = ConditionParser.parse("storage.utilization > 80");

        assertTrue(condition.evaluate(Map.of("storage.utilization", 80.5)));
        assertFalse(condition.evaluate(Map.of("storage.utilization", 80)));
        assertTrue(condition.evaluate(Map.of("storage", Map.of("utilization", "100"))));
    }

    @Test
    void shouldHandleAllOrderingOperators() {
        Map<String, Object> context = Map.of("x", 5);

        assertTrue(ConditionParser.parse("x >= 5").evaluate(context));
        assertTrue(ConditionParser.parse("x <= 5").evaluate(context));
        assertFalse(ConditionParser.parse("x < 5").evaluate(context));
        assertTrue(ConditionParser.parse("x < 5.5").evaluate(context));
        assertTrue(ConditionParser.parse("x > -1").evaluate(context));
    }

    @Test
    void shouldNotMatchWhenValueMissing() {
        assertFalse(ConditionParser.parse("metadata.priority == 'high'").evaluate(metadata(Map.of())));
        assertFalse(ConditionParser.parse("metadata.priority != 'high'").evaluate(metadata(Map.of())));
    }

    @Test
    void shouldNotMatchNonNumericValueAgainstNumber() {
        assertFalse(ConditionParser.parse("metadata.size > 10").evaluate(metadata(Map.of("size", "big"))));
    }

    // ===== Conjunctions =====

    @Test
    void shouldCombineClausesWithAnd() {
        PolicyCondition condition = ConditionParser.parse("metadata.priority == 'high' and metadata.size > 10");

        assertTrue(condition.evaluate(metadata(Map.of("priority", "high", "size", 11))));
        assertFalse(condition.evaluate(metadata(Map.of("priority", "high", "size", 9))));
        assertThat(condition.paths()).containsExactly("metadata.priority", "metadata.size");
    }

    @Test
    void shouldAcceptAmpersandConjunction() {
        PolicyCondition condition = ConditionParser.parse("a == 1 && b == 2");

        assertTrue(condition.evaluate(Map.of("a", 1, "b", 2)));
        assertEquals("(a == 1 AND b == 2)", condition.describe());
    }

    // ===== Errors =====

    @Test
    void shouldRejectMalformedExpression() {
        assertThatThrownBy(() -> ConditionParser.parse("metadata.priority = high"))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertEquals(ErrorCode.INVALID_CONDITION, ((ValidationException) e).getErrorCode()));
    }

    @Test
    void shouldRejectEmptyExpression() {
        assertThrows(ValidationException.class, () -> ConditionParser.parse("  "));
        assertThrows(ValidationException.class, () -> ConditionParser.parse(null));
    }
}
