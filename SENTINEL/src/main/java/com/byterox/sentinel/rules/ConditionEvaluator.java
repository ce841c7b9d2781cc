package com.byterox.sentinel.rules;

import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.domain.model.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Side-effect-free condition evaluation.
 * <p>
 * Against a {@link ScanResult} only {@link ScanResultField} paths resolve. Against a
 * key-value document (workflow context, notification data) any dotted path resolves.
 * Unknown operators and unresolvable fields evaluate to false; nothing here throws.
 */
@Slf4j
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    public static boolean evaluate(RuleCondition condition, ScanResult result) {
        if (condition == null) {
            return false;
        }
        Optional<ScanResultField> field = ScanResultField.fromPath(condition.getField());
        if (field.isEmpty()) {
            log.warn("Condition references unknown scan result field '{}'", condition.getField());
            return false;
        }
        return compare(field.get().extract(result), condition.getOperator(), condition.getThreshold());
    }

    public static boolean evaluate(RuleCondition condition, Map<String, ?> document) {
        if (condition == null) {
            return false;
        }
        return compare(FieldPaths.resolve(document, condition.getField()),
                condition.getOperator(), condition.getThreshold());
    }

    /**
     * @return true when every condition holds; an empty list holds trivially
     */
    public static boolean evaluateAll(List<RuleCondition> conditions, Map<String, ?> document) {
        if (conditions == null) {
            return true;
        }
        return conditions.stream().allMatch(condition -> evaluate(condition, document));
    }

    public static boolean evaluateAll(List<RuleCondition> conditions, ScanResult result) {
        if (conditions == null) {
            return true;
        }
        return conditions.stream().allMatch(condition -> evaluate(condition, result));
    }

    public static boolean compare(Object actual, String operator, Object threshold) {
        Optional<ConditionOperator> op = ConditionOperator.fromValue(operator);
        if (op.isEmpty()) {
            log.warn("Unknown condition operator '{}', evaluating to false", operator);
            return false;
        }
        return switch (op.get()) {
            case EQUALS -> valueEquals(actual, threshold);
            case GREATER_THAN -> compareNumbers(actual, threshold) > 0;
            case LESS_THAN -> compareNumbers(actual, threshold) < 0;
            case CONTAINS -> contains(actual, threshold);
            case IN -> threshold instanceof Collection<?> values
                    && values.stream().anyMatch(value -> valueEquals(actual, value));
        };
    }

    // ========== Private Methods ==========

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(actual, expected) || actual.toString().equals(expected.toString());
    }

    /**
     * Returns 0 when either side is not numeric, so neither greater_than nor less_than holds.
     */
    private static int compareNumbers(Object actual, Object threshold) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(threshold);
        if (left == null || right == null) {
            return 0;
        }
        return left.compareTo(right);
    }

    private static boolean contains(Object actual, Object threshold) {
        if (actual == null || threshold == null) {
            return false;
        }
        if (threshold instanceof Collection<?> candidates) {
            return candidates.stream().anyMatch(candidate -> contains(actual, candidate));
        }
        if (actual instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> valueEquals(item, threshold));
        }
        return actual.toString().contains(threshold.toString());
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
