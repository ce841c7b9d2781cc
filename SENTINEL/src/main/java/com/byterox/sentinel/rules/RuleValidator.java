package com.byterox.sentinel.rules;

import com.byterox.sentinel.domain.model.RuleAction;
import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.rules.action.ActionType;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Configuration-time checks for conditions and actions. Errors are appended to the given list.
 */
public final class RuleValidator {

    private RuleValidator() {
    }

    /**
     * @param scanResultSchema restrict the field to {@link ScanResultField} paths
     */
    public static void validateCondition(RuleCondition condition, String path, boolean scanResultSchema,
                                         List<String> errors) {
        if (condition == null) {
            errors.add(path + " is required");
            return;
        }
        if (isBlank(condition.getField())) {
            errors.add(path + ".field is required");
        } else if (scanResultSchema && ScanResultField.fromPath(condition.getField()).isEmpty()) {
            errors.add(path + ".field '" + condition.getField() + "' is not one of " + ScanResultField.paths());
        }
        var operator = ConditionOperator.fromValue(condition.getOperator());
        if (operator.isEmpty()) {
            errors.add(path + ".operator '" + condition.getOperator() + "' is not one of "
                    + Arrays.stream(ConditionOperator.values()).map(ConditionOperator::value).toList());
        } else if (operator.get() == ConditionOperator.IN && !(condition.getThreshold() instanceof Collection)) {
            errors.add(path + ".threshold must be a list for operator 'in'");
        }
        if (condition.getThreshold() == null) {
            errors.add(path + ".threshold is required");
        }
    }

    public static void validateAction(RuleAction action, String path, List<String> errors) {
        if (action == null) {
            errors.add(path + " is required");
            return;
        }
        if (ActionType.fromValue(action.getType()).isEmpty()) {
            errors.add(path + ".type '" + action.getType() + "' is not one of "
                    + Arrays.stream(ActionType.values()).map(ActionType::value).toList());
        }
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
