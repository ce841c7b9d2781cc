package com.byterox.sentinel.rules;

import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.domain.model.ScanResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private static ScanResult result(int score, String riskLevel, int critical) {
        return ScanResult.builder()
                .target("example.com")
                .summary(ScanResult.Summary.builder()
                        .securityScore(score)
                        .riskLevel(riskLevel)
                        .criticalFindings(critical)
                        .totalFindings(critical)
                        .build())
                .build();
    }

    private static RuleCondition condition(String field, String operator, Object threshold) {
        return RuleCondition.builder().field(field).operator(operator).threshold(threshold).build();
    }

    @Nested
    @DisplayName("Scan results")
    class ScanResultTests {

        @Test
        @DisplayName("should compare numeric fields")
        void numericComparison() {
            ScanResult result = result(60, "Medium", 0);

            assertThat(ConditionEvaluator.evaluate(condition("summary.securityScore", "less_than", 70), result)).isTrue();
            assertThat(ConditionEvaluator.evaluate(condition("summary.securityScore", "greater_than", 70), result)).isFalse();
            assertThat(ConditionEvaluator.evaluate(condition("summary.securityScore", "equals", 60.0), result)).isTrue();
        }

        @Test
        @DisplayName("should match membership and substrings")
        void membership() {
            ScanResult result = result(30, "High", 2);

            assertThat(ConditionEvaluator.evaluate(
                    condition("summary.riskLevel", "in", List.of("High", "Critical")), result)).isTrue();
            assertThat(ConditionEvaluator.evaluate(condition("target", "contains", "example"), result)).isTrue();
        }

        @Test
        @DisplayName("should evaluate to false for unknown fields or operators")
        void unknownFieldOrOperator() {
            ScanResult result = result(10, "Critical", 5);

            assertThat(ConditionEvaluator.evaluate(condition("summary.unknown", "less_than", 50), result)).isFalse();
            assertThat(ConditionEvaluator.evaluate(condition("summary.securityScore", "between", 50), result)).isFalse();
        }

        @Test
        @DisplayName("should not hold ordering comparisons on non-numeric values")
        void nonNumericOrdering() {
            ScanResult result = result(10, "Critical", 5);

            assertThat(ConditionEvaluator.evaluate(condition("summary.riskLevel", "greater_than", 1), result)).isFalse();
            assertThat(ConditionEvaluator.evaluate(condition("summary.riskLevel", "less_than", 1), result)).isFalse();
        }
    }

    @Nested
    @DisplayName("Documents")
    class DocumentTests {

        @Test
        @DisplayName("should resolve dotted paths through nested maps")
        void nestedPath() {
            Map<String, Object> document = Map.of("summary", Map.of("securityScore", 45));

            assertThat(ConditionEvaluator.evaluate(condition("summary.securityScore", "less_than", 50), document)).isTrue();
        }

        @Test
        @DisplayName("should prefer a flat key containing dots")
        void flatKey() {
            Map<String, Object> document = Map.of("scan.score", 80);

            assertThat(ConditionEvaluator.evaluate(condition("scan.score", "greater_than", 50), document)).isTrue();
        }

        @Test
        @DisplayName("should treat a missing value as not matching")
        void missingValue() {
            assertThat(ConditionEvaluator.evaluate(condition("security_score", "less_than", 50), Map.of())).isFalse();
        }

        @Test
        @DisplayName("should hold for an empty condition list and require all otherwise")
        void evaluateAll() {
            Map<String, Object> document = Map.of("security_score", 40, "risk_level", "High");

            assertThat(ConditionEvaluator.evaluateAll(List.of(), document)).isTrue();
            assertThat(ConditionEvaluator.evaluateAll(List.of(
                    condition("security_score", "less_than", 50),
                    condition("risk_level", "equals", "High")), document)).isTrue();
            assertThat(ConditionEvaluator.evaluateAll(List.of(
                    condition("security_score", "less_than", 50),
                    condition("risk_level", "equals", "Low")), document)).isFalse();
        }

        @Test
        @DisplayName("should match list values with contains")
        void containsOnList() {
            Map<String, Object> document = Map.of("tags", List.of("prod", "edge"));

            assertThat(ConditionEvaluator.evaluate(condition("tags", "contains", "edge"), document)).isTrue();
            assertThat(ConditionEvaluator.evaluate(condition("tags", "contains", "dev"), document)).isFalse();
        }
    }
}
