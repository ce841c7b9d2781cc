package com.byterox.sentinel.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single field/operator/threshold comparison.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {

    /** Dotted path of the compared value */
    private String field;

    /** One of equals, greater_than, less_than, contains, in */
    private String operator;

    @JsonAlias("value")
    private Object threshold;
}
