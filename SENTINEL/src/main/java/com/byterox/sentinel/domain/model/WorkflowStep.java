package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowStep {

    /** Display name; defaults to the step type */
    private String name;

    /** scan, notify, wait, condition or action */
    private String type;

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    public String displayName() {
        return name != null && !name.isBlank() ? name : type;
    }
}
