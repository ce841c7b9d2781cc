package com.byterox.sentinel.api.dto;

import com.byterox.sentinel.domain.model.Workflow;
import com.byterox.sentinel.domain.model.WorkflowStep;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating a workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRequest {

    @NotBlank
    private String name;

    private String description;

    private String trigger;

    @NotEmpty
    private List<WorkflowStep> steps;

    private Boolean enabled;

    public Workflow toWorkflow() {
        return Workflow.builder()
                .name(name)
                .description(description)
                .trigger(trigger != null ? trigger : "manual")
                .steps(new ArrayList<>(steps))
                .enabled(enabled == null || enabled)
                .build();
    }
}
