package com.byterox.sentinel.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for an exclusion check.
 */
@Data
@Builder
public class ExclusionCheckResponse {
    private String target;
    private boolean excluded;
    /** Name of the first matching list */
    private String exclusionList;
}
