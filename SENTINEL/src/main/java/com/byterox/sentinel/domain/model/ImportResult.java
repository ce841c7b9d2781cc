package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {

    private int imported;

    /** Entries whose id already existed and overwrite was off */
    private int skipped;

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
