package com.di.martflow.controller.dto;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/warehouse/queries/run}. No name means every catalog statement. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRunRequest {

    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*", message = "name must be a catalog identifier")
    private String name;

    private boolean explain;
}
