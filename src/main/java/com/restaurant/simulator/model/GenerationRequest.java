package com.restaurant.simulator.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "What to generate: one location, a horizon ending on a reference date")
public class GenerationRequest {

    @Schema(description = "Location identifier, written to every row", example = "loc-1")
    private String locationId;

    @Schema(description = "Organisation identifier, folded into the seed when present", example = "org-1")
    private String orgId;

    @Schema(description = "Number of most recent days to generate", example = "7")
    private int horizonDays;

    @Schema(description = "Last generated day (inclusive). Defaults to today in the configured zone.", example = "2026-02-20")
    private LocalDate referenceDate;

    @Schema(description = "Optional overrides of configured defaults")
    private GeneratorOverrides overrides;
}
