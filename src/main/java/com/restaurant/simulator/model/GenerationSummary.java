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
@Schema(description = "Outcome of one generate-and-store run")
public class GenerationSummary {

    @Schema(description = "Location identifier", example = "loc-centro")
    private String locationId;

    @Schema(description = "SUCCESS or FAILED", example = "SUCCESS")
    private String status;

    @Schema(description = "Failure reason when status is FAILED")
    private String error;

    private int horizonDays;
    private LocalDate fromDate;
    private LocalDate toDate;

    private int salesBucketRows;
    private int laborRows;
    private int itemMixRows;
    private int inventoryRows;

    @Schema(description = "Records written to the store")
    private int recordsWritten;

    @Schema(description = "Sum of bucket gross sales (EUR)", example = "38211.40")
    private double totalGrossSales;

    @Schema(description = "Sum of bucket net sales (EUR)", example = "36300.83")
    private double totalNetSales;

    @Schema(description = "Sum of daily labor cost (EUR)", example = "10164.23")
    private double totalLaborCost;

    @Schema(description = "Labor cost over net sales", example = "0.28")
    private double laborRatio;

    private long durationMs;
}
