package com.restaurant.simulator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Daily labor hours and cost for one location")
public class LaborDailyRow {

    @Schema(description = "Location identifier", example = "loc-centro")
    private String locationId;

    @Schema(description = "Business date", example = "2026-02-14")
    private LocalDate date;

    @Schema(description = "Hours on the rota", example = "96.4")
    private double scheduledHours;

    @Schema(description = "Hours actually clocked", example = "98.1")
    private double actualHours;

    @Schema(description = "Actual hours at the average hourly rate (EUR)", example = "1471.50")
    private double laborCostEst;

    @Schema(description = "Actual hours above scheduled", example = "1.7")
    private double overtimeHours;

    @Schema(description = "Staff on shift", example = "12")
    private int headcount;
}
