package com.restaurant.simulator.model;

import com.restaurant.simulator.config.GeneratorProperties.MonthClimate;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Month;
import java.util.List;
import java.util.Map;

/**
 * Per-request replacements for configured defaults. A null field keeps the configured value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Optional per-run overrides of generator defaults")
public class GeneratorOverrides {

    @Schema(description = "Growth over the ramp-up phase", example = "0.30")
    private Double rampRate;

    @Schema(description = "Growth over the steady phase", example = "0.12")
    private Double steadyRate;

    @Schema(description = "Growth over the mature phase", example = "0.05")
    private Double matureRate;

    @Schema(description = "Labor cost as a share of net sales", example = "0.28")
    private Double targetLaborRatio;

    @Schema(description = "Average hourly labor rate (EUR)", example = "15.0")
    private Double avgHourlyRate;

    @Schema(description = "Base daily sales before trend and seasonality (EUR)", example = "5000")
    private Double baseDailySales;

    @Schema(description = "Mean average ticket (EUR)", example = "25.0")
    private Double avgTicketMean;

    @Schema(description = "First service hour", example = "11")
    private Integer openHour;

    @Schema(description = "Last service hour, inclusive", example = "23")
    private Integer closeHour;

    @Schema(description = "Holiday dates (ISO), replacing the configured set")
    private List<String> holidays;

    @Schema(description = "Climate normals by month, replacing the configured table")
    private Map<Month, MonthClimate> climate;

    public static GeneratorOverrides none() {
        return new GeneratorOverrides();
    }

    public static double or(Double override, double fallback) {
        return override != null ? override : fallback;
    }

    public static int or(Integer override, int fallback) {
        return override != null ? override : fallback;
    }

    public static <T> T or(T override, T fallback) {
        return override != null ? override : fallback;
    }
}
