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
@Schema(description = "End-of-day stock movement for one tracked ingredient")
public class InventoryDailyRow {

    private String locationId;
    private LocalDate date;

    @Schema(description = "Ingredient identifier", example = "ingredient-1")
    private String itemId;

    @Schema(description = "Ingredient name", example = "Salmon")
    private String itemName;

    @Schema(description = "Closing stock", example = "61.4")
    private double stockOnHand;

    @Schema(description = "Delivered today", example = "38.6")
    private double stockIn;

    @Schema(description = "Used today", example = "12.9")
    private double stockOut;

    @Schema(description = "Estimated waste out of today's use", example = "0.39")
    private double wasteEst;

    @Schema(description = "True when demand exceeded the stock available")
    private boolean stockoutFlag;
}
