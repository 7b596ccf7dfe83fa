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
@Schema(description = "Daily sales of one top menu item")
public class ItemMixDailyRow {

    private String locationId;
    private LocalDate date;

    @Schema(description = "Menu item identifier", example = "item-1")
    private String itemId;

    @Schema(description = "Menu item name", example = "Paella Valenciana")
    private String itemName;

    @Schema(description = "Units sold", example = "38")
    private int qty;

    @Schema(description = "Net revenue attributed to the item (EUR)", example = "712.50")
    private double revenueNet;

    @Schema(description = "Estimated gross margin, 0-1", example = "0.42")
    private double marginEst;

    @Schema(description = "Units per ticket, capped at 1", example = "0.21")
    private double attachRate;
}
