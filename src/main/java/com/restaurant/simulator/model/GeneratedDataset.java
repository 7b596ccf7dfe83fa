package com.restaurant.simulator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * The four row families produced by one generation run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Generated rows for one location and horizon")
public record GeneratedDataset(List<SalesBucketRow> salesBuckets,
                               List<LaborDailyRow> laborDaily,
                               List<ItemMixDailyRow> itemMixDaily,
                               List<InventoryDailyRow> inventoryDaily) {

    public static GeneratedDataset empty() {
        return new GeneratedDataset(List.of(), List.of(), List.of(), List.of());
    }

    public int totalRows() {
        return salesBuckets.size() + laborDaily.size() + itemMixDaily.size() + inventoryDaily.size();
    }
}
