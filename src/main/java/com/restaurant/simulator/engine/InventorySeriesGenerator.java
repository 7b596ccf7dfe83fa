package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.engine.random.BitMixer;
import com.restaurant.simulator.model.InventoryDailyRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stock simulation for the tracked ingredients.
 *
 * Each day: on restock days (every restockEveryDays-th day index, starting at
 * day 0) the ingredient is topped up to its par level before service; usage is
 * a bounded uniform draw; usage beyond the available stock is lost and flags a
 * stockout. Like the AR residual, stock levels are carried state and steps must
 * run in day order.
 */
public class InventorySeriesGenerator {

    private static final Logger log = LoggerFactory.getLogger(InventorySeriesGenerator.class);

    private final GeneratorProperties.Inventory settings;

    public InventorySeriesGenerator(GeneratorProperties.Inventory settings) {
        this.settings = settings;
    }

    public Map<String, Double> initialLevels() {
        Map<String, Double> levels = new LinkedHashMap<>();
        for (GeneratorProperties.Ingredient ingredient : settings.getIngredients()) {
            levels.put(ingredient.getId(), ingredient.getParLevel());
        }
        return levels;
    }

    public boolean isRestockDay(int dayIndex) {
        return dayIndex % settings.getRestockEveryDays() == 0;
    }

    public InventoryStep step(String locationId, int dayIndex, LocalDate date,
                              Map<String, Double> openingLevels, BitMixer inventoryStream) {
        List<InventoryDailyRow> rows = new ArrayList<>();
        Map<String, Double> closingLevels = new LinkedHashMap<>();
        boolean restock = isRestockDay(dayIndex);

        for (GeneratorProperties.Ingredient ingredient : settings.getIngredients()) {
            double opening = openingLevels.getOrDefault(ingredient.getId(), ingredient.getParLevel());
            double stockIn = restock ? Math.max(0.0, ingredient.getParLevel() - opening) : 0.0;
            double available = opening + stockIn;

            double demand = inventoryStream.nextInRange(settings.getMinDailyUse(), settings.getMaxDailyUse());
            double used = Math.min(demand, available);
            double closing = available - used;
            if (demand > available) {
                log.debug("{} ran out of {} on {}: demand {} {}, available {} {}", locationId,
                        ingredient.getName(), date, Money.round2(demand), ingredient.getUnit(),
                        Money.round2(available), ingredient.getUnit());
            }

            rows.add(InventoryDailyRow.builder()
                    .locationId(locationId)
                    .date(date)
                    .itemId(ingredient.getId())
                    .itemName(ingredient.getName())
                    .stockOnHand(Money.round2(closing))
                    .stockIn(Money.round2(stockIn))
                    .stockOut(Money.round2(used))
                    .wasteEst(Money.round2(used * settings.getWastePct()))
                    .stockoutFlag(demand > available)
                    .build());
            closingLevels.put(ingredient.getId(), closing);
        }
        return new InventoryStep(rows, closingLevels);
    }

    public record InventoryStep(List<InventoryDailyRow> rows, Map<String, Double> closingLevels) {}
}
