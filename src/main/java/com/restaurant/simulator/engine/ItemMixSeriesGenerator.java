package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.model.ItemMixDailyRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Allocates net sales over the top menu items with a linearly decaying share:
 * the first item gets topItemShare, each next one shareStep less (never below 0).
 */
public class ItemMixSeriesGenerator {

    private final GeneratorProperties.Menu settings;

    public ItemMixSeriesGenerator(GeneratorProperties.Menu settings) {
        this.settings = settings;
    }

    public double shareOf(int rank) {
        return Math.max(0.0, settings.getTopItemShare() - rank * settings.getShareStep());
    }

    public List<ItemMixDailyRow> generate(String locationId, LocalDate date, double netSales, int tickets) {
        List<GeneratorProperties.MenuItem> items = settings.getItems();
        List<ItemMixDailyRow> rows = new ArrayList<>(items.size());

        for (int rank = 0; rank < items.size(); rank++) {
            GeneratorProperties.MenuItem item = items.get(rank);
            double revenue = netSales * shareOf(rank);
            int qty = (int) Math.round(revenue / item.getPrice());
            double attachRate = tickets > 0 ? Math.min(1.0, (double) qty / tickets) : 0.0;

            rows.add(ItemMixDailyRow.builder()
                    .locationId(locationId)
                    .date(date)
                    .itemId(item.getId())
                    .itemName(item.getName())
                    .qty(qty)
                    .revenueNet(Money.round2(revenue))
                    .marginEst(item.getMargin())
                    .attachRate(Math.round(attachRate * 10_000.0) / 10_000.0)
                    .build());
        }
        return rows;
    }
}
