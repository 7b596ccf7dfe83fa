package com.restaurant.simulator.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
import com.restaurant.simulator.config.AerospikeConfig;
import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.model.GeneratedDataset;
import com.restaurant.simulator.model.InventoryDailyRow;
import com.restaurant.simulator.model.ItemMixDailyRow;
import com.restaurant.simulator.model.LaborDailyRow;
import com.restaurant.simulator.model.SalesBucketRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Writes generated rows to Aerospike, one set per row family.
 *
 * Keys are derived from the row's natural identity (location + bucket
 * timestamp, or location + date [+ item]), so storing the same run twice
 * overwrites rather than duplicates.
 */
@Repository
public class GeneratedRowRepository {

    private static final Logger log = LoggerFactory.getLogger(GeneratedRowRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final int writeLogEvery;

    public GeneratedRowRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  GeneratorProperties properties) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.writeLogEvery = Math.max(1, properties.getBatch().getWriteLogEvery());
    }

    /**
     * @return number of records written
     */
    public int saveAll(GeneratedDataset dataset) {
        int written = 0;
        for (SalesBucketRow row : dataset.salesBuckets()) {
            saveSalesBucket(row);
            written = logProgress(written + 1);
        }
        for (LaborDailyRow row : dataset.laborDaily()) {
            saveLabor(row);
            written = logProgress(written + 1);
        }
        for (ItemMixDailyRow row : dataset.itemMixDaily()) {
            saveItemMix(row);
            written = logProgress(written + 1);
        }
        for (InventoryDailyRow row : dataset.inventoryDaily()) {
            saveInventory(row);
            written = logProgress(written + 1);
        }
        return written;
    }

    public void saveSalesBucket(SalesBucketRow row) {
        long epochMillis = row.getTimestamp().toInstant().toEpochMilli();
        Key key = new Key(namespace, AerospikeConfig.SET_SALES_15M, row.getLocationId() + ":" + epochMillis);

        client.put(writePolicy, key,
                new Bin("locationId", row.getLocationId()),
                new Bin("ts", epochMillis),
                new Bin("tsLocal", row.getTimestamp().toString()),
                new Bin("salesGross", row.getSalesGross()),
                new Bin("salesNet", row.getSalesNet()),
                new Bin("tickets", row.getTickets()),
                new Bin("covers", row.getCovers()),
                new Bin("discounts", row.getDiscounts()),
                new Bin("voids", row.getVoids()),
                new Bin("comps", row.getComps()),
                new Bin("refunds", row.getRefunds()),
                new Bin("chDineIn", row.getChannelDineIn()),
                new Bin("chPickup", row.getChannelPickup()),
                new Bin("chDelivery", row.getChannelDelivery()));
    }

    public void saveLabor(LaborDailyRow row) {
        Key key = new Key(namespace, AerospikeConfig.SET_LABOR_DAILY, row.getLocationId() + ":" + row.getDate());

        client.put(writePolicy, key,
                new Bin("locationId", row.getLocationId()),
                new Bin("date", row.getDate().toString()),
                new Bin("schedHours", row.getScheduledHours()),
                new Bin("actualHours", row.getActualHours()),
                new Bin("laborCost", row.getLaborCostEst()),
                new Bin("otHours", row.getOvertimeHours()),
                new Bin("headcount", row.getHeadcount()));
    }

    public void saveItemMix(ItemMixDailyRow row) {
        Key key = new Key(namespace, AerospikeConfig.SET_ITEM_MIX_DAILY,
                row.getLocationId() + ":" + row.getDate() + ":" + row.getItemId());

        client.put(writePolicy, key,
                new Bin("locationId", row.getLocationId()),
                new Bin("date", row.getDate().toString()),
                new Bin("itemId", row.getItemId()),
                new Bin("itemName", row.getItemName()),
                new Bin("qty", row.getQty()),
                new Bin("revenueNet", row.getRevenueNet()),
                new Bin("marginEst", row.getMarginEst()),
                new Bin("attachRate", row.getAttachRate()));
    }

    public void saveInventory(InventoryDailyRow row) {
        Key key = new Key(namespace, AerospikeConfig.SET_INVENTORY_DAILY,
                row.getLocationId() + ":" + row.getDate() + ":" + row.getItemId());

        client.put(writePolicy, key,
                new Bin("locationId", row.getLocationId()),
                new Bin("date", row.getDate().toString()),
                new Bin("itemId", row.getItemId()),
                new Bin("itemName", row.getItemName()),
                new Bin("stockOnHand", row.getStockOnHand()),
                new Bin("stockIn", row.getStockIn()),
                new Bin("stockOut", row.getStockOut()),
                new Bin("wasteEst", row.getWasteEst()),
                new Bin("stockout", row.isStockoutFlag()));
    }

    private int logProgress(int written) {
        if (written % writeLogEvery == 0) {
            log.info("Written {} records...", written);
        }
        return written;
    }
}
