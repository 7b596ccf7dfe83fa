package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.engine.calendar.ReferenceTables;
import com.restaurant.simulator.engine.random.IdentityHasher;
import com.restaurant.simulator.engine.random.BitMixer;
import com.restaurant.simulator.engine.random.NormalSampler;
import com.restaurant.simulator.engine.random.SeedIdentity;
import com.restaurant.simulator.model.GeneratedDataset;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GeneratorOverrides;
import com.restaurant.simulator.model.InventoryDailyRow;
import com.restaurant.simulator.model.ItemMixDailyRow;
import com.restaurant.simulator.model.LaborDailyRow;
import com.restaurant.simulator.model.SalesBucketRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Generates the sales, labor, item-mix and inventory series for one seed
 * identity over a horizon of days ending on a reference date.
 *
 * Output is a pure function of (identity, horizon, reference date, settings):
 * the run-scoped stream is seeded from the identity hash and every day-scoped
 * stream from the date plus the identity. Runs share no state, so one instance
 * can serve concurrent runs.
 */
@Component
public class SyntheticDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticDataGenerator.class);

    private final GeneratorProperties properties;

    public SyntheticDataGenerator(GeneratorProperties properties) {
        this.properties = properties;
    }

    /**
     * Run identity of a request: (locationId, orgId), or just locationId when no org is given.
     */
    public static SeedIdentity identityFor(GenerationRequest request) {
        String orgId = request.getOrgId();
        if (orgId == null || orgId.isBlank()) {
            return SeedIdentity.of(request.getLocationId());
        }
        return SeedIdentity.of(request.getLocationId(), orgId);
    }

    /**
     * Generates for a free-form identity string, which is also written as the
     * location id of every row. Uses configured defaults.
     */
    public GeneratedDataset generate(String identity, int horizonDays, LocalDate referenceDate) {
        GenerationRequest request = GenerationRequest.builder()
                .locationId(identity)
                .horizonDays(horizonDays)
                .referenceDate(referenceDate)
                .build();
        return generate(request);
    }

    public GeneratedDataset generate(GenerationRequest request) {
        GenerationConfigValidator.validate(properties, request);
        return run(request.getLocationId(), identityFor(request), request.getHorizonDays(),
                request.getReferenceDate(),
                request.getOverrides() != null ? request.getOverrides() : GeneratorOverrides.none());
    }

    private GeneratedDataset run(String locationId, SeedIdentity identity, int horizon,
                                 LocalDate referenceDate, GeneratorOverrides overrides) {
        if (horizon == 0) {
            log.debug("Horizon is 0 for {}, nothing to generate", identity);
            return GeneratedDataset.empty();
        }

        ZoneId zone = ZoneId.of(properties.getZoneId());
        TrendModel trendModel = TrendModel.from(properties.getTrend(), overrides);
        ReferenceTables tables = ReferenceTables.from(properties.getCalendar(), overrides);
        DailyComposer composer = new DailyComposer(
                GeneratorOverrides.or(overrides.getBaseDailySales(), properties.getBaseDailySales()),
                properties.getSalesFloor(), trendModel, tables,
                properties.getNoise(), properties.getWeather(), properties.getCalendar());
        IntradayAllocator allocator = IntradayAllocator.from(properties.getIntraday(), overrides);
        LaborSeriesGenerator laborGenerator = LaborSeriesGenerator.from(properties.getLabor(), overrides);
        ItemMixSeriesGenerator itemMixGenerator = new ItemMixSeriesGenerator(properties.getMenu());
        InventorySeriesGenerator inventoryGenerator = new InventorySeriesGenerator(properties.getInventory());

        List<SalesBucketRow> buckets = new ArrayList<>(horizon * allocator.slotsPerDay());
        List<LaborDailyRow> labor = new ArrayList<>(horizon);
        List<ItemMixDailyRow> itemMix = new ArrayList<>(horizon * properties.getMenu().getItems().size());
        List<InventoryDailyRow> inventory = new ArrayList<>(horizon * properties.getInventory().getIngredients().size());

        // Run-scoped stream: only the AR(1) shock draws from it.
        NormalSampler runSampler = new NormalSampler(IdentityHasher.mixerFor(identity));
        double residual = 0.0;
        Map<String, Double> stockLevels = inventoryGenerator.initialLevels();

        LocalDate startDate = referenceDate.minusDays(horizon - 1L);
        for (int dayIndex = 0; dayIndex < horizon; dayIndex++) {
            LocalDate date = startDate.plusDays(dayIndex);
            DayStreams streams = DayStreams.forDay(identity, date);

            DayStep step = composer.step(dayIndex, horizon, date, streams.weather(), runSampler, residual);
            residual = step.residual();
            DayRecord day = step.record();

            DayAllocation allocation = allocator.allocate(locationId, day, zone, streams.intraday());
            buckets.addAll(allocation.buckets());

            labor.add(laborGenerator.generate(locationId, day, allocation.netSales(),
                    new NormalSampler(streams.labor())));
            itemMix.addAll(itemMixGenerator.generate(locationId, date, allocation.netSales(), allocation.tickets()));

            BitMixer inventoryStream = streams.inventory();
            InventorySeriesGenerator.InventoryStep inventoryStep =
                    inventoryGenerator.step(locationId, dayIndex, date, stockLevels, inventoryStream);
            inventory.addAll(inventoryStep.rows());
            stockLevels = inventoryStep.closingLevels();

            if (log.isDebugEnabled()) {
                log.debug("{} day {} ({}): level={} trend={} weather={} residual={}",
                        locationId, dayIndex, date, Money.round2(day.salesLevel()),
                        day.trendMultiplier(), day.weatherMultiplier(), day.residual());
            }
        }

        return new GeneratedDataset(buckets, labor, itemMix, inventory);
    }
}
