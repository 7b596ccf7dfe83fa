package com.restaurant.simulator.service;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.config.MetricsConfig;
import com.restaurant.simulator.engine.GenerationConfigValidator;
import com.restaurant.simulator.engine.SyntheticDataGenerator;
import com.restaurant.simulator.model.GeneratedDataset;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GenerationSummary;
import com.restaurant.simulator.model.LaborDailyRow;
import com.restaurant.simulator.model.SalesBucketRow;
import com.restaurant.simulator.repository.GeneratedRowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneId;

@Service
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private final SyntheticDataGenerator generator;
    private final GeneratedRowRepository repository;
    private final GeneratorProperties properties;
    private final MetricsConfig metrics;

    public GenerationService(SyntheticDataGenerator generator,
                             GeneratedRowRepository repository,
                             GeneratorProperties properties,
                             MetricsConfig metrics) {
        this.generator = generator;
        this.repository = repository;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Generate without persisting. Horizons above {@code generator.max-horizon-days} are rejected.
     */
    public GeneratedDataset preview(GenerationRequest request) {
        GenerationRequest resolved = withReferenceDate(request);
        GenerationConfigValidator.validateHorizonLimit(properties, resolved);
        GeneratedDataset dataset = generator.generate(resolved);
        log.info("Previewed {} days for {}: {} rows", resolved.getHorizonDays(), resolved.getLocationId(),
                dataset.totalRows());
        return dataset;
    }

    /**
     * Generate, write every row to Aerospike and summarize the run.
     * Persistence failures are logged and re-thrown.
     */
    public GenerationSummary generateAndStore(GenerationRequest request) {
        long start = System.currentTimeMillis();
        GenerationRequest resolved = withReferenceDate(request);
        GenerationConfigValidator.validateHorizonLimit(properties, resolved);
        log.info("Generating {} days for {} ending {}", resolved.getHorizonDays(), resolved.getLocationId(),
                resolved.getReferenceDate());

        GeneratedDataset dataset = generator.generate(resolved);

        int written;
        try {
            written = repository.saveAll(dataset);
        } catch (RuntimeException e) {
            log.error("Failed to store generated rows for {}: {}", resolved.getLocationId(), e.getMessage());
            metrics.recordRun(STATUS_FAILED, resolved.getHorizonDays());
            throw e;
        }

        metrics.recordRun(STATUS_SUCCESS, resolved.getHorizonDays());
        metrics.recordRows("sales_15m", dataset.salesBuckets().size());
        metrics.recordRows("labor_daily", dataset.laborDaily().size());
        metrics.recordRows("item_mix_daily", dataset.itemMixDaily().size());
        metrics.recordRows("inventory_daily", dataset.inventoryDaily().size());

        GenerationSummary summary = summarize(resolved, dataset, written, System.currentTimeMillis() - start);
        log.info("Stored {} records for {} ({} buckets, {} labor, {} item-mix, {} inventory) in {}ms, labor ratio {}",
                written, summary.getLocationId(), summary.getSalesBucketRows(), summary.getLaborRows(),
                summary.getItemMixRows(), summary.getInventoryRows(), summary.getDurationMs(), summary.getLaborRatio());
        return summary;
    }

    GenerationRequest withReferenceDate(GenerationRequest request) {
        if (request.getReferenceDate() != null) {
            return request;
        }
        LocalDate today = LocalDate.now(ZoneId.of(properties.getZoneId()));
        return GenerationRequest.builder()
                .locationId(request.getLocationId())
                .orgId(request.getOrgId())
                .horizonDays(request.getHorizonDays())
                .referenceDate(today)
                .overrides(request.getOverrides())
                .build();
    }

    static GenerationSummary summarize(GenerationRequest request, GeneratedDataset dataset,
                                       int written, long durationMs) {
        double gross = 0.0;
        double net = 0.0;
        for (SalesBucketRow bucket : dataset.salesBuckets()) {
            gross += bucket.getSalesGross();
            net += bucket.getSalesNet();
        }
        double laborCost = 0.0;
        for (LaborDailyRow row : dataset.laborDaily()) {
            laborCost += row.getLaborCostEst();
        }

        int horizon = request.getHorizonDays();
        LocalDate toDate = request.getReferenceDate();
        return GenerationSummary.builder()
                .locationId(request.getLocationId())
                .status(STATUS_SUCCESS)
                .horizonDays(horizon)
                .fromDate(horizon > 0 ? toDate.minusDays(horizon - 1L) : null)
                .toDate(horizon > 0 ? toDate : null)
                .salesBucketRows(dataset.salesBuckets().size())
                .laborRows(dataset.laborDaily().size())
                .itemMixRows(dataset.itemMixDaily().size())
                .inventoryRows(dataset.inventoryDaily().size())
                .recordsWritten(written)
                .totalGrossSales(Math.round(gross * 100.0) / 100.0)
                .totalNetSales(Math.round(net * 100.0) / 100.0)
                .totalLaborCost(Math.round(laborCost * 100.0) / 100.0)
                .laborRatio(net > 0 ? Math.round(laborCost / net * 10_000.0) / 10_000.0 : 0.0)
                .durationMs(durationMs)
                .build();
    }
}
