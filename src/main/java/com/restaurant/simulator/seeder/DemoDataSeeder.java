package com.restaurant.simulator.seeder;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GenerationSummary;
import com.restaurant.simulator.model.GeneratorOverrides;
import com.restaurant.simulator.service.BatchGenerationService;
import com.restaurant.simulator.service.GenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds Aerospike with a year of demo data for the configured locations.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Every location gets 365 days ending today: 365 x 52 sales buckets plus
 * labor, item-mix and inventory rows (about 25,000 records per location).
 * Re-seeding overwrites the same keys.
 */
@Component
@Profile("seed")
@Order(1)
public class DemoDataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoDataSeeder.class);

    static final int SEED_HORIZON_DAYS = 365;

    private final BatchGenerationService batchGenerationService;
    private final GeneratorProperties properties;

    public DemoDataSeeder(BatchGenerationService batchGenerationService, GeneratorProperties properties) {
        this.batchGenerationService = batchGenerationService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting demo data seeding ===");

        LocalDate today = LocalDate.now(ZoneId.of(properties.getZoneId()));
        List<GenerationSummary> summaries = batchGenerationService.generateAll(seedRequests(today));

        int totalRecords = 0;
        double totalNet = 0.0;
        for (GenerationSummary summary : summaries) {
            if (GenerationService.STATUS_FAILED.equals(summary.getStatus())) {
                log.error("  {} FAILED: {}", displayName(summary.getLocationId()), summary.getError());
                continue;
            }
            log.info("  {}: {} records, net sales {} EUR, labor ratio {}",
                    displayName(summary.getLocationId()), summary.getRecordsWritten(),
                    summary.getTotalNetSales(), summary.getLaborRatio());
            totalRecords += summary.getRecordsWritten();
            totalNet += summary.getTotalNetSales();
        }

        log.info("=== Demo data seeding complete: {} locations, {} records, {} EUR net ===",
                summaries.size(), totalRecords, Math.round(totalNet * 100.0) / 100.0);
    }

    String displayName(String locationId) {
        for (GeneratorProperties.SeedLocation location : properties.getSeedLocations()) {
            if (location.getLocationId().equals(locationId) && location.getName() != null) {
                return location.getName() + " (" + locationId + ")";
            }
        }
        return locationId;
    }

    List<GenerationRequest> seedRequests(LocalDate referenceDate) {
        List<GenerationRequest> requests = new ArrayList<>();
        for (GeneratorProperties.SeedLocation location : properties.getSeedLocations()) {
            requests.add(GenerationRequest.builder()
                    .locationId(location.getLocationId())
                    .horizonDays(SEED_HORIZON_DAYS)
                    .referenceDate(referenceDate)
                    .overrides(GeneratorOverrides.builder()
                            .baseDailySales(location.getBaseDailySales())
                            .avgTicketMean(location.getAvgTicketMean())
                            .build())
                    .build());
        }
        return requests;
    }
}
