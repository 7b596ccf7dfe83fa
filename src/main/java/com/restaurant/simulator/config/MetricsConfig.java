package com.restaurant.simulator.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String status, int horizonDays) {
        Counter.builder("generation.runs.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("generation.horizon.days")
                .register(registry)
                .record(horizonDays);
    }

    public void recordRows(String family, int count) {
        Counter.builder("generation.rows.count")
                .tag("family", family)
                .register(registry)
                .increment(count);
    }
}
