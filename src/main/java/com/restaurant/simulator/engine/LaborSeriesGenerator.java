package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.engine.random.NormalSampler;
import com.restaurant.simulator.model.GeneratorOverrides;
import com.restaurant.simulator.model.LaborDailyRow;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * Daily labor from net sales: the rota targets a fixed labor-cost ratio, and
 * clocked hours scatter around the rota with small multiplicative noise.
 */
public class LaborSeriesGenerator {

    // Busy service days staffed to the weekend minimum.
    private static final Set<DayOfWeek> WEEKEND_SERVICE_DAYS =
            EnumSet.of(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    private final GeneratorProperties.Labor settings;
    private final double targetLaborRatio;
    private final double avgHourlyRate;

    public LaborSeriesGenerator(GeneratorProperties.Labor settings, double targetLaborRatio, double avgHourlyRate) {
        this.settings = settings;
        this.targetLaborRatio = targetLaborRatio;
        this.avgHourlyRate = avgHourlyRate;
    }

    public static LaborSeriesGenerator from(GeneratorProperties.Labor settings, GeneratorOverrides overrides) {
        return new LaborSeriesGenerator(settings,
                GeneratorOverrides.or(overrides.getTargetLaborRatio(), settings.getTargetLaborRatio()),
                GeneratorOverrides.or(overrides.getAvgHourlyRate(), settings.getAvgHourlyRate()));
    }

    public LaborDailyRow generate(String locationId, DayRecord day, double netSales, NormalSampler laborSampler) {
        double targetCost = netSales * targetLaborRatio;
        double minimumHours = WEEKEND_SERVICE_DAYS.contains(day.dayOfWeek())
                ? settings.getMinWeekendHours()
                : settings.getMinWeekdayHours();

        double scheduledHours = Math.max(targetCost / avgHourlyRate, minimumHours);
        double actualHours = Math.max(0.0, scheduledHours * laborSampler.normal(1.0, settings.getHoursNoiseStd()));
        double laborCost = actualHours * avgHourlyRate;
        double overtime = Math.max(0.0, actualHours - scheduledHours);
        int headcount = (int) Math.max(1, Math.round(actualHours / settings.getShiftHours()));

        return LaborDailyRow.builder()
                .locationId(locationId)
                .date(day.date())
                .scheduledHours(Money.round1(scheduledHours))
                .actualHours(Money.round1(actualHours))
                .laborCostEst(Money.round2(laborCost))
                .overtimeHours(Money.round1(overtime))
                .headcount(headcount)
                .build();
    }
}
