package com.restaurant.simulator.engine.calendar;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.config.GeneratorProperties.MonthClimate;
import com.restaurant.simulator.model.GeneratorOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calendar and climate lookups for the daily composer. Pure data, no randomness.
 *
 * Lookups never fail: a missing weekday, month or climate entry resolves to a
 * neutral default (multiplier 1.0, climate {@link #NEUTRAL_CLIMATE}).
 */
public class ReferenceTables {

    private static final Logger log = LoggerFactory.getLogger(ReferenceTables.class);

    public static final double NEUTRAL_MULTIPLIER = 1.0;
    public static final MonthClimate NEUTRAL_CLIMATE = new MonthClimate(18.0, 4.0, 0.25);

    private final Set<LocalDate> holidays;
    private final Map<LocalDate, Double> events;
    private final Map<DayOfWeek, Double> weekdayMultipliers;
    private final Map<Month, Double> monthMultipliers;
    private final Map<Month, MonthClimate> climate;

    public ReferenceTables(Set<LocalDate> holidays,
                           Map<LocalDate, Double> events,
                           Map<DayOfWeek, Double> weekdayMultipliers,
                           Map<Month, Double> monthMultipliers,
                           Map<Month, MonthClimate> climate) {
        this.holidays = Set.copyOf(holidays);
        this.events = Map.copyOf(events);
        this.weekdayMultipliers = copyEnumMap(weekdayMultipliers, DayOfWeek.class);
        this.monthMultipliers = copyEnumMap(monthMultipliers, Month.class);
        this.climate = copyEnumMap(climate, Month.class);
    }

    /**
     * Builds the tables from configuration, with the holiday set and climate
     * table replaced when the overrides carry them. Dates must already be valid
     * ISO strings (checked by the config validator).
     */
    public static ReferenceTables from(GeneratorProperties.Calendar calendar, GeneratorOverrides overrides) {
        List<String> holidayDates = GeneratorOverrides.or(overrides.getHolidays(), calendar.getHolidays());
        Map<Month, MonthClimate> climate = GeneratorOverrides.or(overrides.getClimate(), calendar.getClimate());

        Set<LocalDate> holidays = new HashSet<>();
        for (String date : holidayDates) {
            holidays.add(LocalDate.parse(date));
        }
        Map<LocalDate, Double> events = new HashMap<>();
        calendar.getEvents().forEach((date, multiplier) -> events.put(LocalDate.parse(date), multiplier));

        return new ReferenceTables(holidays, events,
                calendar.getWeekdayMultipliers(), calendar.getMonthMultipliers(), climate);
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public double eventMultiplier(LocalDate date) {
        return events.getOrDefault(date, NEUTRAL_MULTIPLIER);
    }

    public double weekdayMultiplier(DayOfWeek dayOfWeek) {
        Double multiplier = weekdayMultipliers.get(dayOfWeek);
        if (multiplier == null) {
            log.debug("No weekday multiplier for {}, using {}", dayOfWeek, NEUTRAL_MULTIPLIER);
            return NEUTRAL_MULTIPLIER;
        }
        return multiplier;
    }

    public double monthMultiplier(Month month) {
        Double multiplier = monthMultipliers.get(month);
        if (multiplier == null) {
            log.debug("No month multiplier for {}, using {}", month, NEUTRAL_MULTIPLIER);
            return NEUTRAL_MULTIPLIER;
        }
        return multiplier;
    }

    public MonthClimate climate(Month month) {
        MonthClimate normals = climate.get(month);
        if (normals == null) {
            log.debug("No climate normals for {}, using neutral defaults", month);
            return NEUTRAL_CLIMATE;
        }
        return normals;
    }

    public Set<LocalDate> holidays() {
        return Collections.unmodifiableSet(holidays);
    }

    private static <K extends Enum<K>, V> Map<K, V> copyEnumMap(Map<K, V> source, Class<K> keyType) {
        EnumMap<K, V> copy = new EnumMap<>(keyType);
        if (source != null) {
            source.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        return copy;
    }
}
