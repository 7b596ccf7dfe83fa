package com.restaurant.simulator.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "generator")
public class GeneratorProperties {

    // Location-level sales anchor before trend, seasonality and noise (EUR/day).
    private double baseDailySales = 5000.0;

    // No simulated day goes below this, whatever the noise draw.
    private double salesFloor = 500.0;

    // Wall-clock zone for 15-minute bucket timestamps and for "today".
    private String zoneId = "Europe/Madrid";

    // Upper bound on a single run; cost is linear in days x buckets.
    private int maxHorizonDays = 1100;

    private Trend trend = new Trend();
    private Noise noise = new Noise();
    private Weather weather = new Weather();
    private Calendar calendar = new Calendar();
    private Intraday intraday = new Intraday();
    private Labor labor = new Labor();
    private Menu menu = new Menu();
    private Inventory inventory = new Inventory();
    private Batch batch = new Batch();

    // Locations created by the "seed" profile.
    private List<SeedLocation> seedLocations = new ArrayList<>(List.of(
            new SeedLocation("loc-malasana", "La Taberna Malasana", 4500.0, 24.0),
            new SeedLocation("loc-centro", "La Taberna Centro", 5500.0, 26.0),
            new SeedLocation("loc-chamberi", "La Taberna Chamberi", 5000.0, 24.0),
            new SeedLocation("loc-salamanca", "La Taberna Salamanca", 4000.0, 23.0)));

    @Data
    public static class Trend {
        // Fractional positions in the horizon where the growth phase switches.
        private double rampEnd = 0.30;
        private double steadyEnd = 0.70;
        // Multiplier gained over each phase.
        private double rampRate = 0.30;
        private double steadyRate = 0.12;
        private double matureRate = 0.05;
    }

    @Data
    public static class Noise {
        // AR(1) coefficient: share of yesterday's residual carried into today.
        private double arCoefficient = 0.35;
        // Std-dev of the daily shock as a fraction of the deterministic level.
        private double whiteNoisePct = 0.08;
    }

    @Data
    public static class Weather {
        private double rainMultiplier = 0.82;
        private double coldThreshold = 10.0;
        private double coldMultiplier = 0.90;
        private double hotThreshold = 30.0;
        private double hotMultiplier = 0.92;
        private double idealMin = 18.0;
        private double idealMax = 25.0;
        private double idealMultiplier = 1.05;
    }

    @Data
    public static class Calendar {
        private double holidayMultiplier = 0.80;
        private double paydayMultiplier = 1.05;
        private List<Integer> paydayDays = new ArrayList<>(List.of(1, 15));
        // Every day of month from this one onwards counts as payday.
        private int paydayFromDay = 25;

        // ISO dates (Spanish national holidays).
        private List<String> holidays = new ArrayList<>(List.of(
                "2025-01-01", "2025-01-06", "2025-04-18", "2025-04-21", "2025-05-01",
                "2025-08-15", "2025-10-12", "2025-11-01", "2025-12-06", "2025-12-08",
                "2025-12-25",
                "2026-01-01", "2026-01-06", "2026-04-03", "2026-04-06", "2026-05-01",
                "2026-08-15", "2026-10-12", "2026-11-01", "2026-12-06", "2026-12-08",
                "2026-12-25"));

        // ISO date -> demand uplift for large city events.
        private Map<String, Double> events = new LinkedHashMap<>(Map.ofEntries(
                Map.entry("2025-03-15", 1.30), Map.entry("2025-04-20", 1.30),
                Map.entry("2025-05-15", 1.20), Map.entry("2025-07-10", 1.40),
                Map.entry("2025-07-11", 1.40), Map.entry("2025-07-12", 1.40),
                Map.entry("2025-09-20", 1.30), Map.entry("2025-10-25", 1.30),
                Map.entry("2026-02-18", 1.30), Map.entry("2026-03-10", 1.30),
                Map.entry("2026-04-15", 1.30), Map.entry("2026-05-15", 1.20),
                Map.entry("2026-05-20", 1.30), Map.entry("2026-07-09", 1.40),
                Map.entry("2026-07-10", 1.40), Map.entry("2026-07-11", 1.40)));

        private Map<DayOfWeek, Double> weekdayMultipliers = new EnumMap<>(Map.of(
                DayOfWeek.MONDAY, 0.75,
                DayOfWeek.TUESDAY, 0.85,
                DayOfWeek.WEDNESDAY, 0.90,
                DayOfWeek.THURSDAY, 1.00,
                DayOfWeek.FRIDAY, 1.30,
                DayOfWeek.SATURDAY, 1.40,
                DayOfWeek.SUNDAY, 1.10));

        private Map<Month, Double> monthMultipliers = new EnumMap<>(Map.ofEntries(
                Map.entry(Month.JANUARY, 0.90), Map.entry(Month.FEBRUARY, 0.92),
                Map.entry(Month.MARCH, 1.00), Map.entry(Month.APRIL, 1.02),
                Map.entry(Month.MAY, 1.05), Map.entry(Month.JUNE, 0.95),
                Map.entry(Month.JULY, 0.80), Map.entry(Month.AUGUST, 0.75),
                Map.entry(Month.SEPTEMBER, 0.98), Map.entry(Month.OCTOBER, 1.02),
                Map.entry(Month.NOVEMBER, 1.05), Map.entry(Month.DECEMBER, 1.30)));

        // Madrid climate normals.
        private Map<Month, MonthClimate> climate = new EnumMap<>(Map.ofEntries(
                Map.entry(Month.JANUARY, new MonthClimate(8.0, 3.0, 0.30)),
                Map.entry(Month.FEBRUARY, new MonthClimate(10.0, 3.0, 0.28)),
                Map.entry(Month.MARCH, new MonthClimate(13.0, 3.5, 0.25)),
                Map.entry(Month.APRIL, new MonthClimate(15.0, 3.5, 0.35)),
                Map.entry(Month.MAY, new MonthClimate(19.0, 3.5, 0.30)),
                Map.entry(Month.JUNE, new MonthClimate(24.0, 3.0, 0.15)),
                Map.entry(Month.JULY, new MonthClimate(28.0, 3.0, 0.10)),
                Map.entry(Month.AUGUST, new MonthClimate(28.0, 3.0, 0.10)),
                Map.entry(Month.SEPTEMBER, new MonthClimate(24.0, 3.0, 0.20)),
                Map.entry(Month.OCTOBER, new MonthClimate(18.0, 3.5, 0.30)),
                Map.entry(Month.NOVEMBER, new MonthClimate(12.0, 3.0, 0.32)),
                Map.entry(Month.DECEMBER, new MonthClimate(9.0, 3.0, 0.35))));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MonthClimate {
        private double avgTemperature;
        private double temperatureStd;
        private double rainProbability;
    }

    @Data
    public static class Intraday {
        // First and last service hour (inclusive), split into slots.
        private int openHour = 11;
        private int closeHour = 23;
        private int slotMinutes = 15;

        // Share of the day's covers per service hour; unlisted hours get offPeakWeight.
        private Map<Integer, Double> hourWeights = new HashMap<>(Map.of(
                12, 0.04,
                13, 0.15,
                14, 0.15,
                19, 0.04,
                20, 0.17,
                21, 0.17,
                22, 0.17));
        private double offPeakWeight = 0.01;

        private double avgTicketMean = 25.0;
        private double avgTicketStd = 3.0;
        private double minAvgTicket = 5.0;
        private double coversPerTicket = 2.5;
        private double discountPct = 0.05;

        private double dineInMin = 0.62;
        private double dineInSpan = 0.08;
        private double pickupMin = 0.05;
        private double pickupSpan = 0.05;

        private double voidProbability = 0.02;
        private double voidAmount = 15.0;
        private double compProbability = 0.03;
        private double compAmount = 25.0;
        private double refundProbability = 0.01;
        private double refundAmount = 30.0;
    }

    @Data
    public static class Labor {
        private double targetLaborRatio = 0.28;
        private double avgHourlyRate = 15.0;
        private double hoursNoiseStd = 0.03;
        private double minWeekdayHours = 38.0;
        private double minWeekendHours = 48.0;
        private double shiftHours = 8.0;
    }

    @Data
    public static class Menu {
        // Share of net sales for the best seller; each next item gets shareStep less.
        private double topItemShare = 0.15;
        private double shareStep = 0.015;
        private List<MenuItem> items = new ArrayList<>(List.of(
                new MenuItem("item-1", "Paella Valenciana", 18.50, 0.42),
                new MenuItem("item-2", "Jamon Iberico", 16.00, 0.55),
                new MenuItem("item-3", "Croquetas de Jamon", 9.50, 0.48),
                new MenuItem("item-4", "Chuleton de Buey", 32.00, 0.38),
                new MenuItem("item-5", "Pulpo a la Gallega", 22.00, 0.45),
                new MenuItem("item-6", "Gazpacho", 7.50, 0.62),
                new MenuItem("item-7", "Tortilla Espanola", 8.00, 0.58),
                new MenuItem("item-8", "Bacalao al Pil-Pil", 24.00, 0.40),
                new MenuItem("item-9", "Ensalada Mixta", 8.50, 0.65),
                new MenuItem("item-10", "Cerveza Estrella", 3.00, 0.70)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MenuItem {
        private String id;
        private String name;
        private double price;
        private double margin;
    }

    @Data
    public static class Inventory {
        private int restockEveryDays = 3;
        private double minDailyUse = 8.0;
        private double maxDailyUse = 18.0;
        private double wastePct = 0.03;
        private List<Ingredient> ingredients = new ArrayList<>(List.of(
                new Ingredient("ingredient-1", "Salmon", "kg", 100.0),
                new Ingredient("ingredient-2", "Rice", "kg", 85.0),
                new Ingredient("ingredient-3", "Iberian Ham", "kg", 70.0),
                new Ingredient("ingredient-4", "Potatoes", "kg", 55.0),
                new Ingredient("ingredient-5", "Olive Oil", "L", 40.0)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Ingredient {
        private String id;
        private String name;
        private String unit;
        // Stock on hand at the start of a run, and the order-up-to level on restock days.
        private double parLevel;
    }

    @Data
    public static class Batch {
        private int workerThreads = 4;
        private int writeLogEvery = 10_000;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeedLocation {
        private String locationId;
        private String name;
        private double baseDailySales;
        private double avgTicketMean;
    }
}
