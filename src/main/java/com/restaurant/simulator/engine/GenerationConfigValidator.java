package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.config.GeneratorProperties.MonthClimate;
import com.restaurant.simulator.exception.InvalidGenerationConfigException;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GeneratorOverrides;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Checks generator settings and a request before any computation happens.
 * The first violation found is thrown as {@link InvalidGenerationConfigException}.
 */
public final class GenerationConfigValidator {

    private GenerationConfigValidator() {}

    public static void validate(GeneratorProperties properties, GenerationRequest request) {
        validateRequest(request);
        validateProperties(properties);
        validateOverrides(properties, request.getOverrides() != null ? request.getOverrides() : GeneratorOverrides.none());
    }

    static void validateRequest(GenerationRequest request) {
        if (request.getLocationId() == null || request.getLocationId().isEmpty()) {
            throw new InvalidGenerationConfigException("locationId", "locationId must not be empty");
        }
        if (request.getHorizonDays() < 0) {
            throw new InvalidGenerationConfigException("horizonDays", "horizonDays must be >= 0");
        }
        if (request.getReferenceDate() == null) {
            throw new InvalidGenerationConfigException("referenceDate", "referenceDate is required");
        }
    }

    /**
     * Deployment guard applied by the service layer. The generator itself accepts any horizon.
     */
    public static void validateHorizonLimit(GeneratorProperties properties, GenerationRequest request) {
        if (request.getHorizonDays() > properties.getMaxHorizonDays()) {
            throw new InvalidGenerationConfigException("horizonDays",
                    "horizonDays must be <= " + properties.getMaxHorizonDays());
        }
    }

    static void validateProperties(GeneratorProperties p) {
        positive("baseDailySales", p.getBaseDailySales());
        nonNegative("salesFloor", p.getSalesFloor());
        try {
            ZoneId.of(p.getZoneId());
        } catch (DateTimeException | NullPointerException e) {
            throw new InvalidGenerationConfigException("zoneId", "zoneId is not a valid time zone: " + p.getZoneId());
        }

        GeneratorProperties.Trend trend = p.getTrend();
        if (!(trend.getRampEnd() > 0 && trend.getRampEnd() < trend.getSteadyEnd() && trend.getSteadyEnd() < 1)) {
            throw new InvalidGenerationConfigException("trend.rampEnd",
                    "trend changepoints must satisfy 0 < rampEnd < steadyEnd < 1");
        }
        nonNegative("trend.rampRate", trend.getRampRate());
        nonNegative("trend.steadyRate", trend.getSteadyRate());
        nonNegative("trend.matureRate", trend.getMatureRate());

        GeneratorProperties.Noise noise = p.getNoise();
        if (noise.getArCoefficient() < 0 || noise.getArCoefficient() >= 1) {
            throw new InvalidGenerationConfigException("noise.arCoefficient", "noise.arCoefficient must be in [0, 1)");
        }
        nonNegative("noise.whiteNoisePct", noise.getWhiteNoisePct());

        GeneratorProperties.Calendar calendar = p.getCalendar();
        isoDates("calendar.holidays", calendar.getHolidays());
        if (calendar.getEvents() != null) {
            isoDates("calendar.events", List.copyOf(calendar.getEvents().keySet()));
            calendar.getEvents().values().forEach(m -> positive("calendar.events", m));
        }
        climate("calendar.climate", calendar.getClimate());

        GeneratorProperties.Intraday intraday = p.getIntraday();
        int slotMinutes = intraday.getSlotMinutes();
        if (slotMinutes <= 0 || 60 % slotMinutes != 0) {
            throw new InvalidGenerationConfigException("intraday.slotMinutes", "intraday.slotMinutes must divide 60");
        }
        serviceWindow(intraday.getOpenHour(), intraday.getCloseHour());
        nonNegative("intraday.offPeakWeight", intraday.getOffPeakWeight());
        if (intraday.getHourWeights() != null) {
            intraday.getHourWeights().values().forEach(w -> nonNegative("intraday.hourWeights", w));
        }
        positive("intraday.avgTicketMean", intraday.getAvgTicketMean());
        positive("intraday.minAvgTicket", intraday.getMinAvgTicket());
        positive("intraday.coversPerTicket", intraday.getCoversPerTicket());
        fraction("intraday.discountPct", intraday.getDiscountPct());
        if (intraday.getDineInMin() + intraday.getDineInSpan() + intraday.getPickupMin() + intraday.getPickupSpan() > 1.0) {
            throw new InvalidGenerationConfigException("intraday.dineInMin",
                    "dine-in and pickup shares can exceed the bucket total");
        }
        fraction("intraday.voidProbability", intraday.getVoidProbability());
        fraction("intraday.compProbability", intraday.getCompProbability());
        fraction("intraday.refundProbability", intraday.getRefundProbability());

        GeneratorProperties.Labor labor = p.getLabor();
        fraction("labor.targetLaborRatio", labor.getTargetLaborRatio());
        positive("labor.avgHourlyRate", labor.getAvgHourlyRate());
        nonNegative("labor.hoursNoiseStd", labor.getHoursNoiseStd());
        positive("labor.shiftHours", labor.getShiftHours());

        GeneratorProperties.Menu menu = p.getMenu();
        if (menu.getItems() == null || menu.getItems().isEmpty()) {
            throw new InvalidGenerationConfigException("menu.items", "menu.items must not be empty");
        }
        menu.getItems().forEach(item -> positive("menu.items.price", item.getPrice()));

        GeneratorProperties.Inventory inventory = p.getInventory();
        if (inventory.getRestockEveryDays() <= 0) {
            throw new InvalidGenerationConfigException("inventory.restockEveryDays", "inventory.restockEveryDays must be > 0");
        }
        if (inventory.getMinDailyUse() < 0 || inventory.getMaxDailyUse() < inventory.getMinDailyUse()) {
            throw new InvalidGenerationConfigException("inventory.maxDailyUse",
                    "inventory daily use must satisfy 0 <= minDailyUse <= maxDailyUse");
        }
        fraction("inventory.wastePct", inventory.getWastePct());
    }

    static void validateOverrides(GeneratorProperties properties, GeneratorOverrides o) {
        if (o.getRampRate() != null) nonNegative("overrides.rampRate", o.getRampRate());
        if (o.getSteadyRate() != null) nonNegative("overrides.steadyRate", o.getSteadyRate());
        if (o.getMatureRate() != null) nonNegative("overrides.matureRate", o.getMatureRate());
        if (o.getTargetLaborRatio() != null) fraction("overrides.targetLaborRatio", o.getTargetLaborRatio());
        if (o.getAvgHourlyRate() != null) positive("overrides.avgHourlyRate", o.getAvgHourlyRate());
        if (o.getBaseDailySales() != null) positive("overrides.baseDailySales", o.getBaseDailySales());
        if (o.getAvgTicketMean() != null) positive("overrides.avgTicketMean", o.getAvgTicketMean());
        if (o.getOpenHour() != null || o.getCloseHour() != null) {
            serviceWindow(GeneratorOverrides.or(o.getOpenHour(), properties.getIntraday().getOpenHour()),
                    GeneratorOverrides.or(o.getCloseHour(), properties.getIntraday().getCloseHour()));
        }
        if (o.getHolidays() != null) isoDates("overrides.holidays", o.getHolidays());
        if (o.getClimate() != null) climate("overrides.climate", o.getClimate());

        GeneratorProperties.Intraday intraday = properties.getIntraday();
        int openHour = GeneratorOverrides.or(o.getOpenHour(), intraday.getOpenHour());
        int closeHour = GeneratorOverrides.or(o.getCloseHour(), intraday.getCloseHour());
        double curveWeight = 0.0;
        for (int hour = openHour; hour <= closeHour; hour++) {
            Double configured = intraday.getHourWeights() != null ? intraday.getHourWeights().get(hour) : null;
            curveWeight += configured != null ? configured : intraday.getOffPeakWeight();
        }
        if (!(curveWeight > 0)) {
            throw new InvalidGenerationConfigException("intraday.hourWeights",
                    "demand curve has no weight inside the service window");
        }
    }

    private static void serviceWindow(int openHour, int closeHour) {
        if (openHour < 0 || closeHour > 23 || openHour > closeHour) {
            throw new InvalidGenerationConfigException("openHour",
                    "service window must satisfy 0 <= openHour <= closeHour <= 23");
        }
    }

    private static void climate(String field, Map<Month, MonthClimate> table) {
        if (table == null) return;
        for (MonthClimate normals : table.values()) {
            if (normals == null) continue;
            nonNegative(field + ".temperatureStd", normals.getTemperatureStd());
            fraction(field + ".rainProbability", normals.getRainProbability());
        }
    }

    private static void isoDates(String field, List<String> dates) {
        if (dates == null) return;
        for (String date : dates) {
            try {
                LocalDate.parse(date);
            } catch (DateTimeParseException | NullPointerException e) {
                throw new InvalidGenerationConfigException(field, field + " has an invalid ISO date: " + date);
            }
        }
    }

    private static void positive(String field, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidGenerationConfigException(field, field + " must be > 0");
        }
    }

    private static void nonNegative(String field, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidGenerationConfigException(field, field + " must be >= 0");
        }
    }

    private static void fraction(String field, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new InvalidGenerationConfigException(field, field + " must be in [0, 1]");
        }
    }
}
