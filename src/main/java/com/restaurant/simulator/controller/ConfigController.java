package com.restaurant.simulator.controller;

import com.restaurant.simulator.config.AerospikeConfig;
import com.restaurant.simulator.config.GeneratorProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify generator configuration (trend, labor)")
public class ConfigController {

    private final GeneratorProperties properties;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(GeneratorProperties properties, AerospikeConfig aerospikeConfig) {
        this.properties = properties;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Generator overview ──

    @Operation(summary = "Get the main generator settings")
    @GetMapping("/generator")
    public ResponseEntity<Map<String, Object>> getGenerator() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("baseDailySales", properties.getBaseDailySales());
        body.put("salesFloor", properties.getSalesFloor());
        body.put("zoneId", properties.getZoneId());
        body.put("maxHorizonDays", properties.getMaxHorizonDays());
        body.put("trend", trendView());
        body.put("labor", laborView());
        body.put("serviceWindow", Map.of(
                "openHour", properties.getIntraday().getOpenHour(),
                "closeHour", properties.getIntraday().getCloseHour(),
                "slotMinutes", properties.getIntraday().getSlotMinutes()));
        body.put("menuItems", properties.getMenu().getItems().size());
        body.put("ingredients", properties.getInventory().getIngredients().size());
        return ResponseEntity.ok(body);
    }

    // ── Trend ──

    @Operation(summary = "Update growth trend settings",
            description = "Changes apply to the next run but reset on restart.")
    @PutMapping("/trend")
    public ResponseEntity<?> updateTrend(@RequestBody Map<String, Object> body) {
        GeneratorProperties.Trend trend = properties.getTrend();
        double rampEnd = toDouble(body, "rampEnd", trend.getRampEnd());
        double steadyEnd = toDouble(body, "steadyEnd", trend.getSteadyEnd());
        double rampRate = toDouble(body, "rampRate", trend.getRampRate());
        double steadyRate = toDouble(body, "steadyRate", trend.getSteadyRate());
        double matureRate = toDouble(body, "matureRate", trend.getMatureRate());

        // NaN fails every check below.
        if (!(rampEnd > 0)) return badRequest("rampEnd must be > 0", "rampEnd");
        if (!(steadyEnd > rampEnd)) return badRequest("steadyEnd must be greater than rampEnd", "steadyEnd");
        if (!(steadyEnd < 1)) return badRequest("steadyEnd must be < 1", "steadyEnd");
        if (!isFiniteNonNegative(rampRate)) return badRequest("rampRate must be a finite number >= 0", "rampRate");
        if (!isFiniteNonNegative(steadyRate)) return badRequest("steadyRate must be a finite number >= 0", "steadyRate");
        if (!isFiniteNonNegative(matureRate)) return badRequest("matureRate must be a finite number >= 0", "matureRate");

        trend.setRampEnd(rampEnd);
        trend.setSteadyEnd(steadyEnd);
        trend.setRampRate(rampRate);
        trend.setSteadyRate(steadyRate);
        trend.setMatureRate(matureRate);

        return ResponseEntity.ok(trendView());
    }

    // ── Labor ──

    @Operation(summary = "Update labor settings",
            description = "Changes apply to the next run but reset on restart.")
    @PutMapping("/labor")
    public ResponseEntity<?> updateLabor(@RequestBody Map<String, Object> body) {
        GeneratorProperties.Labor labor = properties.getLabor();
        double ratio = toDouble(body, "targetLaborRatio", labor.getTargetLaborRatio());
        double rate = toDouble(body, "avgHourlyRate", labor.getAvgHourlyRate());
        double weekday = toDouble(body, "minWeekdayHours", labor.getMinWeekdayHours());
        double weekend = toDouble(body, "minWeekendHours", labor.getMinWeekendHours());

        if (!(ratio > 0 && ratio <= 1)) return badRequest("targetLaborRatio must be in (0, 1]", "targetLaborRatio");
        if (!(rate > 0) || Double.isInfinite(rate)) return badRequest("avgHourlyRate must be a finite number > 0", "avgHourlyRate");
        if (!isFiniteNonNegative(weekday)) return badRequest("minWeekdayHours must be a finite number >= 0", "minWeekdayHours");
        if (!isFiniteNonNegative(weekend)) return badRequest("minWeekendHours must be a finite number >= 0", "minWeekendHours");

        labor.setTargetLaborRatio(ratio);
        labor.setAvgHourlyRate(rate);
        labor.setMinWeekdayHours(weekday);
        labor.setMinWeekendHours(weekend);

        return ResponseEntity.ok(laborView());
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private Map<String, Object> trendView() {
        GeneratorProperties.Trend trend = properties.getTrend();
        return Map.of(
                "rampEnd", trend.getRampEnd(),
                "steadyEnd", trend.getSteadyEnd(),
                "rampRate", trend.getRampRate(),
                "steadyRate", trend.getSteadyRate(),
                "matureRate", trend.getMatureRate());
    }

    private Map<String, Object> laborView() {
        GeneratorProperties.Labor labor = properties.getLabor();
        return Map.of(
                "targetLaborRatio", labor.getTargetLaborRatio(),
                "avgHourlyRate", labor.getAvgHourlyRate(),
                "minWeekdayHours", labor.getMinWeekdayHours(),
                "minWeekendHours", labor.getMinWeekendHours());
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private static boolean isFiniteNonNegative(double value) {
        return value >= 0 && !Double.isInfinite(value);
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
