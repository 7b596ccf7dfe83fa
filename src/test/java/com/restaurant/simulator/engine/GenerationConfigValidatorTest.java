package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.exception.InvalidGenerationConfigException;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GeneratorOverrides;
import com.restaurant.simulator.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationConfigValidatorTest {

    private GeneratorProperties properties;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.defaultProperties();
    }

    private void assertRejected(GenerationRequest request, String field) {
        assertThatThrownBy(() -> GenerationConfigValidator.validate(properties, request))
                .isInstanceOf(InvalidGenerationConfigException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasFieldOrPropertyWithValue("field", field);
    }

    private GenerationRequest withOverrides(GeneratorOverrides overrides) {
        GenerationRequest request = TestDataFactory.createRequest("loc-1", 7);
        request.setOverrides(overrides);
        return request;
    }

    @Test
    void defaults_areValid() {
        assertThatCode(() -> GenerationConfigValidator.validate(properties, TestDataFactory.createRequest("loc-1", 7)))
                .doesNotThrowAnyException();
        assertThatCode(() -> GenerationConfigValidator.validate(properties, TestDataFactory.createRequest("loc-1", 0)))
                .doesNotThrowAnyException();
    }

    @Test
    void negativeHorizon_rejected() {
        assertRejected(TestDataFactory.createRequest("loc-1", -1), "horizonDays");
    }

    @Test
    void horizonAboveDeploymentLimit_onlyRejectedByLimitCheck() {
        GenerationRequest request = TestDataFactory.createRequest("loc-1", properties.getMaxHorizonDays() + 1);

        assertThatCode(() -> GenerationConfigValidator.validate(properties, request))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> GenerationConfigValidator.validateHorizonLimit(properties, request))
                .isInstanceOf(InvalidGenerationConfigException.class)
                .hasFieldOrPropertyWithValue("field", "horizonDays");
    }

    @Test
    void emptyLocation_rejected() {
        assertRejected(TestDataFactory.createRequest("", 7), "locationId");
        assertRejected(TestDataFactory.createRequest(null, 7), "locationId");
    }

    @Test
    void whitespaceLocation_accepted() {
        assertThatCode(() -> GenerationConfigValidator.validate(properties, TestDataFactory.createRequest(" ", 7)))
                .doesNotThrowAnyException();
    }

    @Test
    void missingReferenceDate_rejected() {
        GenerationRequest request = TestDataFactory.createRequest("loc-1", 7);
        request.setReferenceDate(null);
        assertRejected(request, "referenceDate");
    }

    @Test
    void invalidZone_rejected() {
        properties.setZoneId("Mars/Olympus");
        assertRejected(TestDataFactory.createRequest("loc-1", 7), "zoneId");
    }

    @Test
    void slotWidthNotDividingAnHour_rejected() {
        properties.getIntraday().setSlotMinutes(7);
        assertRejected(TestDataFactory.createRequest("loc-1", 7), "intraday.slotMinutes");
    }

    @Test
    void disorderedChangepoints_rejected() {
        properties.getTrend().setRampEnd(0.8);
        assertRejected(TestDataFactory.createRequest("loc-1", 7), "trend.rampEnd");
    }

    @Test
    void explosiveArCoefficient_rejected() {
        properties.getNoise().setArCoefficient(1.0);
        assertRejected(TestDataFactory.createRequest("loc-1", 7), "noise.arCoefficient");
    }

    @Test
    void malformedHolidayDate_rejected() {
        properties.getCalendar().setHolidays(List.of("2026-13-01"));
        assertRejected(TestDataFactory.createRequest("loc-1", 7), "calendar.holidays");
    }

    @Test
    void malformedEventDate_rejected() {
        properties.getCalendar().setEvents(Map.of("next friday", 1.3));
        assertRejected(TestDataFactory.createRequest("loc-1", 7), "calendar.events");
    }

    @Test
    void overrideLaborRatioAboveOne_rejected() {
        assertRejected(withOverrides(GeneratorOverrides.builder().targetLaborRatio(1.5).build()),
                "overrides.targetLaborRatio");
    }

    @Test
    void overrideServiceWindowOutOfDay_rejected() {
        assertRejected(withOverrides(GeneratorOverrides.builder().closeHour(24).build()), "openHour");
        assertRejected(withOverrides(GeneratorOverrides.builder().openHour(20).closeHour(12).build()), "openHour");
    }

    @Test
    void overrideHolidayDate_rejected() {
        assertRejected(withOverrides(GeneratorOverrides.builder().holidays(List.of("tomorrow")).build()),
                "overrides.holidays");
    }

    @Test
    void curveWithoutWeightInWindow_rejected() {
        properties.getIntraday().setOffPeakWeight(0.0);
        assertRejected(withOverrides(GeneratorOverrides.builder().openHour(16).closeHour(18).build()),
                "intraday.hourWeights");
    }
}
