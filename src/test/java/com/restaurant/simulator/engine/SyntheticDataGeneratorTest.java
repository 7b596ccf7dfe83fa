package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.engine.calendar.ReferenceTables;
import com.restaurant.simulator.engine.random.IdentityHasher;
import com.restaurant.simulator.engine.random.NormalSampler;
import com.restaurant.simulator.engine.random.SeedIdentity;
import com.restaurant.simulator.exception.InvalidGenerationConfigException;
import com.restaurant.simulator.model.GeneratedDataset;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GeneratorOverrides;
import com.restaurant.simulator.model.LaborDailyRow;
import com.restaurant.simulator.model.SalesBucketRow;
import com.restaurant.simulator.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SyntheticDataGeneratorTest {

    private static final LocalDate REFERENCE = TestDataFactory.REFERENCE_DATE;

    private GeneratorProperties properties;
    private SyntheticDataGenerator generator;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.defaultProperties();
        generator = new SyntheticDataGenerator(properties);
    }

    @Test
    void sevenDays_emitExpectedRowCounts() {
        GeneratedDataset dataset = generator.generate("loc-1|org-1", 7, REFERENCE);

        assertThat(dataset.laborDaily()).hasSize(7);
        assertThat(dataset.salesBuckets()).hasSize(364);
        assertThat(dataset.itemMixDaily()).hasSize(70);
        assertThat(dataset.inventoryDaily()).hasSize(35);
        assertThat(dataset.salesBuckets()).allMatch(b -> "loc-1|org-1".equals(b.getLocationId()));
    }

    @Test
    void horizon_endsOnReferenceDate() {
        GeneratedDataset dataset = generator.generate("loc-1|org-1", 7, REFERENCE);

        assertThat(dataset.laborDaily().get(0).getDate()).isEqualTo(REFERENCE.minusDays(6));
        assertThat(dataset.laborDaily().get(6).getDate()).isEqualTo(REFERENCE);
        assertThat(dataset.salesBuckets().get(0).getTimestamp().toLocalDate()).isEqualTo(REFERENCE.minusDays(6));
        assertThat(dataset.salesBuckets().get(363).getTimestamp().toLocalDate()).isEqualTo(REFERENCE);
    }

    @Test
    void sameIdentity_reproducesDataset() {
        GeneratedDataset first = generator.generate(TestDataFactory.createRequest("loc-1", 30));
        GeneratedDataset second = new SyntheticDataGenerator(TestDataFactory.defaultProperties())
                .generate(TestDataFactory.createRequest("loc-1", 30));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void differentIdentities_produceDifferentSeries() {
        List<Double> a = grossSeries(generator.generate(TestDataFactory.createRequest("loc-A", 30)));
        List<Double> b = grossSeries(generator.generate(TestDataFactory.createRequest("loc-B", 30)));

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void orgId_isPartOfTheIdentity() {
        GenerationRequest withOrg = TestDataFactory.createRequest("loc-1", 14);
        GenerationRequest otherOrg = TestDataFactory.createRequest("loc-1", 14);
        otherOrg.setOrgId("org-2");

        assertThat(grossSeries(generator.generate(otherOrg))).isNotEqualTo(grossSeries(generator.generate(withOrg)));
        assertThat(SyntheticDataGenerator.identityFor(withOrg).components()).containsExactly("loc-1", "org-1");
    }

    @Test
    void zeroHorizon_returnsEmptyDataset() {
        GeneratedDataset dataset = generator.generate("loc-1", 0, REFERENCE);

        assertThat(dataset.totalRows()).isZero();
    }

    @Test
    void negativeHorizon_rejectedBeforeGenerating() {
        assertThatThrownBy(() -> generator.generate("loc-1", -3, REFERENCE))
                .isInstanceOf(InvalidGenerationConfigException.class);
    }

    @Test
    void dailyBuckets_sumToComposedDailyLevel_andRespectFloor() {
        int horizon = 60;
        GenerationRequest request = TestDataFactory.createRequest("loc-1", horizon);
        Map<LocalDate, List<SalesBucketRow>> byDay = generator.generate(request).salesBuckets().stream()
                .collect(Collectors.groupingBy(b -> b.getTimestamp().toLocalDate(), TreeMap::new, Collectors.toList()));

        SeedIdentity identity = SyntheticDataGenerator.identityFor(request);
        DailyComposer composer = new DailyComposer(properties.getBaseDailySales(), properties.getSalesFloor(),
                TrendModel.from(properties.getTrend(), GeneratorOverrides.none()),
                ReferenceTables.from(properties.getCalendar(), GeneratorOverrides.none()),
                properties.getNoise(), properties.getWeather(), properties.getCalendar());
        NormalSampler runSampler = new NormalSampler(IdentityHasher.mixerFor(identity));
        double residual = 0.0;

        assertThat(byDay).hasSize(horizon);
        LocalDate start = REFERENCE.minusDays(horizon - 1L);
        for (int dayIndex = 0; dayIndex < horizon; dayIndex++) {
            LocalDate date = start.plusDays(dayIndex);
            DayStep step = composer.step(dayIndex, horizon, date, DayStreams.forDay(identity, date).weather(),
                    runSampler, residual);
            residual = step.residual();
            double level = step.record().salesLevel();

            List<SalesBucketRow> day = byDay.get(date);
            assertThat(day).hasSize(52);
            double gross = day.stream().mapToDouble(SalesBucketRow::getSalesGross).sum();
            assertThat(gross).as("gross on %s", date).isCloseTo(level, within(0.01));
            assertThat(gross).isGreaterThanOrEqualTo(properties.getSalesFloor() - 0.01);
        }
    }

    @Test
    void whitespaceIdentity_isAcceptedAndDeterministic() {
        GeneratedDataset first = generator.generate(" ", 7, REFERENCE);
        GeneratedDataset second = generator.generate(" ", 7, REFERENCE);

        assertThat(first.laborDaily()).hasSize(7);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void horizonBeyondDeploymentLimit_isGeneratedByEngine() {
        GeneratedDataset dataset = generator.generate("loc-1|org-1", 1500, REFERENCE);

        assertThat(dataset.laborDaily()).hasSize(1500);
        assertThat(dataset.laborDaily().get(1499).getDate()).isEqualTo(REFERENCE);
    }

    @Test
    void laborRatio_staysNearTarget() {
        GenerationRequest request = TestDataFactory.createRequest("loc-1", 120);
        GeneratedDataset dataset = generator.generate(request);

        double net = dataset.salesBuckets().stream().mapToDouble(SalesBucketRow::getSalesNet).sum();
        double labor = dataset.laborDaily().stream().mapToDouble(LaborDailyRow::getLaborCostEst).sum();

        assertThat(labor / net).isCloseTo(0.28, within(0.05));
    }

    @Test
    void changingOneDay_leavesOtherDaysUntouched() {
        LocalDate changedDay = REFERENCE.minusDays(10);
        List<String> holidays = new ArrayList<>(properties.getCalendar().getHolidays());
        holidays.add(changedDay.toString());

        GenerationRequest baseline = TestDataFactory.createRequest("loc-1", 30);
        GenerationRequest withHoliday = TestDataFactory.createRequest("loc-1", 30);
        withHoliday.setOverrides(GeneratorOverrides.builder().holidays(holidays).build());

        Map<LocalDate, Double> before = dailyGross(generator.generate(baseline));
        Map<LocalDate, Double> after = dailyGross(generator.generate(withHoliday));

        assertThat(after.get(changedDay)).isLessThan(before.get(changedDay));
        for (LocalDate date : before.keySet()) {
            if (!date.equals(changedDay)) {
                assertThat(after.get(date)).as("gross on %s", date).isEqualTo(before.get(date));
            }
        }
    }

    @Test
    void overrides_scaleTheLevel() {
        GenerationRequest small = TestDataFactory.createRequest("loc-1", 30);
        small.setOverrides(GeneratorOverrides.builder().baseDailySales(2500.0).build());

        double baseline = grossSeries(generator.generate(TestDataFactory.createRequest("loc-1", 30)))
                .stream().mapToDouble(Double::doubleValue).sum();
        double halved = grossSeries(generator.generate(small)).stream().mapToDouble(Double::doubleValue).sum();

        assertThat(halved / baseline).isCloseTo(0.5, within(0.02));
    }

    private static List<Double> grossSeries(GeneratedDataset dataset) {
        return dataset.salesBuckets().stream().map(SalesBucketRow::getSalesGross).collect(Collectors.toList());
    }

    private static Map<LocalDate, Double> dailyGross(GeneratedDataset dataset) {
        return dataset.salesBuckets().stream().collect(Collectors.groupingBy(
                b -> b.getTimestamp().toLocalDate(), TreeMap::new,
                Collectors.summingDouble(SalesBucketRow::getSalesGross)));
    }
}
