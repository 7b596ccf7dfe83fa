package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.model.GeneratorOverrides;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendModelTest {

    private static final double EPS = 1e-9;

    @Test
    void defaultCurve_hitsPhaseTargets() {
        TrendModel model = TrendModel.from(new GeneratorProperties.Trend(), GeneratorOverrides.none());

        assertThat(model.multiplierAt(0.0)).isCloseTo(1.0, within(EPS));
        assertThat(model.multiplierAt(0.30)).isCloseTo(1.30, within(EPS));
        assertThat(model.multiplierAt(0.70)).isCloseTo(1.42, within(EPS));
        assertThat(model.multiplierAt(1.0)).isCloseTo(1.47, within(EPS));
    }

    @Test
    void curve_isContinuousAtChangepoints_forSeveralRateSets() {
        double[][] rateSets = {
                {0.30, 0.12, 0.05},
                {0.0, 0.0, 0.0},
                {1.5, 0.01, 0.9},
                {0.05, 0.8, 0.0}
        };
        for (double[] rates : rateSets) {
            TrendModel model = new TrendModel(0.30, 0.70, rates[0], rates[1], rates[2]);
            for (double changepoint : new double[]{model.rampEnd(), model.steadyEnd()}) {
                double left = model.multiplierAt(changepoint - 1e-12);
                double right = model.multiplierAt(changepoint);
                assertThat(right).isCloseTo(left, within(1e-9));
            }
        }
    }

    @Test
    void curve_isNonDecreasing() {
        TrendModel model = new TrendModel(0.30, 0.70, 0.30, 0.12, 0.05);
        double previous = model.trend(0, 365);
        for (int day = 1; day < 365; day++) {
            double current = model.trend(day, 365);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    void overrides_replaceRates() {
        GeneratorOverrides overrides = GeneratorOverrides.builder().rampRate(0.5).build();
        TrendModel model = TrendModel.from(new GeneratorProperties.Trend(), overrides);

        assertThat(model.multiplierAt(0.30)).isCloseTo(1.5, within(EPS));
        assertThat(model.multiplierAt(1.0)).isCloseTo(1.67, within(EPS));
    }

    @Test
    void zeroHorizon_isNeutral() {
        TrendModel model = TrendModel.from(new GeneratorProperties.Trend(), GeneratorOverrides.none());
        assertThat(model.trend(0, 0)).isEqualTo(1.0);
    }
}
