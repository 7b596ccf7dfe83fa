package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.model.GeneratorOverrides;

/**
 * Three-phase business-maturity growth: ramp-up, steady, mature.
 *
 * The multiplier is piecewise linear in p = dayIndex / horizon and each phase
 * starts where the previous one ended, so the curve has no jump at either
 * changepoint. It reaches 1 + rampRate + steadyRate + matureRate at p = 1.
 */
public class TrendModel {

    private final double rampEnd;
    private final double steadyEnd;
    private final double rampRate;
    private final double steadyRate;
    private final double matureRate;

    public TrendModel(double rampEnd, double steadyEnd,
                      double rampRate, double steadyRate, double matureRate) {
        this.rampEnd = rampEnd;
        this.steadyEnd = steadyEnd;
        this.rampRate = rampRate;
        this.steadyRate = steadyRate;
        this.matureRate = matureRate;
    }

    public static TrendModel from(GeneratorProperties.Trend trend, GeneratorOverrides overrides) {
        return new TrendModel(
                trend.getRampEnd(),
                trend.getSteadyEnd(),
                GeneratorOverrides.or(overrides.getRampRate(), trend.getRampRate()),
                GeneratorOverrides.or(overrides.getSteadyRate(), trend.getSteadyRate()),
                GeneratorOverrides.or(overrides.getMatureRate(), trend.getMatureRate()));
    }

    public double trend(int dayIndex, int horizon) {
        if (horizon <= 0) return 1.0;
        return multiplierAt((double) dayIndex / horizon);
    }

    double multiplierAt(double p) {
        double rampTop = 1.0 + rampRate;
        double steadyTop = rampTop + steadyRate;

        if (p < rampEnd) {
            return 1.0 + rampRate * (p / rampEnd);
        }
        if (p < steadyEnd) {
            return rampTop + steadyRate * ((p - rampEnd) / (steadyEnd - rampEnd));
        }
        return steadyTop + matureRate * ((p - steadyEnd) / (1.0 - steadyEnd));
    }

    public double rampEnd() { return rampEnd; }
    public double steadyEnd() { return steadyEnd; }
}
