package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.config.GeneratorProperties.MonthClimate;
import com.restaurant.simulator.engine.calendar.ReferenceTables;
import com.restaurant.simulator.engine.random.BitMixer;
import com.restaurant.simulator.engine.random.NormalSampler;

import java.time.LocalDate;
import java.util.List;

/**
 * Composes one day's sales level from trend, seasonality, weather, holiday,
 * payday and event multipliers plus an AR(1) noise term.
 *
 * {@link #step} is a pure function of its arguments apart from the two
 * streams it consumes. The weather stream is day-scoped. The run sampler is
 * the run-scoped stream: exactly two uniforms are drawn from it per day, and
 * nothing else in a run touches it, so steps must be taken in day order.
 */
public class DailyComposer {

    private final double baseDailySales;
    private final double salesFloor;
    private final TrendModel trendModel;
    private final ReferenceTables tables;
    private final GeneratorProperties.Noise noise;
    private final GeneratorProperties.Weather weatherSettings;
    private final GeneratorProperties.Calendar calendarSettings;

    public DailyComposer(double baseDailySales,
                         double salesFloor,
                         TrendModel trendModel,
                         ReferenceTables tables,
                         GeneratorProperties.Noise noise,
                         GeneratorProperties.Weather weatherSettings,
                         GeneratorProperties.Calendar calendarSettings) {
        this.baseDailySales = baseDailySales;
        this.salesFloor = salesFloor;
        this.trendModel = trendModel;
        this.tables = tables;
        this.noise = noise;
        this.weatherSettings = weatherSettings;
        this.calendarSettings = calendarSettings;
    }

    public DayStep step(int dayIndex, int horizon, LocalDate date,
                        BitMixer weatherStream, NormalSampler runSampler,
                        double previousResidual) {
        Weather weather = drawWeather(date, weatherStream);

        boolean holiday = tables.isHoliday(date);
        boolean payday = isPayday(date);

        double trend = trendModel.trend(dayIndex, horizon);
        double weekday = tables.weekdayMultiplier(date.getDayOfWeek());
        double month = tables.monthMultiplier(date.getMonth());
        double weatherMultiplier = weatherMultiplier(weather);
        double holidayMultiplier = holiday ? calendarSettings.getHolidayMultiplier() : 1.0;
        double paydayMultiplier = payday ? calendarSettings.getPaydayMultiplier() : 1.0;
        double eventMultiplier = tables.eventMultiplier(date);

        double deterministicLevel = baseDailySales * trend * weekday * month
                * weatherMultiplier * holidayMultiplier * paydayMultiplier * eventMultiplier;

        // Shock is N(0, whiteNoisePct) in level-relative units, i.e. N(0, pct * level) in EUR.
        double shock = runSampler.normal(0.0, noise.getWhiteNoisePct());
        double residual = noise.getArCoefficient() * previousResidual + shock;
        double absoluteResidual = residual * deterministicLevel;

        double salesLevel = Math.max(salesFloor, deterministicLevel + absoluteResidual);

        DayRecord record = new DayRecord(
                dayIndex, date, date.getDayOfWeek(), date.getMonth(), date.getDayOfMonth(),
                holiday, payday, weather,
                trend, weekday, month, weatherMultiplier, holidayMultiplier, paydayMultiplier, eventMultiplier,
                deterministicLevel, residual, absoluteResidual, salesLevel);
        return new DayStep(record, residual);
    }

    /**
     * Temperature ~ N(monthly avg, monthly std), then one uniform against the
     * monthly rain probability. Consumes three draws.
     */
    public Weather drawWeather(LocalDate date, BitMixer weatherStream) {
        MonthClimate climate = tables.climate(date.getMonth());
        NormalSampler sampler = new NormalSampler(weatherStream);
        double temperature = sampler.normal(climate.getAvgTemperature(), climate.getTemperatureStd());
        boolean rain = weatherStream.nextBoolean(climate.getRainProbability());
        return new Weather(temperature, rain);
    }

    public double weatherMultiplier(Weather weather) {
        double multiplier = 1.0;
        if (weather.rain()) {
            multiplier *= weatherSettings.getRainMultiplier();
        }
        double t = weather.temperature();
        if (t < weatherSettings.getColdThreshold()) {
            multiplier *= weatherSettings.getColdMultiplier();
        } else if (t > weatherSettings.getHotThreshold()) {
            multiplier *= weatherSettings.getHotMultiplier();
        } else if (t >= weatherSettings.getIdealMin() && t <= weatherSettings.getIdealMax()) {
            multiplier *= weatherSettings.getIdealMultiplier();
        }
        return multiplier;
    }

    public boolean isPayday(LocalDate date) {
        int dayOfMonth = date.getDayOfMonth();
        List<Integer> paydayDays = calendarSettings.getPaydayDays();
        return dayOfMonth >= calendarSettings.getPaydayFromDay()
                || (paydayDays != null && paydayDays.contains(dayOfMonth));
    }
}
