package com.restaurant.simulator.engine;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;

/**
 * Everything the daily composer derived for one simulated day. Ephemeral: built
 * and consumed inside a single generation run.
 *
 * @param residual         level-relative AR(1) residual carried to the next day
 * @param absoluteResidual residual scaled by the deterministic level (EUR)
 * @param salesLevel       final sales target after the floor (EUR)
 */
public record DayRecord(int dayIndex,
                        LocalDate date,
                        DayOfWeek dayOfWeek,
                        Month month,
                        int dayOfMonth,
                        boolean holiday,
                        boolean payday,
                        Weather weather,
                        double trendMultiplier,
                        double weekdayMultiplier,
                        double monthMultiplier,
                        double weatherMultiplier,
                        double holidayMultiplier,
                        double paydayMultiplier,
                        double eventMultiplier,
                        double deterministicLevel,
                        double residual,
                        double absoluteResidual,
                        double salesLevel) {}
