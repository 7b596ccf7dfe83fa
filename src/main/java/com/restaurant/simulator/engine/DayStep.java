package com.restaurant.simulator.engine;

/**
 * Result of one composer step: the day's record and the residual to carry into
 * the next day.
 */
public record DayStep(DayRecord record, double residual) {}
