package com.restaurant.simulator.engine;

/**
 * One day's simulated weather, drawn from the day-scoped stream.
 */
public record Weather(double temperature, boolean rain) {}
