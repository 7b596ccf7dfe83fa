package com.restaurant.simulator.engine;

import com.restaurant.simulator.engine.random.BitMixer;
import com.restaurant.simulator.engine.random.IdentityHasher;
import com.restaurant.simulator.engine.random.SeedIdentity;

import java.time.LocalDate;

/**
 * Day-scoped random streams. Each is seeded from the date and the run identity
 * only, never from run state, so any day can be re-derived on its own and in
 * any order.
 *
 * The weather stream hashes (date, run identity). The intraday, labor and
 * inventory streams add a purpose component so the row families do not share
 * draws.
 */
public final class DayStreams {

    static final String INTRADAY = "intraday";
    static final String LABOR = "labor";
    static final String INVENTORY = "inventory";

    private final SeedIdentity runIdentity;
    private final String date;

    private DayStreams(SeedIdentity runIdentity, LocalDate date) {
        this.runIdentity = runIdentity;
        this.date = date.toString();
    }

    public static DayStreams forDay(SeedIdentity runIdentity, LocalDate date) {
        return new DayStreams(runIdentity, date);
    }

    public int weatherSeed() {
        return IdentityHasher.hash(runIdentity.scoped(date));
    }

    public BitMixer weather() {
        return new BitMixer(weatherSeed());
    }

    public BitMixer intraday() {
        return IdentityHasher.mixerFor(runIdentity.scoped(date, INTRADAY));
    }

    public BitMixer labor() {
        return IdentityHasher.mixerFor(runIdentity.scoped(date, LABOR));
    }

    public BitMixer inventory() {
        return IdentityHasher.mixerFor(runIdentity.scoped(date, INVENTORY));
    }
}
