package com.restaurant.simulator.engine.random;

/**
 * Reseedable 32-bit pseudo-random generator (Mulberry32).
 *
 * Every int is a valid seed, including 0 and negative values. Two mixers built
 * from the same seed produce the same sequence forever; nothing outside the
 * 32-bit state feeds into the output.
 */
public class BitMixer {

    private static final int WEYL_INCREMENT = 0x6D2B79F5;
    private static final double TWO_POW_32 = 4294967296.0;

    private int state;

    public BitMixer(int seed) {
        this.state = seed;
    }

    /**
     * @return a uniform draw in [0, 1)
     */
    public double next() {
        state += WEYL_INCREMENT;
        int t = state;
        t = (t ^ (t >>> 15)) * (t | 1);
        t ^= t + (t ^ (t >>> 7)) * (t | 61);
        t ^= t >>> 14;
        return (t & 0xFFFFFFFFL) / TWO_POW_32;
    }

    public double nextInRange(double min, double max) {
        return min + next() * (max - min);
    }

    /**
     * Consumes exactly one draw regardless of the outcome.
     */
    public boolean nextBoolean(double probability) {
        return next() < probability;
    }

    public void reseed(int seed) {
        this.state = seed;
    }
}
