package com.restaurant.simulator.engine.random;

/**
 * Box-Muller normal variates drawn from a {@link BitMixer}. Each sample consumes
 * exactly two uniforms; the second variate of the pair is discarded.
 */
public class NormalSampler {

    static final double MIN_UNIFORM = 1e-10;

    private final BitMixer mixer;

    public NormalSampler(BitMixer mixer) {
        this.mixer = mixer;
    }

    public double normal(double mean, double std) {
        double u1 = Math.max(mixer.next(), MIN_UNIFORM);
        double u2 = mixer.next();
        double z = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
        return mean + std * z;
    }

    public BitMixer mixer() {
        return mixer;
    }
}
