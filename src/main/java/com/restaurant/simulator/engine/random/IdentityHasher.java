package com.restaurant.simulator.engine.random;

/**
 * Folds a seed identity into a 32-bit seed with a multiply-and-add rolling hash.
 * Not cryptographic; collisions between distinct identities are acceptable.
 */
public final class IdentityHasher {

    private static final int MULTIPLIER = 31;

    private IdentityHasher() {}

    public static int hash(SeedIdentity identity) {
        return hash(identity.canonical());
    }

    /**
     * h = 31 * h + c over the UTF-16 code units, with 32-bit wrap-around.
     */
    public static int hash(String text) {
        int h = 0;
        for (int i = 0; i < text.length(); i++) {
            h = MULTIPLIER * h + text.charAt(i);
        }
        return h;
    }

    public static BitMixer mixerFor(SeedIdentity identity) {
        return new BitMixer(hash(identity));
    }
}
