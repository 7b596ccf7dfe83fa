package com.restaurant.simulator.engine;

/**
 * Cent-level rounding and exact apportioning of totals.
 */
public final class Money {

    private Money() {}

    public static long toCents(double amount) {
        return Math.round(amount * 100.0);
    }

    public static double fromCents(long cents) {
        return cents / 100.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    /**
     * Splits {@code total} units across shares proportional to {@code weights}
     * using largest remainders. The parts are non-negative and sum to exactly
     * {@code total}. Weights must be non-negative with a positive sum.
     */
    public static long[] apportion(long total, double[] weights) {
        int n = weights.length;
        long[] parts = new long[n];
        if (n == 0) return parts;

        double weightSum = 0.0;
        for (double w : weights) weightSum += w;

        double[] remainders = new double[n];
        long assigned = 0;
        for (int i = 0; i < n; i++) {
            double exact = total * (weights[i] / weightSum);
            parts[i] = (long) Math.floor(exact);
            remainders[i] = exact - parts[i];
            assigned += parts[i];
        }

        long leftover = total - assigned;
        while (leftover > 0) {
            int best = 0;
            for (int i = 1; i < n; i++) {
                if (remainders[i] > remainders[best]) best = i;
            }
            parts[best]++;
            remainders[best] = -1.0;
            leftover--;
        }
        return parts;
    }
}
