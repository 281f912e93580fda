package io.trialmesh.sampling;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Stratified percentiles: trial {@code i} of {@code n} falls in stratum {@code [k/n, (k+1)/n)}
 * with every stratum used exactly once.
 */
public final class LatinHypercube {
    private LatinHypercube() {
    }

    /**
     * One uniform draw inside each stratum, in ascending stratum order.
     */
    public static double[] strata(int n, RandomGenerator rng) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = (i + rng.nextDouble()) / n;
        }
        return out;
    }

    /**
     * Stratified percentiles in random trial order.
     */
    public static double[] percentiles(int n, RandomGenerator rng) {
        double[] out = strata(n, rng);
        shuffle(out, rng);
        return out;
    }

    static void shuffle(double[] values, RandomGenerator rng) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
