package io.trialmesh.sampling;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iman-Conover rank correlation.
 *
 * <p>Van der Waerden scores are shuffled independently per column, re-mixed through the
 * Cholesky factors of the target and the achieved Spearman matrices, and the resulting ranks
 * decide which stratum each trial receives. Marginals are untouched; only rank order changes.
 */
public final class RankCorrelation {
    private static final Logger logger = LoggerFactory.getLogger(RankCorrelation.class);

    private RankCorrelation() {
    }

    /**
     * Returns, for each row and column, the 0-based rank that row should take in that column.
     *
     * @param n      number of trials
     * @param target symmetric, positive-definite k x k rank correlation matrix
     */
    public static int[][] ranks(int n, RealMatrix target, RandomGenerator rng) {
        int k = target.getColumnDimension();
        if (target.getRowDimension() != k) {
            throw new DistributionSpecException("Correlation matrix must be square, got "
                    + target.getRowDimension() + "x" + k);
        }
        RealMatrix p = choleskyLower(target);

        double[] scores = vanDerWaerdenScores(n);
        double[][] s = new double[n][k];
        for (int col = 0; col < k; col++) {
            double[] column = scores.clone();
            LatinHypercube.shuffle(column, rng);
            for (int row = 0; row < n; row++) {
                s[row][col] = column[row];
            }
        }
        RealMatrix sm = new Array2DRowRealMatrix(s, false);

        RealMatrix mixed;
        if (n > k + 1) {
            RealMatrix achieved = new SpearmansCorrelation(sm).getCorrelationMatrix();
            try {
                RealMatrix q = new CholeskyDecomposition(achieved).getL();
                mixed = sm.multiply(MatrixUtils.inverse(q).transpose()).multiply(p.transpose());
            } catch (MathIllegalArgumentException e) {
                logger.warn("Sample rank matrix is singular for n={} k={}; using target factor only", n, k);
                mixed = sm.multiply(p.transpose());
            }
        } else {
            mixed = sm.multiply(p.transpose());
        }

        NaturalRanking ranking = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.SEQUENTIAL);
        int[][] out = new int[n][k];
        for (int col = 0; col < k; col++) {
            double[] colRanks = ranking.rank(mixed.getColumn(col));
            for (int row = 0; row < n; row++) {
                out[row][col] = (int) colRanks[row] - 1;
            }
        }
        return out;
    }

    static RealMatrix choleskyLower(RealMatrix target) {
        try {
            return new CholeskyDecomposition(target).getL();
        } catch (MathIllegalArgumentException e) {
            throw new DistributionSpecException("Correlation matrix is not symmetric positive definite: " + e.getMessage(), e);
        }
    }

    static double[] vanDerWaerdenScores(int n) {
        NormalDistribution standard = new NormalDistribution(0.0, 1.0);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = standard.inverseCumulativeProbability((i + 1.0) / (n + 1.0));
        }
        return out;
    }
}
