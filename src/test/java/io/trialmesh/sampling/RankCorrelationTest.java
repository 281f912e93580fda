package io.trialmesh.sampling;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

final class RankCorrelationTest {

    @Test
    void ranksReachTargetSpearmanCoefficient() {
        int n = 500;
        RealMatrix target = MatrixUtils.createRealMatrix(new double[][]{{1.0, 0.7}, {0.7, 1.0}});
        int[][] ranks = RankCorrelation.ranks(n, target, new Well19937c(42));

        double[] a = new double[n];
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            a[i] = ranks[i][0];
            b[i] = ranks[i][1];
        }
        double rho = new SpearmansCorrelation().correlation(a, b);
        Assertions.assertEquals(0.7, rho, 0.05);
    }

    @Test
    void everyColumnIsAPermutation() {
        int n = 50;
        RealMatrix target = MatrixUtils.createRealMatrix(new double[][]{
                {1.0, -0.5, 0.2},
                {-0.5, 1.0, 0.0},
                {0.2, 0.0, 1.0}
        });
        int[][] ranks = RankCorrelation.ranks(n, target, new Well19937c(7));
        for (int col = 0; col < 3; col++) {
            int[] column = new int[n];
            for (int row = 0; row < n; row++) {
                column[row] = ranks[row][col];
            }
            Arrays.sort(column);
            for (int i = 0; i < n; i++) {
                Assertions.assertEquals(i, column[i]);
            }
        }
    }

    @Test
    void rejectsMatrixThatIsNotPositiveDefinite() {
        RealMatrix impossible = MatrixUtils.createRealMatrix(new double[][]{
                {1.0, 0.9, -0.9},
                {0.9, 1.0, 0.9},
                {-0.9, 0.9, 1.0}
        });
        Assertions.assertThrows(DistributionSpecException.class, () -> RankCorrelation.ranks(20, impossible, new Well19937c(1)));
    }

    @Test
    void latinHypercubeUsesEveryStratumOnce() {
        int n = 20;
        double[] pct = LatinHypercube.percentiles(n, new Well19937c(3));
        boolean[] seen = new boolean[n];
        for (double p : pct) {
            int stratum = (int) Math.floor(p * n);
            Assertions.assertFalse(seen[stratum], "stratum used twice: " + stratum);
            seen[stratum] = true;
        }
    }
}
