package io.github.yok.svd.core.svd;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.svd.core.linearalgebra.EigenSolverSettings;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettingsSelector;
import io.github.yok.svd.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.PowerIterationEigenSolver;
import io.github.yok.svd.core.matrix.DimensionMismatchException;
import io.github.yok.svd.core.random.SeededRandomSource;
import java.util.Arrays;
import java.util.Random;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class TestSvdEngine {

    static SvdEngine powerIterationEngine() {
        return new SvdEngine(new PowerIterationEigenSolver(),
                EigenSolverSettingsSelector.fixed(new EigenSolverSettings(1e-8, 10_000, 0)), 1e-10);
    }

    private final SvdEngine engine = powerIterationEngine();

    /**
     * U·diag(σ)·Vᵗ を計算します。
     */
    static double[][] multiplyBack(SvdResult svd) {
        int m = svd.rows();
        int n = svd.cols();
        double[][] out = new double[m][n];
        for (int k = 0; k < svd.rank(); k++) {
            for (int i = 0; i < m; i++) {
                for (int j = 0; j < n; j++) {
                    out[i][j] += svd.getSigma()[k] * svd.getU().get(i, k) * svd.getVt().get(k, j);
                }
            }
        }
        return out;
    }

    @Test
    void sigmaIsNonIncreasingAndNonNegative() {
        Random random = new Random(17L);
        double[][] a = new double[6][5];
        for (double[] row : a) {
            for (int j = 0; j < row.length; j++) {
                row[j] = random.nextInt(256);
            }
        }

        SvdResult svd = engine.decompose(a, new SeededRandomSource(1L));

        double[] sigma = svd.getSigma();
        assertEquals(5, sigma.length);
        for (int i = 0; i < sigma.length; i++) {
            assertTrue(sigma[i] >= 0.0);
            if (i > 0) {
                assertTrue(sigma[i - 1] >= sigma[i], "sigma is not sorted at " + i);
            }
        }
    }

    @Test
    void knownSingularValuesOfWideMatrix() {
        double[][] a = {{3, 2, 2}, {2, 3, -2}};

        SvdResult svd = engine.decompose(a, new SeededRandomSource(2L));

        assertEquals(2, svd.getU().numRows);
        assertEquals(2, svd.getU().numCols);
        assertEquals(2, svd.getVt().numRows);
        assertEquals(3, svd.getVt().numCols);
        assertArrayEquals(new double[] {5.0, 3.0}, svd.getSigma(), 1e-6);
        assertEquals(2, svd.getConvergedRank());

        double[][] back = multiplyBack(svd);
        for (int i = 0; i < a.length; i++) {
            assertArrayEquals(a[i], back[i], 1e-4);
        }
    }

    @Test
    void tallMatrixHasDeclaredRankOfColumnCount() {
        double[][] a = {{1, 2}, {3, 4}, {5, 6}, {7, 8}, {9, 10}};

        SvdResult svd = engine.decompose(a, new SeededRandomSource(3L));

        assertEquals(2, svd.rank());
        assertEquals(5, svd.rows());
        assertEquals(2, svd.cols());
        double[][] back = multiplyBack(svd);
        for (int i = 0; i < a.length; i++) {
            assertArrayEquals(a[i], back[i], 1e-4);
        }
    }

    @Test
    void squareMatrixRoundTrip() {
        double[][] a = {{10, 20, 30}, {40, 50, 60}, {70, 80, 95}};

        SvdResult svd = engine.decompose(a, new SeededRandomSource(4L));

        assertEquals(3, svd.getConvergedRank());
        double[][] back = multiplyBack(svd);
        for (int i = 0; i < a.length; i++) {
            assertArrayEquals(a[i], back[i], 1e-3);
        }
    }

    @Test
    void singleEntryMatrix() {
        SvdResult svd = engine.decompose(new double[][] {{200}}, new SeededRandomSource(5L));

        assertArrayEquals(new double[] {200.0}, svd.getSigma(), 1e-9);
        assertEquals(1.0, Math.abs(svd.getU().get(0, 0)), 1e-12);
        assertEquals(1.0, Math.abs(svd.getVt().get(0, 0)), 1e-12);
    }

    @Test
    void constantMatrixHasRankOne() {
        double[][] a = new double[4][4];
        for (double[] row : a) {
            Arrays.fill(row, 100.0);
        }

        SvdResult svd = engine.decompose(a, new SeededRandomSource(6L));

        assertEquals(4, svd.rank());
        assertEquals(400.0, svd.getSigma()[0], 1e-6);
        for (int k = 1; k < 4; k++) {
            assertEquals(0.0, svd.getSigma()[k], 1e-3);
        }
    }

    @Test
    void zeroMatrixIsPaddedWithZeros() {
        SvdResult svd = engine.decompose(new DMatrixRMaj(3, 3), new SeededRandomSource(7L));

        assertEquals(0, svd.getConvergedRank());
        assertArrayEquals(new double[3], svd.getSigma(), 0.0);
        assertArrayEquals(new double[9], svd.getU().data, 0.0);
        assertArrayEquals(new double[9], svd.getVt().data, 0.0);
    }

    @Test
    void emptyMatrixIsRejected() {
        assertThrows(DimensionMismatchException.class,
                () -> engine.decompose(new double[0][], new SeededRandomSource(1L)));
        assertThrows(DimensionMismatchException.class,
                () -> engine.decompose(new DMatrixRMaj(0, 3), new SeededRandomSource(1L)));
    }

    @Test
    void inputIsNotModified() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 2, 3}, {4, 5, 6}});
        DMatrixRMaj before = a.copy();

        engine.decompose(a, new SeededRandomSource(1L));

        assertArrayEquals(before.data, a.data, 0.0);
    }

    @Test
    void backendsAgreeOnSingularValues() {
        double[][] a = {{10, 20, 30}, {40, 50, 60}, {70, 80, 95}};
        SvdEngine exact = new SvdEngine(new EjmlSymmetricEigenDecompositionBackend(),
                EigenSolverSettingsSelector.fixed(new EigenSolverSettings(1e-8, 1, 0)), 1e-10);

        assertArrayEquals(exact.decompose(a, new SeededRandomSource(1L)).getSigma(),
                engine.decompose(a, new SeededRandomSource(1L)).getSigma(), 1e-6);
    }
}
