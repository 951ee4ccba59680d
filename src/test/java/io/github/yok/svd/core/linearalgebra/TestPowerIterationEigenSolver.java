package io.github.yok.svd.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.svd.core.linearalgebra.EigenDecompositionBackend.EigenPair;
import io.github.yok.svd.core.matrix.DimensionMismatchException;
import io.github.yok.svd.core.matrix.MatrixOps;
import io.github.yok.svd.core.random.SeededRandomSource;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class TestPowerIterationEigenSolver {

    private static final EigenSolverSettings SETTINGS = new EigenSolverSettings(1e-12, 10_000, 0);

    private final PowerIterationEigenSolver solver = new PowerIterationEigenSolver();

    /**
     * Q·diag(9, 4, 1)·Qᵗ（Q は w = (1, 2, 2) の Householder 反射）を返します。
     */
    static DMatrixRMaj rotatedDiagonal() {
        DMatrixRMaj q = MatrixOps.fromRows(new double[][] {
                {7.0 / 9, -4.0 / 9, -4.0 / 9},
                {-4.0 / 9, 1.0 / 9, -8.0 / 9},
                {-4.0 / 9, -8.0 / 9, 1.0 / 9}});
        DMatrixRMaj d = MatrixOps.fromRows(new double[][] {{9, 0, 0}, {0, 4, 0}, {0, 0, 1}});
        return MatrixOps.multiply(MatrixOps.multiply(q, d), MatrixOps.transpose(q));
    }

    @Test
    void diagonalMatrixYieldsEigenvaluesInDescendingOrder() {
        DMatrixRMaj a = MatrixOps.fromRows(new double[][] {{3, 0, 0}, {0, 5, 0}, {0, 0, 1}});

        List<EigenPair> pairs = solver.decompose(a, SETTINGS, new SeededRandomSource(3L));

        assertEquals(3, pairs.size());
        assertEquals(5.0, pairs.get(0).getValue(), 1e-8);
        assertEquals(3.0, pairs.get(1).getValue(), 1e-8);
        assertEquals(1.0, pairs.get(2).getValue(), 1e-8);
        assertEquals(1.0, Math.abs(pairs.get(0).getVector()[1]), 1e-6);
    }

    @Test
    void agreesWithEjmlBackend() {
        DMatrixRMaj a = rotatedDiagonal();

        List<EigenPair> power = solver.decompose(a, SETTINGS, new SeededRandomSource(11L));
        List<EigenPair> exact = new EjmlSymmetricEigenDecompositionBackend().decompose(a, SETTINGS,
                new SeededRandomSource(11L));

        assertEquals(exact.size(), power.size());
        for (int i = 0; i < exact.size(); i++) {
            assertEquals(exact.get(i).getValue(), power.get(i).getValue(), 1e-8);
            double overlap = MatrixOps.dot(exact.get(i).getVector(), power.get(i).getVector());
            assertEquals(1.0, Math.abs(overlap), 1e-6);
        }
    }

    @Test
    void eigenVectorsAreUnitLength() {
        for (EigenPair p : solver.decompose(rotatedDiagonal(), SETTINGS,
                new SeededRandomSource(5L))) {
            assertEquals(1.0, MatrixOps.norm(p.getVector()), 1e-9);
        }
    }

    @Test
    void zeroMatrixYieldsNoPairs() {
        assertTrue(solver.decompose(new DMatrixRMaj(4, 4), SETTINGS, new SeededRandomSource(1L))
                .isEmpty());
    }

    @Test
    void inputMatrixIsNotModified() {
        DMatrixRMaj a = rotatedDiagonal();
        DMatrixRMaj before = a.copy();

        solver.decompose(a, SETTINGS, new SeededRandomSource(1L));

        assertArrayEquals(before.data, a.data, 0.0);
    }

    @Test
    void maxEigenvaluesLimitsResult() {
        List<EigenPair> pairs = solver.decompose(rotatedDiagonal(),
                new EigenSolverSettings(1e-12, 10_000, 2), new SeededRandomSource(1L));

        assertEquals(2, pairs.size());
        assertEquals(9.0, pairs.get(0).getValue(), 1e-8);
        assertEquals(4.0, pairs.get(1).getValue(), 1e-8);
    }

    @Test
    void nonConvergenceTruncatesWithoutFailing() {
        List<EigenPair> pairs = solver.decompose(rotatedDiagonal(),
                new EigenSolverSettings(1e-12, 1, 0), new SeededRandomSource(1L));

        assertTrue(pairs.isEmpty());
    }

    @Test
    void sameSeedGivesIdenticalResult() {
        List<EigenPair> a = solver.decompose(rotatedDiagonal(), SETTINGS, new SeededRandomSource(9L));
        List<EigenPair> b = solver.decompose(rotatedDiagonal(), SETTINGS, new SeededRandomSource(9L));

        assertEquals(a.size(), b.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).getValue(), b.get(i).getValue(), 0.0);
            assertArrayEquals(a.get(i).getVector(), b.get(i).getVector(), 0.0);
        }
    }

    @Test
    void rejectsNonSquareMatrix() {
        assertThrows(DimensionMismatchException.class,
                () -> solver.decompose(new DMatrixRMaj(2, 3), SETTINGS, new SeededRandomSource(1L)));
    }
}
