package io.github.yok.svd.core.linearalgebra;

import io.github.yok.svd.core.matrix.DimensionMismatchException;
import io.github.yok.svd.core.matrix.MatrixOps;
import io.github.yok.svd.core.random.RandomSource;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、実対称行列の固有分解を行うクラスです。
 *
 * <p>
 * 固有値を絶対値の降順に並べ替え、{@link PowerIterationEigenSolver} と同じ打ち切り規則（最大数、|λ| が許容誤差未満）で返します。
 * 乱数源は使用しません。べき乗法の結果を検証する参照実装としても使用します。
 * </p>
 */
public final class EjmlSymmetricEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、絶対値の降順に固有対を返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @param settings 許容誤差・最大固有値数です（最大反復回数は使用しません）
     * @param random 使用しません
     * @return 絶対値の降順の固有対リストです
     * @throws IllegalArgumentException symmetricMatrix または settings が null の場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public List<EigenPair> decompose(DMatrixRMaj symmetricMatrix, EigenSolverSettings settings,
            RandomSource random) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new DimensionMismatchException(
                    "正方行列が必要です: " + MatrixOps.shape(symmetricMatrix));
        }

        int dim = symmetricMatrix.numRows;

        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, true);

        // EJML は入力を書き換える場合があるため複製を渡します。
        if (!decomposition.decompose(MatrixOps.copy(symmetricMatrix))) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）");
        }

        int found = decomposition.getNumberOfEigenvalues();
        double[] eigenvalues = new double[found];
        double[][] eigenvectors = new double[found][];

        for (int col = 0; col < found; col++) {
            // 実対称を想定しているため、固有値は実数部のみを使います。
            eigenvalues[col] = decomposition.getEigenvalue(col).getReal();

            DMatrixRMaj vec = decomposition.getEigenVector(col);
            if (vec == null) {
                throw new IllegalStateException("固有ベクトルが取得できません: col=" + col);
            }
            eigenvectors[col] = normalize(vec.data, dim);
        }

        int[] order = argsortByMagnitudeDescending(eigenvalues);
        int k = settings.effectiveCount(dim);
        List<EigenPair> pairs = new ArrayList<>(Math.min(k, found));

        for (int i = 0; i < order.length && pairs.size() < k; i++) {
            double lambda = eigenvalues[order[i]];
            if (Math.abs(lambda) < settings.getTolerance()) {
                break;
            }
            pairs.add(new EigenPair(lambda, eigenvectors[order[i]]));
        }
        return pairs;
    }

    /**
     * 配列を絶対値の降順に並べたときのインデックス順を返します（同値は元の順序を保ちます）。
     *
     * @param values 対象配列です
     * @return インデックス配列です
     */
    private static int[] argsortByMagnitudeDescending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }

        Arrays.sort(indices, (i, j) -> Double.compare(Math.abs(values[j]), Math.abs(values[i])));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }

    private static double[] normalize(double[] data, int dim) {
        double[] v = Arrays.copyOf(data, dim);
        double norm = MatrixOps.norm(v);
        if (norm > 0.0) {
            for (int i = 0; i < dim; i++) {
                v[i] /= norm;
            }
        }
        return v;
    }
}
