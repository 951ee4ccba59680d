package io.github.yok.svd.core.linearalgebra;

import io.github.yok.svd.core.random.RandomSource;
import java.util.List;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実対称行列の固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * べき乗法による実装と EJML による実装を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、絶対値の大きい順に最大 {@code settings.maxEigenvalues} 個の固有対を返します。
     *
     * <p>
     * 収束しなかった場合や固有値が許容誤差を下回った場合は、その時点までの固有対を返します（要求数より少なくなり得ます）。 引数の行列は変更しません。
     * </p>
     *
     * @param symmetricMatrix 実対称行列です
     * @param settings 許容誤差・最大反復回数・最大固有値数です
     * @param random 初期ベクトル生成用の乱数源です（使用しない実装もあります）
     * @return 発見順（絶対値の降順）の固有対リストです
     * @throws io.github.yok.svd.core.matrix.DimensionMismatchException 行列が正方でない場合に発生します
     */
    List<EigenPair> decompose(DMatrixRMaj symmetricMatrix, EigenSolverSettings settings,
            RandomSource random);

    /**
     * 固有値と固有ベクトルの組です。
     *
     * <p>
     * 固有値は符号付きの値をそのまま保持します。 固有ベクトルは単位ベクトルです。
     * </p>
     */
    @Value
    class EigenPair {

        /**
         * 固有値です。
         */
        double value;

        /**
         * 固有ベクトルです。
         */
        double[] vector;
    }
}
