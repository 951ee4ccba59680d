package io.github.yok.svd.core.svd;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 特異値分解 {@code A = U·Σ·Vᵗ} の結果を保持するクラスです。
 *
 * <p>
 * {@code r = min(m, n)} とすると、U は m×r、sigma は長さ r、vt は r×n です。 U の列 k と vt の行 k は sigma[k]
 * に対応します。 sigma は降順かつ非負です。
 * </p>
 *
 * <p>
 * 固有値ソルバが r 個より少ない成分で打ち切った場合、不足分は特異値 0、U・vt はゼロベクトルで埋められます。 実際に得られた成分数は
 * {@link #getConvergedRank()} で参照できます。
 * </p>
 */
@Value
public class SvdResult {

    /**
     * 左特異ベクトル行列（m×r、列が特異ベクトル）です。
     */
    DMatrixRMaj u;

    /**
     * 特異値（降順、非負）です。
     */
    double[] sigma;

    /**
     * 右特異ベクトルの転置（r×n、行が特異ベクトル）です。
     */
    DMatrixRMaj vt;

    /**
     * 固有値ソルバが実際に返した成分数です（0 以上 r 以下）。
     */
    int convergedRank;

    /**
     * 宣言上の階数 r（= sigma の長さ）を返します。
     *
     * @return 階数です
     */
    public int rank() {
        return sigma.length;
    }

    /**
     * 元の行列の行数 m を返します。
     *
     * @return 行数です
     */
    public int rows() {
        return u.numRows;
    }

    /**
     * 元の行列の列数 n を返します。
     *
     * @return 列数です
     */
    public int cols() {
        return vt.numCols;
    }
}
