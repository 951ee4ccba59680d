package io.github.yok.svd.core.svd;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.svd.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.EigenDecompositionBackend.EigenPair;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettings;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettingsSelector;
import io.github.yok.svd.core.matrix.DimensionMismatchException;
import io.github.yok.svd.core.matrix.MatrixOps;
import io.github.yok.svd.core.random.RandomSource;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * AᵗA の固有分解から、m×n 行列の特異値分解 {U, Σ, Vᵗ} を組み立てるクラスです。
 *
 * <p>
 * AᵗA 構築 → 固有分解 → σ = sqrt(max(0, λ)) → σ 降順に並べ替え → u = A·v / σ の正規化 → 宣言階数 min(m, n) までゼロ埋め、の順に処理します。
 * </p>
 *
 * <p>
 * 悪条件の入力でも例外にはせず、縮退した成分をゼロベクトルに置き換えます。
 * </p>
 */
@Getter
@Slf4j
public final class SvdEngine {

    /**
     * AᵗA の固有分解を行うバックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 行列サイズごとの固有値ソルバ設定です。
     */
    private final EigenSolverSettingsSelector settingsSelector;

    /**
     * 特異値・左特異ベクトルを縮退とみなす閾値です。
     */
    private final double tolerance;

    /**
     * SVD エンジンを生成します。
     *
     * @param eigenBackend 固有分解バックエンドです（null 不可）
     * @param settingsSelector 固有値ソルバ設定の選択ロジックです（null 不可）
     * @param tolerance 縮退判定の閾値です（0 より大きい値）
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws IllegalArgumentException tolerance が 0 以下の場合に発生します
     */
    public SvdEngine(EigenDecompositionBackend eigenBackend,
            EigenSolverSettingsSelector settingsSelector, double tolerance) {
        this.eigenBackend = checkNotNull(eigenBackend, "eigenBackend は null 不可です");
        this.settingsSelector = checkNotNull(settingsSelector, "settingsSelector は null 不可です");
        checkArgument(tolerance > 0.0, "tolerance は 0 より大きい必要があります: %s", tolerance);
        this.tolerance = tolerance;
    }

    /**
     * 2次元配列で与えた行列を特異値分解します。
     *
     * @param rows 行列の値です
     * @param random 固有値ソルバ用の乱数源です
     * @return 分解結果です
     * @throws DimensionMismatchException 空、または行の長さが揃っていない場合に発生します
     */
    public SvdResult decompose(double[][] rows, RandomSource random) {
        return decompose(MatrixOps.fromRows(rows), random);
    }

    /**
     * 行列を特異値分解します。
     *
     * @param a m×n 行列です（変更しません）
     * @param random 固有値ソルバ用の乱数源です
     * @return 分解結果です
     * @throws DimensionMismatchException 行列が空の場合に発生します
     */
    public SvdResult decompose(DMatrixRMaj a, RandomSource random) {
        checkNotNull(a, "a は null 不可です");
        checkNotNull(random, "random は null 不可です");
        if (a.numRows == 0 || a.numCols == 0) {
            throw new DimensionMismatchException("行列が空です: " + MatrixOps.shape(a));
        }

        int m = a.numRows;
        int n = a.numCols;
        int r = Math.min(m, n);

        // 1) AᵗA（n×n、対称半正定値）
        DMatrixRMaj ata = MatrixOps.multiply(MatrixOps.transpose(a), a);

        // 2) 固有分解（大きな行列は緩い設定を使います）
        EigenSolverSettings settings = settingsSelector.select(m, n).cappedTo(r);
        List<EigenPair> pairs = eigenBackend.decompose(ata, settings, random);
        int found = pairs.size();

        // 3) 特異値（数値誤差による負の固有値は 0 とします）
        double[] sigmaRaw = new double[found];
        for (int i = 0; i < found; i++) {
            sigmaRaw[i] = Math.sqrt(Math.max(0.0, pairs.get(i).getValue()));
        }

        // 4) σ の降順（同値は発見順）
        int[] order = argsortDescending(sigmaRaw);

        double[] sigma = new double[r];
        DMatrixRMaj u = new DMatrixRMaj(m, r);
        DMatrixRMaj vt = new DMatrixRMaj(r, n);
        int degenerate = 0;

        for (int k = 0; k < found; k++) {
            double s = sigmaRaw[order[k]];
            double[] v = pairs.get(order[k]).getVector();
            sigma[k] = s;
            System.arraycopy(v, 0, vt.data, k * n, n);

            // 5) u_k = A·v_k / σ_k を正規化（縮退成分はゼロベクトルのまま）
            if (s > tolerance) {
                double[] uk = MatrixOps.multiplyVector(a, v);
                for (int i = 0; i < m; i++) {
                    uk[i] /= s;
                }
                double norm = MatrixOps.norm(uk);
                if (norm < tolerance) {
                    degenerate++;
                    continue;
                }
                for (int i = 0; i < m; i++) {
                    u.unsafe_set(i, k, uk[i] / norm);
                }
            } else {
                degenerate++;
            }
        }

        // 6) found 以降は σ=0、U・Vᵗ はゼロのまま（宣言階数 r を維持します）
        if (found < r || degenerate > 0) {
            log.debug("特異値分解：宣言階数={}、取得成分数={}、縮退成分数={}（{}）", r, found, degenerate,
                    MatrixOps.shape(a));
        }

        return new SvdResult(u, sigma, vt, found);
    }

    /**
     * 配列を降順に並べたときのインデックス順を返します（同値は元の順序を保ちます）。
     *
     * @param values 対象配列です
     * @return インデックス配列です
     */
    private static int[] argsortDescending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }

        // Arrays.sort（オブジェクト配列）は安定ソートです。
        Arrays.sort(indices, (i, j) -> Double.compare(values[j], values[i]));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }
}
