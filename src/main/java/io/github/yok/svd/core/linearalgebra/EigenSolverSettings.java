package io.github.yok.svd.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.Value;

/**
 * 固有値ソルバの実行設定です。
 */
@Value
public class EigenSolverSettings {

    /**
     * 収束判定・打ち切り判定の閾値（絶対値）です。
     */
    double tolerance;

    /**
     * 1つの固有対あたりの最大反復回数です。
     */
    int maxIterations;

    /**
     * 取得する固有対の最大数です（0 は上限なし）。
     */
    int maxEigenvalues;

    /**
     * 設定を生成します。
     *
     * @param tolerance 閾値です（0 より大きい値）
     * @param maxIterations 最大反復回数です（1 以上）
     * @param maxEigenvalues 最大固有値数です（0 以上、0 は上限なし）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public EigenSolverSettings(double tolerance, int maxIterations, int maxEigenvalues) {
        checkArgument(tolerance > 0.0, "tolerance は 0 より大きい必要があります: %s", tolerance);
        checkArgument(maxIterations > 0, "maxIterations は 1 以上である必要があります: %s", maxIterations);
        checkArgument(maxEigenvalues >= 0, "maxEigenvalues は 0 以上である必要があります: %s",
                maxEigenvalues);
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.maxEigenvalues = maxEigenvalues;
    }

    /**
     * 最大固有値数を rankCap 以下に制限した設定を返します。
     *
     * @param rankCap 階数の上限です（1 以上）
     * @return 最大固有値数が {@code min(maxEigenvalues, rankCap)}（上限なしの場合は rankCap）の設定です
     */
    public EigenSolverSettings cappedTo(int rankCap) {
        checkArgument(rankCap > 0, "rankCap は 1 以上である必要があります: %s", rankCap);
        int k = (maxEigenvalues == 0) ? rankCap : Math.min(maxEigenvalues, rankCap);
        return new EigenSolverSettings(tolerance, maxIterations, k);
    }

    /**
     * 取得数の上限を返します。
     *
     * @param dimension 行列の次元です
     * @return {@code maxEigenvalues} が 0 なら dimension、それ以外は両者の小さい方です
     */
    public int effectiveCount(int dimension) {
        return (maxEigenvalues == 0) ? dimension : Math.min(maxEigenvalues, dimension);
    }
}
