package io.github.yok.svd.core.linearalgebra;

import io.github.yok.svd.core.matrix.DimensionMismatchException;
import io.github.yok.svd.core.matrix.MatrixOps;
import io.github.yok.svd.core.random.RandomSource;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * べき乗法とデフレーションにより、実対称（半正定値）行列の優越固有対を求めるクラスです。
 *
 * <p>
 * 固有対ごとに、乱数初期ベクトル → A·v の正規化反復 → レイリー商の収束判定 → デフレーション {@code A := A - λ·v·vᵗ} を行います。
 * 反復上限までに収束しなかった場合、または |λ| が許容誤差を下回った場合は、その固有対以降を打ち切ります。
 * </p>
 *
 * <p>
 * デフレーションは入力行列の複製に対して行うため、呼び出し側の行列は変更されません。
 * </p>
 */
@Slf4j
public final class PowerIterationEigenSolver implements EigenDecompositionBackend {

    @Override
    public List<EigenPair> decompose(DMatrixRMaj symmetricMatrix, EigenSolverSettings settings,
            RandomSource random) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings は null 不可です");
        }
        if (random == null) {
            throw new IllegalArgumentException("random は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new DimensionMismatchException(
                    "正方行列が必要です: " + MatrixOps.shape(symmetricMatrix));
        }

        int n = symmetricMatrix.numRows;
        int k = settings.effectiveCount(n);
        double tolerance = settings.getTolerance();

        // デフレーションで書き換えるため複製を使います。
        DMatrixRMaj a = MatrixOps.copy(symmetricMatrix);
        List<EigenPair> pairs = new ArrayList<>(k);

        for (int index = 0; index < k; index++) {
            double[] v = randomUnitVector(n, random, tolerance);
            if (v == null) {
                log.debug("初期ベクトルのノルムが許容誤差未満のため打ち切ります。index={}", index);
                break;
            }

            Iteration it = iterate(a, v, settings);
            if (it.isExhausted()) {
                log.debug("A·v のノルムが許容誤差未満のため打ち切ります。index={}、反復回数={}", index,
                        it.getIterations());
                break;
            }
            if (!it.isConverged()) {
                log.warn("固有対が収束しませんでした。以降を打ち切ります。index={}、反復回数={}、λ={}", index,
                        it.getIterations(), it.getLambda());
                break;
            }
            if (Math.abs(it.getLambda()) < tolerance) {
                log.debug("固有値が許容誤差未満のため打ち切ります。index={}、λ={}", index, it.getLambda());
                break;
            }

            pairs.add(new EigenPair(it.getLambda(), it.getVector()));
            log.debug("固有対を取得しました。index={}、λ={}、反復回数={}", index, it.getLambda(), it.getIterations());

            deflate(a, it.getLambda(), it.getVector());
        }

        return pairs;
    }

    /**
     * 単一の固有対についてべき乗法を反復します。
     *
     * @param a 対象行列（デフレーション済み）です
     * @param start 単位初期ベクトルです
     * @param settings 設定です
     * @return 反復結果です
     */
    private static Iteration iterate(DMatrixRMaj a, double[] start, EigenSolverSettings settings) {
        double tolerance = settings.getTolerance();
        double[] v = start;
        double lambda = 0.0;
        boolean converged = false;
        boolean exhausted = false;
        int performed = 0;

        double[] av = MatrixOps.multiplyVector(a, v);
        for (int iter = 1; iter <= settings.getMaxIterations(); iter++) {
            performed = iter;

            double norm = MatrixOps.norm(av);
            if (norm < tolerance) {
                exhausted = true;
                break;
            }
            v = scale(av, 1.0 / norm);

            // レイリー商 vᵗ·A·v（A·v は次の反復でもそのまま使います）
            av = MatrixOps.multiplyVector(a, v);
            double next = MatrixOps.dot(v, av);

            if (Math.abs(next - lambda) < tolerance) {
                lambda = next;
                converged = true;
                break;
            }
            lambda = next;
        }
        return new Iteration(v, lambda, converged, exhausted, performed);
    }

    /**
     * 成分が [-0.5, 0.5] の乱数ベクトルを生成し、正規化して返します。
     *
     * @param n 次元です
     * @param random 乱数源です
     * @param tolerance 閾値です
     * @return 単位ベクトルです（ノルムが閾値未満の場合は null）
     */
    private static double[] randomUnitVector(int n, RandomSource random, double tolerance) {
        double[] v = new double[n];
        for (int i = 0; i < n; i++) {
            v[i] = random.nextDouble() - 0.5;
        }
        double norm = MatrixOps.norm(v);
        if (norm < tolerance) {
            return null;
        }
        return scale(v, 1.0 / norm);
    }

    /**
     * ランク1の差し引き {@code A := A - λ·v·vᵗ} を行います。
     *
     * @param a 対象行列です（その場で更新します）
     * @param lambda 固有値です
     * @param v 単位固有ベクトルです
     */
    private static void deflate(DMatrixRMaj a, double lambda, double[] v) {
        int n = v.length;
        double[] data = a.data;
        for (int i = 0; i < n; i++) {
            double li = lambda * v[i];
            int row = i * n;
            for (int j = 0; j < n; j++) {
                data[row + j] -= li * v[j];
            }
        }
    }

    private static double[] scale(double[] v, double factor) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] * factor;
        }
        return out;
    }

    /**
     * 単一固有対の反復結果です。
     */
    @Value
    private static class Iteration {

        /**
         * 最終反復の単位ベクトルです。
         */
        double[] vector;

        /**
         * 最終反復のレイリー商です。
         */
        double lambda;

        /**
         * 収束したかどうかです。
         */
        boolean converged;

        /**
         * A·v のノルムが許容誤差を下回って反復を中断したかどうかです。
         */
        boolean exhausted;

        /**
         * 実行した反復回数です。
         */
        int iterations;
    }
}
