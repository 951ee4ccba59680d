package io.github.yok.svd.core.reconstruction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.svd.core.svd.SvdResult;
import org.ejml.data.DMatrixRMaj;

/**
 * 上位成分の和 {@code Σ σ_k·U[:,k]·Vᵗ[k,:]} と画素範囲への丸めをまとめたクラスです。
 */
final class LowRankSum {

    /**
     * 画素値の最小値です。
     */
    static final double PIXEL_MIN = 0.0;

    /**
     * 画素値の最大値です。
     */
    static final double PIXEL_MAX = 255.0;

    private LowRankSum() {}

    /**
     * 先頭 count 成分の和を計算し、[0, 255] の整数値に丸めた行列を返します。
     *
     * @param svd 特異値分解の結果です
     * @param count 使用する成分数です（0 以上、階数以下）
     * @return 再構成した行列です
     */
    static DMatrixRMaj sumAndClamp(SvdResult svd, int count) {
        checkNotNull(svd, "svd は null 不可です");
        checkArgument(count >= 0 && count <= svd.rank(), "成分数が範囲外です: %s（階数=%s）", count,
                svd.rank());

        int m = svd.rows();
        int n = svd.cols();
        DMatrixRMaj u = svd.getU();
        DMatrixRMaj vt = svd.getVt();
        double[] sigma = svd.getSigma();

        DMatrixRMaj out = new DMatrixRMaj(m, n);
        double[] data = out.data;

        for (int k = 0; k < count; k++) {
            double s = sigma[k];
            if (s == 0.0) {
                continue;
            }
            int vtRow = k * n;
            for (int i = 0; i < m; i++) {
                double su = s * u.unsafe_get(i, k);
                if (su == 0.0) {
                    continue;
                }
                int row = i * n;
                for (int j = 0; j < n; j++) {
                    data[row + j] += su * vt.data[vtRow + j];
                }
            }
        }

        for (int i = 0; i < data.length; i++) {
            data[i] = toPixel(data[i]);
        }
        return out;
    }

    /**
     * 値を [0, 255] に収めて最も近い整数に丸めます（0.5 は切り上げ）。
     *
     * @param value 値です
     * @return 画素値です
     */
    static double toPixel(double value) {
        if (Double.isNaN(value)) {
            return PIXEL_MIN;
        }
        double clamped = Math.max(PIXEL_MIN, Math.min(PIXEL_MAX, value));
        return Math.round(clamped);
    }
}
