package io.github.yok.svd.core.reconstruction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.svd.core.svd.SvdResult;

/**
 * 特異値の累積和割合で打ち切る再構成（ByEnergy）です。
 *
 * <p>
 * 降順に特異値を加算し、累積和が {@code percent × Σσ} を超えた時点で止めます。 超えた成分自身も使用します。
 * </p>
 */
public final class EnergyRankReconstructor implements RankReconstructor {

    @Override
    public CompressionMethod method() {
        return CompressionMethod.SUM;
    }

    @Override
    public Reconstruction reconstruct(SvdResult svd, double percent) {
        checkNotNull(svd, "svd は null 不可です");
        checkArgument(percent >= 0.0 && percent <= 1.0, "percent は [0, 1] が必要です: %s", percent);

        int available = svd.rank();
        int used = usedCount(svd.getSigma(), percent);
        return new Reconstruction(LowRankSum.sumAndClamp(svd, used), used, available);
    }

    /**
     * 累積和の閾値を超えるまでに必要な成分数を返します。
     *
     * @param sigma 降順の特異値です
     * @param percent 保持割合です
     * @return 成分数です
     */
    static int usedCount(double[] sigma, double percent) {
        if (percent >= 1.0) {
            return sigma.length;
        }

        double total = 0.0;
        for (double s : sigma) {
            total += s;
        }
        double threshold = percent * total;

        double running = 0.0;
        for (int k = 0; k < sigma.length; k++) {
            running += sigma[k];
            if (running > threshold) {
                return k + 1;
            }
        }
        return sigma.length;
    }
}
