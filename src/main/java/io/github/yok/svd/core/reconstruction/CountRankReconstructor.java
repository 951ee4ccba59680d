package io.github.yok.svd.core.reconstruction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.svd.core.svd.SvdResult;

/**
 * 特異値の個数割合で打ち切る再構成（ByCount）です。
 *
 * <p>
 * 使用成分数は {@code max(1, ceil(len(sigma) × percent))} です。
 * </p>
 */
public final class CountRankReconstructor implements RankReconstructor {

    @Override
    public CompressionMethod method() {
        return CompressionMethod.COUNT;
    }

    @Override
    public Reconstruction reconstruct(SvdResult svd, double percent) {
        checkNotNull(svd, "svd は null 不可です");
        checkArgument(percent >= 0.0 && percent <= 1.0, "percent は [0, 1] が必要です: %s", percent);

        int available = svd.rank();
        int retain = retainedCount(available, percent);
        return new Reconstruction(LowRankSum.sumAndClamp(svd, retain), retain, available);
    }

    /**
     * 保持する成分数を返します。
     *
     * @param available 使用可能な成分数です
     * @param percent 保持割合です
     * @return 1 以上 available 以下の成分数です（available が 0 の場合は 0）
     */
    static int retainedCount(int available, double percent) {
        int retain = Math.max(1, (int) Math.ceil(available * percent));
        return Math.min(retain, available);
    }
}
