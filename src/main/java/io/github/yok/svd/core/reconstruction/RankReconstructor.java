package io.github.yok.svd.core.reconstruction;

import io.github.yok.svd.core.svd.SvdResult;

/**
 * 特異値分解の結果から、上位成分のみを用いて行列を再構成する処理のインタフェースです。
 *
 * <p>
 * 再構成後の各要素は [0, 255] に丸め込み、最も近い整数に丸めます。 保持割合が 0 でも最低 1 成分は使用します。
 * </p>
 */
public interface RankReconstructor {

    /**
     * この実装が担当する打ち切り方式を返します。
     *
     * @return 打ち切り方式です
     */
    CompressionMethod method();

    /**
     * 上位成分で行列を再構成します。
     *
     * @param svd 特異値分解の結果です
     * @param percent 保持割合（0 以上 1 以下）です
     * @return 再構成結果です
     */
    Reconstruction reconstruct(SvdResult svd, double percent);
}
