package io.github.yok.svd.core.random;

/**
 * 固有値ソルバの初期ベクトル生成に使用する乱数源を表すインタフェースです。
 *
 * <p>
 * 乱数源を明示的に注入することで、シードを固定した再現可能な実行を可能にします。 チャネルごとの並列実行では
 * {@link #derive(int)} で独立したストリームを取り出します。
 * </p>
 */
public interface RandomSource {

    /**
     * [0, 1) の一様乱数を返します。
     *
     * @return 乱数です
     */
    double nextDouble();

    /**
     * ストリーム番号から派生した、独立した乱数源を返します。
     *
     * <p>
     * 同じ乱数源から同じ番号で派生させた場合、同じ乱数列になります。
     * </p>
     *
     * @param stream ストリーム番号です
     * @return 派生した乱数源です
     */
    RandomSource derive(int stream);
}
