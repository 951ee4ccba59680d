package io.github.yok.svd.out;

import io.github.yok.svd.core.image.CompressionResult;
import io.github.yok.svd.core.reconstruction.CompressionPolicy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 圧縮結果を出力する処理のインタフェースです。
 *
 * <p>
 * 保持割合をスキャンして複数回圧縮することを前提とし、実行ごとに {@link #write(CompressionResult, String)}、
 * スキャン終了後に {@link #finish(List)} を呼び出します。
 * </p>
 */
public interface ResultWriter {

    /**
     * 1回分の圧縮結果を出力します。
     *
     * @param result 圧縮結果です
     * @param runLabel ファイル名に使う実行ラベルです（{@link #runLabel(CompressionPolicy)}）
     */
    void write(CompressionResult result, String runLabel);

    /**
     * スキャン全体の結果を出力します。
     *
     * @param results 実行順の圧縮結果です
     */
    default void finish(List<CompressionResult> results) {}

    /**
     * 命名規約に従って実行ラベルを作成します。
     *
     * <p>
     * 例: {@code method=count_p=30}
     * </p>
     *
     * @param policy 打ち切りポリシーです
     * @return 実行ラベルです
     */
    static String runLabel(CompressionPolicy policy) {
        return "method=" + policy.getMethod().getLabel() + "_p=" + percentageText(policy.getPercent());
    }

    /**
     * 保持割合を百分率の文字列にします（末尾の 0 は省きます）。
     *
     * @param percent 保持割合（0〜1）です
     * @return 百分率の文字列です（例: 30、12.5）
     */
    static String percentageText(double percent) {
        BigDecimal p = BigDecimal.valueOf(percent).movePointRight(2).setScale(2, RoundingMode.HALF_UP);
        return p.stripTrailingZeros().toPlainString();
    }
}
