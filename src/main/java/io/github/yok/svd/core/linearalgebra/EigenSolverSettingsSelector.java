package io.github.yok.svd.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 行列サイズに応じて固有値ソルバの設定を選択するクラスです。
 *
 * <p>
 * 画素数（rows×cols）が閾値を超える行列には、実行時間を抑えるための緩い設定（許容誤差を大きく、反復回数と固有値数を少なく）を適用します。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public final class EigenSolverSettingsSelector {

    /**
     * 通常サイズの行列に適用する設定です。
     */
    private final EigenSolverSettings standard;

    /**
     * 大きな行列に適用する設定です。
     */
    private final EigenSolverSettings largeMatrix;

    /**
     * 大きな行列とみなす画素数の閾値です（この値を超えると largeMatrix を使用します）。
     */
    private final long pixelThreshold;

    /**
     * 常に同じ設定を返すセレクタを生成します。
     *
     * @param settings 設定です
     * @return セレクタです
     */
    public static EigenSolverSettingsSelector fixed(EigenSolverSettings settings) {
        checkNotNull(settings, "settings は null 不可です");
        return new EigenSolverSettingsSelector(settings, settings, Long.MAX_VALUE);
    }

    /**
     * 行列サイズに対応する設定を返します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @return 設定です
     */
    public EigenSolverSettings select(int rows, int cols) {
        checkArgument(rows > 0 && cols > 0, "行列サイズが不正です: %sx%s", rows, cols);
        long pixels = (long) rows * cols;
        return (pixels > pixelThreshold) ? largeMatrix : standard;
    }
}
