package io.github.yok.svd.core.image;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.svd.core.matrix.DimensionMismatchException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 圧縮結果の評価指標（平均二乗誤差、データ圧縮比）を計算するクラスです。
 */
public final class ImageQualityMetrics {

    private ImageQualityMetrics() {}

    /**
     * R, G, B 成分の二乗誤差の平均（MSE）を返します。アルファ成分は無視します。
     *
     * @param original 元画像です
     * @param compressed 圧縮画像です
     * @return 平均二乗誤差です
     * @throws DimensionMismatchException 画像サイズが一致しない場合に発生します
     */
    public static double meanSquaredError(PixelBuffer original, PixelBuffer compressed) {
        checkNotNull(original, "original は null 不可です");
        checkNotNull(compressed, "compressed は null 不可です");
        if (!original.sameSizeAs(compressed)) {
            throw new DimensionMismatchException("画像サイズが一致しません: " + original.getWidth() + "x"
                    + original.getHeight() + " vs " + compressed.getWidth() + "x"
                    + compressed.getHeight());
        }

        byte[] a = original.getData();
        byte[] b = compressed.getData();
        long sumSquared = 0L;
        long count = 0L;
        for (int i = 0; i < a.length; i += PixelBuffer.COMPONENTS) {
            for (int c = 0; c < 3; c++) {
                int diff = (a[i + c] & 0xFF) - (b[i + c] & 0xFF);
                sumSquared += (long) diff * diff;
            }
            count += 3;
        }
        return (double) sumSquared / count;
    }

    /**
     * 階数 k の分解で表現した場合のデータ圧縮比を返します。
     *
     * <p>
     * {@code (rows × cols) / (k × (rows + cols + 1))} を小数点以下2桁（四捨五入）に丸めます。
     * </p>
     *
     * @param rows 行数（画像の高さ）です
     * @param cols 列数（画像の幅）です
     * @param usedComponents 使用した成分数 k です（1 以上）
     * @return データ圧縮比です
     */
    public static BigDecimal compressionRatio(int rows, int cols, int usedComponents) {
        checkArgument(rows > 0 && cols > 0, "行列サイズが不正です: %sx%s", rows, cols);
        checkArgument(usedComponents > 0, "usedComponents は 1 以上が必要です: %s", usedComponents);
        double dense = (double) rows * cols;
        double factored = (double) usedComponents * (rows + cols + 1);
        return BigDecimal.valueOf(dense / factored).setScale(2, RoundingMode.HALF_UP);
    }
}
