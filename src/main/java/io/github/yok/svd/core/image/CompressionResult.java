package io.github.yok.svd.core.image;

import io.github.yok.svd.core.reconstruction.CompressionPolicy;
import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

/**
 * 画像1枚の圧縮結果です。
 */
@Value
public class CompressionResult {

    /**
     * 圧縮後の画素バッファです（元画像と同じサイズ、アルファは 255）。
     */
    PixelBuffer image;

    /**
     * 画像の種類です。
     */
    ImageType imageType;

    /**
     * 適用したポリシーです。
     */
    CompressionPolicy policy;

    /**
     * チャネルごとの結果です（処理順）。
     */
    List<ChannelResult> channels;

    /**
     * 使用した特異値の数（チャネル平均を四捨五入）です。
     */
    int retainedSingularValues;

    /**
     * 特異値の総数（チャネル平均を四捨五入）です。
     */
    int totalSingularValues;

    /**
     * データ圧縮比（小数点以下2桁）です。
     */
    BigDecimal compressionRatio;

    /**
     * 元画像との平均二乗誤差です。
     */
    double meanSquaredError;

    /**
     * 所要時間（ミリ秒）です。
     */
    long elapsedMillis;

    /**
     * 特異値の総数に対する使用数の割合を返します。
     *
     * @return 0 以上 1 以下の割合です
     */
    public double retainedRatio() {
        return (totalSingularValues == 0) ? 0.0
                : (double) retainedSingularValues / totalSingularValues;
    }
}
