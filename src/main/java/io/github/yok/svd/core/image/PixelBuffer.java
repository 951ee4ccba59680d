package io.github.yok.svd.core.image;

import io.github.yok.svd.core.matrix.DimensionMismatchException;
import lombok.Getter;

/**
 * 1画素あたり RGBA 4成分（各 8bit）をインターリーブで保持する画素バッファです。
 *
 * <p>
 * 画素 (x, y) の成分 c（0=R, 1=G, 2=B, 3=A）は {@code data[(y * width + x) * 4 + c]} に格納されます。
 * </p>
 */
@Getter
public final class PixelBuffer {

    /**
     * 1画素あたりの成分数です。
     */
    public static final int COMPONENTS = 4;

    /**
     * アルファ成分のオフセットです。
     */
    public static final int ALPHA = 3;

    /**
     * 幅（画素数）です。
     */
    private final int width;

    /**
     * 高さ（画素数）です。
     */
    private final int height;

    /**
     * RGBA の画素データです。
     */
    private final byte[] data;

    /**
     * 画素バッファを生成します。
     *
     * @param width 幅です（1 以上）
     * @param height 高さです（1 以上）
     * @param data RGBA の画素データです（長さは width × height × 4）
     * @throws DimensionMismatchException サイズとデータ長が一致しない場合に発生します
     */
    public PixelBuffer(int width, int height, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new DimensionMismatchException("画像サイズが不正です: " + width + "x" + height);
        }
        if (data == null || data.length != width * height * COMPONENTS) {
            throw new DimensionMismatchException("画素データ長が width×height×4 と一致しません: "
                    + (data == null ? "null" : data.length) + " vs " + (width * height * COMPONENTS));
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * すべての画素が透明な黒の画素バッファを生成します。
     *
     * @param width 幅です
     * @param height 高さです
     * @return 画素バッファです
     */
    public static PixelBuffer blank(int width, int height) {
        return new PixelBuffer(width, height, new byte[width * height * COMPONENTS]);
    }

    /**
     * 画素数を返します。
     *
     * @return width × height です
     */
    public int pixelCount() {
        return width * height;
    }

    /**
     * 指定画素の成分値（0〜255）を返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @param component 成分のオフセット（0=R, 1=G, 2=B, 3=A）です
     * @return 成分値です
     */
    public int get(int x, int y, int component) {
        return data[index(x, y) + component] & 0xFF;
    }

    /**
     * 指定画素の RGBA を設定します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @param r 赤（0〜255）です
     * @param g 緑（0〜255）です
     * @param b 青（0〜255）です
     * @param a アルファ（0〜255）です
     */
    public void set(int x, int y, int r, int g, int b, int a) {
        int i = index(x, y);
        data[i] = (byte) r;
        data[i + 1] = (byte) g;
        data[i + 2] = (byte) b;
        data[i + ALPHA] = (byte) a;
    }

    /**
     * 同じサイズかどうかを返します。
     *
     * @param other 比較対象です
     * @return 幅と高さが一致する場合 true です
     */
    public boolean sameSizeAs(PixelBuffer other) {
        return other != null && width == other.width && height == other.height;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException(
                    "座標が範囲外です: (" + x + ", " + y + ") / " + width + "x" + height);
        }
        return (y * width + x) * COMPONENTS;
    }
}
