package io.github.yok.svd.input;

import io.github.yok.svd.core.image.PixelBuffer;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.imageio.ImageIO;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 画像ファイルを読み込み、RGBA の画素バッファに変換するクラスです。
 *
 * <p>
 * 幅または高さが上限を超える画像は、縦横比を保ったまま上限に収まるよう縮小します（サイズは切り捨て）。
 * </p>
 */
@Getter
@Slf4j
public final class PixelBufferReader {

    /**
     * 幅・高さの上限です（0 は縮小しません）。
     */
    private final int maxSize;

    /**
     * 画像読み込みを生成します。
     *
     * @param maxSize 幅・高さの上限です（0 以上、0 は縮小しません）
     * @throws IllegalArgumentException maxSize が負の場合に発生します
     */
    public PixelBufferReader(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize は 0 以上を指定してください: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * 画像ファイルを読み込みます。
     *
     * @param path 画像ファイルのパスです
     * @return 画素バッファです
     * @throws IllegalArgumentException path が空の場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public PixelBuffer read(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("画像ファイルのパスは必須です");
        }
        return read(Paths.get(path));
    }

    /**
     * 画像ファイルを読み込みます。
     *
     * @param file 画像ファイルです
     * @return 画素バッファです
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public PixelBuffer read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("画像ファイルが見つかりません: " + file);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("画像の読み込みに失敗しました: " + file, e);
        }
        if (image == null) {
            throw new IllegalStateException("対応していない画像形式です: " + file);
        }

        BufferedImage scaled = scaleToFit(image);
        if (scaled != image) {
            log.info("画像を縮小しました。{}x{} → {}x{}（上限={}）", image.getWidth(), image.getHeight(),
                    scaled.getWidth(), scaled.getHeight(), maxSize);
        }
        return toPixelBuffer(scaled);
    }

    /**
     * 上限を超える場合に縮小した画像を返します。
     *
     * @param image 元画像です
     * @return 縮小した画像（縮小不要なら元画像）です
     */
    BufferedImage scaleToFit(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (maxSize == 0 || (width <= maxSize && height <= maxSize)) {
            return image;
        }

        double ratio = Math.min((double) maxSize / width, (double) maxSize / height);
        int w = Math.max(1, (int) Math.floor(width * ratio));
        int h = Math.max(1, (int) Math.floor(height * ratio));

        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
                    RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * BufferedImage を RGBA の画素バッファに変換します。
     *
     * @param image 画像です
     * @return 画素バッファです
     */
    public static PixelBuffer toPixelBuffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        PixelBuffer buffer = PixelBuffer.blank(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                buffer.set(x, y, (argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF,
                        (argb >>> 24) & 0xFF);
            }
        }
        return buffer;
    }
}
