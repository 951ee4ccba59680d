package io.github.yok.svd.out;

import io.github.yok.svd.core.image.ChannelResult;
import io.github.yok.svd.core.image.CompressionResult;
import io.github.yok.svd.core.image.ImageType;
import io.github.yok.svd.core.image.PixelBuffer;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.imageio.ImageIO;

/**
 * 圧縮画像を PNG に出力するクラスです。
 *
 * <ul>
 * <li>{@code svd_compressed_method=count_p=30.png}（圧縮画像）</li>
 * <li>{@code svd_channel_r_method=count_p=30.png} など（カラー画像のチャネル別画像、各チャネルを自身の色で表示）</li>
 * </ul>
 */
public final class PngResultWriter implements ResultWriter {

    private static final String FILE_HEAD = "svd";

    private static final String FORMAT = "png";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * カラー画像のチャネル別画像を出力するかどうかです。
     */
    private final boolean channelImages;

    /**
     * PNG 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param channelImages チャネル別画像を出力するかどうかです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public PngResultWriter(String outputDir, boolean channelImages) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
        this.channelImages = channelImages;
    }

    /**
     * 圧縮画像（とチャネル別画像）を出力します。
     *
     * @param result 圧縮結果です
     * @param runLabel 実行ラベルです
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(CompressionResult result, String runLabel) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            writePng(toBufferedImage(result.getImage()),
                    FILE_HEAD + "_compressed_" + runLabel + "." + FORMAT);

            if (channelImages && result.getImageType() == ImageType.RGB) {
                for (ChannelResult c : result.getChannels()) {
                    writePng(channelImage(result.getImage(), c),
                            FILE_HEAD + "_channel_" + c.getChannel().getLabel() + "_" + runLabel
                                    + "." + FORMAT);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("PNG 出力に失敗しました: " + outputDir, e);
        }
    }

    private void writePng(BufferedImage image, String fileName) throws IOException {
        Path file = outputDir.resolve(fileName);
        if (!ImageIO.write(image, FORMAT, file.toFile())) {
            throw new IOException("PNG の書き込みに対応する ImageWriter がありません: " + file);
        }
    }

    /**
     * 画素バッファを BufferedImage（ARGB）に変換します。
     *
     * @param buffer 画素バッファです
     * @return 画像です
     */
    static BufferedImage toBufferedImage(PixelBuffer buffer) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = (buffer.get(x, y, PixelBuffer.ALPHA) << 24)
                        | (buffer.get(x, y, 0) << 16) | (buffer.get(x, y, 1) << 8)
                        | buffer.get(x, y, 2);
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }

    /**
     * 1チャネルのみを残した画像を返します（他のチャネルは 0）。
     *
     * @param compressed 圧縮画像です
     * @param channel チャネルの結果です
     * @return チャネル画像です
     */
    static BufferedImage channelImage(PixelBuffer compressed, ChannelResult channel) {
        int width = compressed.getWidth();
        int height = compressed.getHeight();
        int shift = 16 - 8 * channel.getChannel().getOffset();
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value = compressed.get(x, y, channel.getChannel().getOffset());
                image.setRGB(x, y, 0xFF000000 | (value << shift));
            }
        }
        return image;
    }
}
