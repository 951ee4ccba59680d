package io.github.yok.svd.app;

import io.github.yok.svd.core.image.ChannelPipeline;
import io.github.yok.svd.core.image.CompressionResult;
import io.github.yok.svd.core.image.ImageType;
import io.github.yok.svd.core.image.ImageTypeDetector;
import io.github.yok.svd.core.image.PixelBuffer;
import io.github.yok.svd.core.image.ProgressListener;
import io.github.yok.svd.core.random.RandomSource;
import io.github.yok.svd.core.random.SeededRandomSource;
import io.github.yok.svd.core.reconstruction.CompressionMethod;
import io.github.yok.svd.core.reconstruction.CompressionPolicy;
import io.github.yok.svd.input.PixelBufferReader;
import io.github.yok.svd.out.ResultWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で svd-image-compressor を実行するクラスです。
 *
 * <p>
 * 保持割合（百分率）をスキャンし、各割合について画像を圧縮して結果を出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class SvdCliRunner implements CommandLineRunner {

    /**
     * svd-image-compressor の設定値（svd.*）です。
     */
    private final SvdProperties properties;

    /**
     * 画像読み込みです。
     */
    private final PixelBufferReader pixelBufferReader;

    /**
     * 画像種別の判定ロジックです。
     */
    private final ImageTypeDetector imageTypeDetector;

    /**
     * チャネルパイプラインです。
     */
    private final ChannelPipeline channelPipeline;

    /**
     * 結果出力ロジックの一覧です。
     */
    private final List<ResultWriter> resultWriters;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== svd-image-compressor start: low-rank approximation ===");
        System.out.print(properties.toMultilineString());

        String path = properties.getInput().getPath();
        if (path == null || path.isEmpty()) {
            throw new IllegalStateException("input.path は必須です（入力画像ファイルを指定してください）");
        }

        // 保持割合（百分率）の一覧
        List<Integer> percents = properties.getCompression().getPercents();
        if (percents == null || percents.isEmpty()) {
            throw new IllegalStateException("compression.percents は必須です（保持割合の一覧を指定してください）");
        }
        for (Integer pct : percents) {
            if (pct == null || pct < 0 || pct > 100) {
                throw new IllegalStateException(
                        "compression.percents は 0〜100 を指定してください: " + pct);
            }
        }

        CompressionMethod method = properties.getCompression().getMethod();
        Long seed = properties.getEigen().getSeed();

        PixelBuffer image = pixelBufferReader.read(path);
        ImageType imageType = imageTypeDetector.detect(image);
        System.out.println("入力: " + path + "（" + image.getWidth() + "x" + image.getHeight()
                + "、種別=" + imageType.getLabel() + "）");

        ProgressListener progress = (percent, stage, message) -> System.out
                .println(String.format(Locale.ROOT, "  [%3d%%] %s", percent, message));

        List<CompressionResult> results = new ArrayList<>(percents.size());

        // 保持割合ごとに圧縮を実行
        for (int i = 0; i < percents.size(); i++) {
            CompressionPolicy policy = CompressionPolicy.ofPercentage(method, percents.get(i));
            String runLabel = ResultWriter.runLabel(policy);

            // seed 指定時は毎回同じ乱数列、未指定時は実行ごとに新しい乱数列
            RandomSource random =
                    (seed != null) ? new SeededRandomSource(seed) : SeededRandomSource.unseeded();

            System.out.println("=== 保持割合ごとの計算 ===");
            System.out.println("入力: method=" + method.getLabel() + ", p="
                    + ResultWriter.percentageText(policy.getPercent()) + "%（step=" + (i + 1) + "/"
                    + percents.size() + "）");

            CompressionResult result =
                    channelPipeline.compress(image, imageType, policy, random, progress);
            results.add(result);

            for (ResultWriter writer : resultWriters) {
                writer.write(result, runLabel);
            }

            System.out.println("結果: 使用特異値=" + result.getRetainedSingularValues() + " / "
                    + result.getTotalSingularValues() + "（" + fmt2(result.retainedRatio() * 100.0)
                    + "%）, データ圧縮比=" + result.getCompressionRatio().toPlainString());
            System.out.println("結果: MSE=" + fmt2(result.getMeanSquaredError()) + ", 所要時間="
                    + result.getElapsedMillis() + "ms");
        }

        for (ResultWriter writer : resultWriters) {
            writer.finish(results);
        }
        System.out.println("=== svd-image-compressor finished: output=" + properties.getOutput().getDir()
                + " ===");
    }

    /**
     * 数値を小数点以下2桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
