package io.github.yok.svd.core.image;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.svd.core.random.RandomSource;
import io.github.yok.svd.core.reconstruction.CompressionMethod;
import io.github.yok.svd.core.reconstruction.CompressionPolicy;
import io.github.yok.svd.core.reconstruction.RankReconstructor;
import io.github.yok.svd.core.reconstruction.Reconstruction;
import io.github.yok.svd.core.svd.SvdEngine;
import io.github.yok.svd.core.svd.SvdResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 画素バッファをチャネル行列に分解し、チャネルごとに SVD と打ち切り再構成を行って画素バッファへ戻すクラスです。
 *
 * <p>
 * チャネルは互いに独立したタスクとして executor 上で実行し、チャネル順（gray、または R→G→B）に結果を合流させてから画像を再合成します。
 * 各チャネルには {@link RandomSource#derive(int)} で派生させた乱数源を渡すため、実行順序によらず結果は同じです。
 * </p>
 */
@Slf4j
public final class ChannelPipeline {

    /**
     * 不透明を表すアルファ値です。
     */
    private static final int OPAQUE = 255;

    /**
     * 特異値分解エンジンです。
     */
    private final SvdEngine svdEngine;

    /**
     * 打ち切り方式ごとの再構成ロジックです。
     */
    private final Map<CompressionMethod, RankReconstructor> reconstructors;

    /**
     * チャネルタスクを実行する executor です。
     */
    private final Executor executor;

    /**
     * 画像種別の判定ロジックです。
     */
    private final ImageTypeDetector imageTypeDetector;

    /**
     * パイプラインを生成します。
     *
     * @param svdEngine 特異値分解エンジンです
     * @param reconstructors 再構成ロジックの一覧です（方式ごとに1つ）
     * @param executor チャネルタスクを実行する executor です
     * @param imageTypeDetector 画像種別の判定ロジックです
     * @throws IllegalArgumentException 再構成ロジックが不足または重複している場合に発生します
     */
    public ChannelPipeline(SvdEngine svdEngine, List<RankReconstructor> reconstructors,
            Executor executor, ImageTypeDetector imageTypeDetector) {
        this.svdEngine = checkNotNull(svdEngine, "svdEngine は null 不可です");
        this.executor = checkNotNull(executor, "executor は null 不可です");
        this.imageTypeDetector = checkNotNull(imageTypeDetector, "imageTypeDetector は null 不可です");
        checkNotNull(reconstructors, "reconstructors は null 不可です");

        Map<CompressionMethod, RankReconstructor> byMethod = new EnumMap<>(CompressionMethod.class);
        for (RankReconstructor r : reconstructors) {
            RankReconstructor previous = byMethod.put(r.method(), r);
            checkArgument(previous == null, "打ち切り方式 %s の再構成ロジックが重複しています", r.method());
        }
        for (CompressionMethod m : CompressionMethod.values()) {
            checkArgument(byMethod.containsKey(m), "打ち切り方式 %s の再構成ロジックがありません", m);
        }
        this.reconstructors = Collections.unmodifiableMap(byMethod);
    }

    /**
     * 画像種別を判定してから圧縮します。
     *
     * @param image 元画像です
     * @param policy 打ち切りポリシーです
     * @param random 乱数源です
     * @param listener 進捗リスナです
     * @return 圧縮結果です
     */
    public CompressionResult compress(PixelBuffer image, CompressionPolicy policy,
            RandomSource random, ProgressListener listener) {
        checkNotNull(image, "image は null 不可です");
        return compress(image, imageTypeDetector.detect(image), policy, random, listener);
    }

    /**
     * 指定した画像種別として圧縮します。
     *
     * @param image 元画像です
     * @param imageType 画像種別です
     * @param policy 打ち切りポリシーです
     * @param random 乱数源です
     * @param listener 進捗リスナです
     * @return 圧縮結果です
     * @throws io.github.yok.svd.core.matrix.DimensionMismatchException 行列の次元が不正な場合に発生します
     */
    public CompressionResult compress(PixelBuffer image, ImageType imageType,
            CompressionPolicy policy, RandomSource random, ProgressListener listener) {
        checkNotNull(image, "image は null 不可です");
        checkNotNull(imageType, "imageType は null 不可です");
        checkNotNull(policy, "policy は null 不可です");
        checkNotNull(random, "random は null 不可です");
        ProgressListener progress = (listener != null) ? listener : ProgressListener.NONE;

        long t0 = System.nanoTime();
        List<Channel> channels = imageType.getChannels();
        int channelCount = channels.size();

        log.info("圧縮を開始します。サイズ={}x{}、種別={}、方式={}、保持割合={}", image.getWidth(),
                image.getHeight(), imageType.getLabel(), policy.getMethod().getLabel(),
                fmt3(policy.getPercent()));
        report(progress, ProgressStage.STARTED);

        // 1) チャネル行列の抽出と特異値分解（チャネルごとに独立したタスク）
        report(progress, ProgressStage.DECOMPOSING);
        List<CompletableFuture<SvdResult>> decompositions = new ArrayList<>(channelCount);
        for (int i = 0; i < channelCount; i++) {
            Channel channel = channels.get(i);
            RandomSource channelRandom = random.derive(i);
            decompositions.add(CompletableFuture.supplyAsync(
                    () -> svdEngine.decompose(extractChannel(image, channel), channelRandom),
                    executor));
        }

        List<SvdResult> svds = new ArrayList<>(channelCount);
        for (int i = 0; i < channelCount; i++) {
            SvdResult svd = join(decompositions.get(i));
            svds.add(svd);
            Channel channel = channels.get(i);
            int pct = ProgressStage.DECOMPOSING.getPercent()
                    + (ProgressStage.EIGEN_SOLVED.getPercent()
                            - ProgressStage.DECOMPOSING.getPercent()) * (i + 1) / (channelCount + 1);
            progress.onProgress(pct, ProgressStage.DECOMPOSING,
                    channel.getLabel().toUpperCase(Locale.ROOT) + " チャネルの分解が完了しました");
            log.debug("チャネル {} の分解が完了しました。階数={}、取得成分数={}", channel.getLabel(), svd.rank(),
                    svd.getConvergedRank());
        }
        report(progress, ProgressStage.EIGEN_SOLVED);

        // 2) 打ち切り再構成
        report(progress, ProgressStage.RECONSTRUCTING);
        RankReconstructor reconstructor = reconstructors.get(policy.getMethod());
        List<CompletableFuture<Reconstruction>> reconstructions = new ArrayList<>(channelCount);
        for (SvdResult svd : svds) {
            reconstructions.add(CompletableFuture.supplyAsync(
                    () -> reconstructor.reconstruct(svd, policy.getPercent()), executor));
        }

        List<ChannelResult> results = new ArrayList<>(channelCount);
        for (int i = 0; i < channelCount; i++) {
            results.add(new ChannelResult(channels.get(i), svds.get(i), join(reconstructions.get(i))));
        }

        // 3) 再合成と評価
        PixelBuffer output = recompose(image.getWidth(), image.getHeight(), imageType, results);

        int retained = averageRounded(results, true);
        int total = averageRounded(results, false);
        BigDecimal ratio = ImageQualityMetrics.compressionRatio(image.getHeight(), image.getWidth(),
                Math.max(1, retained));
        double mse = ImageQualityMetrics.meanSquaredError(image, output);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        report(progress, ProgressStage.COMPLETED);
        log.info("圧縮が完了しました。使用特異値={} / {}、データ圧縮比={}、MSE={}、所要時間={}ms", retained, total,
                ratio.toPlainString(), fmt3(mse), elapsedMs);

        return new CompressionResult(output, imageType, policy, Collections.unmodifiableList(results),
                retained, total, ratio, mse, elapsedMs);
    }

    /**
     * 画素バッファから1チャネル分の行列（height×width、値は 0〜255）を取り出します。
     *
     * @param image 画素バッファです
     * @param channel チャネルです
     * @return チャネル行列です
     */
    static DMatrixRMaj extractChannel(PixelBuffer image, Channel channel) {
        int width = image.getWidth();
        int height = image.getHeight();
        DMatrixRMaj m = new DMatrixRMaj(height, width);
        byte[] data = image.getData();
        int offset = channel.getOffset();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                m.data[y * width + x] = data[(y * width + x) * PixelBuffer.COMPONENTS + offset] & 0xFF;
            }
        }
        return m;
    }

    /**
     * チャネルごとの再構成結果から画素バッファを組み立てます。
     *
     * <p>
     * グレースケールは R=G=B に同じ値を書き込みます。 アルファは 255 とします。
     * </p>
     *
     * @param width 幅です
     * @param height 高さです
     * @param imageType 画像種別です
     * @param results チャネルごとの結果です（imageType のチャネル順）
     * @return 画素バッファです
     */
    static PixelBuffer recompose(int width, int height, ImageType imageType,
            List<ChannelResult> results) {
        PixelBuffer out = PixelBuffer.blank(width, height);
        byte[] data = out.getData();

        for (ChannelResult result : results) {
            double[] values = result.getReconstruction().getMatrix().data;
            for (int p = 0; p < width * height; p++) {
                byte value = (byte) (int) values[p];
                int base = p * PixelBuffer.COMPONENTS;
                if (imageType == ImageType.GRAYSCALE) {
                    data[base] = value;
                    data[base + 1] = value;
                    data[base + 2] = value;
                } else {
                    data[base + result.getChannel().getOffset()] = value;
                }
            }
        }
        for (int p = 0; p < width * height; p++) {
            data[p * PixelBuffer.COMPONENTS + PixelBuffer.ALPHA] = (byte) OPAQUE;
        }
        return out;
    }

    /**
     * チャネル平均を四捨五入した成分数を返します。
     *
     * @param results チャネルごとの結果です
     * @param used true なら使用成分数、false なら総成分数の平均です
     * @return 平均値（四捨五入）です
     */
    private static int averageRounded(List<ChannelResult> results, boolean used) {
        double sum = 0.0;
        for (ChannelResult r : results) {
            sum += used ? r.usedComponents() : r.totalComponents();
        }
        return (int) Math.round(sum / results.size());
    }

    private static void report(ProgressListener listener, ProgressStage stage) {
        listener.onProgress(stage.getPercent(), stage, stage.getLabel());
    }

    /**
     * タスクの完了を待ち、失敗した場合は元の例外を送出します。
     *
     * @param future タスクです
     * @param <T> 結果の型です
     * @return 結果です
     */
    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("チャネル処理に失敗しました", cause);
        }
    }

    private static String fmt3(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
