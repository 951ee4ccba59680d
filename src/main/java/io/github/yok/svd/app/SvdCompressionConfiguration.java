package io.github.yok.svd.app;

import io.github.yok.svd.core.image.ChannelPipeline;
import io.github.yok.svd.core.image.ImageTypeDetector;
import io.github.yok.svd.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettings;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettingsSelector;
import io.github.yok.svd.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.PowerIterationEigenSolver;
import io.github.yok.svd.core.reconstruction.CountRankReconstructor;
import io.github.yok.svd.core.reconstruction.EnergyRankReconstructor;
import io.github.yok.svd.core.reconstruction.RankReconstructor;
import io.github.yok.svd.core.svd.SvdEngine;
import io.github.yok.svd.input.PixelBufferReader;
import io.github.yok.svd.out.CsvResultWriter;
import io.github.yok.svd.out.PngResultWriter;
import io.github.yok.svd.out.ResultWriter;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SVD 画像圧縮の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 固有分解バックエンド、SVD エンジン、打ち切り再構成、チャネルパイプライン、入出力を組み立てます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class SvdCompressionConfiguration {

    /**
     * svd-image-compressor の設定値（svd.*）です。
     */
    private final SvdProperties p;

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 設定（eigen.backend）に対応する固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        switch (p.getEigen().getBackend()) {
            case EJML:
                return new EjmlSymmetricEigenDecompositionBackend();
            case POWER_ITERATION:
            default:
                return new PowerIterationEigenSolver();
        }
    }

    /**
     * 行列サイズごとの固有値ソルバ設定を生成します。
     *
     * @return 設定の選択ロジックです
     */
    @Bean
    public EigenSolverSettingsSelector eigenSolverSettingsSelector() {
        SvdProperties.Eigen e = p.getEigen();
        SvdProperties.Eigen.LargeMatrix lm = e.getLargeMatrix();
        return new EigenSolverSettingsSelector(
                new EigenSolverSettings(e.getTolerance(), e.getMaxIterations(),
                        e.getMaxEigenvalues()),
                new EigenSolverSettings(lm.getTolerance(), lm.getMaxIterations(),
                        lm.getMaxEigenvalues()),
                lm.getPixelThreshold());
    }

    /**
     * SVD エンジンを生成します。
     *
     * @param eigen 固有分解バックエンドです
     * @param selector 固有値ソルバ設定の選択ロジックです
     * @return SVD エンジンです
     */
    @Bean
    public SvdEngine svdEngine(EigenDecompositionBackend eigen,
            EigenSolverSettingsSelector selector) {
        return new SvdEngine(eigen, selector, p.getDecomposition().getTolerance());
    }

    /**
     * 個数割合の再構成ロジックを生成します。
     *
     * @return 再構成ロジックです
     */
    @Bean
    public RankReconstructor countRankReconstructor() {
        return new CountRankReconstructor();
    }

    /**
     * 累積和割合の再構成ロジックを生成します。
     *
     * @return 再構成ロジックです
     */
    @Bean
    public RankReconstructor energyRankReconstructor() {
        return new EnergyRankReconstructor();
    }

    /**
     * 画像種別の判定ロジックを生成します。
     *
     * @return 判定ロジックです
     */
    @Bean
    public ImageTypeDetector imageTypeDetector() {
        return new ImageTypeDetector();
    }

    /**
     * チャネルタスク用のスレッドプールを生成します（コンテキスト終了時に shutdown します）。
     *
     * @return スレッドプールです
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService channelExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "svd-channel-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(p.getPipeline().getParallelism(), factory);
    }

    /**
     * チャネルパイプラインを生成します。
     *
     * @param svdEngine SVD エンジンです
     * @param reconstructors 再構成ロジックの一覧です
     * @param channelExecutor チャネルタスク用のスレッドプールです
     * @param detector 画像種別の判定ロジックです
     * @return パイプラインです
     */
    @Bean
    public ChannelPipeline channelPipeline(SvdEngine svdEngine,
            List<RankReconstructor> reconstructors, ExecutorService channelExecutor,
            ImageTypeDetector detector) {
        return new ChannelPipeline(svdEngine, reconstructors, channelExecutor, detector);
    }

    /**
     * 画像読み込みを生成します。
     *
     * @return 画像読み込みです
     */
    @Bean
    public PixelBufferReader pixelBufferReader() {
        return new PixelBufferReader(p.getInput().getMaxSize());
    }

    /**
     * CSV 出力を生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter csvResultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }

    /**
     * PNG 出力を生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter pngResultWriter() {
        return new PngResultWriter(p.getOutput().getDir(), p.getOutput().isChannelImages());
    }
}
