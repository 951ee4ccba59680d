package io.github.yok.svd.app;

import io.github.yok.svd.core.reconstruction.CompressionMethod;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * svd-image-compressor の設定値（svd.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "svd")
public class SvdProperties {

    /**
     * 入力画像の設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 圧縮（打ち切り方式・保持割合）の設定です。
     */
    @Valid
    private Compression compression = new Compression();

    /**
     * 固有値ソルバの設定です。
     */
    @Valid
    private Eigen eigen = new Eigen();

    /**
     * 特異値分解の設定です。
     */
    @Valid
    private Decomposition decomposition = new Decomposition();

    /**
     * チャネル並列実行の設定です。
     */
    @Valid
    private Pipeline pipeline = new Pipeline();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "svd")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input in = getInput();
        Compression c = getCompression();
        Eigen e = getEigen();
        Eigen.LargeMatrix lm = e.getLargeMatrix();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // path: 入力画像ファイル
                "path", in.getPath(),
                // maxSize: 幅・高さの上限（超える場合は縮小）
                "maxSize", in.getMaxSize());

        appendSection(sb, nl, "compression",
                // method: 打ち切り方式（COUNT/SUM）
                "method", c.getMethod(),
                // percents: 保持割合（百分率）の一覧
                "percents", c.getPercents());

        appendSection(sb, nl, "eigen",
                // backend: 固有分解の実装（POWER_ITERATION/EJML）
                "backend", e.getBackend(),
                // seed: 乱数シード（未指定なら実行ごとに変化）
                "seed", e.getSeed(),
                // tolerance: 収束判定閾値
                "tolerance", e.getTolerance(),
                // maxIterations: 固有対あたりの最大反復回数
                "maxIterations", e.getMaxIterations(),
                // maxEigenvalues: 最大固有値数（0 は上限なし）
                "maxEigenvalues", e.getMaxEigenvalues(),
                // largeMatrix.*: 画素数が閾値を超える行列に適用する設定
                "largeMatrix.pixelThreshold", lm.getPixelThreshold(),
                "largeMatrix.tolerance", lm.getTolerance(),
                "largeMatrix.maxIterations", lm.getMaxIterations(),
                "largeMatrix.maxEigenvalues", lm.getMaxEigenvalues());

        appendSection(sb, nl, "decomposition",
                // tolerance: 縮退成分の判定閾値
                "tolerance", getDecomposition().getTolerance());

        appendSection(sb, nl, "pipeline",
                // parallelism: チャネル並列数
                "parallelism", getPipeline().getParallelism());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", getOutput().getDir(),
                // channelImages: チャネル別画像を出力するかどうか
                "channelImages", getOutput().isChannelImages());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 入力画像ファイルのパスです。
         */
        private String path;

        /**
         * 幅・高さの上限です（0 は縮小しません）。
         */
        @Min(0)
        private int maxSize = 800;
    }

    @Data
    public static class Compression {

        /**
         * 打ち切り方式です。
         */
        @NotNull
        private CompressionMethod method = CompressionMethod.COUNT;

        /**
         * 保持割合（百分率、0〜100）の一覧です。
         */
        @NotEmpty
        private List<Integer> percents = List.of(10, 30, 50);
    }

    @Data
    public static class Eigen {

        /**
         * 固有分解の実装です。
         */
        @NotNull
        private Backend backend = Backend.POWER_ITERATION;

        /**
         * 乱数シードです（null の場合は実行ごとに変化します）。
         */
        private Long seed;

        /**
         * 収束判定閾値（絶対値）です。
         */
        @DecimalMin(value = "0", inclusive = false)
        private double tolerance = 1e-6;

        /**
         * 固有対あたりの最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 1000;

        /**
         * 最大固有値数です（0 は上限なし）。
         */
        @Min(0)
        private int maxEigenvalues = 0;

        /**
         * 大きな行列に適用する設定です。
         */
        @Valid
        private LargeMatrix largeMatrix = new LargeMatrix();

        public enum Backend {
            POWER_ITERATION, EJML
        }

        @Data
        public static class LargeMatrix {

            /**
             * 大きな行列とみなす画素数（rows×cols）の閾値です。
             */
            @Min(1)
            private long pixelThreshold = 250_000L;

            /**
             * 収束判定閾値（絶対値）です。
             */
            @DecimalMin(value = "0", inclusive = false)
            private double tolerance = 1e-3;

            /**
             * 固有対あたりの最大反復回数です。
             */
            @Min(1)
            private int maxIterations = 300;

            /**
             * 最大固有値数です（0 は上限なし）。
             */
            @Min(0)
            private int maxEigenvalues = 100;
        }
    }

    @Data
    public static class Decomposition {

        /**
         * 特異値・左特異ベクトルを縮退とみなす閾値です。
         */
        @DecimalMin(value = "0", inclusive = false)
        private double tolerance = 1e-10;
    }

    @Data
    public static class Pipeline {

        /**
         * チャネルを並列に処理するスレッド数です（1 は逐次）。
         */
        @Min(1)
        private int parallelism = 3;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";

        /**
         * カラー画像のチャネル別画像を出力するかどうかです。
         */
        private boolean channelImages = true;
    }
}
