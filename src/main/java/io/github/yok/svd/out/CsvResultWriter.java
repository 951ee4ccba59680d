package io.github.yok.svd.out;

import io.github.yok.svd.core.image.ChannelResult;
import io.github.yok.svd.core.image.CompressionResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 圧縮結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（method は打ち切り方式、p は保持割合の百分率）。
 * </p>
 *
 * <ul>
 * <li>{@code svd_meta_method=count_p=30.csv}（使用特異値数、データ圧縮比、MSE など）</li>
 * <li>{@code svd_singularValues_method=count_p=30.csv}（チャネルごとの特異値）</li>
 * <li>{@code svd_summary.csv}（スキャン全体の1実行1行の一覧）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    static final String FILE_HEAD = "svd";

    /**
     * スキャン全体の一覧ファイル名です。
     */
    static final String SUMMARY_FILE = FILE_HEAD + "_summary.csv";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * メタ情報と特異値を出力します。
     *
     * @param result 圧縮結果です
     * @param runLabel 実行ラベルです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(CompressionResult result, String runLabel) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (runLabel == null || runLabel.isEmpty()) {
            throw new IllegalArgumentException("runLabel は必須です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) メタ（使用特異値数、圧縮比、MSE など）
            writeMetaCsv(result, runLabel);

            // 2) チャネルごとの特異値
            writeSingularValuesCsv(result, runLabel);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * スキャン全体の一覧を出力します。
     *
     * @param results 実行順の圧縮結果です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void finish(List<CompressionResult> results) {
        if (results == null || results.isEmpty()) {
            return;
        }

        Path file = outputDir.resolve(SUMMARY_FILE);
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("method", "percent", "imageType", "retained", "total",
                                    "retainedRatio", "compressionRatio", "mse", "elapsedMs")
                            .build().print(w)) {

                for (CompressionResult r : results) {
                    pr.printRecord(r.getPolicy().getMethod().getLabel(),
                            ResultWriter.percentageText(r.getPolicy().getPercent()),
                            r.getImageType().getLabel(), r.getRetainedSingularValues(),
                            r.getTotalSingularValues(), fmt(r.retainedRatio()),
                            r.getCompressionRatio().toPlainString(), fmt(r.getMeanSquaredError()),
                            r.getElapsedMillis());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param result 圧縮結果です
     * @param runLabel 実行ラベルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(CompressionResult result, String runLabel) throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", runLabel));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.method", result.getPolicy().getMethod().getLabel());
            pr.printRecord("input.percent", ResultWriter.percentageText(result.getPolicy().getPercent()));

            pr.printRecord("width", result.getImage().getWidth());
            pr.printRecord("height", result.getImage().getHeight());
            pr.printRecord("imageType", result.getImageType().getLabel());

            pr.printRecord("retainedSingularValues", result.getRetainedSingularValues());
            pr.printRecord("totalSingularValues", result.getTotalSingularValues());
            pr.printRecord("retainedRatio", fmt(result.retainedRatio()));
            pr.printRecord("compressionRatio", result.getCompressionRatio().toPlainString());
            pr.printRecord("mse", fmt(result.getMeanSquaredError()));
            pr.printRecord("elapsedMs", result.getElapsedMillis());

            for (ChannelResult c : result.getChannels()) {
                String prefix = "channel." + c.getChannel().getLabel() + ".";
                pr.printRecord(prefix + "used", c.usedComponents());
                pr.printRecord(prefix + "total", c.totalComponents());
                pr.printRecord(prefix + "convergedRank", c.getSvd().getConvergedRank());
            }
        }
    }

    /**
     * チャネルごとの特異値を出力します。
     *
     * @param result 圧縮結果です
     * @param runLabel 実行ラベルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSingularValuesCsv(CompressionResult result, String runLabel)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("singularValues", runLabel));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("channel", "index", "sigma", "used").build().print(w)) {

            for (ChannelResult c : result.getChannels()) {
                double[] sigma = c.getSvd().getSigma();
                for (int k = 0; k < sigma.length; k++) {
                    pr.printRecord(c.getChannel().getLabel(), k, sigma[k], k < c.usedComponents());
                }
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param kind 種類の識別子（meta/singularValues）
     * @param runLabel 実行ラベルです
     * @return ファイル名です
     */
    static String buildFileName(String kind, String runLabel) {
        return FILE_HEAD + "_" + kind + "_" + runLabel + ".csv";
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }
}
