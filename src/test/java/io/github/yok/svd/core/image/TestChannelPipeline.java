package io.github.yok.svd.core.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.svd.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettings;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettingsSelector;
import io.github.yok.svd.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.PowerIterationEigenSolver;
import io.github.yok.svd.core.random.SeededRandomSource;
import io.github.yok.svd.core.reconstruction.CompressionPolicy;
import io.github.yok.svd.core.reconstruction.CountRankReconstructor;
import io.github.yok.svd.core.reconstruction.EnergyRankReconstructor;
import io.github.yok.svd.core.svd.SvdEngine;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TestChannelPipeline {

    private static final Executor DIRECT = Runnable::run;

    private static final EigenSolverSettingsSelector SETTINGS =
            EigenSolverSettingsSelector.fixed(new EigenSolverSettings(1e-8, 10_000, 0));

    private final ExecutorService pool = Executors.newFixedThreadPool(3);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private static ChannelPipeline pipeline(EigenDecompositionBackend backend, Executor executor) {
        return new ChannelPipeline(new SvdEngine(backend, SETTINGS, 1e-10),
                List.of(new CountRankReconstructor(), new EnergyRankReconstructor()), executor,
                new ImageTypeDetector());
    }

    /**
     * チャネルごとに異なる規則で塗った RGB 画像を返します（アルファは 0）。
     */
    static PixelBuffer colourImage(int width, int height) {
        PixelBuffer image = PixelBuffer.blank(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, (37 * x + 11 * y) % 256, (13 * x * y + 5) % 256,
                        (200 - 17 * x + 3 * y * y) & 0xFF, 0);
            }
        }
        return image;
    }

    @Test
    void fullRetentionReproducesImageWithinOneLevel() {
        PixelBuffer image = colourImage(5, 4);

        CompressionResult result = pipeline(new EjmlSymmetricEigenDecompositionBackend(), DIRECT)
                .compress(image, CompressionPolicy.byCount(1.0), new SeededRandomSource(1L),
                        ProgressListener.NONE);

        assertEquals(ImageType.RGB, result.getImageType());
        assertEquals(3, result.getChannels().size());
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 5; x++) {
                for (int c = 0; c < 3; c++) {
                    assertTrue(Math.abs(image.get(x, y, c) - result.getImage().get(x, y, c)) <= 1);
                }
                assertEquals(255, result.getImage().get(x, y, PixelBuffer.ALPHA));
            }
        }
    }

    @Test
    void parallelAndSequentialRunsAreIdenticalForSameSeed() {
        PixelBuffer image = colourImage(6, 5);
        CompressionPolicy policy = CompressionPolicy.byEnergy(0.6);

        CompressionResult parallel = pipeline(new PowerIterationEigenSolver(), pool)
                .compress(image, policy, new SeededRandomSource(99L), ProgressListener.NONE);
        CompressionResult sequential = pipeline(new PowerIterationEigenSolver(), DIRECT)
                .compress(image, policy, new SeededRandomSource(99L), ProgressListener.NONE);

        assertArrayEquals(sequential.getImage().getData(), parallel.getImage().getData());
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(sequential.getChannels().get(i).getSvd().getSigma(),
                    parallel.getChannels().get(i).getSvd().getSigma(), 0.0);
        }
        assertEquals(sequential.getRetainedSingularValues(), parallel.getRetainedSingularValues());
    }

    @Test
    void grayscaleImageUsesOneChannelAndWritesEqualComponents() {
        PixelBuffer image = PixelBuffer.blank(3, 2);
        int[] values = {0, 40, 80, 120, 160, 250};
        for (int i = 0; i < values.length; i++) {
            image.set(i % 3, i / 3, values[i], values[i], values[i], 255);
        }

        CompressionResult result = pipeline(new PowerIterationEigenSolver(), DIRECT).compress(image,
                CompressionPolicy.byCount(0.5), new SeededRandomSource(3L), ProgressListener.NONE);

        assertEquals(ImageType.GRAYSCALE, result.getImageType());
        assertEquals(1, result.getChannels().size());
        assertEquals(Channel.GRAY, result.getChannels().get(0).getChannel());
        assertEquals(1, result.getRetainedSingularValues());
        assertEquals(2, result.getTotalSingularValues());
        assertEquals(new BigDecimal("1.00"), result.getCompressionRatio());
        PixelBuffer out = result.getImage();
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) {
                assertEquals(out.get(x, y, 0), out.get(x, y, 1));
                assertEquals(out.get(x, y, 0), out.get(x, y, 2));
            }
        }
    }

    @Test
    void progressIsReportedInOrder() {
        List<Integer> rgb = new ArrayList<>();
        pipeline(new PowerIterationEigenSolver(), pool).compress(colourImage(4, 4),
                CompressionPolicy.byCount(0.5), new SeededRandomSource(1L),
                (percent, stage, message) -> rgb.add(percent));

        assertEquals(List.of(0, 10, 20, 30, 40, 50, 80, 100), rgb);

        List<ProgressStage> stages = new ArrayList<>();
        PixelBuffer gray = PixelBuffer.blank(2, 2);
        pipeline(new PowerIterationEigenSolver(), DIRECT).compress(gray,
                CompressionPolicy.byCount(0.5), new SeededRandomSource(1L),
                (percent, stage, message) -> stages.add(stage));

        assertEquals(ProgressStage.STARTED, stages.get(0));
        assertEquals(ProgressStage.COMPLETED, stages.get(stages.size() - 1));
        assertEquals(6, stages.size());
    }

    @Test
    void meanSquaredErrorIsZeroForLosslessResult() {
        PixelBuffer image = PixelBuffer.blank(3, 3);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                image.set(x, y, 100, 100, 100, 255);
            }
        }

        CompressionResult result = pipeline(new PowerIterationEigenSolver(), DIRECT).compress(image,
                CompressionPolicy.byCount(0.1), new SeededRandomSource(1L), null);

        assertEquals(0.0, result.getMeanSquaredError(), 0.0);
    }

    @Test
    void extractChannelBuildsHeightByWidthMatrix() {
        PixelBuffer image = colourImage(3, 2);

        DMatrixRMaj green = ChannelPipeline.extractChannel(image, Channel.GREEN);

        assertEquals(2, green.numRows);
        assertEquals(3, green.numCols);
        assertEquals(image.get(2, 1, 1), green.get(1, 2), 0.0);
    }

    @Test
    void failingChannelPropagatesCause() {
        EigenDecompositionBackend failing = (m, s, r) -> {
            throw new IllegalStateException("boom");
        };

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> pipeline(failing, pool).compress(colourImage(2, 2),
                        CompressionPolicy.byCount(0.5), new SeededRandomSource(1L),
                        ProgressListener.NONE));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void rejectsIncompleteOrDuplicateReconstructors() {
        SvdEngine engine = new SvdEngine(new PowerIterationEigenSolver(), SETTINGS, 1e-10);

        assertThrows(IllegalArgumentException.class, () -> new ChannelPipeline(engine,
                List.of(new CountRankReconstructor()), DIRECT, new ImageTypeDetector()));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelPipeline(engine,
                        List.of(new CountRankReconstructor(), new CountRankReconstructor(),
                                new EnergyRankReconstructor()),
                        DIRECT, new ImageTypeDetector()));
    }
}
