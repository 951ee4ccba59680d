package io.github.yok.svd.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.svd.core.image.ChannelPipeline;
import io.github.yok.svd.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.EigenSolverSettingsSelector;
import io.github.yok.svd.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.svd.core.linearalgebra.PowerIterationEigenSolver;
import io.github.yok.svd.core.svd.SvdEngine;
import io.github.yok.svd.out.ResultWriter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class TestSvdCompressionConfiguration {

    @Configuration
    @EnableConfigurationProperties(SvdProperties.class)
    static class PropertiesConfiguration {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class,
                    SvdCompressionConfiguration.class);

    @Test
    void defaultsWirePowerIterationPipeline() {
        runner.run(context -> {
            assertTrue(context.getBean(EigenDecompositionBackend.class)
                    instanceof PowerIterationEigenSolver);
            assertNotNull(context.getBean(ChannelPipeline.class));
            assertEquals(2, context.getBeansOfType(ResultWriter.class).size());

            EigenSolverSettingsSelector selector = context.getBean(EigenSolverSettingsSelector.class);
            assertEquals(1e-6, selector.getStandard().getTolerance(), 0.0);
            assertEquals(1000, selector.getStandard().getMaxIterations());
            assertEquals(250_000L, selector.getPixelThreshold());
            assertEquals(100, selector.getLargeMatrix().getMaxEigenvalues());
            assertEquals(1e-10, context.getBean(SvdEngine.class).getTolerance(), 0.0);
        });
    }

    @Test
    void propertiesSelectBackendAndSettings() {
        runner.withPropertyValues("svd.eigen.backend=EJML", "svd.eigen.tolerance=1e-9",
                "svd.eigen.large-matrix.pixel-threshold=10", "svd.decomposition.tolerance=1e-7")
                .run(context -> {
                    assertTrue(context.getBean(EigenDecompositionBackend.class)
                            instanceof EjmlSymmetricEigenDecompositionBackend);
                    EigenSolverSettingsSelector selector =
                            context.getBean(EigenSolverSettingsSelector.class);
                    assertEquals(1e-9, selector.getStandard().getTolerance(), 0.0);
                    assertEquals(10L, selector.getPixelThreshold());
                    assertEquals(1e-7, context.getBean(SvdEngine.class).getTolerance(), 0.0);
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        runner.withPropertyValues("svd.pipeline.parallelism=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
        runner.withPropertyValues("svd.eigen.tolerance=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void multilineStringListsAllSections() {
        SvdProperties p = new SvdProperties();
        p.getInput().setPath("in.png");
        String text = p.toMultilineString();

        for (String section : new String[] {"input:", "compression:", "eigen:", "decomposition:",
                "pipeline:", "output:"}) {
            assertTrue(text.contains(section), section);
        }
        assertTrue(text.contains("path: in.png"));
        assertFalse(p.toString().isEmpty());
    }
}
