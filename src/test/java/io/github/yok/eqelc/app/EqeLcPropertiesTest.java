package io.github.yok.eqelc.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.eqelc.core.coupling.LuminescentCouplingModel;
import io.github.yok.eqelc.core.spectrum.SpectrumKind;
import io.github.yok.eqelc.input.SpectrumReader;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

class EqeLcPropertiesTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(PropertiesConfiguration.class);

    @EnableConfigurationProperties(EqeLcProperties.class)
    static class PropertiesConfiguration {
    }

    @Test
    void bundledApplicationYamlBindsCouplingMatrix() throws Exception {
        StandardEnvironment env = new StandardEnvironment();
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application.yml", new ClassPathResource("application.yml"));
        sources.forEach(env.getPropertySources()::addLast);

        EqeLcProperties p = new Binder(ConfigurationPropertySources.get(env))
                .bind("eqelc", EqeLcProperties.class).get();

        assertThat(p.getSpectrum().getKind()).isEqualTo(SpectrumKind.CUSTOM);
        assertThat(p.getSpectrum().getQuantity()).isEqualTo(SpectrumReader.Quantity.PHOTON_FLUX);
        assertThat(p.getCoupling().getMatrix()).containsExactly(Arrays.asList(0.0, 0.10, 0.02),
                Arrays.asList(0.0, 0.0, 0.05), Arrays.asList(0.0, 0.0, 0.0));

        LuminescentCouplingModel model = LuminescentCouplingModel.fromRows(p.getCoupling().getMatrix());
        assertThat(model.junctionCount()).isEqualTo(3);
        assertThat(model.coefficient(0, 2)).isEqualTo(0.02);
        assertThat(model.coefficient(1, 2)).isEqualTo(0.05);
    }

    @Test
    void indexedPropertiesBindNestedMatrixAndDefaults() {
        contextRunner.withPropertyValues("eqelc.input.eqe-file=eqe.csv",
                "eqelc.spectrum.file=g173.csv", "eqelc.spectrum.kind=direct",
                "eqelc.coupling.matrix[0][0]=0.0", "eqelc.coupling.matrix[0][1]=0.3",
                "eqelc.coupling.matrix[1][0]=0.0", "eqelc.coupling.matrix[1][1]=0.0")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    EqeLcProperties p = context.getBean(EqeLcProperties.class);

                    assertThat(p.getSpectrum().getKind()).isEqualTo(SpectrumKind.DIRECT);
                    assertThat(p.getCoupling().getMatrix()).containsExactly(
                            Arrays.asList(0.0, 0.3), Arrays.asList(0.0, 0.0));
                    assertThat(p.getCorrector().getTolerance()).isEqualTo(1e-4);
                    assertThat(p.getCorrector().getMaxIterations()).isEqualTo(100);
                    assertThat(p.getGrid().getMinSpan()).isEqualTo(1.0);
                    assertThat(p.getOutput().getDir()).isEqualTo("./out");
                });
    }

    @Test
    void missingEqeFileFailsValidation() {
        contextRunner.withPropertyValues("eqelc.spectrum.file=g173.csv").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasStackTraceContaining("eqeFile");
        });
    }

    @Test
    void nonPositiveToleranceFailsValidation() {
        contextRunner.withPropertyValues("eqelc.input.eqe-file=eqe.csv",
                "eqelc.spectrum.file=g173.csv", "eqelc.corrector.tolerance=0").run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasStackTraceContaining("tolerance");
                });
    }

    @Test
    void zeroMaxIterationsFailsValidation() {
        contextRunner.withPropertyValues("eqelc.input.eqe-file=eqe.csv",
                "eqelc.spectrum.file=g173.csv", "eqelc.corrector.max-iterations=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasStackTraceContaining("maxIterations");
                });
    }
}
