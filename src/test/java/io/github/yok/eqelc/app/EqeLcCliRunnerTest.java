package io.github.yok.eqelc.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.eqelc.core.error.ConvergenceException;
import io.github.yok.eqelc.core.integration.TrapezoidalPhotocurrentIntegrator;
import io.github.yok.eqelc.core.spectrum.SpectrumKind;
import io.github.yok.eqelc.core.solver.EqeCorrector;
import io.github.yok.eqelc.input.CsvEqeTableReader;
import io.github.yok.eqelc.input.CsvSpectrumReader;
import io.github.yok.eqelc.input.SpectrumReader;
import io.github.yok.eqelc.out.CsvResultWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EqeLcCliRunnerTest {

    @TempDir
    Path dir;

    private EqeLcProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        Path eqe = dir.resolve("eqe.csv");
        Files.write(eqe, ("wavelength,top,bottom\n"
                + "400,0.5,0.9\n500,0.5,0.9\n600,0.5,0.9\n").getBytes(StandardCharsets.UTF_8));
        Path flux = dir.resolve("flux.csv");
        Files.write(flux, "wavelength,photon_flux\n300,1e17\n1000,1e17\n"
                .getBytes(StandardCharsets.UTF_8));

        properties = new EqeLcProperties();
        properties.getInput().setEqeFile(eqe.toString());
        properties.getSpectrum().setKind(SpectrumKind.CUSTOM);
        properties.getSpectrum().setFile(flux.toString());
        properties.getSpectrum().setQuantity(SpectrumReader.Quantity.PHOTON_FLUX);
        properties.getOutput().setDir(dir.resolve("out").toString());
    }

    private EqeLcCliRunner runner(int maxIterations) {
        EqeCorrector corrector = new EqeCorrector(new TrapezoidalPhotocurrentIntegrator(),
                properties.getCorrector().getTolerance(), maxIterations,
                properties.getGrid().getMinSpan());
        return new EqeLcCliRunner(properties, new CsvEqeTableReader(), new CsvSpectrumReader(),
                corrector, new CsvResultWriter(properties.getOutput().getDir()));
    }

    private static List<List<Double>> matrix(double c) {
        return Arrays.asList(Arrays.asList(0.0, c), Arrays.asList(0.0, 0.0));
    }

    @Test
    void convergedRunWritesAllOutputs() {
        properties.getCoupling().setMatrix(matrix(0.2));

        runner(100).run();

        Path out = dir.resolve("out");
        assertThat(out.resolve("eqelc_correctedEqe_spectrum=custom.csv")).exists();
        assertThat(out.resolve("eqelc_currents_spectrum=custom.csv")).exists();
        assertThat(out.resolve("eqelc_meta_spectrum=custom.csv")).exists();
    }

    @Test
    void omittedMatrixMeansNoCorrection() throws Exception {
        runner(100).run();

        List<String> lines = Files.readAllLines(
                dir.resolve("out").resolve("eqelc_correctedEqe_spectrum=custom.csv"));
        assertThat(lines).hasSize(4);
        assertThat(lines.get(1)).isEqualTo("400.0,0.5,0.9");
    }

    @Test
    void nonConvergenceIsRethrownByDefault() {
        properties.getCoupling().setMatrix(matrix(0.2));

        assertThatThrownBy(() -> runner(1).run()).isInstanceOf(ConvergenceException.class);
        assertThat(dir.resolve("out")).doesNotExist();
    }

    @Test
    void bestEffortResultIsWrittenWhenAccepted() throws Exception {
        properties.getCoupling().setMatrix(matrix(0.2));
        properties.getCorrector().setAcceptBestEffort(true);

        runner(1).run();

        List<String> meta = Files.readAllLines(
                dir.resolve("out").resolve("eqelc_meta_spectrum=custom.csv"));
        assertThat(meta).contains("converged,false", "iterations,1");
    }

    @Test
    void multilineConfigurationListsEverySection() {
        String text = properties.toMultilineString();

        assertThat(text).contains("input:", "spectrum:", "coupling:", "grid:", "corrector:",
                "output:", "matrix: (zero)", "kind: CUSTOM");
    }
}
