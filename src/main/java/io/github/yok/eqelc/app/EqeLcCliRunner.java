package io.github.yok.eqelc.app;

import io.github.yok.eqelc.core.coupling.LuminescentCouplingModel;
import io.github.yok.eqelc.core.error.ConvergenceException;
import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.solver.CorrectionInput;
import io.github.yok.eqelc.core.solver.CorrectionResultSet;
import io.github.yok.eqelc.core.solver.EqeCorrector;
import io.github.yok.eqelc.core.spectrum.PhotonFluxSpectrum;
import io.github.yok.eqelc.input.EqeTableReader;
import io.github.yok.eqelc.input.SpectrumReader;
import io.github.yok.eqelc.out.ResultWriter;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で eqe-lc-corrector を実行するクラスです。
 *
 * <p>
 * 測定 EQE とスペクトルを読み込み、LC 補正を 1 回実行して結果を出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EqeLcCliRunner implements CommandLineRunner {

    /**
     * eqe-lc-corrector の設定値（eqelc.*）です。
     */
    private final EqeLcProperties properties;

    /**
     * 測定 EQE の読み込みロジックです。
     */
    private final EqeTableReader eqeTableReader;

    /**
     * スペクトルの読み込みロジックです。
     */
    private final SpectrumReader spectrumReader;

    /**
     * LC 補正器です。
     */
    private final EqeCorrector corrector;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== eqe-lc-corrector start: luminescent coupling correction ===");
        System.out.print(properties.toMultilineString());

        JunctionEqeSet measured =
                eqeTableReader.read(Paths.get(properties.getInput().getEqeFile()));

        EqeLcProperties.Spectrum s = properties.getSpectrum();
        PhotonFluxSpectrum spectrum =
                spectrumReader.read(Paths.get(s.getFile()), s.getKind(), s.getName(), s.getQuantity());

        // 行列を省略した場合は補正なし（全要素 0）
        List<List<Double>> rows = properties.getCoupling().getMatrix();
        LuminescentCouplingModel coupling = (rows == null || rows.isEmpty()) ? null
                : LuminescentCouplingModel.fromRows(rows);

        CorrectionInput input = CorrectionInput.of(measured, spectrum, coupling);

        CorrectionResultSet result;
        try {
            result = corrector.correct(input);
        } catch (ConvergenceException e) {
            if (!properties.getCorrector().isAcceptBestEffort()) {
                throw e;
            }
            log.warn("未収束ですが、最終反復の結果を出力します（acceptBestEffort=true）: {}", e.getMessage());
            result = e.getBestEffort();
        }

        resultWriter.write(result, corrector.getTolerance());

        List<String> names = result.getCorrected().getJunctionNames();
        double[] measuredJ = result.getMeasuredCurrents();
        double[] correctedJ = result.getCurrents();
        for (int j = 0; j < correctedJ.length; j++) {
            System.out.println("結果: " + names.get(j) + " Jsc(測定)=" + fmt5(measuredJ[j])
                    + " mA/cm2, Jsc(補正)=" + fmt5(correctedJ[j]) + " mA/cm2, J_LC="
                    + fmt5(result.couplingCurrent(j)) + " mA/cm2");
        }
        System.out.println("結果: 律速接合=" + names.get(result.limitingJunction()) + ", iterations="
                + result.getConvergence().getIterations() + ", maxDelta="
                + fmt5(result.getConvergence().getMaxDelta()) + ", converged="
                + result.isConverged());
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
