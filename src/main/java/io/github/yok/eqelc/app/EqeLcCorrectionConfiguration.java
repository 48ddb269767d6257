package io.github.yok.eqelc.app;

import io.github.yok.eqelc.core.integration.PhotocurrentIntegrator;
import io.github.yok.eqelc.core.integration.TrapezoidalPhotocurrentIntegrator;
import io.github.yok.eqelc.core.solver.EqeCorrector;
import io.github.yok.eqelc.input.CsvEqeTableReader;
import io.github.yok.eqelc.input.CsvSpectrumReader;
import io.github.yok.eqelc.input.EqeTableReader;
import io.github.yok.eqelc.input.SpectrumReader;
import io.github.yok.eqelc.out.CsvResultWriter;
import io.github.yok.eqelc.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 台形積分 + 固定点反復による LC 補正の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class EqeLcCorrectionConfiguration {

    /**
     * eqe-lc-corrector の設定値（eqelc.*）です。
     */
    private final EqeLcProperties p;

    /**
     * 光電流の積分器を生成します。
     *
     * @return 積分器です
     */
    @Bean
    public PhotocurrentIntegrator photocurrentIntegrator() {
        return new TrapezoidalPhotocurrentIntegrator();
    }

    /**
     * LC 補正器を生成します。
     *
     * @param integrator 積分器です
     * @return 補正器です
     */
    @Bean
    public EqeCorrector eqeCorrector(PhotocurrentIntegrator integrator) {
        EqeLcProperties.Corrector c = p.getCorrector();
        return new EqeCorrector(integrator, c.getTolerance(), c.getMaxIterations(),
                p.getGrid().getMinSpan());
    }

    /**
     * 測定 EQE の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public EqeTableReader eqeTableReader() {
        return new CsvEqeTableReader();
    }

    /**
     * スペクトルの読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public SpectrumReader spectrumReader() {
        return new CsvSpectrumReader();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
