package io.github.yok.eqelc.app;

import io.github.yok.eqelc.core.spectrum.SpectrumKind;
import io.github.yok.eqelc.input.SpectrumReader;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * eqe-lc-corrector の設定値（eqelc.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "eqelc")
public class EqeLcProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 基準スペクトル設定です。
     */
    @Valid
    private Spectrum spectrum = new Spectrum();

    /**
     * 発光結合係数の設定です。
     */
    private Coupling coupling = new Coupling();

    /**
     * 波長グリッド設定です。
     */
    @Valid
    private Grid grid = new Grid();

    /**
     * 補正（固定点反復）の設定です。
     */
    @Valid
    private Corrector corrector = new Corrector();

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
    @ToString.Include(name = "eqelc")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input in = getInput();
        Spectrum s = getSpectrum();
        Coupling c = getCoupling();
        Grid g = getGrid();
        Corrector co = getCorrector();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // eqeFile: 測定 EQE の CSV
                "eqeFile", in.getEqeFile());

        appendSection(sb, nl, "spectrum",
                // kind: DIRECT/GLOBAL/CUSTOM
                "kind", s.getKind(),
                // file: スペクトル CSV
                "file", s.getFile(),
                // name: 表示名（空なら種別の既定名）
                "name", s.getName(),
                // quantity: 表の量（PHOTON_FLUX/IRRADIANCE）
                "quantity", s.getQuantity());

        appendSection(sb, nl, "coupling",
                // matrix: 結合係数行列（空なら補正なし）
                "matrix", c.getMatrix().isEmpty() ? "(zero)" : c.getMatrix());

        appendSection(sb, nl, "grid",
                // minSpan: 共通波長範囲の最小幅 [nm]
                "minSpan", g.getMinSpan());

        appendSection(sb, nl, "corrector",
                // tolerance: 最大電流変化量の許容誤差 [mA/cm²]
                "tolerance", co.getTolerance(),
                // maxIterations: 最大反復回数
                "maxIterations", co.getMaxIterations(),
                // acceptBestEffort: 未収束時に最終反復の結果を出力するかどうか
                "acceptBestEffort", co.isAcceptBestEffort());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

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
         * 測定 EQE の CSV（wavelength, 接合1, 接合2, ...）です。
         */
        @NotBlank
        private String eqeFile;
    }

    @Data
    public static class Spectrum {

        /**
         * スペクトル種別です。
         */
        @NotNull
        private SpectrumKind kind = SpectrumKind.GLOBAL;

        /**
         * スペクトルの CSV です。
         */
        @NotBlank
        private String file;

        /**
         * 表示名です。
         */
        private String name;

        /**
         * 表に格納されている量です。
         */
        @NotNull
        private SpectrumReader.Quantity quantity = SpectrumReader.Quantity.IRRADIANCE;
    }

    @Data
    public static class Coupling {

        /**
         * 結合係数行列です（行 = 上の接合、列 = 下の接合）。
         *
         * <p>
         * 省略した場合は全要素 0（補正なし）として扱います。
         * </p>
         */
        private List<List<Double>> matrix = new ArrayList<>();
    }

    @Data
    public static class Grid {

        /**
         * 共通波長範囲に要求する最小幅 [nm] です。
         */
        @DecimalMin("0.0")
        private double minSpan = 1.0;
    }

    @Data
    public static class Corrector {

        /**
         * 最大電流変化量の許容誤差 [mA/cm²] です。
         */
        @Positive
        private double tolerance = 1e-4;

        /**
         * 最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 100;

        /**
         * 未収束時に最終反復の結果を出力するかどうかです。
         */
        private boolean acceptBestEffort = false;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
