package io.github.yok.eqelc.core.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.spectrum.SpectralGrid;
import io.github.yok.eqelc.core.spectrum.SpectrumKind;
import lombok.Getter;

/**
 * LC 補正結果の不変スナップショットです。
 *
 * <p>
 * 補正 EQE、最終の接合電流、収束記録を保持し、これ以上の計算は行いません。 配列を返すメソッドはすべてコピーを返します。
 * </p>
 */
public final class CorrectionResultSet {

    /**
     * 共通波長グリッドです。
     */
    @Getter
    private final SpectralGrid grid;

    /**
     * 共通グリッドへ揃えた測定 EQE です。
     */
    @Getter
    private final JunctionEqeSet measured;

    /**
     * 補正後（LC 除去後）の EQE です。
     */
    @Getter
    private final JunctionEqeSet corrected;

    /**
     * 補正 EQE から計算した接合電流密度 [mA/cm²] です。
     */
    private final double[] currents;

    /**
     * 測定 EQE から計算した接合電流密度 [mA/cm²] です。
     */
    private final double[] measuredCurrents;

    /**
     * 収束記録です。
     */
    @Getter
    private final ConvergenceRecord convergence;

    /**
     * 収束判定を満たしたかどうかです（false は最大反復到達時の暫定結果です）。
     */
    @Getter
    private final boolean converged;

    /**
     * 使用したスペクトルの種別です。
     */
    @Getter
    private final SpectrumKind spectrumKind;

    /**
     * 使用したスペクトルの表示名です。
     */
    @Getter
    private final String spectrumName;

    /**
     * 結果を生成します。
     *
     * @param measured 測定 EQE（共通グリッド上）です
     * @param corrected 補正 EQE です
     * @param currents 補正後の接合電流密度です
     * @param measuredCurrents 測定 EQE の接合電流密度です
     * @param convergence 収束記録です
     * @param converged 収束したかどうかです
     * @param spectrumKind スペクトル種別です
     * @param spectrumName スペクトル表示名です
     */
    public CorrectionResultSet(JunctionEqeSet measured, JunctionEqeSet corrected,
            double[] currents, double[] measuredCurrents, ConvergenceRecord convergence,
            boolean converged, SpectrumKind spectrumKind, String spectrumName) {
        checkNotNull(measured, "measured は null 不可です");
        checkNotNull(corrected, "corrected は null 不可です");
        checkNotNull(currents, "currents は null 不可です");
        checkNotNull(measuredCurrents, "measuredCurrents は null 不可です");
        checkNotNull(convergence, "convergence は null 不可です");
        if (!measured.getGrid().equals(corrected.getGrid())) {
            throw new IllegalArgumentException("measured と corrected のグリッドが一致しません");
        }
        if (currents.length != corrected.junctionCount()
                || measuredCurrents.length != corrected.junctionCount()) {
            throw new IllegalArgumentException("電流の個数が接合数と一致しません");
        }
        this.grid = corrected.getGrid();
        this.measured = measured;
        this.corrected = corrected;
        this.currents = currents.clone();
        this.measuredCurrents = measuredCurrents.clone();
        this.convergence = convergence;
        this.converged = converged;
        this.spectrumKind = spectrumKind;
        this.spectrumName = spectrumName;
    }

    /**
     * 補正後の接合電流密度 [mA/cm²] を返します。
     *
     * @return 電流密度の配列（コピー）です
     */
    public double[] getCurrents() {
        return currents.clone();
    }

    /**
     * 測定 EQE の接合電流密度 [mA/cm²] を返します。
     *
     * @return 電流密度の配列（コピー）です
     */
    public double[] getMeasuredCurrents() {
        return measuredCurrents.clone();
    }

    /**
     * 接合数を返します。
     *
     * @return 接合数です
     */
    public int junctionCount() {
        return currents.length;
    }

    /**
     * 律速接合のインデックスを返します。
     *
     * @return 律速接合のインデックスです
     */
    public int limitingJunction() {
        return convergence.getLimitingJunction();
    }

    /**
     * 律速接合の電流密度（直列スタックの動作電流）を返します。
     *
     * @return 電流密度 [mA/cm²] です
     */
    public double limitingCurrent() {
        return currents[limitingJunction()];
    }

    /**
     * 指定接合が発光結合で受け取っていた電流密度（測定 − 補正）を返します。
     *
     * @param junction 接合インデックスです
     * @return LC 電流密度 [mA/cm²] です
     */
    public double couplingCurrent(int junction) {
        return measuredCurrents[junction] - currents[junction];
    }

    /**
     * 補正後電流のミスマッチ（(最大 − 最小) / 最小）を返します。
     *
     * @return ミスマッチ率です（最小電流が 0 の場合は無限大）
     */
    public double currentMismatch() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double c : currents) {
            min = Math.min(min, c);
            max = Math.max(max, c);
        }
        if (min <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return (max - min) / min;
    }
}
