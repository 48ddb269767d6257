package io.github.yok.eqelc.core.integration;

import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.spectrum.PhotonFluxSpectrum;
import io.github.yok.eqelc.core.spectrum.SpectralGrid;

/**
 * EQE 曲線と光子束スペクトルから短絡電流密度を求めるインタフェースです。
 *
 * <p>
 * 数値積分の方式を差し替えるための境界です。 実装は副作用を持たない純粋関数である必要があります。
 * </p>
 */
public interface PhotocurrentIntegrator {

    /**
     * J = q·∫EQE(λ)·Φ(λ)dλ を計算し、mA/cm² で返します。
     *
     * @param grid 波長グリッドです
     * @param eqe grid 上の EQE です
     * @param flux grid 上の光子束密度（photons·s⁻¹·m⁻²·nm⁻¹）です
     * @return 電流密度 [mA/cm²] です
     */
    double currentDensity(SpectralGrid grid, double[] eqe, double[] flux);

    /**
     * 指定接合の電流密度を計算します。
     *
     * <p>
     * スペクトルは EQE 集合のグリッド上でサンプリングします。
     * </p>
     *
     * @param eqeSet EQE 集合です
     * @param junction 接合インデックスです
     * @param spectrum 光子束スペクトルです
     * @return 電流密度 [mA/cm²] です
     */
    default double currentDensity(JunctionEqeSet eqeSet, int junction,
            PhotonFluxSpectrum spectrum) {
        SpectralGrid grid = eqeSet.getGrid();
        return currentDensity(grid, eqeSet.curve(junction), spectrum.sampledOn(grid));
    }

    /**
     * 全接合の電流密度を計算します。
     *
     * @param eqeSet EQE 集合です
     * @param spectrum 光子束スペクトルです
     * @return 接合ごとの電流密度 [mA/cm²] です
     */
    default double[] currentDensities(JunctionEqeSet eqeSet, PhotonFluxSpectrum spectrum) {
        SpectralGrid grid = eqeSet.getGrid();
        double[] flux = spectrum.sampledOn(grid);
        double[] out = new double[eqeSet.junctionCount()];
        for (int j = 0; j < out.length; j++) {
            out[j] = currentDensity(grid, eqeSet.curve(j), flux);
        }
        return out;
    }
}
