package io.github.yok.eqelc.core.integration;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.spectrum.SpectralGrid;

/**
 * 台形公式で光電流密度を積分するクラスです。
 *
 * <p>
 * 不等間隔グリッドに対応するため、隣接点の実際の波長差を使います。
 * </p>
 */
public final class TrapezoidalPhotocurrentIntegrator implements PhotocurrentIntegrator {

    /**
     * 電気素量 [C] です。
     */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;

    /**
     * A/m² から mA/cm² への換算係数です（1 A/m² = 0.1 mA/cm²）。
     */
    public static final double A_PER_M2_TO_MA_PER_CM2 = 0.1;

    /**
     * J = q·∫EQE(λ)·Φ(λ)dλ を台形公式で計算し、mA/cm² で返します。
     *
     * @param grid 波長グリッドです
     * @param eqe grid 上の EQE です
     * @param flux grid 上の光子束密度です
     * @return 電流密度 [mA/cm²] です
     * @throws io.github.yok.eqelc.core.error.ValidationException 配列長がグリッドと一致しない場合に発生します
     */
    @Override
    public double currentDensity(SpectralGrid grid, double[] eqe, double[] flux) {
        checkNotNull(grid, "grid は null 不可です");
        grid.requireSameLength(eqe);
        grid.requireSameLength(flux);

        // photons·s⁻¹·m⁻² 単位の積分値
        double photonRate = 0.0;
        double prev = eqe[0] * flux[0];
        for (int k = 1; k < grid.size(); k++) {
            double cur = eqe[k] * flux[k];
            double dl = grid.wavelengthAt(k) - grid.wavelengthAt(k - 1);
            photonRate += 0.5 * (prev + cur) * dl;
            prev = cur;
        }
        return ELEMENTARY_CHARGE * photonRate * A_PER_M2_TO_MA_PER_CM2;
    }
}
