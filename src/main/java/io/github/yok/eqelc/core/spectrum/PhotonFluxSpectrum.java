package io.github.yok.eqelc.core.spectrum;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.error.ValidationException;
import lombok.Getter;

/**
 * 基準照射スペクトルを、波長ごとの光子束密度（photons·s⁻¹·m⁻²·nm⁻¹）として保持するクラスです。
 *
 * <p>
 * 種別（{@link SpectrumKind}）と名前でタグ付けされます。 評価は {@link SpectralGrid} と同じ線形補間で行い、
 * 規格化や単位変換はしません（放射照度からの変換ファクトリのみ例外です）。
 * </p>
 */
public final class PhotonFluxSpectrum {

    /**
     * プランク定数 [J·s] です。
     */
    static final double PLANCK = 6.62607015e-34;

    /**
     * 真空中の光速 [m/s] です。
     */
    static final double SPEED_OF_LIGHT = 2.99792458e8;

    /**
     * スペクトル種別です。
     */
    @Getter
    private final SpectrumKind kind;

    /**
     * 表示名です。
     */
    @Getter
    private final String name;

    /**
     * 光子束密度が定義されている波長グリッドです。
     */
    @Getter
    private final SpectralGrid grid;

    /**
     * 光子束密度の配列です。
     */
    private final double[] flux;

    private PhotonFluxSpectrum(SpectrumKind kind, String name, SpectralGrid grid, double[] flux) {
        this.kind = kind;
        this.name = name;
        this.grid = grid;
        this.flux = flux;
    }

    /**
     * 光子束密度からスペクトルを生成します。
     *
     * @param kind 種別です（null 不可）
     * @param name 表示名です（null または空の場合は種別の既定名を使います）
     * @param wavelengths 波長配列（nm）です
     * @param flux 光子束密度の配列です（有限かつ非負）
     * @return スペクトルです
     * @throws ValidationException 値が不正な場合に発生します
     */
    public static PhotonFluxSpectrum of(SpectrumKind kind, String name, double[] wavelengths,
            double[] flux) {
        checkNotNull(kind, "kind は null 不可です");
        SpectralGrid grid = SpectralGrid.of(wavelengths);
        grid.requireSameLength(flux);

        double[] copy = flux.clone();
        for (int k = 0; k < copy.length; k++) {
            if (!Double.isFinite(copy[k]) || copy[k] < 0.0) {
                throw new ValidationException("光子束密度は有限かつ非負が必要です: wavelength="
                        + grid.wavelengthAt(k) + ", value=" + copy[k]);
            }
        }
        String resolvedName = (name == null || name.isEmpty()) ? kind.getDefaultName() : name;
        return new PhotonFluxSpectrum(kind, resolvedName, grid, copy);
    }

    /**
     * 利用者定義（CUSTOM）のスペクトルを生成します。
     *
     * @param name 表示名です
     * @param wavelengths 波長配列（nm）です
     * @param flux 光子束密度の配列です
     * @return スペクトルです
     */
    public static PhotonFluxSpectrum custom(String name, double[] wavelengths, double[] flux) {
        return of(SpectrumKind.CUSTOM, name, wavelengths, flux);
    }

    /**
     * 分光放射照度（W·m⁻²·nm⁻¹）から光子束密度へ変換してスペクトルを生成します。
     *
     * <p>
     * Φ(λ) = E(λ)·λ / (h·c) です（λ は m に換算します）。
     * </p>
     *
     * @param kind 種別です
     * @param name 表示名です
     * @param wavelengths 波長配列（nm）です
     * @param irradiance 分光放射照度の配列です
     * @return スペクトルです
     * @throws ValidationException 波長が不正（非有限、非単調、0 以下）または放射照度が不正な場合に発生します
     */
    public static PhotonFluxSpectrum fromSpectralIrradiance(SpectrumKind kind, String name,
            double[] wavelengths, double[] irradiance) {
        checkNotNull(irradiance, "irradiance は null 不可です");
        // 変換に使う前に波長を検証します。
        SpectralGrid grid = SpectralGrid.of(wavelengths);
        if (!(grid.first() > 0.0)) {
            throw new ValidationException("波長は正の値が必要です: " + grid.first() + " nm");
        }
        if (grid.size() != irradiance.length) {
            throw new ValidationException("波長と放射照度の個数が一致しません: " + grid.size() + " vs "
                    + irradiance.length);
        }
        double[] flux = new double[irradiance.length];
        for (int k = 0; k < flux.length; k++) {
            flux[k] = irradiance[k] * (grid.wavelengthAt(k) * 1e-9) / (PLANCK * SPEED_OF_LIGHT);
        }
        return of(kind, name, grid.toArray(), flux);
    }

    /**
     * 指定波長の光子束密度を返します。
     *
     * @param wavelength 波長（nm）です
     * @return 光子束密度です
     * @throws io.github.yok.eqelc.core.error.GridMismatchException 範囲外の場合に発生します
     */
    public double fluxAt(double wavelength) {
        return grid.interpolate(wavelength, flux);
    }

    /**
     * 別のグリッド上で光子束密度をサンプリングします。
     *
     * @param target サンプリング先のグリッドです
     * @return target 上の光子束密度（新しい配列）です
     */
    public double[] sampledOn(SpectralGrid target) {
        checkNotNull(target, "target は null 不可です");
        return target.resample(grid, flux);
    }

    /**
     * 光子束密度配列のコピーを返します。
     *
     * @return 光子束密度の配列です
     */
    public double[] getFlux() {
        return flux.clone();
    }

    @Override
    public String toString() {
        return "PhotonFluxSpectrum[" + kind + ", " + name + ", " + grid + "]";
    }
}
