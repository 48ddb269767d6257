package io.github.yok.eqelc.input;

import io.github.yok.eqelc.core.spectrum.PhotonFluxSpectrum;
import io.github.yok.eqelc.core.spectrum.SpectrumKind;
import java.nio.file.Path;

/**
 * 基準照射スペクトルの表を読み込む処理のインタフェースです。
 */
public interface SpectrumReader {

    /**
     * 表に格納されている量です。
     */
    enum Quantity {

        /**
         * 光子束密度（photons·s⁻¹·m⁻²·nm⁻¹）です。
         */
        PHOTON_FLUX,

        /**
         * 分光放射照度（W·m⁻²·nm⁻¹）です。
         */
        IRRADIANCE
    }

    /**
     * 表を読み込み、光子束スペクトルを返します。
     *
     * @param file 入力ファイルです
     * @param kind スペクトル種別です（読み込む列を決めます）
     * @param name 表示名です（null の場合は種別の既定名）
     * @param quantity 表に格納されている量です
     * @return 光子束スペクトルです
     */
    PhotonFluxSpectrum read(Path file, SpectrumKind kind, String name, Quantity quantity);
}
