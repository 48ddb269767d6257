package io.github.yok.eqelc.core.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.coupling.LuminescentCouplingModel;
import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.spectrum.PhotonFluxSpectrum;
import lombok.Value;

/**
 * 1 回の LC 補正に渡す入力のスナップショットです。
 *
 * <p>
 * 構成要素はいずれも不変のため、並行に要求された補正どうしで状態を共有しません。
 * </p>
 */
@Value
public class CorrectionInput {

    /**
     * 測定 EQE です。
     */
    JunctionEqeSet measured;

    /**
     * 基準光子束スペクトルです。
     */
    PhotonFluxSpectrum spectrum;

    /**
     * 結合モデルです。
     */
    LuminescentCouplingModel coupling;

    /**
     * 入力を生成します。
     *
     * @param measured 測定 EQE です（null 不可）
     * @param spectrum 光子束スペクトルです（null 不可）
     * @param coupling 結合モデルです（null の場合は全要素 0 の行列を使います）
     * @return 入力です
     */
    public static CorrectionInput of(JunctionEqeSet measured, PhotonFluxSpectrum spectrum,
            LuminescentCouplingModel coupling) {
        checkNotNull(measured, "measured は null 不可です");
        checkNotNull(spectrum, "spectrum は null 不可です");
        LuminescentCouplingModel resolved = (coupling != null) ? coupling
                : LuminescentCouplingModel.zero(measured.junctionCount());
        return new CorrectionInput(measured, spectrum, resolved);
    }

    /**
     * 結合なし（補正なし）の入力を生成します。
     *
     * @param measured 測定 EQE です
     * @param spectrum 光子束スペクトルです
     * @return 入力です
     */
    public static CorrectionInput withoutCoupling(JunctionEqeSet measured,
            PhotonFluxSpectrum spectrum) {
        return of(measured, spectrum, null);
    }
}
