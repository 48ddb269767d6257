package io.github.yok.eqelc.core.spectrum;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 基準照射スペクトルの種別です。
 *
 * <p>
 * 標準の ASTM G173 表（波長, 地球大気外, 全天傾斜面, 直達+周辺光）を読む場合の列位置を併せて持ちます。 CUSTOM は 2 列（波長, 値）の表を前提とします。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum SpectrumKind {

    /**
     * 直達+周辺光スペクトル（AM1.5D）です。
     */
    DIRECT("ASTM G173 direct+circumsolar (AM1.5D)", 3),

    /**
     * 全天スペクトル（AM1.5G）です。
     */
    GLOBAL("ASTM G173 global tilt (AM1.5G)", 2),

    /**
     * 利用者が与える任意スペクトルです。
     */
    CUSTOM("custom", 1);

    /**
     * 表示用の既定名です。
     */
    private final String defaultName;

    /**
     * 表の中で値を保持する列のインデックス（0 始まり、0 列目は波長）です。
     */
    private final int columnIndex;
}
