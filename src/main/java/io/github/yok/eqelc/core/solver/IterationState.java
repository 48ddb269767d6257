package io.github.yok.eqelc.core.solver;

import lombok.Value;

/**
 * 固定点反復の 1 ステップ分の状態です。
 *
 * <p>
 * 1 回の補正呼び出しの中だけで生成・破棄されます。 反復ごとに新しいインスタンスを作り、前の状態は書き換えません。
 * </p>
 */
@Value
class IterationState {

    /**
     * 反復番号です（0 は初期状態）。
     */
    int iteration;

    /**
     * 真の EQE の推定値です（[接合][波長]）。
     */
    double[][] eqe;

    /**
     * 推定値から計算した接合電流密度 [mA/cm²] です。
     */
    double[] currents;

    /**
     * この反復による最大電流変化量 [mA/cm²] です（初期状態では無限大）。
     */
    double maxDelta;

    /**
     * 測定値をそのまま推定値とした初期状態を生成します。
     *
     * @param measured 測定 EQE です
     * @param currents 測定 EQE から計算した電流密度です
     * @return 初期状態です
     */
    static IterationState initial(double[][] measured, double[] currents) {
        double[][] eqe = new double[measured.length][];
        for (int j = 0; j < measured.length; j++) {
            eqe[j] = measured[j].clone();
        }
        return new IterationState(0, eqe, currents.clone(), Double.POSITIVE_INFINITY);
    }
}
