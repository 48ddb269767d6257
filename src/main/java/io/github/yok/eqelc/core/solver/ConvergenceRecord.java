package io.github.yok.eqelc.core.solver;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * LC 補正の収束記録です。
 */
@Value
public class ConvergenceRecord {

    /**
     * 実行した反復回数です。
     */
    int iterations;

    /**
     * 最終反復での最大電流変化量 [mA/cm²] です。
     */
    double maxDelta;

    /**
     * 最終電流における律速接合のインデックスです。
     */
    int limitingJunction;

    /**
     * 反復ごとの最大電流変化量の履歴です（1 反復目から順に）。
     */
    ImmutableList<Double> deltaHistory;
}
