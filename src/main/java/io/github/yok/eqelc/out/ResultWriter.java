package io.github.yok.eqelc.out;

import io.github.yok.eqelc.core.solver.CorrectionResultSet;

/**
 * LC 補正結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 補正結果を出力します。
     *
     * @param result 補正結果です（未収束の暫定結果を含みます）
     * @param tolerance 補正に用いた許容誤差 [mA/cm²] です
     */
    void write(CorrectionResultSet result, double tolerance);
}
