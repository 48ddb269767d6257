package io.github.yok.eqelc.core.error;

import io.github.yok.eqelc.core.solver.CorrectionResultSet;

/**
 * 最大反復回数に達しても収束判定を満たさなかった場合に発生する例外です。
 *
 * <p>
 * 最終反復の状態（補正 EQE、電流、最大変化量）を {@link #getBestEffort()} で参照できます。 呼び出し側はこれを採用するか中断するかを選べます。
 * </p>
 */
public class ConvergenceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 最終反復の結果（未収束）です。
     */
    private final transient CorrectionResultSet bestEffort;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param bestEffort 最終反復の結果です（null 不可）
     */
    public ConvergenceException(String message, CorrectionResultSet bestEffort) {
        super(message);
        if (bestEffort == null) {
            throw new IllegalArgumentException("bestEffort は null 不可です");
        }
        this.bestEffort = bestEffort;
    }

    /**
     * 最終反復の結果（未収束）を返します。
     *
     * @return 最終反復の結果です
     */
    public CorrectionResultSet getBestEffort() {
        return bestEffort;
    }

    /**
     * 最終反復の接合電流密度 [mA/cm²] を返します。
     *
     * @return 接合電流密度の配列（コピー）です
     */
    public double[] getLastCurrents() {
        return bestEffort.getCurrents();
    }

    /**
     * 最終反復の最大電流変化量 [mA/cm²] を返します。
     *
     * @return 最大電流変化量です
     */
    public double getLastMaxDelta() {
        return bestEffort.getConvergence().getMaxDelta();
    }
}
