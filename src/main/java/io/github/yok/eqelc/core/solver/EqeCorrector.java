package io.github.yok.eqelc.core.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.github.yok.eqelc.core.coupling.LuminescentCouplingModel;
import io.github.yok.eqelc.core.error.ConvergenceException;
import io.github.yok.eqelc.core.error.ValidationException;
import io.github.yok.eqelc.core.integration.PhotocurrentIntegrator;
import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.spectrum.PhotonFluxSpectrum;
import io.github.yok.eqelc.core.spectrum.SpectralGrid;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 測定 EQE から発光結合（LC）の寄与を取り除き、真の EQE と接合電流を自己無撞着に求めるクラスです。
 *
 * <p>
 * 直列スタックの動作電流は律速接合（電流最小の接合）で決まり、上の接合 i から下の接合 j への LC 寄与は 動作電流と接合 i 自身の電流の比で縮小されます。
 * </p>
 *
 * <pre>
 * EQE_meas,j(λ) = EQE_true,j(λ) + Σ_{i&lt;j} c(i,j)·EQE_true,i(λ)·(I_op / J_i)
 * </pre>
 *
 * <p>
 * I_op は全接合の真の電流に依存するため、電流推定 → 律速接合 → 補正 → 電流再計算、を 最大電流変化量が許容誤差を下回るまで反復します。
 * 律速接合への入射結合の総和が 1 以上の場合は、更新を緩和して振動を抑えます。
 * </p>
 */
@Getter
@Slf4j
public final class EqeCorrector {

    /**
     * 電流密度を計算する積分器です。
     */
    private final PhotocurrentIntegrator integrator;

    /**
     * 収束判定に用いる最大電流変化量の許容誤差 [mA/cm²] です。
     */
    private final double tolerance;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 共通波長範囲に要求する最小幅 [nm] です。
     */
    private final double minSpan;

    /**
     * 補正器を生成します。
     *
     * @param integrator 積分器です（null 不可）
     * @param tolerance 許容誤差です（0 より大きい）
     * @param maxIterations 最大反復回数です（1 以上）
     * @param minSpan 共通波長範囲の最小幅です（0 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public EqeCorrector(PhotocurrentIntegrator integrator, double tolerance, int maxIterations,
            double minSpan) {
        if (integrator == null) {
            throw new IllegalArgumentException("integrator は null 不可です");
        }
        if (!(tolerance > 0.0) || !Double.isFinite(tolerance)) {
            throw new IllegalArgumentException("tolerance は 0 より大きい有限値が必要です: " + tolerance);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations は 1 以上が必要です: " + maxIterations);
        }
        if (!(minSpan >= 0.0) || !Double.isFinite(minSpan)) {
            throw new IllegalArgumentException("minSpan は 0 以上の有限値が必要です: " + minSpan);
        }
        this.integrator = integrator;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.minSpan = minSpan;
    }

    /**
     * LC 補正を実行します。
     *
     * @param input 入力スナップショットです
     * @return 収束した補正結果です
     * @throws ValidationException 接合数の不一致など、反復前の検証に失敗した場合に発生します
     * @throws io.github.yok.eqelc.core.error.GridMismatchException 波長範囲の重なりが不十分な場合に発生します
     * @throws ConvergenceException 最大反復回数までに収束しなかった場合に発生します（最終反復の結果を保持します）
     * @throws CancellationException 実行中のスレッドが割り込まれた場合に発生します
     */
    public CorrectionResultSet correct(CorrectionInput input) {
        checkNotNull(input, "input は null 不可です");

        JunctionEqeSet raw = input.getMeasured();
        PhotonFluxSpectrum spectrum = input.getSpectrum();
        LuminescentCouplingModel coupling = input.getCoupling();

        // 反復前にすべて検証します。
        if (coupling.junctionCount() != raw.junctionCount()) {
            throw new ValidationException("EQE の接合数と結合係数行列の次元が一致しません: " + raw.junctionCount()
                    + " vs " + coupling.junctionCount());
        }
        SpectralGrid grid = SpectralGrid.common(minSpan, raw.getGrid(), spectrum.getGrid());
        JunctionEqeSet measured = raw.resampledOnto(grid);
        double[] flux = spectrum.sampledOn(grid);
        double[][] meas = measured.toArray();
        int n = meas.length;

        long t0 = System.nanoTime();
        double[] measuredCurrents = currents(grid, meas, flux);

        log.info("LC補正を開始します。接合数={}、グリッド={}、スペクトル={}（{}）、許容誤差={} mA/cm²、最大反復={}、結合なし={}",
                n, grid, spectrum.getName(), spectrum.getKind(), fmtE(tolerance), maxIterations,
                coupling.isZero());

        IterationState state = IterationState.initial(meas, measuredCurrents);
        List<Double> history = new ArrayList<>();
        boolean converged = false;

        for (int iter = 1; iter <= maxIterations; iter++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("LC補正が中断されました（反復 " + iter + " の開始前）");
            }

            // 1) 律速接合と動作電流
            int limiting = limitingJunction(state.getCurrents());
            double operatingCurrent = state.getCurrents()[limiting];

            // 2) 測定値から LC 寄与を差し引き、緩和係数で前反復の推定値と混合
            double relaxation = relaxationFactor(coupling, limiting);
            double[][] next =
                    subtractCoupling(meas, state, coupling, operatingCurrent, relaxation, grid);

            // 3) 電流の再計算と変化量
            double[] nextCurrents = currents(grid, next, flux);
            double maxDelta = maxAbsDifference(nextCurrents, state.getCurrents());
            history.add(maxDelta);

            state = new IterationState(iter, next, nextCurrents, maxDelta);

            boolean ok = maxDelta < tolerance;
            log.info("LC補正反復 {} / {}：律速接合={}（I_op={} mA/cm²）、緩和係数={}、最大電流変化量={}／許容={} [{}]",
                    iter, maxIterations, measured.getJunctionNames().get(limiting),
                    fmt5(operatingCurrent), fmt5(relaxation), fmtE(maxDelta), fmtE(tolerance),
                    ok ? "OK" : "NG");

            if (ok) {
                converged = true;
                break;
            }
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        int finalLimiting = limitingJunction(state.getCurrents());
        ConvergenceRecord record = new ConvergenceRecord(state.getIteration(),
                state.getMaxDelta(), finalLimiting, ImmutableList.copyOf(history));
        CorrectionResultSet result = new CorrectionResultSet(measured,
                measured.withCurves(state.getEqe()), state.getCurrents(), measuredCurrents, record,
                converged, spectrum.getKind(), spectrum.getName());

        if (!converged) {
            log.warn("LC補正が未収束で終了しました。反復回数={}、所要時間={}ms、最大電流変化量={} mA/cm²、律速接合={}",
                    state.getIteration(), elapsedMs, fmtE(state.getMaxDelta()),
                    measured.getJunctionNames().get(finalLimiting));
            throw new ConvergenceException("LC補正が最大反復回数 " + maxIterations
                    + " までに収束しませんでした: 最大電流変化量=" + fmtE(state.getMaxDelta()) + " mA/cm²", result);
        }

        log.info("LC補正が収束しました。反復回数={}、所要時間={}ms、律速接合={}（J={} mA/cm²）", state.getIteration(),
                elapsedMs, measured.getJunctionNames().get(finalLimiting),
                fmt5(state.getCurrents()[finalLimiting]));
        return result;
    }

    /**
     * 律速接合（電流最小の接合）のインデックスを返します。
     *
     * <p>
     * 同値の場合は最も上（インデックス最小）の接合を返します。
     * </p>
     *
     * @param currents 接合電流密度です（長さ 1 以上）
     * @return 律速接合のインデックスです
     */
    public static int limitingJunction(double[] currents) {
        checkNotNull(currents, "currents は null 不可です");
        if (currents.length == 0) {
            throw new IllegalArgumentException("currents は 1 要素以上が必要です");
        }
        int best = 0;
        for (int j = 1; j < currents.length; j++) {
            if (currents[j] < currents[best]) {
                best = j;
            }
        }
        return best;
    }

    /**
     * 律速接合への入射結合の総和 C から緩和係数を返します。
     *
     * <p>
     * 律速接合の電流は J(k+1) = J_meas − C·J(k) で更新されるため、C ≥ 1 では振動して収束しません。 その場合は 1 / (1 + C) で混合し、
     * 固定点 J_meas / (1 + C) へ 1 反復で到達させます。 C &lt; 1 では 1（混合なし）です。
     * </p>
     *
     * @param coupling 結合モデルです
     * @param limiting 律速接合のインデックスです
     * @return 緩和係数です（0 より大きく 1 以下）
     */
    static double relaxationFactor(LuminescentCouplingModel coupling, int limiting) {
        double sum = 0.0;
        for (double c : coupling.couplingInto(limiting).values()) {
            sum += c;
        }
        return (sum >= 1.0) ? 1.0 / (1.0 + sum) : 1.0;
    }

    /**
     * 測定 EQE から、現在の推定値にもとづく LC 寄与を差し引いた新しい推定値を返します。
     *
     * <p>
     * 上の接合の推定値は前反復のもの（Jacobi 型更新）を使い、更新候補は relaxation·候補 + (1 − relaxation)·前反復値 で混合します。
     * 入射結合のない接合は測定値のままです。 混合後に負になる点は 0 に丸めます。
     * </p>
     *
     * @param meas 測定 EQE です
     * @param state 現在の反復状態です
     * @param coupling 結合モデルです
     * @param operatingCurrent 動作電流（律速接合の電流）です
     * @param relaxation 緩和係数です（0 より大きく 1 以下）
     * @param grid 波長グリッドです
     * @return 新しい推定値です
     */
    private static double[][] subtractCoupling(double[][] meas, IterationState state,
            LuminescentCouplingModel coupling, double operatingCurrent, double relaxation,
            SpectralGrid grid) {
        double[][] eqe = state.getEqe();
        double[] currents = state.getCurrents();
        double[][] next = new double[meas.length][];

        for (int j = 0; j < meas.length; j++) {
            next[j] = meas[j].clone();

            Map<Integer, Double> incoming = coupling.couplingInto(j);
            if (incoming.isEmpty()) {
                continue;
            }

            int clamped = 0;
            int firstClamped = -1;
            for (Map.Entry<Integer, Double> e : incoming.entrySet()) {
                int i = e.getKey();
                // 電流 0 の接合は発光しないため寄与なし
                if (!(currents[i] > 0.0)) {
                    continue;
                }
                double scale = e.getValue() * (operatingCurrent / currents[i]);
                for (int k = 0; k < next[j].length; k++) {
                    next[j][k] -= scale * eqe[i][k];
                }
            }
            for (int k = 0; k < next[j].length; k++) {
                next[j][k] = relaxation * next[j][k] + (1.0 - relaxation) * eqe[j][k];
                if (next[j][k] < JunctionEqeSet.MIN_EQE) {
                    next[j][k] = JunctionEqeSet.MIN_EQE;
                    if (clamped++ == 0) {
                        firstClamped = k;
                    }
                }
            }
            if (clamped > 0) {
                log.warn("接合 {} の補正 EQE が負になったため {} 点を 0 に丸めました（最初の波長={} nm）", j, clamped,
                        grid.wavelengthAt(firstClamped));
            }
        }
        return next;
    }

    private double[] currents(SpectralGrid grid, double[][] eqe, double[] flux) {
        double[] out = new double[eqe.length];
        for (int j = 0; j < eqe.length; j++) {
            out[j] = integrator.currentDensity(grid, eqe[j], flux);
        }
        return out;
    }

    private static double maxAbsDifference(double[] a, double[] b) {
        double max = 0.0;
        for (int j = 0; j < a.length; j++) {
            max = Math.max(max, Math.abs(a[j] - b[j]));
        }
        return max;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }
}
