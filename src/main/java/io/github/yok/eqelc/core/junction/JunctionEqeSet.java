package io.github.yok.eqelc.core.junction;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.github.yok.eqelc.core.error.ValidationException;
import io.github.yok.eqelc.core.spectrum.SpectralGrid;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * 接合ごとの EQE 曲線を、共通の波長グリッド上で保持するクラスです。
 *
 * <p>
 * 接合は直列スタックの物理順（上から下、バンドギャップの大きい順）に並びます。 この順序が発光結合の向き（上の接合から下の接合へのみ）を決めます。
 * </p>
 *
 * <p>
 * EQE 値は [0, {@value #MAX_EQE}] に収まる必要があります（ノイズによる 1 超えは許容します）。 生成後は変更できません。
 * </p>
 */
public final class JunctionEqeSet {

    /**
     * EQE の下限です。
     */
    public static final double MIN_EQE = 0.0;

    /**
     * EQE の上限です。
     */
    public static final double MAX_EQE = 1.2;

    /**
     * 波長グリッドです。
     */
    @Getter
    private final SpectralGrid grid;

    /**
     * 接合名の一覧です（上から下の順）。
     */
    @Getter
    private final ImmutableList<String> junctionNames;

    /**
     * EQE 値です（[接合][波長]）。
     */
    private final double[][] values;

    private JunctionEqeSet(SpectralGrid grid, ImmutableList<String> junctionNames,
            double[][] values) {
        this.grid = grid;
        this.junctionNames = junctionNames;
        this.values = values;
    }

    /**
     * EQE 曲線の集合を検証して生成します。
     *
     * @param grid 波長グリッドです（null 不可）
     * @param junctionNames 接合名の一覧です（null の場合は J1, J2, ... を使います）
     * @param curves 接合ごとの EQE 曲線です（[接合][波長]、コピーして保持します）
     * @return EQE 曲線の集合です
     * @throws ValidationException 接合数が 0、曲線長の不一致、または値が範囲外の場合に発生します
     */
    public static JunctionEqeSet of(SpectralGrid grid, List<String> junctionNames,
            double[][] curves) {
        checkNotNull(grid, "grid は null 不可です");
        checkNotNull(curves, "curves は null 不可です");
        if (curves.length == 0) {
            throw new ValidationException("接合が 1 つ以上必要です");
        }

        List<String> names = (junctionNames != null) ? junctionNames : defaultNames(curves.length);
        if (names.size() != curves.length) {
            throw new ValidationException(
                    "接合名の個数と EQE 曲線の個数が一致しません: " + names.size() + " vs " + curves.length);
        }

        double[][] copy = new double[curves.length][];
        for (int j = 0; j < curves.length; j++) {
            checkNotNull(curves[j], "curves[%s] は null 不可です", j);
            grid.requireSameLength(curves[j]);
            copy[j] = curves[j].clone();
            for (int k = 0; k < copy[j].length; k++) {
                double v = copy[j][k];
                if (!Double.isFinite(v) || v < MIN_EQE || v > MAX_EQE) {
                    throw new ValidationException("EQE が [" + MIN_EQE + ", " + MAX_EQE + "] の範囲外です: junction="
                            + names.get(j) + ", wavelength=" + grid.wavelengthAt(k) + ", value=" + v);
                }
            }
        }
        return new JunctionEqeSet(grid, ImmutableList.copyOf(names), copy);
    }

    /**
     * 接合名を既定値（J1, J2, ...）にして生成します。
     *
     * @param grid 波長グリッドです
     * @param curves 接合ごとの EQE 曲線です
     * @return EQE 曲線の集合です
     */
    public static JunctionEqeSet of(SpectralGrid grid, double[][] curves) {
        return of(grid, null, curves);
    }

    /**
     * 既定の接合名（J1, J2, ...）を返します。
     *
     * @param count 接合数です
     * @return 接合名の一覧です
     */
    public static List<String> defaultNames(int count) {
        List<String> names = new ArrayList<>(count);
        for (int j = 0; j < count; j++) {
            names.add("J" + (j + 1));
        }
        return names;
    }

    /**
     * 別のグリッドへ再サンプリングした新しい集合を返します。
     *
     * @param target 再サンプリング先のグリッドです
     * @return 再サンプリングした集合です（target が同じグリッドなら自身を返します）
     */
    public JunctionEqeSet resampledOnto(SpectralGrid target) {
        checkNotNull(target, "target は null 不可です");
        if (target.equals(grid)) {
            return this;
        }
        double[][] out = new double[values.length][];
        for (int j = 0; j < values.length; j++) {
            out[j] = target.resample(grid, values[j]);
        }
        return new JunctionEqeSet(target, junctionNames, out);
    }

    /**
     * 同じグリッド・接合名で、曲線だけを差し替えた新しい集合を返します。
     *
     * @param curves 新しい曲線です（[接合][波長]）
     * @return 新しい集合です
     * @throws ValidationException 値が範囲外の場合に発生します
     */
    public JunctionEqeSet withCurves(double[][] curves) {
        return of(grid, junctionNames, curves);
    }

    /**
     * 接合数を返します。
     *
     * @return 接合数です
     */
    public int junctionCount() {
        return values.length;
    }

    /**
     * 指定接合の EQE 曲線のコピーを返します。
     *
     * @param junction 接合インデックス（0 が最上部）です
     * @return EQE 曲線です
     */
    public double[] curve(int junction) {
        return values[junction].clone();
    }

    /**
     * 指定接合・指定グリッド点の EQE を返します。
     *
     * @param junction 接合インデックスです
     * @param index グリッド点のインデックスです
     * @return EQE 値です
     */
    public double valueAt(int junction, int index) {
        return values[junction][index];
    }

    /**
     * 全曲線のコピーを返します（[接合][波長]）。
     *
     * @return 全曲線です
     */
    public double[][] toArray() {
        double[][] out = new double[values.length][];
        for (int j = 0; j < values.length; j++) {
            out[j] = values[j].clone();
        }
        return out;
    }
}
