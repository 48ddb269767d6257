package io.github.yok.eqelc.core.spectrum;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.error.GridMismatchException;
import io.github.yok.eqelc.core.error.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * 全スペクトルと EQE 曲線が共有する波長軸（nm）を表すクラスです。
 *
 * <p>
 * 波長は有限値かつ狭義単調増加で、点数は 2 以上です。 生成後は変更できません。
 * </p>
 *
 * <p>
 * 補間はすべて線形補間で、測定範囲外への外挿は行いません。 グリッド点と一致する波長では元の値をそのまま返すため、 自身のグリッドへの再サンプリングは恒等変換になります。
 * </p>
 */
@Slf4j
public final class SpectralGrid {

    /**
     * 波長配列（nm）です。
     */
    private final double[] wavelengths;

    private SpectralGrid(double[] wavelengths) {
        this.wavelengths = wavelengths;
    }

    /**
     * 波長配列を検証してグリッドを生成します。
     *
     * @param wavelengths 波長配列（nm）です（コピーして保持します）
     * @return グリッドです
     * @throws NullPointerException wavelengths が null の場合に発生します
     * @throws ValidationException 点数が 2 未満、非有限値、または狭義単調増加でない場合に発生します
     */
    public static SpectralGrid of(double... wavelengths) {
        checkNotNull(wavelengths, "wavelengths は null 不可です");
        if (wavelengths.length < 2) {
            throw new ValidationException("波長グリッドは 2 点以上が必要です: " + wavelengths.length);
        }
        double[] copy = wavelengths.clone();
        for (int k = 0; k < copy.length; k++) {
            if (!Double.isFinite(copy[k])) {
                throw new ValidationException("波長に有限でない値が含まれています: index=" + k + ", value=" + copy[k]);
            }
            if (k > 0 && !(copy[k] > copy[k - 1])) {
                throw new ValidationException("波長グリッドが狭義単調増加ではありません: index=" + k + ", "
                        + copy[k - 1] + " -> " + copy[k]);
            }
        }
        return new SpectralGrid(copy);
    }

    /**
     * base グリッドを、全グリッドの波長範囲の共通部分に制限した共通グリッドを返します。
     *
     * <p>
     * 共通部分の外にある base の点は除外し、WARN ログを出力します（ゼロ埋めはしません）。
     * </p>
     *
     * @param minSpan 共通部分に要求する最小幅（nm、0 以上）です
     * @param base 共通軸の点を提供するグリッドです
     * @param others 範囲を重ね合わせる他のグリッドです
     * @return 共通グリッドです
     * @throws GridMismatchException 共通部分が空、minSpan 未満、または 2 点未満しか残らない場合に発生します
     */
    public static SpectralGrid common(double minSpan, SpectralGrid base, SpectralGrid... others) {
        checkNotNull(base, "base は null 不可です");
        checkNotNull(others, "others は null 不可です");
        if (!(minSpan >= 0.0) || !Double.isFinite(minSpan)) {
            throw new IllegalArgumentException("minSpan は 0 以上の有限値が必要です: " + minSpan);
        }

        double lo = base.first();
        double hi = base.last();
        for (SpectralGrid g : others) {
            checkNotNull(g, "others に null が含まれています");
            lo = Math.max(lo, g.first());
            hi = Math.min(hi, g.last());
        }

        if (!(hi > lo)) {
            throw new GridMismatchException(
                    "波長範囲の共通部分が空です: [" + fmt(lo) + ", " + fmt(hi) + "] nm");
        }
        if (hi - lo < minSpan) {
            throw new GridMismatchException("波長範囲の共通部分が最小幅に足りません: 幅=" + fmt(hi - lo) + " nm, 最小幅="
                    + fmt(minSpan) + " nm");
        }

        int from = 0;
        while (from < base.size() && base.wavelengths[from] < lo) {
            from++;
        }
        int to = base.size();
        while (to > from && base.wavelengths[to - 1] > hi) {
            to--;
        }

        int dropped = base.size() - (to - from);
        if (to - from < 2) {
            throw new GridMismatchException("共通範囲 [" + fmt(lo) + ", " + fmt(hi)
                    + "] nm に含まれるグリッド点が 2 点未満です: " + (to - from));
        }
        if (dropped == 0) {
            return base;
        }

        log.warn("共通波長範囲 [{}, {}] nm の外にあるため {} 点を除外しました（外挿は行いません）", fmt(lo), fmt(hi),
                dropped);
        return new SpectralGrid(Arrays.copyOfRange(base.wavelengths, from, to));
    }

    /**
     * source グリッド上の値を、このグリッドへ線形補間で再サンプリングします。
     *
     * @param source 値が定義されているグリッドです
     * @param values source 上の値です（長さは source の点数と一致が必要です）
     * @return このグリッド上の値（新しい配列）です
     * @throws GridMismatchException このグリッドの点が source の範囲外にある場合に発生します
     * @throws ValidationException values の長さが source と一致しない場合に発生します
     */
    public double[] resample(SpectralGrid source, double[] values) {
        checkNotNull(source, "source は null 不可です");
        checkNotNull(values, "values は null 不可です");
        source.requireSameLength(values);

        if (source.equals(this)) {
            return values.clone();
        }

        double[] out = new double[wavelengths.length];
        for (int k = 0; k < wavelengths.length; k++) {
            out[k] = source.interpolate(wavelengths[k], values);
        }
        return out;
    }

    /**
     * このグリッド上の値を、指定波長で線形補間します。
     *
     * @param wavelength 波長（nm）です
     * @param values このグリッド上の値です
     * @return 補間値です
     * @throws GridMismatchException wavelength がグリッド範囲外の場合に発生します
     */
    public double interpolate(double wavelength, double[] values) {
        requireSameLength(values);
        if (!(wavelength >= first() && wavelength <= last())) {
            throw new GridMismatchException("波長 " + fmt(wavelength) + " nm はグリッド範囲 [" + fmt(first())
                    + ", " + fmt(last()) + "] nm の外です（外挿は行いません）");
        }

        int idx = Arrays.binarySearch(wavelengths, wavelength);
        if (idx >= 0) {
            return values[idx];
        }

        // 挿入位置 ip について wavelengths[ip-1] < wavelength < wavelengths[ip] です。
        int ip = -idx - 1;
        double x0 = wavelengths[ip - 1];
        double x1 = wavelengths[ip];
        double t = (wavelength - x0) / (x1 - x0);
        return values[ip - 1] + t * (values[ip] - values[ip - 1]);
    }

    /**
     * 点数を返します。
     *
     * @return 点数です
     */
    public int size() {
        return wavelengths.length;
    }

    /**
     * 指定インデックスの波長を返します。
     *
     * @param index インデックスです
     * @return 波長（nm）です
     */
    public double wavelengthAt(int index) {
        return wavelengths[index];
    }

    /**
     * 波長配列のコピーを返します。
     *
     * @return 波長配列（nm）です
     */
    public double[] toArray() {
        return wavelengths.clone();
    }

    /**
     * 最短波長を返します。
     *
     * @return 最短波長（nm）です
     */
    public double first() {
        return wavelengths[0];
    }

    /**
     * 最長波長を返します。
     *
     * @return 最長波長（nm）です
     */
    public double last() {
        return wavelengths[wavelengths.length - 1];
    }

    /**
     * 値配列の長さがグリッド点数と一致することを検証します。
     *
     * @param values 値配列です
     * @throws ValidationException 長さが一致しない場合に発生します
     */
    public void requireSameLength(double[] values) {
        checkNotNull(values, "values は null 不可です");
        if (values.length != wavelengths.length) {
            throw new ValidationException(
                    "値の個数がグリッド点数と一致しません: " + values.length + " vs " + wavelengths.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpectralGrid)) {
            return false;
        }
        return Arrays.equals(wavelengths, ((SpectralGrid) o).wavelengths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(wavelengths);
    }

    @Override
    public String toString() {
        return "SpectralGrid[" + fmt(first()) + ".." + fmt(last()) + " nm, " + size() + " 点]";
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
