package io.github.yok.eqelc.core.coupling;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.error.InvalidCouplingException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;

/**
 * 接合間の発光結合（LC）係数行列を保持・検証するクラスです。
 *
 * <p>
 * 要素 (i, j)（i &lt; j）は、接合 i の放射発光のうち接合 j に再吸収される割合です。 値は [0, 1] で、対角および下三角（i &ge; j）はすべて 0
 * です。
 * </p>
 */
public final class LuminescentCouplingModel {

    /**
     * 係数行列（n×n）です。外部には可変参照を渡しません。
     */
    private final DMatrixRMaj matrix;

    private LuminescentCouplingModel(DMatrixRMaj matrix) {
        this.matrix = matrix;
    }

    /**
     * 係数行列を検証してモデルを生成します。
     *
     * @param matrix 係数行列です（コピーして保持します）
     * @return 結合モデルです
     * @throws InvalidCouplingException 形状・値域・上三角性に違反がある場合に発生します
     */
    public static LuminescentCouplingModel of(DMatrixRMaj matrix) {
        if (matrix == null) {
            throw new InvalidCouplingException("結合係数行列は null 不可です");
        }
        if (matrix.numRows == 0 || matrix.numRows != matrix.numCols) {
            throw new InvalidCouplingException(
                    "結合係数行列は 1×1 以上の正方行列が必要です: " + matrix.numRows + "x" + matrix.numCols);
        }

        int n = matrix.numRows;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double c = matrix.get(i, j);
                if (!Double.isFinite(c) || c < 0.0 || c > 1.0) {
                    throw new InvalidCouplingException(
                            "結合係数は [0, 1] が必要です: (" + i + ", " + j + ")=" + c);
                }
                if (i >= j && c != 0.0) {
                    throw new InvalidCouplingException("結合係数は上の接合から下の接合（i < j）にのみ設定できます: (" + i
                            + ", " + j + ")=" + c);
                }
            }
        }
        return new LuminescentCouplingModel(matrix.copy());
    }

    /**
     * 2 次元配列から生成します。
     *
     * @param coefficients 係数行列です（[上の接合][下の接合]）
     * @return 結合モデルです
     * @throws InvalidCouplingException 行の長さが揃っていない場合などに発生します
     */
    public static LuminescentCouplingModel of(double[][] coefficients) {
        if (coefficients == null) {
            throw new InvalidCouplingException("結合係数行列は null 不可です");
        }
        int n = coefficients.length;
        for (int i = 0; i < n; i++) {
            if (coefficients[i] == null || coefficients[i].length != n) {
                throw new InvalidCouplingException("結合係数行列は正方行列が必要です: row=" + i);
            }
        }
        return of(new DMatrixRMaj(coefficients));
    }

    /**
     * 設定値（行のリスト）から生成します。
     *
     * @param rows 行のリストです
     * @return 結合モデルです
     * @throws InvalidCouplingException 行に null が含まれる場合などに発生します
     */
    public static LuminescentCouplingModel fromRows(List<List<Double>> rows) {
        checkNotNull(rows, "rows は null 不可です");
        double[][] data = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            if (row == null) {
                throw new InvalidCouplingException("結合係数行列の行が null です: row=" + i);
            }
            data[i] = new double[row.size()];
            for (int j = 0; j < row.size(); j++) {
                Double v = row.get(j);
                if (v == null) {
                    throw new InvalidCouplingException("結合係数に null が含まれています: (" + i + ", " + j + ")");
                }
                data[i][j] = v.doubleValue();
            }
        }
        return of(data);
    }

    /**
     * 全要素 0（補正なし）のモデルを生成します。
     *
     * @param junctionCount 接合数です（1 以上）
     * @return 結合モデルです
     */
    public static LuminescentCouplingModel zero(int junctionCount) {
        if (junctionCount <= 0) {
            throw new InvalidCouplingException("接合数は 1 以上が必要です: " + junctionCount);
        }
        return new LuminescentCouplingModel(new DMatrixRMaj(junctionCount, junctionCount));
    }

    /**
     * 接合数を返します。
     *
     * @return 接合数です
     */
    public int junctionCount() {
        return matrix.numRows;
    }

    /**
     * 結合係数 c(i, j) を返します。
     *
     * @param upper 上の接合インデックスです
     * @param lower 下の接合インデックスです
     * @return 結合係数です
     * @throws InvalidCouplingException インデックスが範囲外の場合に発生します
     */
    public double coefficient(int upper, int lower) {
        checkIndex(upper);
        checkIndex(lower);
        return matrix.get(upper, lower);
    }

    /**
     * 上の接合 i から到達する下の接合 j と、その係数を返します（係数 0 は含めません）。
     *
     * @param upper 上の接合インデックスです
     * @return j → 係数 の対応（j の昇順、変更不可）です
     * @throws InvalidCouplingException インデックスが範囲外の場合に発生します
     */
    public Map<Integer, Double> couplingFrom(int upper) {
        checkIndex(upper);
        Map<Integer, Double> out = new LinkedHashMap<>();
        for (int j = upper + 1; j < matrix.numCols; j++) {
            double c = matrix.get(upper, j);
            if (c != 0.0) {
                out.put(j, c);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * 下の接合 j へ結合する上の接合 i と、その係数を返します（係数 0 は含めません）。
     *
     * @param lower 下の接合インデックスです
     * @return i → 係数 の対応（i の昇順、変更不可）です
     * @throws InvalidCouplingException インデックスが範囲外の場合に発生します
     */
    public Map<Integer, Double> couplingInto(int lower) {
        checkIndex(lower);
        Map<Integer, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < lower; i++) {
            double c = matrix.get(i, lower);
            if (c != 0.0) {
                out.put(i, c);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * 全要素が 0 かどうかを返します。
     *
     * @return 全要素 0 の場合は true です
     */
    public boolean isZero() {
        return MatrixFeatures_DDRM.isZeros(matrix, 0.0);
    }

    /**
     * 係数行列のコピーを返します。
     *
     * @return 係数行列です
     */
    public DMatrixRMaj toMatrix() {
        return matrix.copy();
    }

    private void checkIndex(int junction) {
        if (junction < 0 || junction >= matrix.numRows) {
            throw new InvalidCouplingException(
                    "接合インデックスが範囲外です: " + junction + "（接合数=" + matrix.numRows + "）");
        }
    }
}
