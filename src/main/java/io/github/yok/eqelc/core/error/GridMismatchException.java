package io.github.yok.eqelc.core.error;

/**
 * 波長グリッド同士の重なりが不十分な場合、または測定範囲外を評価しようとした場合に発生する例外です。
 */
public class GridMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public GridMismatchException(String message) {
        super(message);
    }
}
