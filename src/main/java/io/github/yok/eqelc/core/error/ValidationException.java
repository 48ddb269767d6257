package io.github.yok.eqelc.core.error;

/**
 * 入力データが前提条件を満たさない場合に発生する例外です。
 *
 * <p>
 * EQE 値の範囲外、波長グリッドの非単調、接合数の不一致などを表します。 反復計算の開始前に検出されます。
 * </p>
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public ValidationException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param cause 原因です
     */
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
