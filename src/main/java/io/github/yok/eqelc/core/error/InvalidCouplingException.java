package io.github.yok.eqelc.core.error;

/**
 * 発光結合（LC）係数行列の形状・値域・上三角性に違反がある場合に発生する例外です。
 */
public class InvalidCouplingException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public InvalidCouplingException(String message) {
        super(message);
    }
}
