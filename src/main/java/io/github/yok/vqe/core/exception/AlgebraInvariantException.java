package io.github.yok.vqe.core.exception;

/**
 * Pauli 代数の不変条件（エルミート性・反交換関係・簡約の冪等性など）が破れた場合に発生する例外です。
 *
 * <p>
 * 入力ではなく実装側の欠陥を示すため、致命的なエラーとして扱います。
 * </p>
 */
public class AlgebraInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public AlgebraInvariantException(String message) {
        super(message);
    }
}
