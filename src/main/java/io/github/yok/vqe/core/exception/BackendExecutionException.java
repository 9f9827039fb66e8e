package io.github.yok.vqe.core.exception;

/**
 * 期待値推定や最小化のバックエンドが失敗した場合に発生する例外です。
 *
 * <p>
 * 一時的な失敗（タイムアウト、実行エラー）を表し、呼び出し元は回数を限定して再試行できます。 代数側の例外とは型で区別できます。
 * </p>
 */
public class BackendExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public BackendExecutionException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param cause 原因です
     */
    public BackendExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
