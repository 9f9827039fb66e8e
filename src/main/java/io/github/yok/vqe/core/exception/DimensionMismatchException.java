package io.github.yok.vqe.core.exception;

import lombok.Getter;

/**
 * 演算子やテンソルの次元（量子ビット数・軌道数・パラメータ数）が一致しない場合に発生する例外です。
 *
 * <p>
 * 入力の組み合わせそのものが不正であるため、再試行せずに即時に呼び出し元へ伝播させます。
 * </p>
 */
@Getter
public class DimensionMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 期待した次元です。
     */
    private final int expected;

    /**
     * 実際に与えられた次元です。
     */
    private final int actual;

    /**
     * 例外を生成します。
     *
     * @param what 不一致の対象を表す説明です
     * @param expected 期待した次元です
     * @param actual 実際に与えられた次元です
     */
    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + " の次元が一致しません: expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
