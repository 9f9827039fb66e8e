package io.github.yok.vqe.core.state;

/**
 * パラメータベクトルから量子状態を準備する、パラメータ付き状態族を表すインタフェースです。
 *
 * <p>
 * 同じパラメータに対しては常に同じ状態を返す（決定的である）ことを前提とします。
 * </p>
 */
public interface StatePreparation {

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    int numQubits();

    /**
     * パラメータ数を返します。
     *
     * @return パラメータ数です
     */
    int parameterCount();

    /**
     * パラメータに対応する状態を準備します。
     *
     * @param parameters パラメータです（長さ {@link #parameterCount()}）
     * @return 準備した状態です
     * @throws io.github.yok.vqe.core.exception.DimensionMismatchException パラメータ数が一致しない場合に発生します
     */
    PreparedState prepare(double[] parameters);
}
