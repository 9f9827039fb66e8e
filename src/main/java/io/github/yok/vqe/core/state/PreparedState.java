package io.github.yok.vqe.core.state;

/**
 * 状態準備で得られる量子状態のハンドルです。
 *
 * <p>
 * 期待値推定の実装は、自身が扱える具体型（例: {@link StateVector}）かどうかを確認して利用します。
 * </p>
 */
public interface PreparedState {

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    int numQubits();
}
