package io.github.yok.vqe.core.estimation;

import io.github.yok.vqe.core.exception.BackendExecutionException;
import io.github.yok.vqe.core.pauli.PauliTerm;
import io.github.yok.vqe.core.state.PreparedState;

/**
 * 準備した状態に対する Pauli 文字列の期待値を推定するインタフェースです。
 *
 * <p>
 * 有限回の測定による推定など、確率的な実装を許します。実装は複数スレッドから同時に呼ばれても安全である必要があります。
 * </p>
 */
public interface ExpectationEstimator {

    /**
     * 期待値 ⟨ψ|P|ψ⟩ を推定します。
     *
     * @param term Pauli 文字列です
     * @param state 準備した状態です
     * @return 期待値の推定値（実数）です
     * @throws BackendExecutionException 推定の実行に失敗した場合に発生します
     */
    double estimate(PauliTerm term, PreparedState state);
}
