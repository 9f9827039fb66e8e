package io.github.yok.vqe.core.estimation;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.pauli.PauliTerm;
import io.github.yok.vqe.core.state.PreparedState;
import io.github.yok.vqe.core.state.StateVector;
import lombok.Getter;
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * 有限回の測定（ショット）を模擬して期待値を推定する推定器です。
 *
 * <p>
 * Pauli 文字列の固有値は ±1 なので、厳密な期待値 e から +1 が出る確率 {@code (1+e)/2} を求め、 ショット数の二項分布から標本を取ります。推定値は
 * {@code 2k/shots - 1} です。
 * </p>
 *
 * <p>
 * 乱数はシード・Pauli 文字列・状態の指紋から毎回導出するため、同じ入力には同じ推定値を返し、 スレッド間で共有する可変状態を持ちません。
 * </p>
 */
@Getter
public final class SampledExpectationEstimator implements ExpectationEstimator {

    /**
     * 1 回の推定あたりのショット数です。
     */
    private final int shots;

    /**
     * 乱数シードです。
     */
    private final long seed;

    /**
     * 厳密な期待値の計算器です。
     */
    private final StateVectorExpectationEstimator exact = new StateVectorExpectationEstimator();

    /**
     * 推定器を生成します。
     *
     * @param shots ショット数です（1 以上）
     * @param seed 乱数シードです
     */
    public SampledExpectationEstimator(int shots, long seed) {
        Preconditions.checkArgument(shots > 0, "shots は 1 以上が必要です: %s", shots);
        this.shots = shots;
        this.seed = seed;
    }

    @Override
    public double estimate(PauliTerm term, PreparedState state) {
        StateVector psi = StateVectorExpectationEstimator.asStateVector(state);
        double e = exact.expectation(term, psi).getReal();

        double p = Math.min(1.0, Math.max(0.0, 0.5 * (1.0 + e)));
        if (p == 0.0 || p == 1.0) {
            // 固有状態: 測定結果は確定
            return 2.0 * p - 1.0;
        }

        long fp = psi.fingerprint();
        RandomGenerator rng = new Well19937c(new int[] {(int) (seed >>> 32), (int) seed,
                (int) (term.getZBits() >>> 32), (int) term.getZBits(),
                (int) (term.getXBits() >>> 32), (int) term.getXBits(), (int) (fp >>> 32),
                (int) fp});
        int plus = new BinomialDistribution(rng, shots, p).sample();
        return 2.0 * plus / shots - 1.0;
    }
}
