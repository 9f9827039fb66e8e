package io.github.yok.vqe.core.estimation;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.pauli.PauliAlgebra;
import io.github.yok.vqe.core.pauli.PauliTerm;
import io.github.yok.vqe.core.state.PreparedState;
import io.github.yok.vqe.core.state.StateVector;
import org.apache.commons.math3.complex.Complex;

/**
 * 状態ベクトルから期待値を厳密に計算する推定器です。
 *
 * <p>
 * {@code P|b⟩ = i^(|Z∧X| + 2|Z∧b|) |b xor X⟩} を用いて {@code Σ_b conj(ψ(b xor X)) i^phase ψ(b)} を計算します。
 * </p>
 */
public final class StateVectorExpectationEstimator implements ExpectationEstimator {

    @Override
    public double estimate(PauliTerm term, PreparedState state) {
        return expectation(term, asStateVector(state)).getReal();
    }

    /**
     * 複素数としての期待値を返します（エルミートな Pauli 文字列なら虚部は丸め誤差程度です）。
     *
     * @param term Pauli 文字列です
     * @param psi 状態ベクトルです
     * @return 期待値です
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public Complex expectation(PauliTerm term, StateVector psi) {
        Preconditions.checkNotNull(term, "term は null 不可です");
        if (term.getNumQubits() != psi.numQubits()) {
            throw new DimensionMismatchException("期待値を求める Pauli 文字列", psi.numQubits(),
                    term.getNumQubits());
        }
        double re = 0.0;
        double im = 0.0;
        int dim = psi.dimension();
        for (int b = 0; b < dim; b++) {
            Complex amp = psi.amplitude(b);
            if (amp.getReal() == 0.0 && amp.getImaginary() == 0.0) {
                continue;
            }
            Complex applied = PauliAlgebra.timesIPower(amp, term.phaseOn(b));
            Complex bra = psi.amplitude((int) term.flip(b)).conjugate();
            re += bra.getReal() * applied.getReal() - bra.getImaginary() * applied.getImaginary();
            im += bra.getReal() * applied.getImaginary() + bra.getImaginary() * applied.getReal();
        }
        return new Complex(re, im);
    }

    /**
     * 状態が {@link StateVector} であることを確認して返します。
     *
     * @param state 状態です
     * @return 状態ベクトルです
     * @throws IllegalArgumentException 状態ベクトル以外の場合に発生します
     */
    static StateVector asStateVector(PreparedState state) {
        Preconditions.checkNotNull(state, "state は null 不可です");
        if (!(state instanceof StateVector)) {
            throw new IllegalArgumentException(
                    "状態ベクトル以外の状態は扱えません: " + state.getClass().getName());
        }
        return (StateVector) state;
    }
}
