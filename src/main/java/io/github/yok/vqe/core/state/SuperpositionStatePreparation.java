package io.github.yok.vqe.core.state;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;

/**
 * 指定した計算基底状態の実振幅重ね合わせとして状態を準備するクラスです。
 *
 * <p>
 * k 個の基底状態に対して k-1 個の角度 θ を用い、超球座標で振幅を決めます（常に正規化されています）。
 * </p>
 *
 * <pre>
 *   c_0     = cos(θ_0/2)
 *   c_m     = sin(θ_0/2) … sin(θ_(m-1)/2) cos(θ_m/2)
 *   c_(k-1) = sin(θ_0/2) … sin(θ_(k-2)/2)
 * </pre>
 *
 * <p>
 * 4 量子ビットで基底 {5, 10}（|0101⟩ と |1010⟩）を指定すると、H2 分子で用いる 1 パラメータ状態 {@code cos(θ/2)|0101⟩ + sin(θ/2)|1010⟩}
 * になります。
 * </p>
 */
public final class SuperpositionStatePreparation implements StatePreparation {

    /**
     * 量子ビット数です。
     */
    private final int numQubits;

    /**
     * 重ね合わせる基底インデックスです。
     */
    private final int[] basisStates;

    /**
     * 状態族を生成します。
     *
     * @param numQubits 量子ビット数です
     * @param basisStates 重ね合わせる基底インデックスです（2 個以上、重複なし）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SuperpositionStatePreparation(int numQubits, int[] basisStates) {
        Preconditions.checkArgument(numQubits >= 1 && numQubits <= StateVector.MAX_QUBITS,
                "numQubits は 1 以上 %s 以下が必要です: %s", StateVector.MAX_QUBITS, numQubits);
        Preconditions.checkNotNull(basisStates, "basisStates は null 不可です");
        Preconditions.checkArgument(basisStates.length >= 2, "基底状態は 2 個以上が必要です: %s",
                basisStates.length);
        int dim = 1 << numQubits;
        for (int b : basisStates) {
            Preconditions.checkArgument(b >= 0 && b < dim, "基底インデックスが範囲外です: %s (dim=%s)", b,
                    dim);
        }
        Preconditions.checkArgument(
                Arrays.stream(basisStates).distinct().count() == basisStates.length,
                "基底インデックスが重複しています: %s", Arrays.toString(basisStates));
        this.numQubits = numQubits;
        this.basisStates = basisStates.clone();
    }

    /**
     * 重ね合わせる基底インデックスのコピーを返します。
     *
     * @return 基底インデックスです
     */
    public int[] getBasisStates() {
        return basisStates.clone();
    }

    @Override
    public int numQubits() {
        return numQubits;
    }

    @Override
    public int parameterCount() {
        return basisStates.length - 1;
    }

    @Override
    public StateVector prepare(double[] parameters) {
        Preconditions.checkNotNull(parameters, "parameters は null 不可です");
        if (parameters.length != parameterCount()) {
            throw new DimensionMismatchException("状態準備のパラメータ", parameterCount(),
                    parameters.length);
        }

        Complex[] amps = new Complex[1 << numQubits];
        Arrays.fill(amps, Complex.ZERO);

        double sinProduct = 1.0;
        for (int m = 0; m < parameters.length; m++) {
            double half = 0.5 * parameters[m];
            amps[basisStates[m]] = new Complex(sinProduct * Math.cos(half), 0.0);
            sinProduct *= Math.sin(half);
        }
        amps[basisStates[basisStates.length - 1]] = new Complex(sinProduct, 0.0);

        return new StateVector(numQubits, amps);
    }
}
