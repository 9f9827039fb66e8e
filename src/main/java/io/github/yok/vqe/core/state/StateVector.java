package io.github.yok.vqe.core.state;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;

/**
 * 計算基底での複素振幅ベクトルとして量子状態を保持する不変クラスです。
 *
 * <p>
 * 基底インデックスの第 q ビットが量子ビット q の値です。
 * </p>
 */
public final class StateVector implements PreparedState {

    /**
     * 状態ベクトルとして保持できる最大の量子ビット数です。
     */
    public static final int MAX_QUBITS = 24;

    /**
     * 量子ビット数です。
     */
    private final int numQubits;

    /**
     * 長さ 2^numQubits の複素振幅です。
     */
    private final Complex[] amplitudes;

    /**
     * 状態ベクトルを生成します（振幅はコピーして保持します）。
     *
     * @param numQubits 量子ビット数です
     * @param amplitudes 長さ 2^numQubits の振幅です
     * @throws IllegalArgumentException 長さが一致しない場合に発生します
     */
    public StateVector(int numQubits, Complex[] amplitudes) {
        Preconditions.checkArgument(numQubits >= 1 && numQubits <= MAX_QUBITS,
                "numQubits は 1 以上 %s 以下が必要です: %s", MAX_QUBITS, numQubits);
        Preconditions.checkNotNull(amplitudes, "amplitudes は null 不可です");
        Preconditions.checkArgument(amplitudes.length == (1 << numQubits),
                "振幅の長さは 2^%s が必要です: %s", numQubits, amplitudes.length);
        this.numQubits = numQubits;
        this.amplitudes = amplitudes.clone();
    }

    /**
     * 単一の計算基底状態 |b⟩ を返します。
     *
     * @param numQubits 量子ビット数です
     * @param basis 基底インデックスです
     * @return 基底状態です
     */
    public static StateVector basis(int numQubits, int basis) {
        Complex[] amps = new Complex[1 << numQubits];
        Arrays.fill(amps, Complex.ZERO);
        Preconditions.checkElementIndex(basis, amps.length, "basis");
        amps[basis] = Complex.ONE;
        return new StateVector(numQubits, amps);
    }

    @Override
    public int numQubits() {
        return numQubits;
    }

    /**
     * 次元（2^n）を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return amplitudes.length;
    }

    /**
     * 指定基底の振幅を返します。
     *
     * @param basis 基底インデックスです
     * @return 振幅です
     */
    public Complex amplitude(int basis) {
        return amplitudes[basis];
    }

    /**
     * ノルムの 2 乗 ⟨ψ|ψ⟩ を返します。
     *
     * @return ノルムの 2 乗です
     */
    public double normSquared() {
        double s = 0.0;
        for (Complex a : amplitudes) {
            s += a.getReal() * a.getReal() + a.getImaginary() * a.getImaginary();
        }
        return s;
    }

    /**
     * 振幅から決まる指紋（ハッシュ値）を返します。乱数シードの導出に使います。
     *
     * @return 指紋です
     */
    public long fingerprint() {
        long h = 1125899906842597L;
        for (Complex a : amplitudes) {
            h = 31 * h + Double.doubleToLongBits(a.getReal());
            h = 31 * h + Double.doubleToLongBits(a.getImaginary());
        }
        return h;
    }
}
