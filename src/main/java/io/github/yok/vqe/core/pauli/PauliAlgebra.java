package io.github.yok.vqe.core.pauli;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import java.util.Map;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.ZMatrixRMaj;

/**
 * Pauli 文字列とその和に対する代数演算（積・随伴・簡約・行列化）を提供するクラスです。
 *
 * <p>
 * 位相規約は {@link PauliTerm} に記載のとおり {@code Y = iXZ} です。
 * </p>
 */
public final class PauliAlgebra {

    /**
     * 簡約で係数を 0 とみなす既定の閾値です。
     */
    public static final double DEFAULT_TOLERANCE = 1e-12;

    /**
     * 行列化できる最大の量子ビット数です（2^n × 2^n の密行列を確保するため）。
     */
    public static final int MAX_MATRIX_QUBITS = 14;

    private PauliAlgebra() {
    }

    /**
     * 2 つの Pauli 文字列の積を計算します。
     *
     * <p>
     * ビットパターンは Z・X それぞれの XOR です。位相は {@code i^(z·x) X^x Z^z} の並べ替えから
     * {@code |Za∧Xa| + |Zb∧Xb| + 2|Za∧Xb| - |Zc∧Xc| (mod 4)} となります。
     * </p>
     *
     * @param a 左側の Pauli 文字列です
     * @param b 右側の Pauli 文字列です
     * @return 積（パターンと位相）です
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public static PauliProduct multiply(PauliTerm a, PauliTerm b) {
        if (a.getNumQubits() != b.getNumQubits()) {
            throw new DimensionMismatchException("Pauli 文字列の積", a.getNumQubits(),
                    b.getNumQubits());
        }
        long z = a.getZBits() ^ b.getZBits();
        long x = a.getXBits() ^ b.getXBits();
        int phase = a.yCount() + b.yCount() + 2 * Long.bitCount(a.getZBits() & b.getXBits())
                - Long.bitCount(z & x);
        return new PauliProduct(PauliTerm.of(a.getNumQubits(), z, x), Math.floorMod(phase, 4));
    }

    /**
     * 2 つの和の積（分配則による全項の積）を計算し、簡約して返します。
     *
     * @param left 左側の和です
     * @param right 右側の和です
     * @return 簡約済みの積です
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public static PauliSum compose(PauliSum left, PauliSum right) {
        if (left.numQubits() != right.numQubits()) {
            throw new DimensionMismatchException("Pauli 和の積", left.numQubits(),
                    right.numQubits());
        }
        PauliSum.Builder builder = PauliSum.builder(left.numQubits());
        for (Map.Entry<PauliTerm, Complex> l : left.terms().entrySet()) {
            for (Map.Entry<PauliTerm, Complex> r : right.terms().entrySet()) {
                PauliProduct p = multiply(l.getKey(), r.getKey());
                Complex c = timesIPower(l.getValue().multiply(r.getValue()), p.getPhase());
                builder.add(p.getTerm(), c);
            }
        }
        return simplify(builder.build());
    }

    /**
     * 随伴（エルミート共役）を返します。Pauli 文字列は自己随伴なので、係数を複素共役にするだけです。
     *
     * @param sum 対象の和です
     * @return 随伴です
     */
    public static PauliSum adjoint(PauliSum sum) {
        PauliSum.Builder builder = PauliSum.builder(sum.numQubits());
        sum.terms().forEach((term, c) -> builder.add(term, c.conjugate()));
        return builder.build();
    }

    /**
     * 反交換子 {@code {A, B} = AB + BA} を計算し、簡約して返します。
     *
     * @param a 1 つ目の和です
     * @param b 2 つ目の和です
     * @return 簡約済みの反交換子です
     */
    public static PauliSum anticommutator(PauliSum a, PauliSum b) {
        return simplify(compose(a, b).add(compose(b, a)));
    }

    /**
     * 既定の閾値で簡約します。
     *
     * @param sum 対象の和です
     * @return 簡約済みの和です
     * @see #simplify(PauliSum, double)
     */
    public static PauliSum simplify(PauliSum sum) {
        return simplify(sum, DEFAULT_TOLERANCE);
    }

    /**
     * 同じパターンの項を合算し、係数の絶対値が閾値未満の項を取り除きます。
     *
     * <p>
     * 冪等です（{@code simplify(simplify(x)) == simplify(x)}）。
     * </p>
     *
     * @param sum 対象の和です
     * @param tolerance 係数を 0 とみなす閾値です（0 以上）
     * @return 簡約済みの和です
     */
    public static PauliSum simplify(PauliSum sum, double tolerance) {
        Preconditions.checkArgument(tolerance >= 0.0, "tolerance は 0 以上が必要です: %s", tolerance);
        PauliSum.Builder builder = PauliSum.builder(sum.numQubits());
        sum.terms().forEach((term, c) -> {
            if (c.abs() >= tolerance) {
                builder.add(term, c);
            }
        });
        return builder.build();
    }

    /**
     * 和を 2^n × 2^n の複素密行列に展開します。
     *
     * <p>
     * 結果は各項のクロネッカー積 {@code P_(n-1) ⊗ ... ⊗ P_0} を係数倍して足し合わせたものと一致します。 各項は
     * {@code P|b⟩ = i^(|Z∧X| + 2|Z∧b|) |b xor X⟩} を用いて列ごとに書き込みます。
     * </p>
     *
     * @param sum 対象の和です
     * @param numQubits 量子ビット数です
     * @return 密行列です
     * @throws DimensionMismatchException numQubits が和の幅と一致しない場合に発生します
     * @throws IllegalArgumentException numQubits が大きすぎる場合に発生します
     */
    public static ZMatrixRMaj toMatrix(PauliSum sum, int numQubits) {
        if (sum.numQubits() != numQubits) {
            throw new DimensionMismatchException("行列化する Pauli 和", numQubits, sum.numQubits());
        }
        Preconditions.checkArgument(numQubits <= MAX_MATRIX_QUBITS,
                "行列化できる量子ビット数は %s 以下です: %s", MAX_MATRIX_QUBITS, numQubits);

        int dim = 1 << numQubits;
        ZMatrixRMaj matrix = new ZMatrixRMaj(dim, dim);

        for (Map.Entry<PauliTerm, Complex> e : sum.terms().entrySet()) {
            PauliTerm term = e.getKey();
            Complex c = e.getValue();
            for (int col = 0; col < dim; col++) {
                int row = (int) term.flip(col);
                Complex v = timesIPower(c, term.phaseOn(col));
                matrix.set(row, col, matrix.getReal(row, col) + v.getReal(),
                        matrix.getImag(row, col) + v.getImaginary());
            }
        }
        return matrix;
    }

    /**
     * 複素数に {@code i^power} を掛けます（丸め誤差なしで実部・虚部を入れ替えます）。
     *
     * @param c 複素数です
     * @param power i のべき指数です
     * @return {@code c · i^power} です
     */
    public static Complex timesIPower(Complex c, int power) {
        switch (Math.floorMod(power, 4)) {
            case 0:
                return c;
            case 1:
                return new Complex(-c.getImaginary(), c.getReal());
            case 2:
                return new Complex(-c.getReal(), -c.getImaginary());
            default:
                return new Complex(c.getImaginary(), -c.getReal());
        }
    }
}
