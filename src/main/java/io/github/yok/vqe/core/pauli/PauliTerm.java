package io.github.yok.vqe.core.pauli;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * N 量子ビットの Pauli 文字列を、Z フラグと X フラグの 2 つのビット列で表す不変クラスです。
 *
 * <p>
 * 量子ビット q はビット列の第 q ビットに対応します（計算基底インデックスの第 q ビットとも一致します）。 1 量子ビットあたりのフラグ (z, x) は次の演算子を表します。
 * </p>
 *
 * <ul>
 * <li>(0, 0) : I</li>
 * <li>(0, 1) : X</li>
 * <li>(1, 0) : Z</li>
 * <li>(1, 1) : Y（位相規約 {@code Y = iXZ}）</li>
 * </ul>
 *
 * <p>
 * つまりフラグ (z, x) の演算子は {@code i^(z·x) X^x Z^z} です。この規約は乗算・行列化・期待値推定のすべてで共通です。
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class PauliTerm implements Comparable<PauliTerm> {

    /**
     * 扱える最大の量子ビット数です（ビット列を long で保持するため）。
     */
    public static final int MAX_QUBITS = 62;

    /**
     * 量子ビット数（ビット列の幅）です。
     */
    private final int numQubits;

    /**
     * Z フラグのビット列です。
     */
    private final long zBits;

    /**
     * X フラグのビット列です。
     */
    private final long xBits;

    private PauliTerm(int numQubits, long zBits, long xBits) {
        this.numQubits = numQubits;
        this.zBits = zBits;
        this.xBits = xBits;
    }

    /**
     * フラグのビット列から Pauli 文字列を生成します。
     *
     * @param numQubits 量子ビット数です（1 以上 {@link #MAX_QUBITS} 以下）
     * @param zBits Z フラグです
     * @param xBits X フラグです
     * @return Pauli 文字列です
     * @throws IllegalArgumentException 量子ビット数が範囲外、または幅を超えるビットが立っている場合に発生します
     */
    public static PauliTerm of(int numQubits, long zBits, long xBits) {
        Preconditions.checkArgument(numQubits >= 1 && numQubits <= MAX_QUBITS,
                "numQubits は 1 以上 %s 以下が必要です: %s", MAX_QUBITS, numQubits);
        long mask = widthMask(numQubits);
        Preconditions.checkArgument((zBits & ~mask) == 0L && (xBits & ~mask) == 0L,
                "量子ビット数 %s を超えるビットが立っています: z=%s, x=%s", numQubits,
                Long.toBinaryString(zBits), Long.toBinaryString(xBits));
        return new PauliTerm(numQubits, zBits, xBits);
    }

    /**
     * 恒等演算子を返します。
     *
     * @param numQubits 量子ビット数です
     * @return 恒等演算子です
     */
    public static PauliTerm identity(int numQubits) {
        return of(numQubits, 0L, 0L);
    }

    /**
     * {@code "IXYZ"} 形式のラベルから Pauli 文字列を生成します。
     *
     * <p>
     * 先頭の文字が最上位の量子ビット（q = N-1）、末尾の文字が q = 0 です。
     * </p>
     *
     * @param label I/X/Y/Z からなるラベルです
     * @return Pauli 文字列です
     * @throws IllegalArgumentException ラベルが不正な場合に発生します
     */
    public static PauliTerm parse(String label) {
        Preconditions.checkArgument(label != null && !label.isEmpty(), "label は必須です");
        int n = label.length();
        long z = 0L;
        long x = 0L;
        for (int pos = 0; pos < n; pos++) {
            int qubit = n - 1 - pos;
            long bit = 1L << qubit;
            switch (label.charAt(pos)) {
                case 'I':
                    break;
                case 'X':
                    x |= bit;
                    break;
                case 'Z':
                    z |= bit;
                    break;
                case 'Y':
                    z |= bit;
                    x |= bit;
                    break;
                default:
                    throw new IllegalArgumentException("不正な Pauli ラベルです: " + label);
            }
        }
        return of(n, z, x);
    }

    /**
     * 指定量子ビット上の 1 量子ビット Pauli 演算子（I/X/Y/Z）を返します。
     *
     * @param qubit 量子ビットインデックスです
     * @return 演算子の文字です
     */
    public char pauliAt(int qubit) {
        Preconditions.checkElementIndex(qubit, numQubits, "qubit");
        boolean z = ((zBits >>> qubit) & 1L) != 0L;
        boolean x = ((xBits >>> qubit) & 1L) != 0L;
        if (z && x) {
            return 'Y';
        }
        if (x) {
            return 'X';
        }
        return z ? 'Z' : 'I';
    }

    /**
     * 恒等演算子かどうかを返します。
     *
     * @return 恒等演算子の場合は true です
     */
    public boolean isIdentity() {
        return zBits == 0L && xBits == 0L;
    }

    /**
     * Y の個数（Z と X の両方が立っている量子ビット数）を返します。
     *
     * @return Y の個数です
     */
    public int yCount() {
        return Long.bitCount(zBits & xBits);
    }

    /**
     * 他の Pauli 文字列と可換かどうかを返します。
     *
     * @param other 比較対象です
     * @return 可換なら true、反可換なら false です
     */
    public boolean commutesWith(PauliTerm other) {
        int overlap = Long.bitCount(zBits & other.xBits) + Long.bitCount(xBits & other.zBits);
        return (overlap & 1) == 0;
    }

    /**
     * 計算基底 |b⟩ に作用させた結果の基底インデックス（{@code b xor X}）を返します。
     *
     * @param basis 基底インデックスです
     * @return 作用後の基底インデックスです
     */
    public long flip(long basis) {
        return basis ^ xBits;
    }

    /**
     * 計算基底 |b⟩ に作用させたときの位相を i のべき指数（0..3）で返します。
     *
     * <p>
     * {@code P|b⟩ = i^(|Z∧X| + 2|Z∧b|) |b xor X⟩} です。
     * </p>
     *
     * @param basis 基底インデックスです
     * @return i のべき指数です
     */
    public int phaseOn(long basis) {
        return (yCount() + 2 * Long.bitCount(zBits & basis)) & 3;
    }

    /**
     * {@code "IXYZ"} 形式のラベルを返します（先頭が q = N-1）。
     *
     * @return ラベルです
     */
    public String toLabel() {
        StringBuilder sb = new StringBuilder(numQubits);
        for (int q = numQubits - 1; q >= 0; q--) {
            sb.append(pauliAt(q));
        }
        return sb.toString();
    }

    @Override
    public int compareTo(PauliTerm o) {
        int c = Integer.compare(numQubits, o.numQubits);
        if (c != 0) {
            return c;
        }
        c = Long.compare(xBits, o.xBits);
        if (c != 0) {
            return c;
        }
        return Long.compare(zBits, o.zBits);
    }

    @Override
    public String toString() {
        return toLabel();
    }

    /**
     * 量子ビット数分の下位ビットが立ったマスクを返します。
     *
     * @param numQubits 量子ビット数です
     * @return マスクです
     */
    static long widthMask(int numQubits) {
        return (1L << numQubits) - 1L;
    }
}
