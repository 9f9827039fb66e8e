package io.github.yok.vqe.core.pauli;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math3.complex.Complex;

/**
 * Pauli 文字列の複素係数付き和（ビットパターン → 係数の写像）を表す不変クラスです。
 *
 * <p>
 * 同じビットパターンの項は 2 つ以上存在しません。項は {@link PauliTerm} の自然順序で保持するため、 反復順は常に決定的です。
 * </p>
 */
public final class PauliSum {

    /**
     * 重複項の合算順を入力順に依存させないための並び順です（実部、虚部の順）。
     */
    private static final Comparator<Complex> SUMMATION_ORDER =
            Comparator.comparingDouble(Complex::getReal).thenComparingDouble(Complex::getImaginary);

    /**
     * 量子ビット数です。
     */
    private final int numQubits;

    /**
     * ビットパターン → 係数の写像です。
     */
    private final ImmutableSortedMap<PauliTerm, Complex> terms;

    private PauliSum(int numQubits, Map<PauliTerm, Complex> terms) {
        this.numQubits = numQubits;
        this.terms = ImmutableSortedMap.copyOf(terms);
    }

    /**
     * 項を持たない（ゼロ演算子の）和を返します。
     *
     * @param numQubits 量子ビット数です
     * @return ゼロ演算子です
     */
    public static PauliSum zero(int numQubits) {
        return builder(numQubits).build();
    }

    /**
     * 恒等演算子（係数 1）を返します。
     *
     * @param numQubits 量子ビット数です
     * @return 恒等演算子です
     */
    public static PauliSum identity(int numQubits) {
        return of(PauliTerm.identity(numQubits), Complex.ONE);
    }

    /**
     * 1 項だけの和を返します。
     *
     * @param term Pauli 文字列です
     * @param coefficient 係数です
     * @return 1 項の和です
     */
    public static PauliSum of(PauliTerm term, Complex coefficient) {
        return builder(term.getNumQubits()).add(term, coefficient).build();
    }

    /**
     * 重複項を合算しながら和を組み立てるビルダーを返します。
     *
     * @param numQubits 量子ビット数です
     * @return ビルダーです
     */
    public static Builder builder(int numQubits) {
        return new Builder(numQubits);
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int numQubits() {
        return numQubits;
    }

    /**
     * 項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return terms.size();
    }

    /**
     * 項が 1 つもないかを返します。
     *
     * @return ゼロ演算子なら true です
     */
    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * ビットパターン → 係数の写像（変更不可）を返します。
     *
     * @return 項の写像です
     */
    public ImmutableSortedMap<PauliTerm, Complex> terms() {
        return terms;
    }

    /**
     * 指定パターンの係数を返します。存在しない場合は 0 です。
     *
     * @param term Pauli 文字列です
     * @return 係数です
     */
    public Complex coefficient(PauliTerm term) {
        Complex c = terms.get(term);
        return (c != null) ? c : Complex.ZERO;
    }

    /**
     * 全係数に複素スカラーを掛けた和を返します。
     *
     * @param factor 掛ける値です
     * @return スケール後の和です
     */
    public PauliSum scale(Complex factor) {
        Builder b = builder(numQubits);
        terms.forEach((term, c) -> b.add(term, c.multiply(factor)));
        return b.build();
    }

    /**
     * 全係数に実数を掛けた和を返します。
     *
     * @param factor 掛ける値です
     * @return スケール後の和です
     */
    public PauliSum scale(double factor) {
        return scale(new Complex(factor, 0.0));
    }

    /**
     * 2 つの和を足し合わせます（簡約は行いません）。
     *
     * @param other 足す和です
     * @return 和です
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public PauliSum add(PauliSum other) {
        return builder(numQubits).addAll(this).addAll(other).build();
    }

    /**
     * エルミート演算子かどうかを返します。
     *
     * <p>
     * 各 Pauli 文字列はエルミートであり、パターンは重複しないため、すべての係数が実数であることと同値です。
     * </p>
     *
     * @param tolerance 虚部の許容誤差です
     * @return エルミートなら true です
     */
    public boolean isHermitian(double tolerance) {
        for (Complex c : terms.values()) {
            if (Math.abs(c.getImaginary()) > tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * エルミート部分 {@code (A + A†) / 2} を返します。係数の実部だけを残した和と同じです。
     *
     * @return エルミート部分です
     */
    public PauliSum hermitianPart() {
        Builder b = builder(numQubits);
        terms.forEach((term, c) -> b.add(term, c.getReal(), 0.0));
        return b.build();
    }

    /**
     * 係数の虚部の絶対値の最大値を返します。
     *
     * @return 虚部の最大値です
     */
    public double maxImaginaryPart() {
        double max = 0.0;
        for (Complex c : terms.values()) {
            max = Math.max(max, Math.abs(c.getImaginary()));
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PauliSum)) {
            return false;
        }
        PauliSum other = (PauliSum) o;
        return numQubits == other.numQubits && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return 31 * numQubits + terms.keySet().hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        terms.forEach((term, c) -> {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(String.format(Locale.ROOT, "(%.6f%+.6fi)", c.getReal(), c.getImaginary()))
                    .append('*').append(term.toLabel());
        });
        return sb.toString();
    }

    /**
     * 重複を許して項を蓄積し、{@link #build()} で同じパターンの係数を合算するビルダーです。
     *
     * <p>
     * 合算は係数を一定の順序に並べてから行うため、追加順を入れ替えても結果は完全に一致します。 スレッドセーフではありません。
     * </p>
     */
    public static final class Builder {

        /**
         * 量子ビット数です。
         */
        private final int numQubits;

        /**
         * パターンごとの係数の寄与です。
         */
        private final Map<PauliTerm, List<Complex>> contributions = new HashMap<>();

        private Builder(int numQubits) {
            Preconditions.checkArgument(numQubits >= 1 && numQubits <= PauliTerm.MAX_QUBITS,
                    "numQubits は 1 以上 %s 以下が必要です: %s", PauliTerm.MAX_QUBITS, numQubits);
            this.numQubits = numQubits;
        }

        /**
         * 項を追加します。
         *
         * @param term Pauli 文字列です
         * @param coefficient 係数です
         * @return このビルダーです
         * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
         */
        public Builder add(PauliTerm term, Complex coefficient) {
            Preconditions.checkNotNull(term, "term は null 不可です");
            Preconditions.checkNotNull(coefficient, "coefficient は null 不可です");
            if (term.getNumQubits() != numQubits) {
                throw new DimensionMismatchException("Pauli 文字列 " + term, numQubits,
                        term.getNumQubits());
            }
            contributions.computeIfAbsent(term, k -> new ArrayList<>(2)).add(coefficient);
            return this;
        }

        /**
         * 実部・虚部を指定して項を追加します。
         *
         * @param term Pauli 文字列です
         * @param real 係数の実部です
         * @param imaginary 係数の虚部です
         * @return このビルダーです
         */
        public Builder add(PauliTerm term, double real, double imaginary) {
            return add(term, new Complex(real, imaginary));
        }

        /**
         * 和の全項を追加します。
         *
         * @param sum 追加する和です
         * @return このビルダーです
         * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
         */
        public Builder addAll(PauliSum sum) {
            checkWidth(sum);
            sum.terms.forEach(this::add);
            return this;
        }

        /**
         * 和の全項に係数を掛けて追加します。
         *
         * @param sum 追加する和です
         * @param factor 掛ける係数です
         * @return このビルダーです
         * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
         */
        public Builder addAll(PauliSum sum, Complex factor) {
            checkWidth(sum);
            sum.terms.forEach((term, c) -> add(term, c.multiply(factor)));
            return this;
        }

        /**
         * 同じパターンの係数を合算して和を生成します（微小係数の除去は行いません）。
         *
         * @return 和です
         */
        public PauliSum build() {
            Map<PauliTerm, Complex> merged = new TreeMap<>();
            contributions.forEach((term, values) -> {
                List<Complex> sorted = new ArrayList<>(values);
                sorted.sort(SUMMATION_ORDER);
                double re = 0.0;
                double im = 0.0;
                for (Complex c : sorted) {
                    re += c.getReal();
                    im += c.getImaginary();
                }
                merged.put(term, new Complex(re, im));
            });
            return new PauliSum(numQubits, merged);
        }

        /**
         * 量子ビット数が一致することを確認します。
         *
         * @param sum 加える和です
         * @throws DimensionMismatchException 一致しない場合に発生します
         */
        private void checkWidth(PauliSum sum) {
            if (sum.numQubits != numQubits) {
                throw new DimensionMismatchException("Pauli 和", numQubits, sum.numQubits);
            }
        }
    }
}
