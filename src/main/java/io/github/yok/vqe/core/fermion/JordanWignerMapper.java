package io.github.yok.vqe.core.fermion;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.AlgebraInvariantException;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.pauli.PauliAlgebra;
import io.github.yok.vqe.core.pauli.PauliSum;
import io.github.yok.vqe.core.pauli.PauliTerm;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * Jordan-Wigner 変換により、フェルミオンの消滅・生成演算子を Pauli 和として構築するクラスです。
 *
 * <p>
 * 軌道 i の消滅演算子は {@code a_i = 0.5·Z_0…Z_(i-1) X_i + 0.5i·Z_0…Z_(i-1) Y_i} です。 軌道の順序は積分テンソルの添字と一致させます。
 * </p>
 */
@Slf4j
public final class JordanWignerMapper {

    /**
     * 反交換関係の検証に用いる許容誤差です。
     */
    private static final double RELATION_TOLERANCE = 1e-12;

    /**
     * 係数 0.5 です。
     */
    private static final Complex HALF = new Complex(0.5, 0.0);

    /**
     * 係数 0.5i です。
     */
    private static final Complex HALF_I = new Complex(0.0, 0.5);

    /**
     * 全軌道の消滅演算子を軌道インデックス順に返します。
     *
     * @param numOrbitals 軌道数（= 量子ビット数）です
     * @return 消滅演算子の一覧です（変更不可）
     * @throws IllegalArgumentException 軌道数が範囲外の場合に発生します
     */
    public List<FermionOperator> annihilationOperators(int numOrbitals) {
        Preconditions.checkArgument(numOrbitals >= 1 && numOrbitals <= PauliTerm.MAX_QUBITS,
                "軌道数は 1 以上 %s 以下が必要です: %s", PauliTerm.MAX_QUBITS, numOrbitals);

        List<FermionOperator> operators = new ArrayList<>(numOrbitals);
        for (int i = 0; i < numOrbitals; i++) {
            // Z 列: 軌道 i より前の量子ビット [0, i)
            long zString = (1L << i) - 1L;
            long site = 1L << i;

            PauliTerm xTerm = PauliTerm.of(numOrbitals, zString, site);
            PauliTerm yTerm = PauliTerm.of(numOrbitals, zString | site, site);

            PauliSum op = PauliSum.builder(numOrbitals).add(xTerm, HALF).add(yTerm, HALF_I).build();
            operators.add(new FermionOperator(i, FermionOperator.Kind.ANNIHILATION, op));
        }
        return Collections.unmodifiableList(operators);
    }

    /**
     * 消滅演算子の随伴として生成演算子を返します。
     *
     * @param annihilators 消滅演算子の一覧です
     * @return 生成演算子の一覧です（同じ軌道順、変更不可）
     * @throws AlgebraInvariantException 随伴の随伴が元に戻らない場合に発生します
     */
    public List<FermionOperator> creationOperators(List<FermionOperator> annihilators) {
        Preconditions.checkNotNull(annihilators, "annihilators は null 不可です");

        List<FermionOperator> creators = new ArrayList<>(annihilators.size());
        for (FermionOperator a : annihilators) {
            Preconditions.checkArgument(a.getKind() == FermionOperator.Kind.ANNIHILATION,
                    "消滅演算子以外が含まれています: orbital=%s", a.getOrbital());
            PauliSum adjoint = PauliAlgebra.adjoint(a.getOperator());
            if (!PauliAlgebra.adjoint(adjoint).equals(a.getOperator())) {
                throw new AlgebraInvariantException(
                        "随伴の随伴が元の演算子と一致しません: orbital=" + a.getOrbital());
            }
            creators.add(
                    new FermionOperator(a.getOrbital(), FermionOperator.Kind.CREATION, adjoint));
        }
        return Collections.unmodifiableList(creators);
    }

    /**
     * 正準反交換関係 {@code {a_i, a_j†} = δ_ij I} と {@code {a_i, a_j} = 0} を全ての組で検証します。
     *
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     * @throws DimensionMismatchException 一覧の長さが一致しない場合に発生します
     * @throws AlgebraInvariantException 関係が成り立たない組がある場合に発生します
     */
    public void verifyAnticommutation(List<FermionOperator> annihilators,
            List<FermionOperator> creators) {
        if (annihilators.size() != creators.size()) {
            throw new DimensionMismatchException("生成演算子の一覧", annihilators.size(),
                    creators.size());
        }
        int n = annihilators.size();
        if (n == 0) {
            return;
        }
        int numQubits = annihilators.get(0).getOperator().numQubits();
        PauliSum identity = PauliSum.identity(numQubits);
        PauliSum zero = PauliSum.zero(numQubits);

        for (int i = 0; i < n; i++) {
            PauliSum ai = annihilators.get(i).getOperator();
            for (int j = 0; j < n; j++) {
                PauliSum mixed = PauliAlgebra.simplify(
                        PauliAlgebra.anticommutator(ai, creators.get(j).getOperator()),
                        RELATION_TOLERANCE);
                PauliSum expected = (i == j) ? identity : zero;
                if (!mixed.equals(expected)) {
                    throw new AlgebraInvariantException("反交換関係 {a_" + i + ", a_" + j
                            + "†} が成り立ちません: " + mixed);
                }

                PauliSum same = PauliAlgebra.simplify(
                        PauliAlgebra.anticommutator(ai, annihilators.get(j).getOperator()),
                        RELATION_TOLERANCE);
                if (!same.isEmpty()) {
                    throw new AlgebraInvariantException(
                            "反交換関係 {a_" + i + ", a_" + j + "} が 0 になりません: " + same);
                }
            }
        }
        log.info("Jordan-Wigner 演算子の反交換関係を検証しました。軌道数={}", n);
    }
}
