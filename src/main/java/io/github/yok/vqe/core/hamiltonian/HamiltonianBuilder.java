package io.github.yok.vqe.core.hamiltonian;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.fermion.FermionOperator;
import io.github.yok.vqe.core.pauli.PauliAlgebra;
import io.github.yok.vqe.core.pauli.PauliSum;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * 1 体・2 体積分と Jordan-Wigner 演算子から、量子ビットハミルトニアン（Pauli 和）を構築するクラスです。
 *
 * <p>
 * {@code H = Σ_ij h_ij a_i† a_j + 0.5 Σ_ijkl g_ijkl a_i† a_j† a_k a_l} を簡約して返します。
 * </p>
 *
 * <p>
 * 2 体項の {@code a_i† a_j†} と {@code a_k a_l} は添字の組だけに依存するため、構築の最初に n² 通りずつ 計算して使い回します。
 * </p>
 */
@Slf4j
public final class HamiltonianBuilder {

    /**
     * 2 体項に掛ける係数です。
     */
    private static final double TWO_BODY_FACTOR = 0.5;

    /**
     * 構築結果をエルミートとみなす虚部の許容誤差です。
     */
    private static final double HERMITIAN_TOLERANCE = 1e-9;

    /**
     * 分子積分からハミルトニアンを構築します。
     *
     * @param integrals 分子積分です
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     * @return 簡約済みのハミルトニアンです
     * @see #build(Complex[][], Complex[][][][], List, List)
     */
    public PauliSum build(MolecularIntegrals integrals, List<FermionOperator> annihilators,
            List<FermionOperator> creators) {
        Preconditions.checkNotNull(integrals, "integrals は null 不可です");
        return build(integrals.getOneBody(), integrals.getTwoBody(), annihilators, creators);
    }

    /**
     * 1 体・2 体積分からハミルトニアンを構築します。
     *
     * @param oneBody 1 体積分です（n×n）
     * @param twoBody 2 体積分です（n×n×n×n）
     * @param annihilators 消滅演算子の一覧です（長さ n）
     * @param creators 生成演算子の一覧です（長さ n）
     * @return 簡約済みのハミルトニアンです
     * @throws DimensionMismatchException テンソルと演算子の次元が一致しない場合に発生します
     */
    public PauliSum build(Complex[][] oneBody, Complex[][][][] twoBody,
            List<FermionOperator> annihilators, List<FermionOperator> creators) {
        int n = checkOperators(annihilators, creators);
        MolecularIntegrals.checkOneBodyShape(oneBody, n);
        MolecularIntegrals.checkTwoBodyShape(twoBody, n);

        long t0 = System.nanoTime();
        int numQubits = annihilators.get(0).getOperator().numQubits();

        PauliSum.Builder total = PauliSum.builder(numQubits);
        addOneBody(total, oneBody, annihilators, creators);
        int twoBodyTerms = addTwoBody(total, twoBody, annihilators, creators);

        PauliSum hamiltonian = PauliAlgebra.simplify(total.build());

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("ハミルトニアンを構築しました。軌道数={}、2 体の非ゼロ要素数={}、Pauli 項数={}、所要時間={}ms", n,
                twoBodyTerms, hamiltonian.size(), elapsedMs);

        if (!hamiltonian.isHermitian(HERMITIAN_TOLERANCE)) {
            log.warn("ハミルトニアンがエルミートではありません。係数の虚部の最大値={}",
                    String.format(Locale.ROOT, "%.3e", hamiltonian.maxImaginaryPart()));
        }
        return hamiltonian;
    }

    /**
     * 1 体項 {@code Σ_ij h_ij a_i† a_j} だけを構築します。
     *
     * @param oneBody 1 体積分です（n×n）
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     * @return 簡約済みの 1 体項です
     */
    public PauliSum buildOneBody(Complex[][] oneBody, List<FermionOperator> annihilators,
            List<FermionOperator> creators) {
        int n = checkOperators(annihilators, creators);
        MolecularIntegrals.checkOneBodyShape(oneBody, n);

        PauliSum.Builder total = PauliSum.builder(annihilators.get(0).getOperator().numQubits());
        addOneBody(total, oneBody, annihilators, creators);
        return PauliAlgebra.simplify(total.build());
    }

    /**
     * 1 体項 {@code Σ_ij h_ij a_i† a_j} を加えます。
     *
     * @param total 加算先です
     * @param oneBody 1 体積分です
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     */
    private static void addOneBody(PauliSum.Builder total, Complex[][] oneBody,
            List<FermionOperator> annihilators, List<FermionOperator> creators) {
        int n = annihilators.size();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                Complex h = oneBody[i][j];
                if (isZero(h)) {
                    continue;
                }
                total.addAll(PauliAlgebra.compose(creators.get(i).getOperator(),
                        annihilators.get(j).getOperator()), h);
            }
        }
    }

    /**
     * 2 体項 {@code 0.5 Σ_ijkl g_ijkl a_i† a_j† a_k a_l} を加えます。
     *
     * @param total 加算先です
     * @param twoBody 2 体積分です
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     * @return 2 体積分の非ゼロ要素数です
     */
    private static int addTwoBody(PauliSum.Builder total, Complex[][][][] twoBody,
            List<FermionOperator> annihilators, List<FermionOperator> creators) {
        int n = annihilators.size();

        // a_i† a_j† と a_k a_l は (i, j) / (k, l) の組ごとに 1 回だけ計算
        PauliSum[][] creatorPairs = new PauliSum[n][n];
        PauliSum[][] annihilatorPairs = new PauliSum[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                creatorPairs[i][j] = PauliAlgebra.compose(creators.get(i).getOperator(),
                        creators.get(j).getOperator());
                annihilatorPairs[i][j] = PauliAlgebra.compose(annihilators.get(i).getOperator(),
                        annihilators.get(j).getOperator());
            }
        }

        int nonZero = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                PauliSum cc = creatorPairs[i][j];
                for (int k = 0; k < n; k++) {
                    for (int l = 0; l < n; l++) {
                        Complex g = twoBody[i][j][k][l];
                        if (isZero(g)) {
                            continue;
                        }
                        nonZero++;
                        // i == j または k == l の組はパウリ排他でゼロ演算子
                        PauliSum aa = annihilatorPairs[k][l];
                        if (cc.isEmpty() || aa.isEmpty()) {
                            continue;
                        }
                        total.addAll(PauliAlgebra.compose(cc, aa), g.multiply(TWO_BODY_FACTOR));
                    }
                }
            }
        }
        return nonZero;
    }

    /**
     * 消滅・生成演算子の一覧を検証し、軌道数を返します。
     *
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     * @return 軌道数です
     * @throws DimensionMismatchException 一覧の長さが一致しない場合に発生します
     */
    private static int checkOperators(List<FermionOperator> annihilators,
            List<FermionOperator> creators) {
        Preconditions.checkNotNull(annihilators, "annihilators は null 不可です");
        Preconditions.checkNotNull(creators, "creators は null 不可です");
        Preconditions.checkArgument(!annihilators.isEmpty(), "annihilators が空です");
        if (creators.size() != annihilators.size()) {
            throw new DimensionMismatchException("生成演算子の一覧", annihilators.size(),
                    creators.size());
        }
        return annihilators.size();
    }

    /**
     * 厳密にゼロの係数かどうかを返します。
     *
     * @param c 係数です
     * @return 実部・虚部ともに 0 なら true です
     */
    private static boolean isZero(Complex c) {
        return c.getReal() == 0.0 && c.getImaginary() == 0.0;
    }
}
