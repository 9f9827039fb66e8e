package io.github.yok.vqe.core.hamiltonian;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import java.util.Arrays;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * 1 つの原子間距離における分子積分（1 体・2 体テンソル）と核間反発エネルギーを保持するクラスです。
 *
 * <p>
 * テンソルは読み取り専用の入力として扱います。1 体テンソルは n×n、2 体テンソルは n×n×n×n で、 n は軌道数（= 量子ビット数）です。
 * </p>
 */
@Getter
public final class MolecularIntegrals {

    /**
     * 原子間距離です。
     */
    private final double distance;

    /**
     * 1 体積分 h[i][j] です。
     */
    private final Complex[][] oneBody;

    /**
     * 2 体積分 g[i][j][k][l] です。
     */
    private final Complex[][][][] twoBody;

    /**
     * 核間反発エネルギーです。
     */
    private final double nuclearRepulsion;

    /**
     * 分子積分を生成します。
     *
     * @param distance 原子間距離です
     * @param oneBody 1 体積分です（n×n）
     * @param twoBody 2 体積分です（n×n×n×n）
     * @param nuclearRepulsion 核間反発エネルギーです
     * @throws NullPointerException テンソルまたは要素が null の場合に発生します
     * @throws DimensionMismatchException テンソルの形状が一致しない場合に発生します
     */
    public MolecularIntegrals(double distance, Complex[][] oneBody, Complex[][][][] twoBody,
            double nuclearRepulsion) {
        Preconditions.checkNotNull(oneBody, "oneBody は null 不可です");
        Preconditions.checkNotNull(twoBody, "twoBody は null 不可です");
        Preconditions.checkArgument(oneBody.length > 0, "軌道数は 1 以上が必要です");

        int n = oneBody.length;
        checkOneBodyShape(oneBody, n);
        checkTwoBodyShape(twoBody, n);

        this.distance = distance;
        this.oneBody = oneBody;
        this.twoBody = twoBody;
        this.nuclearRepulsion = nuclearRepulsion;
    }

    /**
     * 軌道数を返します。
     *
     * @return 軌道数です
     */
    public int numOrbitals() {
        return oneBody.length;
    }

    /**
     * 1 体テンソルが n×n であることを検証します。
     *
     * @param oneBody 1 体テンソルです
     * @param n 軌道数です
     */
    static void checkOneBodyShape(Complex[][] oneBody, int n) {
        if (oneBody.length != n) {
            throw new DimensionMismatchException("1 体積分", n, oneBody.length);
        }
        for (Complex[] row : oneBody) {
            Preconditions.checkNotNull(row, "1 体積分の行が null です");
            if (row.length != n) {
                throw new DimensionMismatchException("1 体積分の行", n, row.length);
            }
            for (Complex v : row) {
                Preconditions.checkNotNull(v, "1 体積分の要素が null です");
            }
        }
    }

    /**
     * 2 体テンソルが n×n×n×n であることを検証します。
     *
     * @param twoBody 2 体テンソルです
     * @param n 軌道数です
     */
    static void checkTwoBodyShape(Complex[][][][] twoBody, int n) {
        if (twoBody.length != n) {
            throw new DimensionMismatchException("2 体積分", n, twoBody.length);
        }
        for (Complex[][][] a : twoBody) {
            Preconditions.checkNotNull(a, "2 体積分の要素が null です");
            if (a.length != n) {
                throw new DimensionMismatchException("2 体積分（第 2 添字）", n, a.length);
            }
            for (Complex[][] b : a) {
                Preconditions.checkNotNull(b, "2 体積分の要素が null です");
                if (b.length != n) {
                    throw new DimensionMismatchException("2 体積分（第 3 添字）", n, b.length);
                }
                for (Complex[] c : b) {
                    Preconditions.checkNotNull(c, "2 体積分の要素が null です");
                    if (c.length != n) {
                        throw new DimensionMismatchException("2 体積分（第 4 添字）", n, c.length);
                    }
                    for (Complex v : c) {
                        Preconditions.checkNotNull(v, "2 体積分の要素が null です");
                    }
                }
            }
        }
    }

    /**
     * 全要素 0 の 2 体テンソルを生成します。
     *
     * @param n 軌道数です
     * @return 2 体テンソルです
     */
    public static Complex[][][][] zeroTwoBody(int n) {
        Complex[][][][] t = new Complex[n][n][n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                for (int k = 0; k < n; k++) {
                    Arrays.fill(t[i][j][k], Complex.ZERO);
                }
            }
        }
        return t;
    }

    /**
     * 全要素 0 の 1 体テンソルを生成します。
     *
     * @param n 軌道数です
     * @return 1 体テンソルです
     */
    public static Complex[][] zeroOneBody(int n) {
        Complex[][] t = new Complex[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(t[i], Complex.ZERO);
        }
        return t;
    }
}
