package io.github.yok.vqe.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.vqe.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import io.github.yok.vqe.core.linearalgebra.HermitianEmbedding;
import io.github.yok.vqe.core.pauli.PauliAlgebra;
import io.github.yok.vqe.core.pauli.PauliSum;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;

/**
 * ハミルトニアンを密行列に展開して対角化し、最小固有値（厳密な基底エネルギー）を求めるクラスです。
 *
 * <p>
 * 計算量は量子ビット数に対して指数的（2^n 次元）なので、参照値として小さな系にのみ使います。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class ExactSolver {

    /**
     * ハミルトニアンの係数を実数とみなす許容誤差です。超えた場合はエルミート部分を対角化し、警告ログを出します。
     */
    private static final double HERMITIAN_TOLERANCE = 1e-9;

    /**
     * 最小固有値が縮退に近いとみなすギャップの閾値です。
     */
    private static final double DEGENERACY_TOLERANCE = 1e-9;

    /**
     * 固有分解バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 最小固有値を返します。
     *
     * @param hamiltonian ハミルトニアンです
     * @param numQubits 量子ビット数です
     * @return 最小固有値です
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public double minimalEigenvalue(PauliSum hamiltonian, int numQubits) {
        return solve(hamiltonian, numQubits, false).getMinimalEigenvalue();
    }

    /**
     * 最小固有値と、必要なら基底状態を求めます。
     *
     * @param hamiltonian ハミルトニアンです
     * @param numQubits 量子ビット数です
     * @param computeGroundState 基底状態ベクトルも求める場合は true です
     * @return 厳密解です
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public ExactSolution solve(PauliSum hamiltonian, int numQubits, boolean computeGroundState) {
        Preconditions.checkNotNull(hamiltonian, "hamiltonian は null 不可です");
        PauliSum target = hamiltonian;
        if (!hamiltonian.isHermitian(HERMITIAN_TOLERANCE)) {
            log.warn("ハミルトニアンの係数に虚部があります。エルミート部分を対角化します。係数の虚部の最大値={}、許容値={}",
                    String.format(Locale.ROOT, "%.3e", hamiltonian.maxImaginaryPart()),
                    String.format(Locale.ROOT, "%.3e", HERMITIAN_TOLERANCE));
            target = hamiltonian.hermitianPart();
        }

        long t0 = System.nanoTime();

        ZMatrixRMaj matrix = PauliAlgebra.toMatrix(target, numQubits);
        EigenDecompositionResult eigen = eigenBackend
                .decomposeSymmetricAndSort(HermitianEmbedding.embed(matrix), computeGroundState);

        // 埋め込み行列では各固有値が 2 回ずつ現れるため、次の準位は添字 2 です。
        double[] values = eigen.getEigenvalues();
        double minimal = values[0];
        double gap = values[2] - values[0];

        if (gap < DEGENERACY_TOLERANCE) {
            log.warn("最小固有値が縮退に近い状態です。最小固有値={}、次の固有値とのギャップ={}", fmt10(minimal),
                    String.format(Locale.ROOT, "%.3e", gap));
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("厳密対角化が完了しました。次元={}、最小固有値={}、ギャップ={}、所要時間={}ms", matrix.numRows,
                fmt10(minimal), fmt10(gap), elapsedMs);

        double[] groundState = computeGroundState
                ? HermitianEmbedding.extractVector(eigen.getEigenvectors(), 0)
                : null;
        return new ExactSolution(minimal, gap, groundState);
    }

    /**
     * 小数点以下 10 桁で整形します。
     *
     * @param v 値です
     * @return 整形した文字列です
     */
    private static String fmt10(double v) {
        return String.format(Locale.ROOT, "%.10f", v);
    }

    /**
     * 厳密対角化の結果を表すクラスです。
     */
    @Value
    public static class ExactSolution {

        /**
         * 最小固有値です。
         */
        double minimalEigenvalue;

        /**
         * 最小固有値と次の固有値のギャップです。
         */
        double spectralGap;

        /**
         * 基底状態ベクトル（{re_0, im_0, re_1, im_1, ...}、未計算なら null）です。
         */
        double[] groundState;

        /**
         * 厳密解を生成します（基底状態ベクトルはコピーして保持します）。
         *
         * @param minimalEigenvalue 最小固有値です
         * @param spectralGap 次の固有値とのギャップです
         * @param groundState 基底状態ベクトルです（null 可）
         */
        public ExactSolution(double minimalEigenvalue, double spectralGap, double[] groundState) {
            this.minimalEigenvalue = minimalEigenvalue;
            this.spectralGap = spectralGap;
            this.groundState = (groundState != null) ? groundState.clone() : null;
        }

        /**
         * 基底状態ベクトルのコピーを返します。
         *
         * @return 基底状態ベクトルです（未計算なら null）
         */
        public double[] getGroundState() {
            return (groundState != null) ? groundState.clone() : null;
        }
    }
}
