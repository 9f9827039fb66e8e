package io.github.yok.vqe.core.linearalgebra;

import com.google.common.base.Preconditions;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 複素エルミート行列 {@code H = A + iB} を実対称行列 {@code [[A, -B], [B, A]]} に埋め込むクラスです。
 *
 * <p>
 * 埋め込んだ 2d×2d 行列の固有値は H の各固有値がちょうど 2 回ずつ現れたものです。 固有ベクトル {@code (u, w)} は H の固有ベクトル
 * {@code u + iw} に対応します。
 * </p>
 */
public final class HermitianEmbedding {

    private HermitianEmbedding() {
    }

    /**
     * エルミート行列を実対称行列に埋め込みます。
     *
     * @param hermitian エルミート行列です（d×d）
     * @return 実対称行列です（2d×2d）
     */
    public static DMatrixRMaj embed(ZMatrixRMaj hermitian) {
        Preconditions.checkNotNull(hermitian, "hermitian は null 不可です");
        Preconditions.checkArgument(hermitian.numRows == hermitian.numCols, "正方行列が必要です: %sx%s",
                hermitian.numRows, hermitian.numCols);

        int d = hermitian.numRows;
        DMatrixRMaj real = new DMatrixRMaj(2 * d, 2 * d);
        for (int r = 0; r < d; r++) {
            for (int c = 0; c < d; c++) {
                double a = hermitian.getReal(r, c);
                double b = hermitian.getImag(r, c);
                real.set(r, c, a);
                real.set(r + d, c + d, a);
                real.set(r, c + d, -b);
                real.set(r + d, c, b);
            }
        }
        return real;
    }

    /**
     * 埋め込み行列の固有ベクトル（列）から、元のエルミート行列の固有ベクトルを取り出します。
     *
     * @param eigenvectors 埋め込み行列の固有ベクトル行列です（列が固有ベクトル）
     * @param column 取り出す列です
     * @return 複素固有ベクトルを {re_0, im_0, re_1, im_1, ...} の順に並べた配列です（正規化済み）
     */
    public static double[] extractVector(DMatrixRMaj eigenvectors, int column) {
        int d = eigenvectors.numRows / 2;
        double[] interleaved = new double[2 * d];
        double norm2 = 0.0;
        for (int r = 0; r < d; r++) {
            double re = eigenvectors.get(r, column);
            double im = eigenvectors.get(r + d, column);
            interleaved[2 * r] = re;
            interleaved[2 * r + 1] = im;
            norm2 += re * re + im * im;
        }
        double norm = Math.sqrt(norm2);
        if (norm > 0.0) {
            for (int i = 0; i < interleaved.length; i++) {
                interleaved[i] /= norm;
            }
        }
        return interleaved;
    }
}
