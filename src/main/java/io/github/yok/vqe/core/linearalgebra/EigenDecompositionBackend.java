package io.github.yok.vqe.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実対称行列の固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * エルミート行列は {@link HermitianEmbedding} で実対称行列に埋め込んでから渡します。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @param computeVectors 固有ベクトルも求める場合は true です
     * @return 固有値昇順の固有分解結果です（computeVectors が false の場合、固有ベクトルは null）
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    EigenDecompositionResult decomposeSymmetricAndSort(DMatrixRMaj symmetricMatrix,
            boolean computeVectors);

    /**
     * 固有分解の結果（固有値・固有ベクトル）を保持するクラスです。
     *
     * <p>
     * 固有ベクトル行列は「列が固有ベクトル」である前提です。
     * </p>
     */
    @Value
    class EigenDecompositionResult {

        /**
         * 昇順の固有値配列です。
         */
        double[] eigenvalues;

        /**
         * 固有ベクトル行列です（列が固有ベクトル、未計算なら null）。
         */
        DMatrixRMaj eigenvectors;
    }
}
