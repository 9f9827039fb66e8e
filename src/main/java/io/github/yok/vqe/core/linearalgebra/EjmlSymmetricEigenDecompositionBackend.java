package io.github.yok.vqe.core.linearalgebra;

import java.util.Comparator;
import java.util.stream.IntStream;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML の対称固有値ソルバで実対称行列を分解するバックエンドです。
 *
 * <p>
 * computeVectors が false の場合は固有値だけを計算します。
 * </p>
 */
public final class EjmlSymmetricEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。入力行列は変更しません。
     *
     * @param symmetricMatrix 実対称行列です
     * @param computeVectors 固有ベクトルも求める場合は true です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException symmetricMatrix が null または正方でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public EigenDecompositionResult decomposeSymmetricAndSort(DMatrixRMaj symmetricMatrix,
            boolean computeVectors) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        int dim = symmetricMatrix.numRows;
        if (symmetricMatrix.numCols != dim) {
            throw new IllegalArgumentException(
                    "正方行列が必要です: " + dim + "x" + symmetricMatrix.numCols);
        }

        EigenDecomposition_F64<DMatrixRMaj> eig =
                DecompositionFactory_DDRM.eig(dim, computeVectors, true);
        if (!eig.decompose(symmetricMatrix.copy())) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）: dim=" + dim);
        }

        double[] raw = new double[eig.getNumberOfEigenvalues()];
        for (int k = 0; k < raw.length; k++) {
            raw[k] = eig.getEigenvalue(k).getReal();
        }
        int[] order = IntStream.range(0, raw.length).boxed()
                .sorted(Comparator.comparingDouble(k -> raw[k])).mapToInt(Integer::intValue)
                .toArray();

        double[] values = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            values[k] = raw[order[k]];
        }
        if (!computeVectors) {
            return new EigenDecompositionResult(values, null);
        }

        DMatrixRMaj vectors = new DMatrixRMaj(dim, order.length);
        for (int k = 0; k < order.length; k++) {
            DMatrixRMaj v = eig.getEigenVector(order[k]);
            if (v == null) {
                throw new IllegalStateException("固有ベクトルが取得できません: index=" + order[k]);
            }
            CommonOps_DDRM.insert(v, vectors, 0, k);
        }
        return new EigenDecompositionResult(values, vectors);
    }
}
