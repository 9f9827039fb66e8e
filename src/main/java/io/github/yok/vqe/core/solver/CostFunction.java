package io.github.yok.vqe.core.solver;

/**
 * パラメータベクトルからスカラーのコストを返す関数です。
 */
@FunctionalInterface
public interface CostFunction {

    /**
     * コストを評価します。
     *
     * @param parameters パラメータです
     * @return コストです
     */
    double value(double[] parameters);
}
