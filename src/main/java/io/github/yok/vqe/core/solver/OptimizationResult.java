package io.github.yok.vqe.core.solver;

import lombok.Value;

/**
 * 変分最小化の結果を表すクラスです（1 つの原子間距離につき 1 つ生成され、以後変更されません）。
 */
@Value
public class OptimizationResult {

    /**
     * 収束したパラメータです。
     */
    double[] parameters;

    /**
     * 最小コスト（ハミルトニアンの期待値の推定値）です。
     */
    double cost;

    /**
     * コスト関数の評価回数です。
     */
    int evaluations;

    /**
     * 最小化器の反復回数です。
     */
    int iterations;

    /**
     * 収束条件を満たして終了したかどうかです。
     */
    boolean converged;

    /**
     * 結果を生成します（パラメータはコピーして保持します）。
     *
     * @param parameters 収束したパラメータです
     * @param cost 最小コストです
     * @param evaluations 評価回数です
     * @param iterations 反復回数です
     * @param converged 収束したかどうかです
     */
    public OptimizationResult(double[] parameters, double cost, int evaluations, int iterations,
            boolean converged) {
        this.parameters = parameters.clone();
        this.cost = cost;
        this.evaluations = evaluations;
        this.iterations = iterations;
        this.converged = converged;
    }

    /**
     * 収束したパラメータのコピーを返します。
     *
     * @return パラメータです
     */
    public double[] getParameters() {
        return parameters.clone();
    }
}
