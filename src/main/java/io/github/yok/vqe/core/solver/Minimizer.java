package io.github.yok.vqe.core.solver;

import lombok.Value;

/**
 * 勾配を用いない（導関数不要の）最小化器を表すインタフェースです。
 *
 * <p>
 * コスト関数が投げた例外は握りつぶさず、そのまま呼び出し元へ伝播させる必要があります。
 * </p>
 */
public interface Minimizer {

    /**
     * コスト関数を最小化します。
     *
     * @param cost コスト関数です
     * @param initialParameters 初期パラメータです
     * @return 最小化結果です
     */
    MinimizationResult minimize(CostFunction cost, double[] initialParameters);

    /**
     * 最小化器の結果を表すクラスです。
     */
    @Value
    class MinimizationResult {

        /**
         * 最良点のパラメータです。
         */
        double[] point;

        /**
         * 最良点でのコストです。
         */
        double value;

        /**
         * コスト関数の評価回数です。
         */
        int evaluations;

        /**
         * 反復回数です。
         */
        int iterations;

        /**
         * 収束条件を満たして終了したかどうかです。
         */
        boolean converged;

        /**
         * 結果を生成します（最良点はコピーして保持します）。
         *
         * @param point 最良点のパラメータです
         * @param value 最良点でのコストです
         * @param evaluations 評価回数です
         * @param iterations 反復回数です
         * @param converged 収束したかどうかです
         */
        public MinimizationResult(double[] point, double value, int evaluations, int iterations,
                boolean converged) {
            this.point = point.clone();
            this.value = value;
            this.evaluations = evaluations;
            this.iterations = iterations;
            this.converged = converged;
        }

        /**
         * 最良点のコピーを返します。
         *
         * @return 最良点のパラメータです
         */
        public double[] getPoint() {
            return point.clone();
        }
    }
}
