package io.github.yok.vqe.core.solver;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.MultivariateOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

/**
 * Apache Commons Math の導関数不要な最適化器（Nelder-Mead 単体法 / Powell 法）による最小化器です。
 *
 * <p>
 * 評価回数が上限に達した場合は、それまでの最良点を {@code converged=false} として返します。
 * </p>
 */
@Slf4j
@Getter
public final class CommonsMathMinimizer implements Minimizer {

    /**
     * 最適化手法です。
     */
    public enum Method {
        /**
         * Nelder-Mead 単体法です。
         */
        NELDER_MEAD,

        /**
         * Powell の共役方向法です。
         */
        POWELL
    }

    /**
     * 最適化手法です。
     */
    private final Method method;

    /**
     * Nelder-Mead の初期単体の辺の長さです。
     */
    private final double initialStep;

    /**
     * 収束判定の相対許容誤差です。
     */
    private final double relativeTolerance;

    /**
     * 収束判定の絶対許容誤差です。
     */
    private final double absoluteTolerance;

    /**
     * コスト関数の最大評価回数です。
     */
    private final int maxEvaluations;

    /**
     * 最小化器を生成します。
     *
     * @param method 最適化手法です
     * @param initialStep Nelder-Mead の初期単体の辺の長さです（0 より大きい）
     * @param relativeTolerance 相対許容誤差です（0 より大きい）
     * @param absoluteTolerance 絶対許容誤差です（0 より大きい）
     * @param maxEvaluations 最大評価回数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CommonsMathMinimizer(Method method, double initialStep, double relativeTolerance,
            double absoluteTolerance, int maxEvaluations) {
        Preconditions.checkNotNull(method, "method は null 不可です");
        Preconditions.checkArgument(initialStep > 0.0, "initialStep は 0 より大きい必要があります: %s",
                initialStep);
        Preconditions.checkArgument(relativeTolerance > 2 * Math.ulp(1.0),
                "relativeTolerance が小さすぎます: %s", relativeTolerance);
        Preconditions.checkArgument(absoluteTolerance > 0.0,
                "absoluteTolerance は 0 より大きい必要があります: %s", absoluteTolerance);
        Preconditions.checkArgument(maxEvaluations > 0, "maxEvaluations は 1 以上が必要です: %s",
                maxEvaluations);
        this.method = method;
        this.initialStep = initialStep;
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public MinimizationResult minimize(CostFunction cost, double[] initialParameters) {
        Preconditions.checkNotNull(cost, "cost は null 不可です");
        Preconditions.checkNotNull(initialParameters, "initialParameters は null 不可です");
        Preconditions.checkArgument(initialParameters.length > 0, "パラメータが空です");

        BestPointTracker tracker = new BestPointTracker(cost);
        MultivariateOptimizer optimizer = createOptimizer();

        try {
            PointValuePair best = optimize(optimizer, tracker, initialParameters);
            return new MinimizationResult(best.getPoint(), best.getValue(),
                    tracker.evaluations, optimizer.getIterations(), true);
        } catch (TooManyEvaluationsException | TooManyIterationsException e) {
            log.warn("最小化が評価回数の上限に達しました。手法={}、評価回数={}、最良コスト={}、最良点={}", method,
                    tracker.evaluations, String.format(Locale.ROOT, "%.8f", tracker.bestValue),
                    Arrays.toString(tracker.bestPoint));
            return new MinimizationResult(tracker.bestPoint, tracker.bestValue,
                    tracker.evaluations, optimizer.getIterations(), false);
        }
    }

    /**
     * 設定された手法の最適化器を生成します。
     *
     * @return 最適化器です
     */
    private MultivariateOptimizer createOptimizer() {
        switch (method) {
            case POWELL:
                return new PowellOptimizer(relativeTolerance, absoluteTolerance);
            case NELDER_MEAD:
            default:
                return new SimplexOptimizer(relativeTolerance, absoluteTolerance);
        }
    }

    /**
     * 最適化を実行します。Nelder-Mead の場合は初期単体も指定します。
     *
     * @param optimizer 最適化器です
     * @param tracker 評価を記録するコスト関数です
     * @param initialParameters 初期パラメータです
     * @return 最適点です
     */
    private PointValuePair optimize(MultivariateOptimizer optimizer, BestPointTracker tracker,
            double[] initialParameters) {
        ObjectiveFunction objective = new ObjectiveFunction(tracker);
        if (optimizer instanceof SimplexOptimizer) {
            double[] steps = new double[initialParameters.length];
            Arrays.fill(steps, initialStep);
            return optimizer.optimize(new MaxEval(maxEvaluations), new MaxIter(maxEvaluations),
                    objective, GoalType.MINIMIZE, new InitialGuess(initialParameters.clone()),
                    new NelderMeadSimplex(steps));
        }
        return optimizer.optimize(new MaxEval(maxEvaluations), new MaxIter(maxEvaluations),
                objective, GoalType.MINIMIZE, new InitialGuess(initialParameters.clone()));
    }

    /**
     * 評価回数と最良点を記録しながらコスト関数を呼び出すラッパーです（単一スレッドで使用します）。
     */
    private static final class BestPointTracker implements MultivariateFunction {

        /**
         * 包んでいるコスト関数です。
         */
        private final CostFunction cost;

        /**
         * 評価回数です。
         */
        private int evaluations;

        /**
         * これまでの最小コストです。
         */
        private double bestValue = Double.POSITIVE_INFINITY;

        /**
         * 最小コストを与えた点です。
         */
        private double[] bestPoint;

        BestPointTracker(CostFunction cost) {
            this.cost = cost;
        }

        @Override
        public double value(double[] point) {
            double v = cost.value(point.clone());
            evaluations++;
            if (bestPoint == null || v < bestValue) {
                bestValue = v;
                bestPoint = point.clone();
            }
            return v;
        }
    }
}
