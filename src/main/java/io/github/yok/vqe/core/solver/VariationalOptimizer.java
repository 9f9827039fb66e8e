package io.github.yok.vqe.core.solver;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.vqe.core.estimation.ExpectationEstimator;
import io.github.yok.vqe.core.exception.AlgebraInvariantException;
import io.github.yok.vqe.core.exception.BackendExecutionException;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.pauli.PauliSum;
import io.github.yok.vqe.core.pauli.PauliTerm;
import io.github.yok.vqe.core.state.PreparedState;
import io.github.yok.vqe.core.state.StatePreparation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * パラメータ付き状態に対するハミルトニアンの期待値を、導関数不要の最小化器で最小化するクラスです（VQE の古典最適化ループ）。
 *
 * <p>
 * コスト関数は 状態準備 → 各 Pauli パターンの期待値推定 → {@code Σ 係数·推定値} の実部、です。 推定器の失敗は
 * {@link BackendExecutionException} として呼び出し元へ伝播し、既定値で置き換えることはしません。
 * </p>
 *
 * <p>
 * 各項の推定は実行器へ投入し、タイムアウト付きで待ちます。実行器が指定されない場合は、専用の単一スレッドの実行器を使います。
 * 集計は常にハミルトニアンの項順で行うため、結果は実行順に依存しません。
 * </p>
 */
@Slf4j
@Getter
public final class VariationalOptimizer {

    /**
     * 状態準備です。
     */
    private final StatePreparation statePreparation;

    /**
     * 期待値推定器です。
     */
    private final ExpectationEstimator estimator;

    /**
     * 最小化器です。
     */
    private final Minimizer minimizer;

    /**
     * 項ごとの推定を実行する実行器です。
     */
    private final ExecutorService termExecutor;

    /**
     * 項を 1 つずつ投入して待つかどうかです（専用の単一スレッドの実行器を使う場合に true）。
     */
    private final boolean oneTermAtATime;

    /**
     * 1 項の推定を待つ上限時間（ミリ秒）です。
     */
    private final long termTimeoutMillis;

    /**
     * コストの虚部を許容する上限です。超えた場合は警告ログを出します。
     */
    private final double imaginaryTolerance;

    /**
     * 最適化器を生成します。
     *
     * @param statePreparation 状態準備です
     * @param estimator 期待値推定器です
     * @param minimizer 最小化器です
     * @param termExecutor 項ごとの推定用の実行器です（null の場合は単一スレッドの実行器を生成します）
     * @param termTimeoutMillis 1 項の推定を待つ上限時間（ミリ秒、1 以上）です
     * @param imaginaryTolerance コストの虚部の許容上限です（0 以上）
     */
    public VariationalOptimizer(StatePreparation statePreparation, ExpectationEstimator estimator,
            Minimizer minimizer, ExecutorService termExecutor, long termTimeoutMillis,
            double imaginaryTolerance) {
        Preconditions.checkNotNull(statePreparation, "statePreparation は null 不可です");
        Preconditions.checkNotNull(estimator, "estimator は null 不可です");
        Preconditions.checkNotNull(minimizer, "minimizer は null 不可です");
        Preconditions.checkArgument(termTimeoutMillis > 0, "termTimeoutMillis は 1 以上が必要です: %s",
                termTimeoutMillis);
        Preconditions.checkArgument(imaginaryTolerance >= 0.0,
                "imaginaryTolerance は 0 以上が必要です: %s", imaginaryTolerance);
        this.statePreparation = statePreparation;
        this.estimator = estimator;
        this.minimizer = minimizer;
        this.oneTermAtATime = (termExecutor == null);
        this.termExecutor = (termExecutor != null) ? termExecutor
                : Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                        .setNameFormat("vqe-estimate-%d").setDaemon(true).build());
        this.termTimeoutMillis = termTimeoutMillis;
        this.imaginaryTolerance = imaginaryTolerance;
    }

    /**
     * ハミルトニアンの期待値を最小化します。
     *
     * @param hamiltonian ハミルトニアンです
     * @param initialParameters 初期パラメータです
     * @return 最適化結果です
     * @throws DimensionMismatchException 量子ビット数またはパラメータ数が一致しない場合に発生します
     * @throws BackendExecutionException 期待値推定が失敗した場合に発生します
     */
    public OptimizationResult minimize(PauliSum hamiltonian, double[] initialParameters) {
        checkDimensions(hamiltonian, initialParameters);

        long t0 = System.nanoTime();
        log.info("変分最小化を開始します。Pauli 項数={}、パラメータ数={}、初期パラメータ={}", hamiltonian.size(),
                initialParameters.length, Arrays.toString(initialParameters));

        Minimizer.MinimizationResult r =
                minimizer.minimize(params -> cost(hamiltonian, params), initialParameters);

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        if (r.isConverged()) {
            log.info("変分最小化が収束しました。最小コスト={}、評価回数={}、反復回数={}、所要時間={}ms、パラメータ={}",
                    fmt8(r.getValue()), r.getEvaluations(), r.getIterations(), elapsedMs,
                    Arrays.toString(r.getPoint()));
        } else {
            log.warn("変分最小化が未収束で終了しました。最良コスト={}、評価回数={}、所要時間={}ms、パラメータ={}",
                    fmt8(r.getValue()), r.getEvaluations(), elapsedMs,
                    Arrays.toString(r.getPoint()));
        }

        return new OptimizationResult(r.getPoint(), r.getValue(), r.getEvaluations(),
                r.getIterations(), r.isConverged());
    }

    /**
     * コスト関数を 1 回評価します。
     *
     * @param hamiltonian ハミルトニアンです
     * @param parameters パラメータです
     * @return 期待値の推定値（実部）です
     * @throws DimensionMismatchException 次元が一致しない場合に発生します
     * @throws BackendExecutionException 期待値推定が失敗した場合に発生します
     */
    public double cost(PauliSum hamiltonian, double[] parameters) {
        checkDimensions(hamiltonian, parameters);

        PreparedState state = statePreparation.prepare(parameters);

        List<PauliTerm> patterns = new ArrayList<>(hamiltonian.terms().keySet());
        double[] estimates = estimateAll(patterns, state);

        double re = 0.0;
        double im = 0.0;
        int idx = 0;
        for (Map.Entry<PauliTerm, Complex> e : hamiltonian.terms().entrySet()) {
            double v = estimates[idx++];
            re += e.getValue().getReal() * v;
            im += e.getValue().getImaginary() * v;
        }

        if (Math.abs(im) > imaginaryTolerance) {
            log.warn("コストの虚部が許容値を超えています。虚部={}、許容値={}、パラメータ={}",
                    String.format(Locale.ROOT, "%.3e", im),
                    String.format(Locale.ROOT, "%.3e", imaginaryTolerance),
                    Arrays.toString(parameters));
        }
        log.debug("コスト評価: パラメータ={}、コスト={}", Arrays.toString(parameters), fmt8(re));
        return re;
    }

    /**
     * 全パターンの期待値を推定し、パターン順に並べて返します。
     *
     * @param patterns Pauli パターンです
     * @param state 準備した状態です
     * @return 推定値です
     */
    private double[] estimateAll(List<PauliTerm> patterns, PreparedState state) {
        double[] estimates = new double[patterns.size()];
        if (oneTermAtATime) {
            for (int i = 0; i < estimates.length; i++) {
                PauliTerm p = patterns.get(i);
                Future<Double> f = termExecutor.submit(() -> estimator.estimate(p, state));
                estimates[i] = await(List.of(f))[0];
            }
            return estimates;
        }

        List<Future<Double>> futures = new ArrayList<>(patterns.size());
        for (PauliTerm p : patterns) {
            futures.add(termExecutor.submit(() -> estimator.estimate(p, state)));
        }
        return await(futures);
    }

    /**
     * 投入済みの推定を順に待ち、結果を投入順に並べて返します。失敗した場合は残りを取り消します。
     *
     * @param futures 投入済みの推定です
     * @return 推定値です
     * @throws BackendExecutionException タイムアウトまたは推定器の失敗の場合に発生します
     */
    private double[] await(List<Future<Double>> futures) {
        double[] estimates = new double[futures.size()];
        try {
            for (int i = 0; i < estimates.length; i++) {
                estimates[i] = futures.get(i).get(termTimeoutMillis, TimeUnit.MILLISECONDS);
            }
            return estimates;
        } catch (TimeoutException e) {
            throw new BackendExecutionException(
                    "期待値推定がタイムアウトしました（" + termTimeoutMillis + "ms）", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendExecutionException("期待値推定の待機中に割り込まれました", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } finally {
            for (Future<Double> f : futures) {
                f.cancel(true);
            }
        }
    }

    /**
     * 並行実行で発生した例外を、代数エラーとバックエンドエラーが区別できる形に戻します。
     *
     * @param e 実行例外です
     * @return 再送出する例外です
     */
    private static RuntimeException unwrap(ExecutionException e) {
        return classify(e.getCause());
    }

    /**
     * 推定器の例外を分類します。引数の誤りや代数の不変条件違反はそのまま返し、それ以外はバックエンドの失敗として包みます。
     *
     * @param cause 推定器が投げた例外です
     * @return 再送出する例外です
     */
    private static RuntimeException classify(Throwable cause) {
        if (cause instanceof BackendExecutionException
                || cause instanceof IllegalArgumentException
                || cause instanceof NullPointerException
                || cause instanceof AlgebraInvariantException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new BackendExecutionException("期待値推定に失敗しました: " + cause, cause);
    }

    /**
     * ハミルトニアンの量子ビット数とパラメータ数を状態準備と照合します。
     *
     * @param hamiltonian ハミルトニアンです
     * @param parameters パラメータです
     * @throws DimensionMismatchException 一致しない場合に発生します
     */
    private void checkDimensions(PauliSum hamiltonian, double[] parameters) {
        Preconditions.checkNotNull(hamiltonian, "hamiltonian は null 不可です");
        Preconditions.checkNotNull(parameters, "parameters は null 不可です");
        if (hamiltonian.numQubits() != statePreparation.numQubits()) {
            throw new DimensionMismatchException("ハミルトニアンの量子ビット数",
                    statePreparation.numQubits(), hamiltonian.numQubits());
        }
        if (parameters.length != statePreparation.parameterCount()) {
            throw new DimensionMismatchException("パラメータ数", statePreparation.parameterCount(),
                    parameters.length);
        }
    }

    /**
     * 小数点以下 8 桁で整形します。
     *
     * @param v 値です
     * @return 整形した文字列です
     */
    private static String fmt8(double v) {
        return String.format(Locale.ROOT, "%.8f", v);
    }
}
