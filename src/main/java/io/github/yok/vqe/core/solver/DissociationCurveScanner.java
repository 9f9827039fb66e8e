package io.github.yok.vqe.core.solver;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.vqe.core.exception.BackendExecutionException;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.fermion.FermionOperator;
import io.github.yok.vqe.core.hamiltonian.HamiltonianBuilder;
import io.github.yok.vqe.core.hamiltonian.MolecularIntegrals;
import io.github.yok.vqe.core.pauli.PauliSum;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 原子間距離ごとに ハミルトニアン構築 → 厳密対角化 → 変分最小化 を行い、解離曲線を求めるクラスです。
 *
 * <p>
 * 距離点どうしは書き込み可能な状態を共有しないため、ワーカープールで並行に計算できます。 結果は常に入力（距離）の順で返します。
 * </p>
 *
 * <p>
 * 変分最小化は {@link BackendExecutionException} の場合に限り、上限回数まで再試行します。 次元不一致や代数の不変条件違反は再試行せずに伝播させます。
 * </p>
 */
@Slf4j
@Getter
public final class DissociationCurveScanner {

    /**
     * ハミルトニアン構築器です。
     */
    private final HamiltonianBuilder hamiltonianBuilder;

    /**
     * 厳密対角化ソルバです。
     */
    private final ExactSolver exactSolver;

    /**
     * 変分最適化器です。
     */
    private final VariationalOptimizer variationalOptimizer;

    /**
     * 消滅演算子の一覧です。
     */
    private final List<FermionOperator> annihilators;

    /**
     * 生成演算子の一覧です。
     */
    private final List<FermionOperator> creators;

    /**
     * 変分最小化の初期パラメータです。
     */
    private final double[] initialParameters;

    /**
     * 変分最小化の最大試行回数です。
     */
    private final int maxAttempts;

    /**
     * 距離点を並行計算するワーカー数です。
     */
    private final int parallelism;

    /**
     * スキャナを生成します。
     *
     * @param hamiltonianBuilder ハミルトニアン構築器です
     * @param exactSolver 厳密対角化ソルバです
     * @param variationalOptimizer 変分最適化器です
     * @param annihilators 消滅演算子の一覧です
     * @param creators 生成演算子の一覧です
     * @param initialParameters 初期パラメータです
     * @param maxAttempts 最大試行回数です（1 以上）
     * @param parallelism ワーカー数です（1 以上）
     */
    public DissociationCurveScanner(HamiltonianBuilder hamiltonianBuilder,
            ExactSolver exactSolver, VariationalOptimizer variationalOptimizer,
            List<FermionOperator> annihilators, List<FermionOperator> creators,
            double[] initialParameters, int maxAttempts, int parallelism) {
        Preconditions.checkNotNull(hamiltonianBuilder, "hamiltonianBuilder は null 不可です");
        Preconditions.checkNotNull(exactSolver, "exactSolver は null 不可です");
        Preconditions.checkNotNull(variationalOptimizer, "variationalOptimizer は null 不可です");
        Preconditions.checkNotNull(annihilators, "annihilators は null 不可です");
        Preconditions.checkNotNull(creators, "creators は null 不可です");
        Preconditions.checkNotNull(initialParameters, "initialParameters は null 不可です");
        Preconditions.checkArgument(maxAttempts > 0, "maxAttempts は 1 以上が必要です: %s", maxAttempts);
        Preconditions.checkArgument(parallelism > 0, "parallelism は 1 以上が必要です: %s", parallelism);
        this.hamiltonianBuilder = hamiltonianBuilder;
        this.exactSolver = exactSolver;
        this.variationalOptimizer = variationalOptimizer;
        this.annihilators = List.copyOf(annihilators);
        this.creators = List.copyOf(creators);
        this.initialParameters = initialParameters.clone();
        this.maxAttempts = maxAttempts;
        this.parallelism = parallelism;
    }

    /**
     * 全距離点を計算します。
     *
     * @param points 距離点ごとの分子積分です
     * @return 距離点ごとの結果です（入力と同じ順）
     * @throws BackendExecutionException 再試行しても変分最小化が失敗した場合に発生します
     */
    public List<DistancePointResult> scan(List<MolecularIntegrals> points) {
        Preconditions.checkNotNull(points, "points は null 不可です");
        int total = points.size();
        log.info("解離曲線の計算を開始します。距離点数={}、並列数={}、最大試行回数={}", total, parallelism, maxAttempts);

        List<DistancePointResult> results = new ArrayList<>(total);
        if (parallelism == 1 || total <= 1) {
            for (int i = 0; i < total; i++) {
                results.add(computePoint(points.get(i), i + 1, total));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, total),
                new ThreadFactoryBuilder().setNameFormat("vqe-scan-%d").setDaemon(true).build());
        try {
            List<Future<DistancePointResult>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                MolecularIntegrals p = points.get(i);
                int step = i + 1;
                futures.add(pool.submit(() -> computePoint(p, step, total)));
            }
            for (Future<DistancePointResult> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendExecutionException("解離曲線の計算中に割り込まれました", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("距離点の計算に失敗しました", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 1 つの距離点を計算します。
     *
     * @param point 分子積分です
     * @param step 進捗表示用の番号（1 始まり）です
     * @param total 進捗表示用の総数です
     * @return 計算結果です
     * @throws DimensionMismatchException 軌道数が演算子の数と一致しない場合に発生します
     * @throws BackendExecutionException 再試行しても変分最小化が失敗した場合に発生します
     */
    public DistancePointResult computePoint(MolecularIntegrals point, int step, int total) {
        Preconditions.checkNotNull(point, "point は null 不可です");
        if (point.numOrbitals() != annihilators.size()) {
            throw new DimensionMismatchException("分子積分の軌道数", annihilators.size(),
                    point.numOrbitals());
        }

        log.info("=== 距離点 {}/{}：距離={} ===", step, total, fmt5(point.getDistance()));

        PauliSum hamiltonian = hamiltonianBuilder.build(point, annihilators, creators);
        double exact = exactSolver.minimalEigenvalue(hamiltonian, hamiltonian.numQubits());

        OptimizationResult optimization = null;
        BackendExecutionException lastFailure = null;
        int attempt = 0;
        while (optimization == null && attempt < maxAttempts) {
            attempt++;
            try {
                optimization = variationalOptimizer.minimize(hamiltonian, initialParameters);
            } catch (BackendExecutionException e) {
                lastFailure = e;
                log.warn("変分最小化が失敗しました。距離={}、試行={}/{}、原因={}", fmt5(point.getDistance()),
                        attempt, maxAttempts, e.getMessage());
            }
        }
        if (optimization == null) {
            throw new BackendExecutionException("変分最小化が再試行の上限に達しました。距離="
                    + point.getDistance() + "、試行回数=" + maxAttempts, lastFailure);
        }

        DistancePointResult result = new DistancePointResult(point.getDistance(), exact,
                optimization.getCost(), point.getNuclearRepulsion(), hamiltonian.size(), attempt,
                optimization);

        log.info("結果: 距離={}、厳密={}、変分={}、差={}、核間反発={}", fmt5(point.getDistance()),
                fmt8(exact), fmt8(optimization.getCost()), fmt8(optimization.getCost() - exact),
                fmt8(point.getNuclearRepulsion()));
        return result;
    }

    /**
     * 小数点以下 5 桁で整形します。
     *
     * @param v 値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
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
