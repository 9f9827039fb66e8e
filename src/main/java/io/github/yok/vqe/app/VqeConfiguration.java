package io.github.yok.vqe.app;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.vqe.core.estimation.ExpectationEstimator;
import io.github.yok.vqe.core.estimation.SampledExpectationEstimator;
import io.github.yok.vqe.core.estimation.StateVectorExpectationEstimator;
import io.github.yok.vqe.core.fermion.FermionOperator;
import io.github.yok.vqe.core.fermion.JordanWignerMapper;
import io.github.yok.vqe.core.hamiltonian.HamiltonianBuilder;
import io.github.yok.vqe.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.vqe.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vqe.core.solver.CommonsMathMinimizer;
import io.github.yok.vqe.core.solver.DissociationCurveScanner;
import io.github.yok.vqe.core.solver.ExactSolver;
import io.github.yok.vqe.core.solver.Minimizer;
import io.github.yok.vqe.core.solver.VariationalOptimizer;
import io.github.yok.vqe.core.state.StatePreparation;
import io.github.yok.vqe.core.state.SuperpositionStatePreparation;
import io.github.yok.vqe.input.CsvIntegralSource;
import io.github.yok.vqe.input.IntegralSource;
import io.github.yok.vqe.out.CsvResultWriter;
import io.github.yok.vqe.out.ResultWriter;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jordan-Wigner 写像 + 厳密対角化 + VQE による解離曲線計算の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class VqeConfiguration {

    /**
     * vqe-solver の設定値（vqe.*）です。
     */
    private final VqeProperties p;

    /**
     * Jordan-Wigner 写像を生成します。
     *
     * @return 写像です
     */
    @Bean
    public JordanWignerMapper jordanWignerMapper() {
        return new JordanWignerMapper();
    }

    /**
     * ハミルトニアン構築器を生成します。
     *
     * @return 構築器です
     */
    @Bean
    public HamiltonianBuilder hamiltonianBuilder() {
        return new HamiltonianBuilder();
    }

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlSymmetricEigenDecompositionBackend();
    }

    /**
     * 厳密対角化ソルバを生成します。
     *
     * @param eigen 固有分解バックエンドです
     * @return 厳密対角化ソルバです
     */
    @Bean
    public ExactSolver exactSolver(EigenDecompositionBackend eigen) {
        return new ExactSolver(eigen);
    }

    /**
     * 試行状態の準備ロジックを生成します。
     *
     * @return 状態準備です
     */
    @Bean
    public StatePreparation statePreparation() {
        int[] basis = p.getAnsatz().getBasisStates().stream().mapToInt(Integer::intValue).toArray();
        return new SuperpositionStatePreparation(p.getOrbitals(), basis);
    }

    /**
     * 設定された方式の期待値推定器を生成します。
     *
     * @return 期待値推定器です
     */
    @Bean
    public ExpectationEstimator expectationEstimator() {
        VqeProperties.Estimation e = p.getEstimation();
        if (e.getMode() == VqeProperties.Estimation.Mode.SAMPLED) {
            return new SampledExpectationEstimator(e.getShots(), e.getSeed());
        }
        return new StateVectorExpectationEstimator();
    }

    /**
     * 導関数不要の最小化器を生成します。
     *
     * @return 最小化器です
     */
    @Bean
    public Minimizer minimizer() {
        VqeProperties.Optimizer o = p.getOptimizer();
        return new CommonsMathMinimizer(o.getMethod(), o.getInitialStep(),
                o.getRelativeTolerance(), o.getAbsoluteTolerance(), o.getMaxEvaluations());
    }

    /**
     * 項ごとの推定を実行するワーカープールを生成します。
     *
     * <p>
     * 距離点を並行に計算する場合でも各点が termParallelism 本ずつ使えるよう、スキャンの並列数を掛けた大きさにします。
     * </p>
     *
     * @return ワーカープールです
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService termExecutor() {
        int threads = p.getEstimation().getTermParallelism() * p.getScan().getParallelism();
        return Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("vqe-term-%d").setDaemon(true).build());
    }

    /**
     * 変分最適化器を生成します。
     *
     * <p>
     * 各項の推定はワーカープールへ投入し、termTimeoutMillis を上限に待ちます。
     * </p>
     *
     * @param statePreparation 状態準備です
     * @param estimator 期待値推定器です
     * @param minimizer 最小化器です
     * @param termExecutor 項ごとの推定用ワーカープールです
     * @return 変分最適化器です
     */
    @Bean
    public VariationalOptimizer variationalOptimizer(StatePreparation statePreparation,
            ExpectationEstimator estimator, Minimizer minimizer, ExecutorService termExecutor) {
        VqeProperties.Estimation e = p.getEstimation();
        return new VariationalOptimizer(statePreparation, estimator, minimizer, termExecutor,
                e.getTermTimeoutMillis(), e.getImaginaryTolerance());
    }

    /**
     * 解離曲線スキャナを生成します。
     *
     * <p>
     * 起動時に Jordan-Wigner 演算子を一度だけ生成し、正準反交換関係を検証します。
     * </p>
     *
     * @param mapper Jordan-Wigner 写像です
     * @param builder ハミルトニアン構築器です
     * @param exactSolver 厳密対角化ソルバです
     * @param variationalOptimizer 変分最適化器です
     * @return スキャナです
     */
    @Bean
    public DissociationCurveScanner dissociationCurveScanner(JordanWignerMapper mapper,
            HamiltonianBuilder builder, ExactSolver exactSolver,
            VariationalOptimizer variationalOptimizer) {
        List<FermionOperator> annihilators = mapper.annihilationOperators(p.getOrbitals());
        List<FermionOperator> creators = mapper.creationOperators(annihilators);
        mapper.verifyAnticommutation(annihilators, creators);

        VqeProperties.Scan s = p.getScan();
        return new DissociationCurveScanner(builder, exactSolver, variationalOptimizer,
                annihilators, creators, p.getAnsatz().getInitialParameters(), s.getMaxAttempts(),
                s.getParallelism());
    }

    /**
     * 分子積分の読み込み元を生成します。
     *
     * @return 読み込み元です
     */
    @Bean
    public IntegralSource integralSource() {
        return new CsvIntegralSource(p.getIntegrals().getDir(), p.getOrbitals());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
