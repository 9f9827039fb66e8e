package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.estimation.ExpectationEstimator;
import io.github.yok.vqe.core.estimation.StateVectorExpectationEstimator;
import io.github.yok.vqe.core.exception.BackendExecutionException;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.pauli.PauliSum;
import io.github.yok.vqe.core.pauli.PauliTerm;
import io.github.yok.vqe.core.state.SuperpositionStatePreparation;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class VariationalOptimizerTest {

    private final Minimizer minimizer = new CommonsMathMinimizer(
            CommonsMathMinimizer.Method.NELDER_MEAD, 0.5, 1e-10, 1e-12, 2000);

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void singleQubitTransverseFieldReachesMinusOne() {
        VariationalOptimizer optimizer = optimizer(1, new int[] {0, 1},
                new StateVectorExpectationEstimator(), null);
        PauliSum h = PauliSum.of(PauliTerm.parse("X"), Complex.ONE);

        OptimizationResult r = optimizer.minimize(h, new double[] {0.0});

        assertTrue(r.isConverged());
        assertEquals(-1.0, r.getCost(), 1e-3);
        assertEquals(1, r.getParameters().length);
        assertTrue(r.getEvaluations() > 0);
    }

    @Test
    void costSumsCoefficientTimesExpectation() {
        VariationalOptimizer optimizer = optimizer(2, new int[] {0, 3},
                new StateVectorExpectationEstimator(), null);
        PauliSum h = PauliSum.builder(2).add(PauliTerm.identity(2), -0.5, 0.0)
                .add(PauliTerm.parse("ZI"), 0.25, 0.0).add(PauliTerm.parse("XX"), 0.75, 0.0)
                .build();
        double theta = 0.9;

        double cost = optimizer.cost(h, new double[] {theta});

        // <ZI> = cos θ, <XX> = sin θ
        assertEquals(-0.5 + 0.25 * Math.cos(theta) + 0.75 * Math.sin(theta), cost, 1e-12);
    }

    @Test
    void concurrentTermEstimationMatchesSequential() {
        PauliSum h = PauliSum.builder(3).add(PauliTerm.identity(3), -0.3, 0.0)
                .add(PauliTerm.parse("ZIZ"), 0.17, 0.0).add(PauliTerm.parse("XXI"), -0.41, 0.0)
                .add(PauliTerm.parse("YYI"), 0.05, 0.0).add(PauliTerm.parse("IZZ"), 0.9, 0.0)
                .build();
        int[] basis = {0b001, 0b110, 0b111};
        double[] params = {0.7, -1.9};

        double sequential = optimizer(3, basis, new StateVectorExpectationEstimator(), null)
                .cost(h, params);
        double concurrent = optimizer(3, basis, new StateVectorExpectationEstimator(), executor)
                .cost(h, params);

        assertEquals(sequential, concurrent, 0.0);
    }

    @Test
    void estimatorFailureSurfacesAsBackendError() {
        ExpectationEstimator failing = (term, state) -> {
            throw new IllegalStateException("backend down");
        };
        PauliSum h = PauliSum.of(PauliTerm.parse("Z"), Complex.ONE);

        BackendExecutionException sequential = assertThrows(BackendExecutionException.class,
                () -> optimizer(1, new int[] {0, 1}, failing, null).minimize(h, new double[] {0}));
        assertTrue(sequential.getCause() instanceof IllegalStateException);

        assertThrows(BackendExecutionException.class,
                () -> optimizer(1, new int[] {0, 1}, failing, executor).cost(h, new double[] {0}));
    }

    @Test
    void backendErrorIsPropagatedUnchanged() {
        BackendExecutionException failure = new BackendExecutionException("queue rejected");
        ExpectationEstimator failing = (term, state) -> {
            throw failure;
        };
        PauliSum h = PauliSum.of(PauliTerm.parse("Z"), Complex.ONE);

        BackendExecutionException thrown = assertThrows(BackendExecutionException.class,
                () -> optimizer(1, new int[] {0, 1}, failing, executor).cost(h, new double[] {0}));
        assertSame(failure, thrown);
    }

    @Test
    void slowEstimationTimesOut() {
        ExpectationEstimator slow = (term, state) -> {
            try {
                Thread.sleep(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0.0;
        };
        VariationalOptimizer optimizer = new VariationalOptimizer(
                new SuperpositionStatePreparation(1, new int[] {0, 1}), slow, minimizer, executor,
                50L, 1e-6);
        PauliSum h = PauliSum.of(PauliTerm.parse("Z"), Complex.ONE);

        assertThrows(BackendExecutionException.class, () -> optimizer.cost(h, new double[] {0}));
    }

    @Test
    void slowEstimationTimesOutWithoutSuppliedExecutor() {
        ExpectationEstimator slow = (term, state) -> {
            try {
                Thread.sleep(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0.0;
        };
        VariationalOptimizer optimizer = new VariationalOptimizer(
                new SuperpositionStatePreparation(1, new int[] {0, 1}), slow, minimizer, null,
                50L, 1e-6);
        PauliSum h = PauliSum.of(PauliTerm.parse("Z"), Complex.ONE);

        long t0 = System.nanoTime();
        assertThrows(BackendExecutionException.class, () -> optimizer.cost(h, new double[] {0}));
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        assertTrue(elapsedMs < 1_500L, "elapsed=" + elapsedMs + "ms");
    }

    @Test
    void programmingErrorsAreNotWrappedAsBackendErrors() {
        IllegalArgumentException badArgument = new IllegalArgumentException("unsupported state");
        ExpectationEstimator rejecting = (term, state) -> {
            throw badArgument;
        };
        ExpectationEstimator nullDereference = (term, state) -> {
            throw new NullPointerException("state");
        };
        PauliSum h = PauliSum.of(PauliTerm.parse("Z"), Complex.ONE);

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> optimizer(1, new int[] {0, 1}, rejecting, null).cost(h, new double[] {0}));
        assertSame(badArgument, thrown);
        assertThrows(NullPointerException.class, () -> optimizer(1, new int[] {0, 1},
                nullDereference, executor).cost(h, new double[] {0}));
    }

    @Test
    void resultParametersCannotBeModifiedByCallers() {
        double[] initial = {0.0};
        VariationalOptimizer optimizer = optimizer(1, new int[] {0, 1},
                new StateVectorExpectationEstimator(), null);

        OptimizationResult r =
                optimizer.minimize(PauliSum.of(PauliTerm.parse("X"), Complex.ONE), initial);
        double converged = r.getParameters()[0];
        r.getParameters()[0] = 99.0;

        assertEquals(converged, r.getParameters()[0], 0.0);
        assertEquals(0.0, initial[0], 0.0);
    }

    @Test
    void dimensionMismatchIsNotRetriedAsBackendError() {
        VariationalOptimizer optimizer = optimizer(2, new int[] {0, 3},
                new StateVectorExpectationEstimator(), null);

        assertThrows(DimensionMismatchException.class,
                () -> optimizer.minimize(PauliSum.identity(3), new double[] {0.0}));
        assertThrows(DimensionMismatchException.class,
                () -> optimizer.minimize(PauliSum.identity(2), new double[] {0.0, 1.0}));
    }

    private VariationalOptimizer optimizer(int numQubits, int[] basis,
            ExpectationEstimator estimator, ExecutorService termExecutor) {
        return new VariationalOptimizer(new SuperpositionStatePreparation(numQubits, basis),
                estimator, minimizer, termExecutor, 10_000L, 1e-6);
    }
}
