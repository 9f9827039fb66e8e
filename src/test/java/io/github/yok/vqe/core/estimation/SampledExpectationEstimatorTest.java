package io.github.yok.vqe.core.estimation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.pauli.PauliTerm;
import io.github.yok.vqe.core.state.StateVector;
import io.github.yok.vqe.core.state.SuperpositionStatePreparation;
import org.junit.jupiter.api.Test;

class SampledExpectationEstimatorTest {

    private final SuperpositionStatePreparation prep =
            new SuperpositionStatePreparation(2, new int[] {0, 3});

    @Test
    void sameSeedGivesSameEstimate() {
        StateVector psi = prep.prepare(new double[] {1.1});
        PauliTerm zi = PauliTerm.parse("ZI");

        double a = new SampledExpectationEstimator(512, 7L).estimate(zi, psi);
        double b = new SampledExpectationEstimator(512, 7L).estimate(zi, psi);

        assertEquals(a, b, 0.0);
    }

    @Test
    void estimateIsMultipleOfShotResolutionNearExactValue() {
        int shots = 4096;
        StateVector psi = prep.prepare(new double[] {1.1});
        PauliTerm zi = PauliTerm.parse("ZI");
        double exact = new StateVectorExpectationEstimator().estimate(zi, psi);

        double sampled = new SampledExpectationEstimator(shots, 11L).estimate(zi, psi);

        double plus = (sampled + 1.0) * shots / 2.0;
        assertEquals(Math.rint(plus), plus, 1e-9);
        assertTrue(sampled >= -1.0 && sampled <= 1.0);
        assertEquals(exact, sampled, 0.1);
    }

    @Test
    void eigenstatesAreMeasuredWithoutNoise() {
        SampledExpectationEstimator estimator = new SampledExpectationEstimator(16, 3L);

        assertEquals(1.0, estimator.estimate(PauliTerm.parse("ZZ"), StateVector.basis(2, 3)), 0.0);
        assertEquals(-1.0, estimator.estimate(PauliTerm.parse("IZ"), StateVector.basis(2, 1)),
                0.0);
        assertEquals(1.0, estimator.estimate(PauliTerm.identity(2), StateVector.basis(2, 2)), 0.0);
    }

    @Test
    void shotsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SampledExpectationEstimator(0, 1L));
    }
}
