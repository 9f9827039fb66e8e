package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class CurveSummaryTest {

    @Test
    void meanSquaredErrorUsesTotalEnergies() {
        List<DistancePointResult> results = List.of(result(0.6, -1.10, -1.08, 0.8),
                result(0.8, -1.20, -1.17, 0.6), result(1.0, -1.05, -1.05, 0.5));

        CurveSummary s = CurveSummary.of(results);

        assertEquals(3, s.getPointCount());
        // 全エネルギー: 厳密 -0.30, -0.60, -0.55 / 変分 -0.28, -0.57, -0.55
        assertEquals(-0.60, s.getMinimalExactEnergy(), 1e-12);
        assertEquals(0.8, s.getExactEquilibriumDistance(), 0.0);
        assertEquals(-0.57, s.getMinimalVariationalEnergy(), 1e-12);
        assertEquals(0.8, s.getVariationalEquilibriumDistance(), 0.0);
        assertEquals((0.02 * 0.02 + 0.03 * 0.03) / 3.0, s.getMeanSquaredError(), 1e-12);
    }

    @Test
    void emptyCurveIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CurveSummary.of(List.of()));
    }

    private static DistancePointResult result(double distance, double exact, double variational,
            double repulsion) {
        return new DistancePointResult(distance, exact, variational, repulsion, 5, 1,
                new OptimizationResult(new double[] {0.1}, variational, 20, 10, true));
    }
}
