package io.github.yok.vqe.core.solver;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Value;

/**
 * 解離曲線全体の要約（最小エネルギーとその距離、厳密曲線との平均二乗誤差）です。
 */
@Value
public class CurveSummary {

    /**
     * 距離点の数です。
     */
    int pointCount;

    /**
     * 厳密な全エネルギーの最小値です。
     */
    double minimalExactEnergy;

    /**
     * 厳密な全エネルギーが最小となる距離です。
     */
    double exactEquilibriumDistance;

    /**
     * 変分による全エネルギーの最小値です。
     */
    double minimalVariationalEnergy;

    /**
     * 変分による全エネルギーが最小となる距離です。
     */
    double variationalEquilibriumDistance;

    /**
     * 変分曲線と厳密曲線の平均二乗誤差です。
     */
    double meanSquaredError;

    /**
     * 距離点ごとの結果から要約を作成します。
     *
     * @param results 距離点ごとの結果です（1 件以上）
     * @return 要約です
     */
    public static CurveSummary of(List<DistancePointResult> results) {
        Preconditions.checkNotNull(results, "results は null 不可です");
        Preconditions.checkArgument(!results.isEmpty(), "results が空です");

        DistancePointResult bestExact = results.get(0);
        DistancePointResult bestVariational = results.get(0);
        double sumSq = 0.0;
        for (DistancePointResult r : results) {
            if (r.exactTotalEnergy() < bestExact.exactTotalEnergy()) {
                bestExact = r;
            }
            if (r.variationalTotalEnergy() < bestVariational.variationalTotalEnergy()) {
                bestVariational = r;
            }
            double d = r.variationalTotalEnergy() - r.exactTotalEnergy();
            sumSq += d * d;
        }
        return new CurveSummary(results.size(), bestExact.exactTotalEnergy(),
                bestExact.getDistance(), bestVariational.variationalTotalEnergy(),
                bestVariational.getDistance(), sumSq / results.size());
    }
}
