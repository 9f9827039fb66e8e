package io.github.yok.vqe.core.solver;

import lombok.Value;

/**
 * 1 つの原子間距離における計算結果（厳密値・変分値・核間反発）を表すクラスです。
 */
@Value
public class DistancePointResult {

    /**
     * 原子間距離です。
     */
    double distance;

    /**
     * 厳密対角化による電子エネルギー（最小固有値）です。
     */
    double exactEnergy;

    /**
     * 変分最小化による電子エネルギー（最小コスト）です。
     */
    double variationalEnergy;

    /**
     * 核間反発エネルギーです。
     */
    double nuclearRepulsion;

    /**
     * ハミルトニアンの Pauli 項数です。
     */
    int hamiltonianTermCount;

    /**
     * 変分最小化に要した試行回数です（再試行を含む）。
     */
    int attempts;

    /**
     * 変分最小化の結果です。
     */
    OptimizationResult optimization;

    /**
     * 厳密な全エネルギー（電子エネルギー + 核間反発）を返します。
     *
     * @return 全エネルギーです
     */
    public double exactTotalEnergy() {
        return exactEnergy + nuclearRepulsion;
    }

    /**
     * 変分による全エネルギー（電子エネルギー + 核間反発）を返します。
     *
     * @return 全エネルギーです
     */
    public double variationalTotalEnergy() {
        return variationalEnergy + nuclearRepulsion;
    }
}
