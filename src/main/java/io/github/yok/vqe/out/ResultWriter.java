package io.github.yok.vqe.out;

import io.github.yok.vqe.core.solver.CurveSummary;
import io.github.yok.vqe.core.solver.DistancePointResult;
import java.util.List;

/**
 * 解離曲線の計算結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 距離点ごとの結果と曲線全体の要約を出力します。
     *
     * @param results 距離点ごとの結果です（距離の昇順）
     * @param summary 曲線全体の要約です
     */
    void write(List<DistancePointResult> results, CurveSummary summary);
}
