package io.github.yok.vqe.out;

import io.github.yok.vqe.core.solver.CurveSummary;
import io.github.yok.vqe.core.solver.DistancePointResult;
import io.github.yok.vqe.core.solver.OptimizationResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <ul>
 * <li>{@code vqe_dissociation_curve.csv}: 距離点ごとの厳密解・変分解（電子エネルギーと全エネルギー）</li>
 * <li>{@code vqe_summary.csv}: 平衡距離、最小エネルギー、2 曲線間の平均二乗誤差など</li>
 * </ul>
 */
@Slf4j
@Getter
public final class CsvResultWriter implements ResultWriter {

    /**
     * 解離曲線のファイル名です。
     */
    public static final String CURVE_FILE = "vqe_dissociation_curve.csv";

    /**
     * 要約のファイル名です。
     */
    public static final String SUMMARY_FILE = "vqe_summary.csv";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 距離点ごとの結果と要約を出力します。
     *
     * @param results 距離点ごとの結果です
     * @param summary 要約です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(List<DistancePointResult> results, CurveSummary summary) {
        if (results == null) {
            throw new IllegalArgumentException("results は null 不可です");
        }
        if (summary == null) {
            throw new IllegalArgumentException("summary は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);
            writeCurveCsv(results);
            writeSummaryCsv(summary);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("計算結果を出力しました: {}", outputDir.toAbsolutePath());
    }

    /**
     * 距離点ごとの解離曲線を書き出します。
     *
     * @param results 距離点ごとの結果です
     * @throws IOException 書き込みに失敗した場合に発生します
     */
    private void writeCurveCsv(List<DistancePointResult> results) throws IOException {
        Path file = outputDir.resolve(CURVE_FILE);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("distance", "exactEnergy", "variationalEnergy",
                                "nuclearRepulsion", "exactTotalEnergy", "variationalTotalEnergy",
                                "error", "hamiltonianTerms", "evaluations", "attempts",
                                "converged")
                        .build().print(w)) {

            for (DistancePointResult r : results) {
                OptimizationResult opt = r.getOptimization();
                pr.printRecord(r.getDistance(), r.getExactEnergy(), r.getVariationalEnergy(),
                        r.getNuclearRepulsion(), r.exactTotalEnergy(), r.variationalTotalEnergy(),
                        r.getVariationalEnergy() - r.getExactEnergy(),
                        r.getHamiltonianTermCount(), opt.getEvaluations(), r.getAttempts(),
                        opt.isConverged());
            }
        }
    }

    /**
     * 集計値をキーと値の 2 列で書き出します。
     *
     * @param summary 集計値です
     * @throws IOException 書き込みに失敗した場合に発生します
     */
    private void writeSummaryCsv(CurveSummary summary) throws IOException {
        Path file = outputDir.resolve(SUMMARY_FILE);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("pointCount", summary.getPointCount());
            pr.printRecord("exact.minimalTotalEnergy", summary.getMinimalExactEnergy());
            pr.printRecord("exact.equilibriumDistance", summary.getExactEquilibriumDistance());
            pr.printRecord("variational.minimalTotalEnergy",
                    summary.getMinimalVariationalEnergy());
            pr.printRecord("variational.equilibriumDistance",
                    summary.getVariationalEquilibriumDistance());
            pr.printRecord("meanSquaredError", summary.getMeanSquaredError());
        }
    }
}
