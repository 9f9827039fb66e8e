package io.github.yok.vqe.app;

import io.github.yok.vqe.core.hamiltonian.MolecularIntegrals;
import io.github.yok.vqe.core.solver.CurveSummary;
import io.github.yok.vqe.core.solver.DissociationCurveScanner;
import io.github.yok.vqe.core.solver.DistancePointResult;
import io.github.yok.vqe.input.IntegralSource;
import io.github.yok.vqe.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で vqe-solver を実行するクラスです。
 *
 * <p>
 * 距離点ごとの分子積分を読み込み、厳密解と VQE 推定値の解離曲線を求めて CSV に出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class VqeCliRunner implements CommandLineRunner {

    /**
     * vqe-solver の設定値（vqe.*）です。
     */
    private final VqeProperties properties;

    /**
     * 分子積分の読み込み元です。
     */
    private final IntegralSource integralSource;

    /**
     * 解離曲線スキャナです。
     */
    private final DissociationCurveScanner scanner;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== vqe-solver start: dissociation curve ===");
        System.out.print(properties.toMultilineString());

        List<MolecularIntegrals> points = integralSource.load();
        if (points.isEmpty()) {
            throw new IllegalStateException(
                    "積分ファイルが 1 つもありません: " + properties.getIntegrals().getDir());
        }

        List<DistancePointResult> results = scanner.scan(points);
        CurveSummary summary = CurveSummary.of(results);
        resultWriter.write(results, summary);

        System.out.println("=== 解離曲線 ===");
        for (DistancePointResult r : results) {
            System.out.println("距離=" + fmt5(r.getDistance()) + ", 厳密="
                    + fmt8(r.exactTotalEnergy()) + ", VQE=" + fmt8(r.variationalTotalEnergy())
                    + ", 評価回数=" + r.getOptimization().getEvaluations());
        }
        System.out.println("結果: 平衡距離（厳密）=" + fmt5(summary.getExactEquilibriumDistance())
                + ", 最小エネルギー（厳密）=" + fmt8(summary.getMinimalExactEnergy()));
        System.out.println("結果: 平衡距離（VQE）=" + fmt5(summary.getVariationalEquilibriumDistance())
                + ", 最小エネルギー（VQE）=" + fmt8(summary.getMinimalVariationalEnergy()));
        System.out.println("結果: 平均二乗誤差=" + String.format(Locale.ROOT, "%.3e",
                summary.getMeanSquaredError()));
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
