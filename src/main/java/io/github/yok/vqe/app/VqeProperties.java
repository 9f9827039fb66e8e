package io.github.yok.vqe.app;

import io.github.yok.vqe.core.solver.CommonsMathMinimizer;
import java.util.Arrays;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * vqe-solver の設定値（vqe.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "vqe")
public class VqeProperties {

    /**
     * スピン軌道数（= 量子ビット数）です。
     */
    @Min(1)
    private int orbitals = 4;

    /**
     * 分子積分の入力設定です。
     */
    @Valid
    private Integrals integrals = new Integrals();

    /**
     * 試行状態（アンザッツ）の設定です。
     */
    @Valid
    private Ansatz ansatz = new Ansatz();

    /**
     * 期待値推定の設定です。
     */
    @Valid
    private Estimation estimation = new Estimation();

    /**
     * 古典最適化の設定です。
     */
    @Valid
    private Optimizer optimizer = new Optimizer();

    /**
     * 距離スキャンの設定です。
     */
    @Valid
    private Scan scan = new Scan();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "vqe")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Ansatz a = getAnsatz();
        Estimation e = getEstimation();
        Optimizer o = getOptimizer();
        Scan s = getScan();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "system",
                // orbitals: スピン軌道数（量子ビット数）
                "orbitals", getOrbitals());

        appendSection(sb, nl, "integrals",
                // dir: 距離点ごとの積分 CSV を置いたディレクトリ
                "dir", getIntegrals().getDir());

        appendSection(sb, nl, "ansatz",
                // basisStates: 重ね合わせる計算基底の添字
                "basisStates", a.getBasisStates(),
                // initialParameters: 最小化の初期パラメータ
                "initialParameters", a.getInitialParameters());

        appendSection(sb, nl, "estimation",
                "mode", e.getMode(),
                "shots", e.getShots(),
                "seed", e.getSeed(),
                // termTimeoutMillis: 1 項の推定を待つ上限時間
                "termTimeoutMillis", e.getTermTimeoutMillis(),
                // termParallelism: 項ごとの推定の並列数（1 なら逐次）
                "termParallelism", e.getTermParallelism(),
                "imaginaryTolerance", e.getImaginaryTolerance());

        appendSection(sb, nl, "optimizer",
                "method", o.getMethod(),
                "initialStep", o.getInitialStep(),
                "relativeTolerance", o.getRelativeTolerance(),
                "absoluteTolerance", o.getAbsoluteTolerance(),
                "maxEvaluations", o.getMaxEvaluations());

        appendSection(sb, nl, "scan",
                // parallelism: 距離点を並行計算するワーカー数
                "parallelism", s.getParallelism(),
                // maxAttempts: 変分最小化の最大試行回数
                "maxAttempts", s.getMaxAttempts());

        appendSection(sb, nl, "output",
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を YAML 風に追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            if (val instanceof double[]) {
                val = Arrays.toString((double[]) val);
            }
            sb.append("    ").append(kvPairs[i]).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Integrals {

        /**
         * 積分 CSV のディレクトリです。
         */
        @NotBlank
        private String dir = "./integrals";
    }

    @Data
    public static class Ansatz {

        /**
         * 重ね合わせる計算基底の添字です（2 個以上）。
         *
         * <p>
         * 既定値 {5, 10} は 4 量子ビットで {@code |0101⟩} と {@code |1010⟩} の重ね合わせです。
         * </p>
         */
        @NotEmpty
        private List<Integer> basisStates = List.of(5, 10);

        /**
         * 最小化の初期パラメータです（長さ = basisStates の個数 - 1）。
         */
        @NotNull
        private double[] initialParameters = {0.0};
    }

    @Data
    public static class Estimation {

        /**
         * 推定方式です。
         */
        @NotNull
        private Mode mode = Mode.EXACT;

        /**
         * SAMPLED のショット数です。
         */
        @Min(1)
        private int shots = 512;

        /**
         * SAMPLED の乱数シードです。
         */
        private long seed = 7L;

        /**
         * 1 項の推定を待つ上限時間（ミリ秒）です。
         */
        @Min(1)
        private long termTimeoutMillis = 10_000L;

        /**
         * 項ごとの推定の並列数です。
         */
        @Min(1)
        private int termParallelism = 1;

        /**
         * コストの虚部の許容上限です。
         */
        @DecimalMin("0.0")
        private double imaginaryTolerance = 1e-6;

        public enum Mode {
            EXACT, SAMPLED
        }
    }

    @Data
    public static class Optimizer {

        /**
         * 最小化の手法です。
         */
        @NotNull
        private CommonsMathMinimizer.Method method = CommonsMathMinimizer.Method.NELDER_MEAD;

        /**
         * 初期単体の辺の長さです。
         */
        private double initialStep = 0.5;

        /**
         * 収束判定の相対許容誤差です。
         */
        private double relativeTolerance = 1e-10;

        /**
         * 収束判定の絶対許容誤差です。
         */
        private double absoluteTolerance = 1e-12;

        /**
         * コスト関数の最大評価回数です。
         */
        @Min(1)
        private int maxEvaluations = 2000;
    }

    @Data
    public static class Scan {

        @Min(1)
        /**
         * 距離点を並行に計算するワーカー数です。
         */
        private int parallelism = 1;

        @Min(1)
        /**
         * バックエンドの失敗時に変分最小化を試行する最大回数です。
         */
        private int maxAttempts = 3;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
