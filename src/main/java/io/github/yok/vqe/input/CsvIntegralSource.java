package io.github.yok.vqe.input;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.hamiltonian.MolecularIntegrals;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.math3.complex.Complex;

/**
 * ディレクトリ内の CSV ファイル（1 ファイル = 1 距離点）から分子積分を読み込むクラスです。
 *
 * <p>
 * 各ファイルはヘッダ {@code kind,i,j,k,l,real,imag} を持ち、kind ごとに次の行を含みます。
 * </p>
 *
 * <ul>
 * <li>{@code distance}: 原子間距離（real 列）</li>
 * <li>{@code repulsion}: 核間反発エネルギー（real 列、省略時 0）</li>
 * <li>{@code one_body}: 1 体積分 h[i][j]（real, imag 列）</li>
 * <li>{@code two_body}: 2 体積分 g[i][j][k][l]（real, imag 列）</li>
 * </ul>
 *
 * <p>
 * 記載のないテンソル要素は 0 です。
 * </p>
 */
@Slf4j
@Getter
public final class CsvIntegralSource implements IntegralSource {

    /**
     * 入力ディレクトリです。
     */
    private final Path directory;

    /**
     * 呼び出し側と合意した軌道数です。
     */
    private final int numOrbitals;

    /**
     * 読み込み元を生成します。
     *
     * @param directory 入力ディレクトリです
     * @param numOrbitals 軌道数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvIntegralSource(String directory, int numOrbitals) {
        Preconditions.checkArgument(directory != null && !directory.isEmpty(),
                "integrals.dir は必須です");
        Preconditions.checkArgument(numOrbitals > 0, "軌道数は 1 以上が必要です: %s", numOrbitals);
        this.directory = Paths.get(directory);
        this.numOrbitals = numOrbitals;
    }

    /**
     * ディレクトリ内の全 CSV を読み込み、距離の昇順で返します。
     *
     * @return 分子積分の一覧です
     * @throws IllegalStateException ディレクトリが存在しない、またはファイルの内容が不正な場合に発生します
     * @throws UncheckedIOException 読み込みに失敗した場合に発生します
     */
    @Override
    public List<MolecularIntegrals> load() {
        if (!Files.isDirectory(directory)) {
            throw new IllegalStateException("積分ファイルのディレクトリが存在しません: " + directory);
        }

        List<Path> files;
        try (Stream<Path> s = Files.list(directory)) {
            files = s.filter(
                    p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("積分ファイルの一覧取得に失敗しました: " + directory, e);
        }

        List<MolecularIntegrals> points = new ArrayList<>(files.size());
        for (Path file : files) {
            points.add(read(file));
        }
        points.sort(Comparator.comparingDouble(MolecularIntegrals::getDistance));

        log.info("分子積分を読み込みました。ディレクトリ={}、距離点数={}、軌道数={}", directory, points.size(),
                numOrbitals);
        return points;
    }

    /**
     * 1 ファイルを読み込みます。
     *
     * @param file CSV ファイルです
     * @return 分子積分です
     */
    MolecularIntegrals read(Path file) {
        int n = numOrbitals;
        Complex[][] oneBody = MolecularIntegrals.zeroOneBody(n);
        Complex[][][][] twoBody = MolecularIntegrals.zeroTwoBody(n);
        Double distance = null;
        double repulsion = 0.0;

        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                .setSkipHeaderRecord(true).setIgnoreEmptyLines(true).setTrim(true).build();

        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(r)) {
            for (CSVRecord rec : parser) {
                String kind = rec.get("kind").toLowerCase(Locale.ROOT);
                switch (kind) {
                    case "distance":
                        distance = parseDouble(file, rec, "real");
                        break;
                    case "repulsion":
                        repulsion = parseDouble(file, rec, "real");
                        break;
                    case "one_body":
                        oneBody[index(file, rec, "i")][index(file, rec, "j")] =
                                parseComplex(file, rec);
                        break;
                    case "two_body":
                        twoBody[index(file, rec, "i")][index(file, rec, "j")][index(file, rec,
                                "k")][index(file, rec, "l")] = parseComplex(file, rec);
                        break;
                    default:
                        throw new IllegalStateException("不明な kind です: " + kind + "（" + file + " 行 "
                                + rec.getRecordNumber() + "）");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("積分ファイルの読み込みに失敗しました: " + file, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("積分ファイルの形式が不正です: " + file + "（" + e.getMessage() + "）",
                    e);
        }

        if (distance == null) {
            throw new IllegalStateException("distance 行がありません: " + file);
        }
        return new MolecularIntegrals(distance, oneBody, twoBody, repulsion);
    }

    /**
     * 軌道添字の列を読み取り、範囲を検証します。
     *
     * @param file 読み込み中のファイルです
     * @param rec レコードです
     * @param column 列名です
     * @return 添字です
     * @throws IllegalStateException 数値でない場合や範囲外の場合に発生します
     */
    private int index(Path file, CSVRecord rec, String column) {
        String raw = rec.get(column);
        int v;
        try {
            v = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("添字 " + column + " が整数ではありません: " + raw + "（" + file
                    + " 行 " + rec.getRecordNumber() + "）", e);
        }
        if (v < 0 || v >= numOrbitals) {
            throw new IllegalStateException("添字 " + column + " が範囲外です: " + v + "（軌道数=" + numOrbitals
                    + "、" + file + " 行 " + rec.getRecordNumber() + "）");
        }
        return v;
    }

    /**
     * real 列と imag 列から複素数を読み取ります。imag が空なら 0 とします。
     *
     * @param file 読み込み中のファイルです
     * @param rec レコードです
     * @return 複素数です
     */
    private static Complex parseComplex(Path file, CSVRecord rec) {
        double re = parseDouble(file, rec, "real");
        String imRaw = rec.get("imag");
        double im = (imRaw == null || imRaw.isEmpty()) ? 0.0 : parseDouble(file, rec, "imag");
        return new Complex(re, im);
    }

    /**
     * 数値列を読み取ります。
     *
     * @param file 読み込み中のファイルです
     * @param rec レコードです
     * @param column 列名です
     * @return 値です
     * @throws IllegalStateException 数値でない場合に発生します
     */
    private static double parseDouble(Path file, CSVRecord rec, String column) {
        String raw = rec.get(column);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalStateException("列 " + column + " が数値ではありません: " + raw + "（" + file
                    + " 行 " + rec.getRecordNumber() + "）", e);
        }
    }
}
