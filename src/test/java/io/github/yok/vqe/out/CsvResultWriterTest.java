package io.github.yok.vqe.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.solver.CurveSummary;
import io.github.yok.vqe.core.solver.DistancePointResult;
import io.github.yok.vqe.core.solver.OptimizationResult;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesCurveAndSummary() throws IOException {
        List<DistancePointResult> results = List.of(
                new DistancePointResult(0.5, -1.5, -1.49, 1.0, 15, 1,
                        new OptimizationResult(new double[] {0.2}, -1.49, 30, 12, true)),
                new DistancePointResult(0.75, -1.85, -1.85, 0.7, 15, 2,
                        new OptimizationResult(new double[] {-0.2}, -1.85, 41, 18, false)));
        CurveSummary summary = CurveSummary.of(results);
        Path outDir = tempDir.resolve("nested/out");

        new CsvResultWriter(outDir.toString()).write(results, summary);

        List<CSVRecord> curve = read(outDir.resolve(CsvResultWriter.CURVE_FILE));
        assertEquals(2, curve.size());
        assertEquals(0.5, Double.parseDouble(curve.get(0).get("distance")), 0.0);
        assertEquals(-0.5, Double.parseDouble(curve.get(0).get("exactTotalEnergy")), 1e-12);
        assertEquals(-0.49, Double.parseDouble(curve.get(0).get("variationalTotalEnergy")), 1e-12);
        assertEquals("41", curve.get(1).get("evaluations"));
        assertEquals("2", curve.get(1).get("attempts"));
        assertEquals("false", curve.get(1).get("converged"));

        Map<String, String> kv = new HashMap<>();
        for (CSVRecord r : read(outDir.resolve(CsvResultWriter.SUMMARY_FILE))) {
            kv.put(r.get("key"), r.get("value"));
        }
        assertEquals("2", kv.get("pointCount"));
        assertEquals(0.75, Double.parseDouble(kv.get("exact.equilibriumDistance")), 0.0);
        assertTrue(kv.containsKey("meanSquaredError"));
    }

    @Test
    void rejectsMissingArguments() {
        assertThrows(IllegalArgumentException.class, () -> new CsvResultWriter(""));
        CsvResultWriter writer = new CsvResultWriter(tempDir.toString());
        assertThrows(IllegalArgumentException.class, () -> writer.write(null, null));
    }

    private static List<CSVRecord> read(Path file) throws IOException {
        CSVFormat format =
                CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader().setSkipHeaderRecord(true)
                        .build();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(r)) {
            return parser.getRecords();
        }
    }
}
