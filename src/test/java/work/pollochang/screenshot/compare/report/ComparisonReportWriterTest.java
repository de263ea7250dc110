package work.pollochang.screenshot.compare.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.screenshot.compare.core.ColorMode;
import work.pollochang.screenshot.compare.core.ComparisonError;
import work.pollochang.screenshot.compare.core.ComparisonResult;
import work.pollochang.screenshot.compare.core.ImageInfo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonReportWriterTest {

    private static BatchReport sampleReport(Path dir) {
        PairReport similar = PairReport.of(dir.resolve("a.png"), dir.resolve("b.png"),
                ComparisonResult.of(1.0, 0.99, 0.001, 0.95, false, null)
                        .withImages(new ImageInfo(10, 10, ColorMode.RGB), new ImageInfo(20, 20, ColorMode.RGBA)),
                dir.resolve("diff_a_b.png"));
        PairReport failed = PairReport.of(dir.resolve("c.png"), dir.resolve("d.png"),
                ComparisonResult.failed(ComparisonError.DECODE_FAILURE, 0.95, "bad png"), null);
        PairReport missing = PairReport.notFound(dir.resolve("e.png"), dir.resolve("f.png"), 0.95,
                dir.resolve("f.png"));

        Map<ComparisonOutcome, Long> counts = new EnumMap<>(ComparisonOutcome.class);
        counts.put(ComparisonOutcome.SIMILAR, 1L);
        counts.put(ComparisonOutcome.FAILED, 1L);
        counts.put(ComparisonOutcome.SKIPPED_NOT_FOUND, 1L);
        return new BatchReport(0.95, 3, counts, List.of(similar, failed, missing));
    }

    @Test
    void testWriteThenRead_ShouldKeepAllFields(@TempDir Path tempDir) throws IOException {
        ComparisonReportWriter writer = new ComparisonReportWriter();
        BatchReport report = sampleReport(tempDir);

        Path file = writer.write(report, tempDir);
        BatchReport loaded = writer.read(file);

        assertEquals(tempDir.resolve(ComparisonReportWriter.REPORT_FILE_NAME), file);
        assertEquals(report, loaded);
        assertEquals(1, loaded.count(ComparisonOutcome.FAILED));
        assertEquals(0, loaded.count(ComparisonOutcome.DIFFERENT));
        assertEquals("DECODE_FAILURE", loaded.pairs().get(1).error());
        assertEquals(new ImageInfo(20, 20, ColorMode.RGBA), loaded.pairs().get(0).actualImage());
    }

    /**
     * 成功的比對不輸出錯誤欄位
     */
    @Test
    void testSuccessfulPair_ShouldOmitNullFields(@TempDir Path tempDir) throws IOException {
        BatchReport report = new BatchReport(0.95, 1, Map.of(ComparisonOutcome.SIMILAR, 1L),
                List.of(sampleReport(tempDir).pairs().get(0)));

        Path file = new ComparisonReportWriter().write(report, tempDir);
        String json = Files.readString(file, StandardCharsets.UTF_8);

        assertTrue(json.contains("\"hashSimilarity\""));
        assertTrue(json.contains("\"diffImage\""));
        assertFalse(json.contains("\"errorMessage\""));
        assertFalse(json.contains("\"diffImageBase64\""));
        assertTrue(json.contains("\"baselineImage\""));
        assertTrue(json.contains("\"mode\" : \"RGBA\""));
        assertFalse(json.contains("allSimilar"));
    }

    @Test
    void testAllSimilar() {
        BatchReport empty = new BatchReport(0.95, 0, Map.of(), List.of());
        BatchReport allOk = new BatchReport(0.95, 2, Map.of(ComparisonOutcome.SIMILAR, 2L), List.of());

        assertFalse(empty.allSimilar());
        assertTrue(allOk.allSimilar());
        assertFalse(sampleReport(Path.of("shots")).allSimilar());
    }

    @Test
    void testOutcomeOfResult() {
        assertEquals(ComparisonOutcome.SIMILAR,
                ComparisonOutcome.of(ComparisonResult.of(1.0, 1.0, 0.0, 0.95, false, null)));
        assertEquals(ComparisonOutcome.DIFFERENT,
                ComparisonOutcome.of(ComparisonResult.of(1.0, 0.5, 0.2, 0.95, false, null)));
        assertEquals(ComparisonOutcome.FAILED,
                ComparisonOutcome.of(ComparisonResult.failed(ComparisonError.ZERO_SIZE, 0.95, "empty")));
    }
}
