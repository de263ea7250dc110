package work.pollochang.screenshot.compare;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.pollochang.screenshot.compare.core.ImageCodec;
import work.pollochang.screenshot.compare.core.PixelImage;
import work.pollochang.screenshot.compare.core.TestImages;
import work.pollochang.screenshot.compare.report.BatchReport;
import work.pollochang.screenshot.compare.report.ComparisonReportWriter;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    private static int run(String... args) {
        return new CommandLine(new Execute()).execute(args);
    }

    /**
     * 執行命令並回傳標準輸出
     */
    private static String runAndCapture(String... args) {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new Execute());
        commandLine.setOut(new PrintWriter(out));
        assertEquals(0, commandLine.execute(args));
        return out.toString();
    }

    private static void writeScreenshots(Path dir) throws IOException {
        PixelImage base = TestImages.gradient(60, 40);
        ImageCodec.writePng(base, dir.resolve("base.png"));
        ImageCodec.writePng(base, dir.resolve("same.png"));
        ImageCodec.writePng(TestImages.withRect(base, 0, 0, 60, 20, 0, 0, 0), dir.resolve("changed.png"));
    }

    /**
     * 全部相似時結束碼為 0
     */
    @Test
    void testSimilarPair_ShouldExitWithZero(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);
        Path out = tempDir.resolve("out");

        int exitCode = run("-b", tempDir.resolve("base.png").toString(),
                "-a", tempDir.resolve("same.png").toString(),
                "-o", out.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(out.resolve(ComparisonReportWriter.REPORT_FILE_NAME)));
    }

    /**
     * 任一組不相似時結束碼為 1
     */
    @Test
    void testPairListWithDifference_ShouldExitWithOne(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);
        Path list = tempDir.resolve("pairs.csv");
        Files.write(list, List.of("base.png,same.png", "base.png,changed.png"), StandardCharsets.UTF_8);

        int exitCode = run("--pair-list", list.toString(),
                "--output-dir", tempDir.resolve("out").toString(),
                "--history-db", tempDir.resolve("history").toString());

        assertEquals(1, exitCode);
        assertTrue(Files.exists(tempDir.resolve("out").resolve("comparisons").resolve("diff_base_changed.png")));
    }

    /**
     * 門檻 0 時任何成功的比對都算相似
     */
    @Test
    void testZeroThreshold_ShouldAcceptDifferentPair(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);

        int exitCode = run("-b", tempDir.resolve("base.png").toString(),
                "-a", tempDir.resolve("changed.png").toString(),
                "-o", tempDir.resolve("out").toString(),
                "-t", "0");

        assertEquals(0, exitCode);
    }

    /**
     * 參數錯誤回傳 picocli 的使用錯誤結束碼
     */
    @Test
    void testInvalidArguments_ShouldExitWithUsageError(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);
        String base = tempDir.resolve("base.png").toString();
        String out = tempDir.resolve("out").toString();

        assertEquals(CommandLine.ExitCode.USAGE, run("-o", out));
        assertEquals(CommandLine.ExitCode.USAGE, run("-b", base, "-o", out));
        assertEquals(CommandLine.ExitCode.USAGE, run("-b", base, "-a", base, "-o", out, "-t", "1.5"));
        assertEquals(CommandLine.ExitCode.USAGE, run("-b", base, "-a", base, "-o", out, "--ssim-window", "4"));
        assertEquals(CommandLine.ExitCode.USAGE, run("-b", base, "-a", base));
    }

    @Test
    void testEmbedDiff_ShouldWriteBase64IntoReport(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);
        Path out = tempDir.resolve("out");

        int exitCode = run("-b", tempDir.resolve("base.png").toString(),
                "-a", tempDir.resolve("changed.png").toString(),
                "-o", out.toString(), "--embed-diff");

        assertEquals(1, exitCode);
        BatchReport report = new ComparisonReportWriter().read(out.resolve(ComparisonReportWriter.REPORT_FILE_NAME));
        assertNotNull(report.pairs().get(0).diffImageBase64());
    }

    /**
     * archive 子命令將截圖移到 archived/，不需要 --output-dir
     */
    @Test
    void testArchiveCommand_ShouldMoveScreenshot(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);
        Path store = tempDir.resolve("store");

        runAndCapture("archive", "-d", store.toString(), "-r", "flaky", tempDir.resolve("base.png").toString());

        assertFalse(Files.exists(tempDir.resolve("base.png")));
        try (Stream<Path> archived = Files.list(store.resolve("archived"))) {
            List<Path> files = archived.collect(Collectors.toList());
            assertEquals(1, files.size());
            assertTrue(files.get(0).getFileName().toString().matches("base_flaky_\\d{8}_\\d{6}\\.png"));
        }
        assertEquals(1, run("archive", "-d", store.toString(), tempDir.resolve("missing.png").toString()));
    }

    @Test
    void testCleanCommand_ShouldDeleteOldScreenshots(@TempDir Path tempDir) throws IOException {
        Path store = tempDir.resolve("store");
        Files.createDirectories(store.resolve("failures"));
        Path old = Files.write(store.resolve("failures").resolve("old.png"), new byte[10]);
        Path recent = Files.write(store.resolve("recent.png"), new byte[5]);
        Files.setLastModifiedTime(old, FileTime.from(Instant.now().minus(Duration.ofDays(10))));

        String output = runAndCapture("clean", "-d", store.toString(), "--days", "7");

        assertTrue(output.contains("deleted=1 freedBytes=10"), output);
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(recent));
        assertEquals(CommandLine.ExitCode.USAGE, run("clean", "-d", store.toString(), "--days", "-1"));
    }

    @Test
    void testStatsCommand_ShouldPrintJson(@TempDir Path tempDir) throws IOException {
        Path store = tempDir.resolve("store");
        Files.createDirectories(store.resolve("successes"));
        Files.write(store.resolve("successes").resolve("ok.png"), new byte[7]);

        String output = runAndCapture("stats", "-d", store.toString());

        assertTrue(output.contains("\"totalScreenshots\" : 1"), output);
        assertTrue(output.contains("\"ok.png\""), output);
        assertTrue(output.contains("\"archived\""), output);
    }

    @Test
    void testCollageCommand_ShouldWriteCollage(@TempDir Path tempDir) throws IOException {
        writeScreenshots(tempDir);
        Path collage = tempDir.resolve("collage.png");

        String output = runAndCapture("collage", "-d", tempDir.resolve("store").toString(), "-o", collage.toString(),
                tempDir.resolve("base.png").toString(), tempDir.resolve("changed.png").toString());

        assertTrue(output.contains(collage.toString()), output);
        PixelImage image = ImageCodec.read(collage);
        assertEquals(800, image.width());
    }
}
