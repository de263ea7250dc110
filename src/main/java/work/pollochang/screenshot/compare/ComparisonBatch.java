package work.pollochang.screenshot.compare;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.screenshot.compare.core.ComparisonError;
import work.pollochang.screenshot.compare.core.ComparisonResult;
import work.pollochang.screenshot.compare.core.DiffImage;
import work.pollochang.screenshot.compare.core.ImageCodec;
import work.pollochang.screenshot.compare.core.ImageComparator;
import work.pollochang.screenshot.compare.history.H2HistoryManager;
import work.pollochang.screenshot.compare.report.BatchReport;
import work.pollochang.screenshot.compare.report.ComparisonOutcome;
import work.pollochang.screenshot.compare.report.ComparisonParams;
import work.pollochang.screenshot.compare.report.ComparisonReportWriter;
import work.pollochang.screenshot.compare.report.PairReport;
import work.pollochang.screenshot.compare.store.ScreenshotStore;
import work.pollochang.screenshot.compare.store.StoreDirectory;
import work.pollochang.screenshot.compare.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 進行批次截圖比對
 */
@Setter
@Slf4j
public class ComparisonBatch {

    private List<ScreenshotPair> pairs = new ArrayList<>();
    private Path outputDir;
    private ComparisonParams comparisonParams = ComparisonParams.defaults();
    private long timeOutHr = 24;
    private Path historyDbPath;
    private boolean embedDiffImages;

    /**
     * 一組待比對的截圖：基準圖與本次截圖。
     */
    public record ScreenshotPair(Path baseline, Path actual) {}

    /**
     * 讀取比對清單，每行一組 {@code 基準圖<Tab 或逗號>比對圖}，空行與 # 開頭的註解會被略過。
     * 行內有 Tab 時以第一個 Tab 分隔，路徑中可以含逗號；沒有 Tab 時以第一個逗號分隔。
     * 相對路徑以清單檔案所在目錄為基準。
     *
     * @throws IOException 清單無法讀取，或某一行格式錯誤
     */
    public static List<ScreenshotPair> readPairList(Path pairListFile) throws IOException {
        Path baseDir = pairListFile.toAbsolutePath().getParent();
        List<ScreenshotPair> result = new ArrayList<>();
        List<String> lines = Files.readAllLines(pairListFile);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split(line.indexOf('\t') >= 0 ? "\t" : ",", 2);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IOException(String.format("%s 第 %d 行格式錯誤: %s", pairListFile, i + 1, line));
            }
            result.add(new ScreenshotPair(baseDir.resolve(parts[0].trim()), baseDir.resolve(parts[1].trim())));
        }
        return result;
    }

    public BatchReport execute() {
        ScreenshotStore store = new ScreenshotStore(outputDir);
        Path comparisonsDir = store.resolve(StoreDirectory.COMPARISONS);
        ImageComparator comparator = new ImageComparator(comparisonParams);
        double threshold = comparisonParams.threshold();
        boolean embed = embedDiffImages;

        int coreCount = Math.max(1, Runtime.getRuntime().availableProcessors());
        log.info("偵測到 {} 個 CPU 核心，建立固定大小為 {} 的執行緒池。", coreCount, coreCount);
        ExecutorService executor = Executors.newFixedThreadPool(coreCount);

        List<Future<PairReport>> futures = new ArrayList<>();
        List<PairReport> reports = new ArrayList<>();
        try {
            for (ScreenshotPair pair : pairs) {
                futures.add(executor.submit(() -> comparePair(comparator, pair, threshold, comparisonsDir, embed)));
            }

            log.info("所有 {} 組比對任務已提交，等待處理完成...", futures.size());
            executor.shutdown();
            try {
                // 等待所有任務完成，最多等待數小時
                if (!executor.awaitTermination(timeOutHr, TimeUnit.HOURS)) {
                    log.warn("執行緒池等待逾時，部分任務可能未完成。");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("執行緒池被中斷。", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt(); // 恢復中斷狀態
            }

            for (int i = 0; i < futures.size(); i++) {
                reports.add(collect(pairs.get(i), futures.get(i), threshold));
            }
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        // 逾時的任務可能在取消後才完成，因此以收集到的紀錄計數
        Map<ComparisonOutcome, Long> counts = new EnumMap<>(ComparisonOutcome.class);
        for (ComparisonOutcome outcome : ComparisonOutcome.values()) {
            counts.put(outcome, 0L);
        }
        for (PairReport report : reports) {
            counts.merge(report.outcome(), 1L, Long::sum);
        }
        BatchReport batchReport = new BatchReport(threshold, reports.size(), counts, reports);

        try {
            new ComparisonReportWriter().write(batchReport, outputDir);
        } catch (IOException e) {
            log.error("{} - 寫入比對報告時發生錯誤", outputDir, e);
        }

        if (historyDbPath != null) {
            saveHistory(historyDbPath, reports);
        }

        log.info("========================================比對結果統計========================================");
        log.info(" 總計: {}", batchReport.total());
        for (ComparisonOutcome outcome : ComparisonOutcome.values()) {
            log.info(" {}: {}", outcome.getDescription(), batchReport.count(outcome));
        }
        log.info("========================================比對結果統計========================================");
        return batchReport;
    }

    /**
     * 將本次比對紀錄寫入 H2 歷史資料庫。
     *
     * @return 是否成功寫入；失敗時整批回滾並記錄警告，不影響比對報告
     */
    static boolean saveHistory(Path historyDb, List<PairReport> reports) {
        try (H2HistoryManager history = new H2HistoryManager(historyDb)) {
            history.initSchema();
            boolean saved = history.saveAll(reports);
            if (!saved) {
                log.warn("{} - {} 筆比對紀錄未寫入歷史資料庫", historyDb, reports.size());
            }
            return saved;
        }
    }

    /**
     * 比對單一組截圖；有像素差異時將差異圖寫入 {@code diffDir}。
     *
     * @param embedDiffImage 是否在紀錄中附上 Base64 編碼的差異圖
     */
    static PairReport comparePair(ImageComparator comparator, ScreenshotPair pair, double threshold,
                                  Path diffDir, boolean embedDiffImage) {
        Path baseline = pair.baseline();
        Path actual = pair.actual();
        for (Path path : List.of(baseline, actual)) {
            if (!FileTools.isReadableFile(path)) {
                log.warn("{} - 檔案不存在或不可讀，跳過", path);
                return PairReport.notFound(baseline, actual, threshold, path);
            }
        }

        ComparisonResult result;
        try {
            result = comparator.compare(Files.readAllBytes(baseline), Files.readAllBytes(actual), threshold);
        } catch (IOException e) {
            log.warn("{} - 讀取截圖時發生 I/O 錯誤", baseline, e);
            result = ComparisonResult.failed(ComparisonError.DECODE_FAILURE, threshold, "讀取失敗: " + e.getMessage());
        }

        Path diffPath = null;
        String diffBase64 = null;
        Optional<DiffImage> diff = result.diff().filter(DiffImage::hasChanges);
        if (diff.isPresent()) {
            diffPath = diffDir.resolve(FileTools.diffFileName(baseline, actual));
            try {
                ImageCodec.writePng(diff.get().image(), diffPath);
                if (embedDiffImage) {
                    diffBase64 = ScreenshotStore.toBase64(diffPath);
                }
            } catch (IOException e) {
                log.warn("{} - 無法寫出差異圖", diffPath, e);
                diffPath = null;
            }
        }

        if (result.isFailed()) {
            log.warn("{} <-> {} - {}: {}", baseline, actual, result.error().getDescription(), result.errorMessage());
        } else {
            log.info("{} <-> {} - {}", baseline, actual, result.similar() ? "相似" : "不相似");
        }
        PairReport report = PairReport.of(baseline, actual, result, diffPath);
        return diffBase64 == null ? report : report.withDiffImageBase64(diffBase64);
    }

    /**
     * 取得任務的比對紀錄；任務未完成時取消並記為逾時失敗。
     */
    static PairReport collect(ScreenshotPair pair, Future<PairReport> future, double threshold) {
        String reason;
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (ExecutionException e) {
                log.error("{} - 比對任務發生未知錯誤", pair.baseline(), e.getCause());
                reason = "比對任務失敗: " + e.getCause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reason = "等待比對結果時被中斷";
            }
        } else {
            future.cancel(true);
            reason = "比對逾時，任務未完成";
        }
        ComparisonResult failed = ComparisonResult.failed(ComparisonError.COMPUTATION_FAILURE, threshold, reason);
        return PairReport.of(pair.baseline(), pair.actual(), failed, null);
    }
}
