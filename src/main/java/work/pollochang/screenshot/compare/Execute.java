package work.pollochang.screenshot.compare;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;
import work.pollochang.screenshot.compare.history.H2HistoryManager;
import work.pollochang.screenshot.compare.report.BatchReport;
import work.pollochang.screenshot.compare.report.ComparisonOutcome;
import work.pollochang.screenshot.compare.report.ComparisonParams;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "screenshot-compare",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "截圖比對工具 (平均雜湊、SSIM、像素差異)",
        subcommands = {
                StoreCommands.Archive.class,
                StoreCommands.Clean.class,
                StoreCommands.Stats.class,
                StoreCommands.Collage.class
        })
public class Execute implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-b", "--baseline"}, description = "基準截圖。需搭配 --actual。")
    private File baseline;

    @Option(names = {"-a", "--actual"}, description = "本次截圖。需搭配 --baseline。")
    private File actual;

    @Option(names = {"-p", "--pair-list"}, description = "比對清單，每行一組: 基準圖<Tab 或逗號>比對圖。")
    private File pairList;

    // 子命令執行時不檢查，因此不設為 required，改在 call() 中檢查
    @Option(names = {"-o", "--output-dir"}, description = "截圖目錄，比對報告寫在此處，差異圖寫在 comparisons/ 子目錄。")
    private File outputDir;

    @Option(names = {"-t", "--threshold"}, defaultValue = "0.95", description = "相似度門檻，範圍 0.0 到 1.0 (預設: 0.95)。")
    private double threshold;

    @Option(names = {"--hash-size"}, defaultValue = "8", description = "平均雜湊每邊格數 (預設: 8，即 64 位元)。")
    private int hashSize;

    @Option(names = {"--ssim-window"}, defaultValue = "11", description = "SSIM 高斯視窗邊長，須為奇數 (預設: 11)。")
    private int ssimWindow;

    @Option(names = {"--ssim-sigma"}, defaultValue = "1.5", description = "SSIM 高斯視窗標準差 (預設: 1.5)。")
    private double ssimSigma;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Option(names = {"--history-db"}, description = "H2 比對歷史資料庫的檔案路徑，未指定則不記錄。")
    private File historyDb;

    @Option(names = {"--embed-diff"}, description = "在 JSON 報告中以 Base64 內嵌差異圖。")
    private boolean embedDiff;

    @Override
    public Integer call() throws Exception {
        if (outputDir == null) {
            throw new ParameterException(spec.commandLine(), "缺少必要參數: --output-dir");
        }
        ComparisonParams params;
        try {
            params = new ComparisonParams(threshold, hashSize, ssimWindow, ssimSigma);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        List<ComparisonBatch.ScreenshotPair> pairs;
        if (pairList != null) {
            if (baseline != null || actual != null) {
                throw new ParameterException(spec.commandLine(), "--pair-list 不可與 --baseline/--actual 同時使用");
            }
            pairs = ComparisonBatch.readPairList(pairList.toPath());
        } else if (baseline != null && actual != null) {
            pairs = List.of(new ComparisonBatch.ScreenshotPair(baseline.toPath(), actual.toPath()));
        } else {
            throw new ParameterException(spec.commandLine(), "請指定 --pair-list，或同時指定 --baseline 與 --actual");
        }

        log.info("========================================比對程式參數設定========================================");
        log.info("比對組數: {}", pairs.size());
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("相似度門檻: {}", params.threshold());
        log.info("雜湊格數: {}x{}", params.hashSize(), params.hashSize());
        log.info("SSIM 視窗: {} (sigma {})", params.ssimWindowSize(), params.ssimSigma());
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        log.info("比對歷史資料庫: {}", historyDb == null ? "未啟用" : historyDb.getAbsolutePath());
        log.info("內嵌差異圖: {}", embedDiff ? "是" : "否");
        log.info("========================================比對程式參數設定========================================");

        ComparisonBatch comparisonBatch = new ComparisonBatch();
        comparisonBatch.setPairs(pairs);
        comparisonBatch.setOutputDir(outputDir.toPath());
        comparisonBatch.setComparisonParams(params);
        comparisonBatch.setTimeOutHr(timeOutHr);
        comparisonBatch.setHistoryDbPath(historyDb == null ? null : historyDb.toPath());
        comparisonBatch.setEmbedDiffImages(embedDiff);
        BatchReport report = comparisonBatch.execute();

        if (historyDb != null) {
            try (H2HistoryManager history = new H2HistoryManager(historyDb.toPath())) {
                Map<ComparisonOutcome, Long> statistics = history.loadStatistics();
                log.info("歷史比對統計: {}", statistics);
            }
        }

        log.info("所有比對執行完畢");
        return report.allSimilar() ? 0 : 1;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
