package work.pollochang.screenshot.compare;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import work.pollochang.screenshot.compare.store.CleanupResult;
import work.pollochang.screenshot.compare.store.ScreenshotStore;
import work.pollochang.screenshot.compare.store.StoreStatistics;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * 截圖目錄的管理子命令。
 */
public final class StoreCommands {

    private StoreCommands() {}

    @Slf4j
    @Command(name = "archive", mixinStandardHelpOptions = true,
            description = "將截圖移到 archived/ 子目錄，檔名加上原因與時間。")
    static class Archive implements Callable<Integer> {

        @Option(names = {"-d", "--store-dir"}, required = true, description = "截圖目錄。")
        private File storeDir;

        @Option(names = {"-r", "--reason"}, defaultValue = ScreenshotStore.DEFAULT_ARCHIVE_REASON,
                description = "封存原因，會成為檔名的一部分 (預設: ${DEFAULT-VALUE})。")
        private String reason;

        @Parameters(arity = "1..*", paramLabel = "SCREENSHOT", description = "要封存的截圖。")
        private List<File> screenshots;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            ScreenshotStore store = new ScreenshotStore(storeDir.toPath());
            int archived = 0;
            for (File screenshot : screenshots) {
                Optional<Path> target;
                try {
                    target = store.archive(screenshot.toPath(), reason);
                } catch (IllegalArgumentException e) {
                    throw new ParameterException(spec.commandLine(), e.getMessage(), e);
                }
                if (target.isPresent()) {
                    archived++;
                }
            }
            log.info("已封存 {}/{} 張截圖", archived, screenshots.size());
            return archived == screenshots.size() ? 0 : 1;
        }
    }

    @Slf4j
    @Command(name = "clean", mixinStandardHelpOptions = true,
            description = "刪除超過保留天數的截圖 (基準目錄與各子目錄，不遞迴)。")
    static class Clean implements Callable<Integer> {

        @Option(names = {"-d", "--store-dir"}, required = true, description = "截圖目錄。")
        private File storeDir;

        @Option(names = {"--days"}, defaultValue = "" + ScreenshotStore.DEFAULT_DAYS_TO_KEEP,
                description = "保留天數 (預設: ${DEFAULT-VALUE})。")
        private int daysToKeep;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            if (daysToKeep < 0) {
                throw new ParameterException(spec.commandLine(), "保留天數不可為負數: " + daysToKeep);
            }
            CleanupResult result = new ScreenshotStore(storeDir.toPath()).cleanOldScreenshots(daysToKeep);
            spec.commandLine().getOut().printf("deleted=%d freedBytes=%d%n", result.deletedCount(), result.freedBytes());
            return 0;
        }
    }

    @Command(name = "stats", mixinStandardHelpOptions = true,
            description = "以 JSON 輸出截圖目錄的統計資料。")
    static class Stats implements Callable<Integer> {

        @Option(names = {"-d", "--store-dir"}, required = true, description = "截圖目錄。")
        private File storeDir;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            StoreStatistics statistics = new ScreenshotStore(storeDir.toPath()).statistics();
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            PrintWriter out = spec.commandLine().getOut();
            out.println(mapper.writeValueAsString(statistics));
            out.flush();
            return 0;
        }
    }

    @Slf4j
    @Command(name = "collage", mixinStandardHelpOptions = true,
            description = "將多張截圖拼成一張 PNG (每張寬 400 px，最多 3 欄)。")
    static class Collage implements Callable<Integer> {

        @Option(names = {"-d", "--store-dir"}, required = true, description = "截圖目錄，未指定輸出檔時拼貼圖寫在此處。")
        private File storeDir;

        @Option(names = {"-o", "--output"}, description = "拼貼圖輸出檔案 (預設: collage_<時間>.png)。")
        private File output;

        @Parameters(arity = "1..*", paramLabel = "SCREENSHOT", description = "要拼貼的截圖。")
        private List<File> screenshots;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            ScreenshotStore store = new ScreenshotStore(storeDir.toPath());
            Optional<Path> collage = store.createCollage(
                    screenshots.stream().map(File::toPath).collect(Collectors.toList()),
                    output == null ? null : output.toPath());
            collage.ifPresent(path -> spec.commandLine().getOut().println(path));
            return collage.isPresent() ? 0 : 1;
        }
    }
}
