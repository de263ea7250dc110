package work.pollochang.screenshot.compare.store;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.screenshot.compare.core.ColorMode;
import work.pollochang.screenshot.compare.core.ImageCodec;
import work.pollochang.screenshot.compare.core.PixelImage;
import work.pollochang.screenshot.compare.tools.FileTools;
import work.pollochang.screenshot.compare.tools.ImageTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 截圖目錄管理：封存、清除舊檔、統計與拼貼。
 *
 * <p>目錄結構為基準目錄加上 {@link StoreDirectory} 的各個子目錄，建構時全部建立。
 * 清除與統計只看基準目錄與子目錄本身 (不遞迴)，且只處理 .png、.jpg、.jpeg 檔案。</p>
 */
@Slf4j
public class ScreenshotStore {

    public static final int DEFAULT_DAYS_TO_KEEP = 7;
    public static final String DEFAULT_ARCHIVE_REASON = "test_completion";
    public static final String ROOT_KEY = "root";

    static final int COLLAGE_CELL_WIDTH = 400;
    static final int COLLAGE_MAX_COLUMNS = 3;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path baseDir;
    private final Clock clock;

    public ScreenshotStore(Path baseDir) {
        this(baseDir, Clock.systemDefaultZone());
    }

    public ScreenshotStore(Path baseDir, Clock clock) {
        this.baseDir = baseDir;
        this.clock = clock;
        FileTools.ensureDirectoryExists(baseDir);
        for (StoreDirectory directory : StoreDirectory.values()) {
            FileTools.ensureDirectoryExists(resolve(directory));
        }
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path resolve(StoreDirectory directory) {
        return baseDir.resolve(directory.getDirName());
    }

    /**
     * 將截圖移到 {@code archived/}，檔名為 {@code <原檔名>_<原因>_<yyyyMMdd_HHmmss><副檔名>}。
     *
     * @return 封存後的路徑；截圖不存在或搬移失敗時為空
     * @throws IllegalArgumentException 原因為空白或含路徑分隔字元
     */
    public Optional<Path> archive(Path screenshot, String reason) {
        if (reason == null || reason.isBlank() || reason.contains("/") || reason.contains("\\")) {
            throw new IllegalArgumentException("封存原因不可為空白或含路徑分隔字元: " + reason);
        }
        if (!Files.isRegularFile(screenshot)) {
            log.warn("{} - 找不到要封存的截圖", screenshot);
            return Optional.empty();
        }

        String archiveName = FileTools.stem(screenshot) + "_" + reason + "_" + timestamp()
                + FileTools.extension(screenshot);
        Path target = resolve(StoreDirectory.ARCHIVED).resolve(archiveName);
        try {
            Files.move(screenshot, target);
            log.info("{} - 截圖已封存至 {}", screenshot, target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("{} - 封存截圖失敗", screenshot, e);
            return Optional.empty();
        }
    }

    /**
     * 刪除最後修改時間早於 {@code daysToKeep} 天前的截圖。
     *
     * @throws IllegalArgumentException 天數為負數
     */
    public CleanupResult cleanOldScreenshots(int daysToKeep) {
        if (daysToKeep < 0) {
            throw new IllegalArgumentException("保留天數不可為負數: " + daysToKeep);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysToKeep));
        long deletedCount = 0;
        long freedBytes = 0;

        for (Path directory : scannedDirectories().values()) {
            for (Path file : listScreenshots(directory)) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        long size = Files.size(file);
                        Files.delete(file);
                        deletedCount++;
                        freedBytes += size;
                        log.debug("{} - 已刪除舊截圖", file);
                    }
                } catch (IOException e) {
                    log.warn("{} - 無法刪除舊截圖", file, e);
                }
            }
        }

        log.info("已清除 {} 張舊截圖，釋放 {} MB", deletedCount, String.format("%.2f", freedBytes / 1024.0 / 1024.0));
        return new CleanupResult(deletedCount, freedBytes);
    }

    public StoreStatistics statistics() {
        long totalScreenshots = 0;
        long totalSizeBytes = 0;
        Map<String, StoreStatistics.DirectoryStatistics> byDirectory = new LinkedHashMap<>();
        Path oldest = null;
        Instant oldestTime = null;
        Path newest = null;
        Instant newestTime = null;

        for (Map.Entry<String, Path> entry : scannedDirectories().entrySet()) {
            long count = 0;
            long sizeBytes = 0;
            List<StoreStatistics.FileEntry> files = new ArrayList<>();
            for (Path file : listScreenshots(entry.getValue())) {
                long size;
                Instant modified;
                try {
                    size = Files.size(file);
                    modified = Files.getLastModifiedTime(file).toInstant();
                } catch (IOException e) {
                    log.warn("{} - 無法讀取檔案資訊，略過", file, e);
                    continue;
                }
                count++;
                sizeBytes += size;
                files.add(new StoreStatistics.FileEntry(file.getFileName().toString(), size, isoLocal(modified)));

                if (oldestTime == null || modified.isBefore(oldestTime)) {
                    oldest = file;
                    oldestTime = modified;
                }
                if (newestTime == null || modified.isAfter(newestTime)) {
                    newest = file;
                    newestTime = modified;
                }
            }
            totalScreenshots += count;
            totalSizeBytes += sizeBytes;
            byDirectory.put(entry.getKey(), new StoreStatistics.DirectoryStatistics(count, sizeBytes, files));
        }

        return new StoreStatistics(totalScreenshots, totalSizeBytes, byDirectory,
                oldest == null ? null : new StoreStatistics.FileStamp(oldest.toString(), isoLocal(oldestTime)),
                newest == null ? null : new StoreStatistics.FileStamp(newest.toString(), isoLocal(newestTime)));
    }

    /**
     * 將多張截圖拼成一張 PNG：每張縮放為寬 400 px，最多 3 欄，白色 RGB 背景。
     * 每列高度取最高的一張，較矮的截圖靠上對齊。
     *
     * @param screenshots 截圖路徑，不存在或無法解碼的會被略過
     * @param output      輸出檔案；{@code null} 時為基準目錄下的 {@code collage_<yyyyMMdd_HHmmss>.png}
     * @return 拼貼圖路徑；沒有可用的截圖或寫出失敗時為空
     */
    public Optional<Path> createCollage(List<Path> screenshots, Path output) {
        if (screenshots == null || screenshots.isEmpty()) {
            log.warn("沒有提供要拼貼的截圖");
            return Optional.empty();
        }

        List<PixelImage> cells = new ArrayList<>();
        for (Path screenshot : screenshots) {
            if (!FileTools.isReadableFile(screenshot)) {
                log.warn("{} - 檔案不存在或不可讀，略過", screenshot);
                continue;
            }
            try {
                PixelImage image = ImageTools.convertMode(ImageCodec.read(screenshot), ColorMode.RGB);
                int height = (int) Math.max(1L, (long) image.height() * COLLAGE_CELL_WIDTH / image.width());
                cells.add(ImageTools.resizeImage(image, COLLAGE_CELL_WIDTH, height));
            } catch (IOException e) {
                log.warn("{} - 無法解碼截圖，略過", screenshot, e);
            }
        }
        if (cells.isEmpty()) {
            log.warn("沒有可用於拼貼的截圖");
            return Optional.empty();
        }

        PixelImage collage = tile(cells);
        Path target = output != null ? output : baseDir.resolve("collage_" + timestamp() + ".png");
        try {
            ImageCodec.writePng(collage, target);
            log.info("{} - 已建立 {} 張截圖的拼貼 ({}x{})", target, cells.size(), collage.width(), collage.height());
            return Optional.of(target);
        } catch (IOException e) {
            log.error("{} - 寫出拼貼圖失敗", target, e);
            return Optional.empty();
        }
    }

    /**
     * 讀取截圖並編碼為 Base64，供嵌入報告使用。
     */
    public static String toBase64(Path screenshot) throws IOException {
        return Base64.getEncoder().encodeToString(Files.readAllBytes(screenshot));
    }

    static PixelImage tile(List<PixelImage> cells) {
        int columns = Math.min(COLLAGE_MAX_COLUMNS, cells.size());
        int rows = (cells.size() + columns - 1) / columns;
        int cellHeight = cells.stream().mapToInt(PixelImage::height).max().orElse(0);
        int width = columns * COLLAGE_CELL_WIDTH;
        int height = rows * cellHeight;

        byte[] pixels = new byte[width * height * 3];
        Arrays.fill(pixels, (byte) 0xFF);
        for (int i = 0; i < cells.size(); i++) {
            PixelImage cell = cells.get(i);
            byte[] source = cell.pixels();
            int left = (i % columns) * COLLAGE_CELL_WIDTH;
            int top = (i / columns) * cellHeight;
            int rowBytes = cell.width() * 3;
            for (int y = 0; y < cell.height(); y++) {
                System.arraycopy(source, y * rowBytes, pixels, ((top + y) * width + left) * 3, rowBytes);
            }
        }
        return new PixelImage(width, height, ColorMode.RGB, pixels);
    }

    private Map<String, Path> scannedDirectories() {
        Map<String, Path> directories = new LinkedHashMap<>();
        directories.put(ROOT_KEY, baseDir);
        for (StoreDirectory directory : StoreDirectory.values()) {
            directories.put(directory.getDirName(), resolve(directory));
        }
        return directories;
    }

    private static List<Path> listScreenshots(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(FileTools::isScreenshot).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.error("{} - 無法列出目錄內容", directory, e);
            return List.of();
        }
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    private String isoLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, clock.getZone()).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
