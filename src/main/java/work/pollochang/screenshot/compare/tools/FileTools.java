package work.pollochang.screenshot.compare.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

@Slf4j
public class FileTools {

    /**
     * 視為截圖的副檔名 (小寫)
     */
    public static final Set<String> SCREENSHOT_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg");

    private FileTools() {}

    /**
     * 確保指定的目錄存在，如果不存在則建立它。
     * @param directoryPath 要檢查或建立的目錄路徑
     */
    public static void ensureDirectoryExists(Path directoryPath) {
        if (!Files.exists(directoryPath)) {
            try {
                Files.createDirectories(directoryPath);
                log.info("{} - 目標目錄已建立", directoryPath);
            } catch (IOException e) {
                // 拋出 RuntimeException 使上層能夠捕獲並中止程式
                throw new RuntimeException("無法建立目錄: " + directoryPath, e);
            }
        } else {
            log.debug("{} - 目標目錄已存在", directoryPath);
        }
    }

    public static boolean isReadableFile(Path path) {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    /**
     * 取得不含副檔名的檔名，例如 {@code login.png -> login}。
     */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * 取得副檔名 (含點)，例如 {@code login.png -> .png}；沒有副檔名時為空字串。
     */
    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    /**
     * 是否為截圖檔案 (.png、.jpg、.jpeg，不分大小寫)。
     */
    public static boolean isScreenshot(Path path) {
        return Files.isRegularFile(path)
                && SCREENSHOT_EXTENSIONS.contains(extension(path).toLowerCase(Locale.ROOT));
    }

    /**
     * 差異圖檔名: {@code diff_<基準檔名>_<比對檔名>.png}
     */
    public static String diffFileName(Path baseline, Path actual) {
        return "diff_" + stem(baseline) + "_" + stem(actual) + ".png";
    }
}
