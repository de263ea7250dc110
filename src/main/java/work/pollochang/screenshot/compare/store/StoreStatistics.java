package work.pollochang.screenshot.compare.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * 截圖目錄的統計資料，{@code byDirectory} 以 {@code root} 與各子目錄名稱為鍵。
 *
 * @param totalScreenshots 截圖總數
 * @param totalSizeBytes   截圖總大小
 * @param byDirectory      各目錄的統計
 * @param oldestScreenshot 最舊的截圖，沒有截圖時為 {@code null}
 * @param newestScreenshot 最新的截圖，沒有截圖時為 {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreStatistics(
        long totalScreenshots,
        long totalSizeBytes,
        Map<String, DirectoryStatistics> byDirectory,
        FileStamp oldestScreenshot,
        FileStamp newestScreenshot
) {

    public record DirectoryStatistics(long count, long sizeBytes, List<FileEntry> files) {}

    /**
     * @param modified ISO-8601 本地時間
     */
    public record FileEntry(String name, long sizeBytes, String modified) {}

    public record FileStamp(String path, String modified) {}
}
