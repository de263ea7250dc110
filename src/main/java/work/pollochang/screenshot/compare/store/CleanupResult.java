package work.pollochang.screenshot.compare.store;

/**
 * 清除舊截圖的結果。
 *
 * @param deletedCount 刪除的檔案數
 * @param freedBytes   釋放的位元組數
 */
public record CleanupResult(long deletedCount, long freedBytes) {}
