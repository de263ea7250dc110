package work.pollochang.screenshot.compare.store;

/**
 * 截圖目錄下的子目錄。
 */
public enum StoreDirectory {
    FAILURES("failures", "失敗截圖"),
    SUCCESSES("successes", "成功截圖"),
    COMPARISONS("comparisons", "比對差異圖"),
    ELEMENTS("elements", "元素截圖"),
    ARCHIVED("archived", "已封存截圖");

    private final String dirName;
    private final String description;

    StoreDirectory(String dirName, String description) {
        this.dirName = dirName;
        this.description = description;
    }

    public String getDirName() { return dirName; }
    public String getDescription() { return description; }
}
