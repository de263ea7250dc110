package work.pollochang.screenshot.compare.report;

import work.pollochang.screenshot.compare.core.ComparisonResult;

public enum ComparisonOutcome {
    SIMILAR("相似"),
    DIFFERENT("不相似"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED("比對失敗");

    private final String description;
    ComparisonOutcome(String description) { this.description = description; }
    public String getDescription() { return description; }

    public static ComparisonOutcome of(ComparisonResult result) {
        if (result.isFailed()) {
            return FAILED;
        }
        return result.similar() ? SIMILAR : DIFFERENT;
    }
}
