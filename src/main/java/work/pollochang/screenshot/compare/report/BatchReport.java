package work.pollochang.screenshot.compare.report;

import java.util.List;
import java.util.Map;

/**
 * 批次比對的完整報告。
 *
 * @param threshold 使用的相似度門檻
 * @param total     比對組數
 * @param counts    各結果的數量
 * @param pairs     每組的比對紀錄，依清單順序排列
 */
public record BatchReport(double threshold, long total, Map<ComparisonOutcome, Long> counts, List<PairReport> pairs) {

    public long count(ComparisonOutcome outcome) {
        Long value = counts.get(outcome);
        return value == null ? 0 : value;
    }

    public boolean allSimilar() {
        return total > 0 && count(ComparisonOutcome.SIMILAR) == total;
    }
}
