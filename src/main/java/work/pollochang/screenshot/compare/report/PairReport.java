package work.pollochang.screenshot.compare.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.pollochang.screenshot.compare.core.ComparisonResult;
import work.pollochang.screenshot.compare.core.ImageInfo;

import java.nio.file.Path;

/**
 * 單一組截圖的比對紀錄，寫入 JSON 報告與歷史資料庫。
 *
 * <p>{@code baselineImage} 與 {@code actualImage} 是兩張截圖比對前的尺寸與色彩模式；
 * {@code diffImageBase64} 只在要求內嵌差異圖時才會填入。</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PairReport(
        String baseline,
        String actual,
        ComparisonOutcome outcome,
        boolean similar,
        double hashSimilarity,
        double ssim,
        double pixelDifferenceRatio,
        double threshold,
        boolean degraded,
        ImageInfo baselineImage,
        ImageInfo actualImage,
        String diffImage,
        String diffImageBase64,
        String error,
        String errorMessage
) {

    public static PairReport of(Path baseline, Path actual, ComparisonResult result, Path diffImage) {
        return new PairReport(
                baseline.toString(),
                actual.toString(),
                ComparisonOutcome.of(result),
                result.similar(),
                result.hashSimilarity(),
                result.ssim(),
                result.pixelDifferenceRatio(),
                result.threshold(),
                result.degraded(),
                result.firstImage(),
                result.secondImage(),
                diffImage == null ? null : diffImage.toString(),
                null,
                result.error() == null ? null : result.error().name(),
                result.errorMessage()
        );
    }

    public static PairReport notFound(Path baseline, Path actual, double threshold, Path missing) {
        return new PairReport(baseline.toString(), actual.toString(), ComparisonOutcome.SKIPPED_NOT_FOUND,
                false, 0.0, 0.0, 0.0, threshold, false, null, null, null, null, null,
                "檔案不存在或不可讀: " + missing);
    }

    /**
     * 附上 Base64 編碼的差異圖 PNG。
     */
    public PairReport withDiffImageBase64(String base64) {
        return new PairReport(baseline, actual, outcome, similar, hashSimilarity, ssim, pixelDifferenceRatio,
                threshold, degraded, baselineImage, actualImage, diffImage, base64, error, errorMessage);
    }
}
