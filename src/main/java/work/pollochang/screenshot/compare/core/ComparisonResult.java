package work.pollochang.screenshot.compare.core;

import java.util.Optional;

/**
 * 單次截圖比對的結果，建立後不可變。
 *
 * <p>比對失敗時 {@code similar} 一律為 {@code false}、各項分數為 0、沒有差異圖，
 * 並附上 {@link ComparisonError} 與錯誤描述。呼叫端因此可以只斷言 {@link #similar()}，
 * 不需區分「比對失敗」與「圖片不同」。</p>
 *
 * @param similar              是否相似 (雜湊相似度與 SSIM 皆達門檻)
 * @param hashSimilarity       平均雜湊相似度 0–1
 * @param ssim                 結構相似度 0–1
 * @param pixelDifferenceRatio 有差異的像素比例 0–1，僅供診斷，不參與判定
 * @param threshold            本次使用的門檻
 * @param degraded             SSIM 以降級方式估算，信心較低
 * @param diffImage            差異圖，失敗時為 {@code null}
 * @param error                錯誤類型，成功時為 {@code null}
 * @param errorMessage         錯誤描述，成功時為 {@code null}
 * @param firstImage           第一張圖片的原始尺寸與模式，未取得時為 {@code null}
 * @param secondImage          第二張圖片正規化前的尺寸與模式，未取得時為 {@code null}
 */
public record ComparisonResult(
        boolean similar,
        double hashSimilarity,
        double ssim,
        double pixelDifferenceRatio,
        double threshold,
        boolean degraded,
        DiffImage diffImage,
        ComparisonError error,
        String errorMessage,
        ImageInfo firstImage,
        ImageInfo secondImage
) {

    public static ComparisonResult of(double hashSimilarity, double ssim, double pixelDifferenceRatio,
                                      double threshold, boolean degraded, DiffImage diffImage) {
        boolean similar = hashSimilarity >= threshold && ssim >= threshold;
        return new ComparisonResult(similar, hashSimilarity, ssim, pixelDifferenceRatio,
                threshold, degraded, diffImage, null, null, null, null);
    }

    public static ComparisonResult failed(ComparisonError error, double threshold, String errorMessage) {
        return new ComparisonResult(false, 0.0, 0.0, 0.0, threshold, false, null, error, errorMessage, null, null);
    }

    /**
     * 附上兩張圖片比對前的尺寸與模式。
     */
    public ComparisonResult withImages(ImageInfo first, ImageInfo second) {
        return new ComparisonResult(similar, hashSimilarity, ssim, pixelDifferenceRatio, threshold, degraded,
                diffImage, error, errorMessage, first, second);
    }

    public boolean isFailed() {
        return error != null;
    }

    public Optional<DiffImage> diff() {
        return Optional.ofNullable(diffImage);
    }
}
