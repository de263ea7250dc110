package work.pollochang.screenshot.compare.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.screenshot.compare.report.ComparisonParams;
import work.pollochang.screenshot.compare.tools.ImageTools;

import java.util.Objects;

/**
 * 截圖比對器。
 *
 * <p>對兩張已解碼的圖片計算三項互相獨立的指標：</p>
 * <ol>
 *   <li>平均雜湊相似度，對輕微的重新著色與反鋸齒雜訊不敏感，可抓出版面的大幅變動。</li>
 *   <li>結構相似度 (SSIM)，高斯視窗 {@code ssimWindowSize}、標準差 {@code ssimSigma}。</li>
 *   <li>像素差異比例，任一通道不同即計為差異，並產生差異圖。</li>
 * </ol>
 *
 * <p>判定：雜湊相似度與 SSIM 皆大於等於門檻即為相似。像素差異比例只用於診斷與差異圖，
 * 字型微調或反鋸齒造成的像素雜訊不會讓比對失敗。</p>
 *
 * <p>比對前會先正規化第二張圖：色彩模式不同時轉成第一張圖的模式，尺寸不同時以 Lanczos
 * 縮放到第一張圖的尺寸。正規化永遠是單向的，第一張圖不會被改動。</p>
 *
 * <p>除了門檻參數不合法之外，所有失敗都以 {@link ComparisonResult#failed} 回傳，不會拋出例外。
 * 本類別不保存任何狀態，可同時在多個執行緒中使用。</p>
 *
 * <pre>{@code
 * ImageComparator comparator = new ImageComparator(ComparisonParams.defaults());
 * ComparisonResult result = comparator.compare(baseline, actual, 0.95);
 * assertTrue(result.similar(), result.errorMessage());
 * }</pre>
 *
 * @since 0.1.0
 */
@Slf4j
public class ImageComparator {

    private final ComparisonParams params;

    public ImageComparator() {
        this(ComparisonParams.defaults());
    }

    public ImageComparator(ComparisonParams params) {
        this.params = Objects.requireNonNull(params, "params must not be null");
    }

    /**
     * 以設定中的門檻比對兩張圖片。
     */
    public ComparisonResult compare(PixelImage first, PixelImage second) {
        return compare(first, second, params.threshold());
    }

    /**
     * 解碼後比對兩份已編碼的截圖 (PNG 等)。解碼失敗以 {@link ComparisonError#DECODE_FAILURE}
     * 或 {@link ComparisonError#UNSUPPORTED_MODE} 回傳。
     */
    public ComparisonResult compare(byte[] first, byte[] second, double threshold) {
        ComparisonParams.requireThreshold(threshold);
        PixelImage firstImage;
        PixelImage secondImage;
        try {
            firstImage = ImageCodec.decode(first);
        } catch (UnsupportedImageModeException e) {
            log.warn("第一張圖片色彩模式不支援: {}", e.getMessage());
            return ComparisonResult.failed(ComparisonError.UNSUPPORTED_MODE, threshold, "第一張圖片: " + e.getMessage());
        } catch (ImageDecodeException e) {
            log.warn("第一張圖片無法解碼: {}", e.getMessage());
            return ComparisonResult.failed(ComparisonError.DECODE_FAILURE, threshold, "第一張圖片: " + e.getMessage());
        }
        try {
            secondImage = ImageCodec.decode(second);
        } catch (UnsupportedImageModeException e) {
            log.warn("第二張圖片色彩模式不支援: {}", e.getMessage());
            return ComparisonResult.failed(ComparisonError.UNSUPPORTED_MODE, threshold, "第二張圖片: " + e.getMessage());
        } catch (ImageDecodeException e) {
            log.warn("第二張圖片無法解碼: {}", e.getMessage());
            return ComparisonResult.failed(ComparisonError.DECODE_FAILURE, threshold, "第二張圖片: " + e.getMessage());
        }
        return compare(firstImage, secondImage, threshold);
    }

    /**
     * 比對兩張圖片。
     *
     * @param first     基準圖片，決定比對使用的尺寸與色彩模式
     * @param second    待比對圖片，必要時會被轉換與縮放 (產生新圖片，不修改原圖)
     * @param threshold 相似度門檻 0–1
     * @return 比對結果，永不為 {@code null}
     * @throws IllegalArgumentException 門檻不在 0–1 之間
     */
    public ComparisonResult compare(PixelImage first, PixelImage second, double threshold) {
        ComparisonParams.requireThreshold(threshold);

        if (first == null || second == null) {
            return ComparisonResult.failed(ComparisonError.DECODE_FAILURE, threshold,
                    (first == null ? "第一張" : "第二張") + "圖片沒有像素資料");
        }
        if (first.isEmpty() || second.isEmpty()) {
            return ComparisonResult.failed(ComparisonError.ZERO_SIZE, threshold,
                    String.format("圖片尺寸為零: %dx%d vs %dx%d",
                            first.width(), first.height(), second.width(), second.height()));
        }

        try {
            PixelImage normalized;
            try {
                normalized = normalize(first, second);
            } catch (IllegalArgumentException e) {
                log.warn("無法將第二張圖片轉換為 {} 模式: {}", first.mode(), e.getMessage());
                return ComparisonResult.failed(ComparisonError.UNSUPPORTED_MODE, threshold, e.getMessage());
            }

            String mismatch = describeShapeMismatch(first, normalized);
            if (mismatch != null) {
                log.error("正規化後圖片形狀仍不一致: {}", mismatch);
                return ComparisonResult.failed(ComparisonError.SHAPE_MISMATCH, threshold, mismatch);
            }

            double hashSimilarity = PerceptualHash.of(first, params.hashSize())
                    .similarity(PerceptualHash.of(normalized, params.hashSize()));
            StructuralSimilarity.Score ssim = StructuralSimilarity.compute(
                    first, normalized, params.ssimWindowSize(), params.ssimSigma());
            PixelDifference.Outcome difference = PixelDifference.compute(first, normalized);

            ComparisonResult result = ComparisonResult.of(hashSimilarity, ssim.value(), difference.ratio(),
                            threshold, ssim.degraded(), difference.diffImage())
                    .withImages(ImageInfo.of(first), ImageInfo.of(second));
            log.info("截圖比對: 雜湊相似度 {}, SSIM {}{}, 像素差異 {}% -> {}",
                    String.format("%.3f", hashSimilarity),
                    String.format("%.4f", ssim.value()),
                    ssim.degraded() ? " (降級)" : "",
                    String.format("%.4f", difference.ratio() * 100),
                    result.similar() ? "相似" : "不相似");
            return result;
        } catch (OutOfMemoryError e) {
            log.error("比對 {}x{} 圖片時發生記憶體溢位", first.width(), first.height(), e);
            return ComparisonResult.failed(ComparisonError.OUT_OF_MEMORY, threshold, "記憶體溢位: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("比對圖片時發生未預期的錯誤", e);
            return ComparisonResult.failed(ComparisonError.COMPUTATION_FAILURE, threshold, String.valueOf(e));
        }
    }

    /**
     * 將第二張圖片轉成第一張圖片的色彩模式與尺寸。
     */
    static PixelImage normalize(PixelImage first, PixelImage second) {
        PixelImage result = second;
        if (result.mode() != first.mode()) {
            log.debug("色彩模式不同 ({} vs {})，轉換第二張圖片", first.mode(), result.mode());
            result = ImageTools.convertMode(result, first.mode());
        }
        if (result.width() != first.width() || result.height() != first.height()) {
            log.debug("尺寸不同 ({}x{} vs {}x{})，以 Lanczos 縮放第二張圖片",
                    first.width(), first.height(), result.width(), result.height());
            result = ImageTools.resizeImage(result, first.width(), first.height());
        }
        return result;
    }

    /**
     * @return 形狀不一致的描述，一致時為 {@code null}
     */
    static String describeShapeMismatch(PixelImage first, PixelImage second) {
        if (first.sameShape(second)) {
            return null;
        }
        return String.format("%dx%d %s vs %dx%d %s",
                first.width(), first.height(), first.mode(),
                second.width(), second.height(), second.mode());
    }
}
