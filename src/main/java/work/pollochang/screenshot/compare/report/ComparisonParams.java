package work.pollochang.screenshot.compare.report;

/**
 * 比對參數。
 *
 * @param threshold      相似度門檻 0–1
 * @param hashSize       平均雜湊的格數 (邊長)，位元數為其平方
 * @param ssimWindowSize SSIM 高斯視窗邊長，須為奇數
 * @param ssimSigma      SSIM 高斯視窗標準差
 */
public record ComparisonParams(double threshold, int hashSize, int ssimWindowSize, double ssimSigma) {

    public static final double DEFAULT_THRESHOLD = 0.95;
    public static final int DEFAULT_HASH_SIZE = 8;
    public static final int DEFAULT_SSIM_WINDOW = 11;
    public static final double DEFAULT_SSIM_SIGMA = 1.5;

    public ComparisonParams {
        requireThreshold(threshold);
        if (hashSize < 2) {
            throw new IllegalArgumentException("hashSize 至少為 2: " + hashSize);
        }
        if (ssimWindowSize < 1 || ssimWindowSize % 2 == 0) {
            throw new IllegalArgumentException("ssimWindowSize 必須為正奇數: " + ssimWindowSize);
        }
        if (!(ssimSigma > 0) || Double.isInfinite(ssimSigma)) {
            throw new IllegalArgumentException("ssimSigma 必須大於 0: " + ssimSigma);
        }
    }

    public static ComparisonParams defaults() {
        return new ComparisonParams(DEFAULT_THRESHOLD, DEFAULT_HASH_SIZE, DEFAULT_SSIM_WINDOW, DEFAULT_SSIM_SIGMA);
    }

    public ComparisonParams withThreshold(double newThreshold) {
        return new ComparisonParams(newThreshold, hashSize, ssimWindowSize, ssimSigma);
    }

    public static void requireThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("門檻必須介於 0 與 1 之間: " + threshold);
        }
    }
}
