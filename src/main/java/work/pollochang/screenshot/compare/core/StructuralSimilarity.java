package work.pollochang.screenshot.compare.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.screenshot.compare.tools.ImageTools;

/**
 * 結構相似度 (SSIM)。
 *
 * <p>兩張圖先轉成亮度平面，以高斯加權視窗 (可分離的一維卷積，valid 模式) 計算局部平均、
 * 變異數與共變異數，再以標準 SSIM 公式合成並取平均值。</p>
 *
 * <p>圖片小於視窗或計算結果非有限數時，改用單一全域視窗估算，並標記為降級結果。</p>
 */
@Slf4j
final class StructuralSimilarity {

    private static final double C1 = (0.01 * 255) * (0.01 * 255);
    private static final double C2 = (0.03 * 255) * (0.03 * 255);

    private StructuralSimilarity() {}

    record Score(double value, boolean degraded) {}

    static Score compute(PixelImage first, PixelImage second, int windowSize, double sigma) {
        if (first.width() != second.width() || first.height() != second.height()) {
            throw new IllegalArgumentException("SSIM 需要相同尺寸的圖片");
        }
        int width = first.width();
        int height = first.height();
        double[] x = ImageTools.luminancePlane(first);
        double[] y = ImageTools.luminancePlane(second);

        if (width < windowSize || height < windowSize) {
            log.warn("圖片尺寸 {}x{} 小於 SSIM 視窗 {}，改用全域估算", width, height, windowSize);
            return globalScore(x, y);
        }

        double windowed = windowedMean(x, y, width, height, gaussianKernel(windowSize, sigma));
        if (!Double.isFinite(windowed)) {
            log.warn("SSIM 視窗計算結果非有限數 ({})，改用全域估算", windowed);
            return globalScore(x, y);
        }
        return new Score(clamp(windowed), false);
    }

    private static double windowedMean(double[] x, double[] y, int width, int height, double[] kernel) {
        int n = x.length;
        double[] xx = new double[n];
        double[] yy = new double[n];
        double[] xy = new double[n];
        for (int i = 0; i < n; i++) {
            xx[i] = x[i] * x[i];
            yy[i] = y[i] * y[i];
            xy[i] = x[i] * y[i];
        }

        double[] mu1 = convolveValid(x, width, height, kernel);
        double[] mu2 = convolveValid(y, width, height, kernel);
        double[] ex2 = convolveValid(xx, width, height, kernel);
        double[] ey2 = convolveValid(yy, width, height, kernel);
        double[] exy = convolveValid(xy, width, height, kernel);

        double sum = 0.0;
        for (int i = 0; i < mu1.length; i++) {
            sum += ssim(mu1[i], mu2[i], ex2[i], ey2[i], exy[i]);
        }
        return sum / mu1.length;
    }

    private static Score globalScore(double[] x, double[] y) {
        double n = x.length;
        double sx = 0.0;
        double sy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < x.length; i++) {
            sx += x[i];
            sy += y[i];
            sxx += x[i] * x[i];
            syy += y[i] * y[i];
            sxy += x[i] * y[i];
        }
        double value = ssim(sx / n, sy / n, sxx / n, syy / n, sxy / n);
        if (!Double.isFinite(value)) {
            log.warn("全域 SSIM 估算結果非有限數，分數以 0 計");
            return new Score(0.0, true);
        }
        return new Score(clamp(value), true);
    }

    private static double ssim(double mu1, double mu2, double ex2, double ey2, double exy) {
        double mu1Sq = mu1 * mu1;
        double mu2Sq = mu2 * mu2;
        double mu1Mu2 = mu1 * mu2;
        double sigma1Sq = ex2 - mu1Sq;
        double sigma2Sq = ey2 - mu2Sq;
        double sigma12 = exy - mu1Mu2;
        return ((2 * mu1Mu2 + C1) * (2 * sigma12 + C2))
                / ((mu1Sq + mu2Sq + C1) * (sigma1Sq + sigma2Sq + C2));
    }

    /**
     * 正規化的一維高斯核，二維視窗為其外積。
     */
    static double[] gaussianKernel(int size, double sigma) {
        double[] kernel = new double[size];
        int radius = size / 2;
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            kernel[i] = Math.exp(-(d * d) / (2.0 * sigma * sigma));
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    /**
     * valid 模式的二維卷積，輸出 (width-k+1) x (height-k+1)。
     */
    private static double[] convolveValid(double[] plane, int width, int height, double[] kernel) {
        int k = kernel.length;
        int outWidth = width - k + 1;
        int outHeight = height - k + 1;

        double[] rows = new double[outWidth * height];
        for (int y = 0; y < height; y++) {
            int in = y * width;
            int out = y * outWidth;
            for (int x = 0; x < outWidth; x++) {
                double acc = 0.0;
                for (int i = 0; i < k; i++) {
                    acc += kernel[i] * plane[in + x + i];
                }
                rows[out + x] = acc;
            }
        }

        double[] result = new double[outWidth * outHeight];
        for (int y = 0; y < outHeight; y++) {
            for (int x = 0; x < outWidth; x++) {
                double acc = 0.0;
                for (int i = 0; i < k; i++) {
                    acc += kernel[i] * rows[(y + i) * outWidth + x];
                }
                result[y * outWidth + x] = acc;
            }
        }
        return result;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
