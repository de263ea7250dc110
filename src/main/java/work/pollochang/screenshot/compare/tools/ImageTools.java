package work.pollochang.screenshot.compare.tools;

import work.pollochang.screenshot.compare.core.ColorMode;
import work.pollochang.screenshot.compare.core.PixelImage;

import java.util.Arrays;

/**
 * 像素層級的圖片工具：色彩模式轉換、Lanczos 縮放與亮度平面擷取。
 * 所有方法皆回傳新圖片，不修改輸入。
 */
public class ImageTools {

    private static final int LANCZOS_A = 3;

    private ImageTools() {}

    /**
     * 將圖片轉換為指定的色彩模式。
     * <ul>
     *   <li>RGB → 灰階使用 ITU-R 601-2 亮度公式</li>
     *   <li>離開 RGBA 時捨棄透明度，進入 RGBA 時透明度設為 255</li>
     *   <li>灰階 → RGB 將亮度複製到三個通道</li>
     * </ul>
     *
     * @param source 原始圖片
     * @param target 目標色彩模式
     * @return 轉換後的圖片；模式相同時直接回傳原圖
     */
    public static PixelImage convertMode(PixelImage source, ColorMode target) {
        if (source.mode() == target) {
            return source;
        }
        int count = source.pixelCount();
        int srcChannels = source.channels();
        int dstChannels = target.channels();
        byte[] src = source.pixels();
        byte[] dst = new byte[count * dstChannels];

        for (int i = 0; i < count; i++) {
            int s = i * srcChannels;
            int r;
            int g;
            int b;
            int a = 255;
            switch (source.mode()) {
                case GRAY:
                    r = g = b = src[s] & 0xFF;
                    break;
                case RGB:
                    r = src[s] & 0xFF;
                    g = src[s + 1] & 0xFF;
                    b = src[s + 2] & 0xFF;
                    break;
                case RGBA:
                    r = src[s] & 0xFF;
                    g = src[s + 1] & 0xFF;
                    b = src[s + 2] & 0xFF;
                    a = src[s + 3] & 0xFF;
                    break;
                default:
                    throw new IllegalArgumentException("不支援的來源色彩模式: " + source.mode());
            }

            int d = i * dstChannels;
            switch (target) {
                case GRAY:
                    dst[d] = (byte) luma(r, g, b);
                    break;
                case RGB:
                    dst[d] = (byte) r;
                    dst[d + 1] = (byte) g;
                    dst[d + 2] = (byte) b;
                    break;
                case RGBA:
                    dst[d] = (byte) r;
                    dst[d + 1] = (byte) g;
                    dst[d + 2] = (byte) b;
                    dst[d + 3] = (byte) a;
                    break;
                default:
                    throw new IllegalArgumentException("不支援的目標色彩模式: " + target);
            }
        }
        return new PixelImage(source.width(), source.height(), target, dst);
    }

    /**
     * 擷取亮度平面 (灰階值 0–255)，以列為主排列。
     */
    public static double[] luminancePlane(PixelImage image) {
        PixelImage gray = convertMode(image, ColorMode.GRAY);
        byte[] pixels = gray.pixels();
        double[] plane = new double[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            plane[i] = pixels[i] & 0xFF;
        }
        return plane;
    }

    /**
     * 以 Lanczos (a=3) 濾波器將圖片縮放到指定尺寸，先水平再垂直兩次一維卷積。
     * 縮小時濾波器會依比例放寬，避免疊頻。
     *
     * @param source    原始圖片，尺寸不可為零
     * @param newWidth  目標寬度
     * @param newHeight 目標高度
     * @return 縮放後的圖片；尺寸相同時直接回傳原圖
     */
    public static PixelImage resizeImage(PixelImage source, int newWidth, int newHeight) {
        if (newWidth <= 0 || newHeight <= 0) {
            throw new IllegalArgumentException("目標尺寸必須大於 0: " + newWidth + "x" + newHeight);
        }
        if (source.isEmpty()) {
            throw new IllegalArgumentException("無法縮放尺寸為零的圖片");
        }
        if (source.width() == newWidth && source.height() == newHeight) {
            return source;
        }

        int channels = source.channels();
        int srcWidth = source.width();
        int srcHeight = source.height();
        byte[] src = source.pixels();

        // 水平方向: srcWidth x srcHeight -> newWidth x srcHeight
        Contribution[] columns = contributions(srcWidth, newWidth);
        double[] horizontal = new double[newWidth * srcHeight * channels];
        for (int y = 0; y < srcHeight; y++) {
            int rowOffset = y * srcWidth;
            for (int x = 0; x < newWidth; x++) {
                Contribution c = columns[x];
                int out = (y * newWidth + x) * channels;
                for (int k = 0; k < c.weights().length; k++) {
                    double w = c.weights()[k];
                    int in = (rowOffset + c.start() + k) * channels;
                    for (int ch = 0; ch < channels; ch++) {
                        horizontal[out + ch] += w * (src[in + ch] & 0xFF);
                    }
                }
            }
        }

        // 垂直方向: newWidth x srcHeight -> newWidth x newHeight
        Contribution[] rows = contributions(srcHeight, newHeight);
        byte[] dst = new byte[newWidth * newHeight * channels];
        double[] acc = new double[channels];
        for (int y = 0; y < newHeight; y++) {
            Contribution c = rows[y];
            for (int x = 0; x < newWidth; x++) {
                Arrays.fill(acc, 0.0);
                for (int k = 0; k < c.weights().length; k++) {
                    double w = c.weights()[k];
                    int in = ((c.start() + k) * newWidth + x) * channels;
                    for (int ch = 0; ch < channels; ch++) {
                        acc[ch] += w * horizontal[in + ch];
                    }
                }
                int out = (y * newWidth + x) * channels;
                for (int ch = 0; ch < channels; ch++) {
                    dst[out + ch] = (byte) clamp(Math.round(acc[ch]));
                }
            }
        }
        return new PixelImage(newWidth, newHeight, source.mode(), dst);
    }

    static int luma(int r, int g, int b) {
        // 定點數版本的 L = R*299/1000 + G*587/1000 + B*114/1000
        return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
    }

    private static int clamp(long value) {
        if (value < 0) return 0;
        if (value > 255) return 255;
        return (int) value;
    }

    private static Contribution[] contributions(int srcSize, int dstSize) {
        double scale = (double) srcSize / dstSize;
        double filterScale = Math.max(1.0, scale);
        double support = LANCZOS_A * filterScale;

        Contribution[] result = new Contribution[dstSize];
        for (int i = 0; i < dstSize; i++) {
            double center = (i + 0.5) * scale;
            int start = Math.max(0, (int) Math.floor(center - support));
            int end = Math.min(srcSize, (int) Math.ceil(center + support));
            double[] weights = new double[end - start];
            double total = 0.0;
            for (int j = start; j < end; j++) {
                double w = lanczos((j + 0.5 - center) / filterScale);
                weights[j - start] = w;
                total += w;
            }
            if (total != 0.0) {
                for (int k = 0; k < weights.length; k++) {
                    weights[k] /= total;
                }
            }
            result[i] = new Contribution(start, weights);
        }
        return result;
    }

    private static double lanczos(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        if (x <= -LANCZOS_A || x >= LANCZOS_A) {
            return 0.0;
        }
        double px = Math.PI * x;
        return LANCZOS_A * Math.sin(px) * Math.sin(px / LANCZOS_A) / (px * px);
    }

    private record Contribution(int start, double[] weights) {}
}
