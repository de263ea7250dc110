package work.pollochang.screenshot.compare.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 已解碼的圖片：寬、高、色彩模式與原始像素緩衝區。
 *
 * <p>緩衝區以列為主 (row-major)、通道交錯排列，長度必須等於
 * {@code width * height * mode.channels()}。建構時與 {@link #pixels()} 都會複製緩衝區，
 * 外部對陣列的修改不會影響圖片內容。相等性比較的是像素內容而非陣列參考。</p>
 *
 * @param width  寬度 (px)
 * @param height 高度 (px)
 * @param mode   色彩模式
 * @param pixels 像素緩衝區
 * @since 0.1.0
 */
public record PixelImage(int width, int height, ColorMode mode, byte[] pixels) {

    public PixelImage {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(pixels, "pixels must not be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("圖片尺寸不可為負數: " + width + "x" + height);
        }
        long expected = (long) width * height * mode.channels();
        if (expected != pixels.length) {
            throw new IllegalArgumentException(String.format(
                    "像素緩衝區長度 %d 與 %dx%d (%s) 不符，預期 %d",
                    pixels.length, width, height, mode, expected));
        }
        pixels = pixels.clone();
    }

    /**
     * @return 像素緩衝區的複本
     */
    @Override
    public byte[] pixels() {
        return pixels.clone();
    }

    /**
     * 建立指定尺寸、所有通道皆為 0 的圖片。
     */
    public static PixelImage blank(int width, int height, ColorMode mode) {
        return new PixelImage(width, height, mode, new byte[width * height * mode.channels()]);
    }

    public int channels() {
        return mode.channels();
    }

    public int pixelCount() {
        return width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public boolean sameShape(PixelImage other) {
        return width == other.width && height == other.height && mode == other.mode;
    }

    /**
     * 取得指定像素某一通道的值 (0–255)。
     */
    public int sample(int x, int y, int channel) {
        return pixels[(y * width + x) * mode.channels() + channel] & 0xFF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelImage)) {
            return false;
        }
        PixelImage other = (PixelImage) o;
        return sameShape(other) && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height, mode) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "PixelImage[" + width + "x" + height + " " + mode + ", " + pixels.length + " bytes]";
    }
}
