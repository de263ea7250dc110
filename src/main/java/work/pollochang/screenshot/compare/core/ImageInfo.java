package work.pollochang.screenshot.compare.core;

/**
 * 比對前的圖片尺寸與色彩模式，記錄在比對報告中。
 *
 * @param width  寬度 (px)
 * @param height 高度 (px)
 * @param mode   色彩模式
 */
public record ImageInfo(int width, int height, ColorMode mode) {

    public static ImageInfo of(PixelImage image) {
        return new ImageInfo(image.width(), image.height(), image.mode());
    }
}
