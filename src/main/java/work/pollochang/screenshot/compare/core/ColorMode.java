package work.pollochang.screenshot.compare.core;

/**
 * 像素的色彩模式，每個通道皆為 0–255 的 8 位元值。
 */
public enum ColorMode {
    GRAY(1, "灰階"),
    RGB(3, "RGB"),
    RGBA(4, "RGBA (含透明度)");

    private final int channels;
    private final String description;

    ColorMode(int channels, String description) {
        this.channels = channels;
        this.description = description;
    }

    public int channels() { return channels; }
    public String getDescription() { return description; }
}
