package work.pollochang.screenshot.compare.core;

/**
 * 產生測試用的合成圖片。
 */
public final class TestImages {

    private TestImages() {}

    /**
     * 單一顏色的 RGB 圖片
     */
    public static PixelImage solid(int width, int height, int r, int g, int b) {
        byte[] pixels = new byte[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            pixels[i * 3] = (byte) r;
            pixels[i * 3 + 1] = (byte) g;
            pixels[i * 3 + 2] = (byte) b;
        }
        return new PixelImage(width, height, ColorMode.RGB, pixels);
    }

    /**
     * 有明顯紋理的 RGB 漸層圖片，用來模擬一般畫面
     */
    public static PixelImage gradient(int width, int height) {
        byte[] pixels = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int offset = (y * width + x) * 3;
                pixels[offset] = (byte) (x * 4);
                pixels[offset + 1] = (byte) (y * 5);
                pixels[offset + 2] = (byte) ((x * 7 + y * 3) % 256);
            }
        }
        return new PixelImage(width, height, ColorMode.RGB, pixels);
    }

    /**
     * 灰階漸層
     */
    public static PixelImage grayGradient(int width, int height) {
        byte[] pixels = new byte[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[y * width + x] = (byte) ((x * 3 + y * 2) % 256);
            }
        }
        return new PixelImage(width, height, ColorMode.GRAY, pixels);
    }

    /**
     * 複製一張 RGB 圖片並在指定範圍內填上顏色，原圖不變
     */
    public static PixelImage withRect(PixelImage source, int x0, int y0, int w, int h, int r, int g, int b) {
        if (source.mode() != ColorMode.RGB) {
            throw new IllegalArgumentException("only RGB");
        }
        byte[] pixels = source.pixels().clone();
        for (int y = y0; y < y0 + h; y++) {
            for (int x = x0; x < x0 + w; x++) {
                int offset = (y * source.width() + x) * 3;
                pixels[offset] = (byte) r;
                pixels[offset + 1] = (byte) g;
                pixels[offset + 2] = (byte) b;
            }
        }
        return new PixelImage(source.width(), source.height(), ColorMode.RGB, pixels);
    }

    /**
     * 以比例座標定義的色塊版面：左側深灰、右側淺灰，右上角一塊黑色方塊。
     * 不同尺寸產生的是同一份內容的縮放版本。
     */
    public static PixelImage layout(int size) {
        byte[] pixels = new byte[size * size * 3];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                double u = (double) x / size;
                double v = (double) y / size;
                int value;
                if (u >= 0.75 && v < 0.25) {
                    value = 0;
                } else if (u < 0.5) {
                    value = 60;
                } else {
                    value = 200;
                }
                int offset = (y * size + x) * 3;
                pixels[offset] = (byte) value;
                pixels[offset + 1] = (byte) value;
                pixels[offset + 2] = (byte) value;
            }
        }
        return new PixelImage(size, size, ColorMode.RGB, pixels);
    }
}
