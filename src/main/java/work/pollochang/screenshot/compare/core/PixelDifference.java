package work.pollochang.screenshot.compare.core;

import java.awt.Rectangle;

/**
 * 逐像素比對：任一通道不同即視為差異，沒有容忍範圍。
 * 同時產生二值的差異圖 (變動為紅色，其餘透明)。
 */
final class PixelDifference {

    private PixelDifference() {}

    /**
     * @param first  基準圖片
     * @param second 與基準同尺寸、同模式的圖片
     */
    static Outcome compute(PixelImage first, PixelImage second) {
        if (!first.sameShape(second)) {
            throw new IllegalArgumentException("逐像素比對需要相同尺寸與模式");
        }
        int width = first.width();
        int height = first.height();
        int channels = first.channels();
        byte[] a = first.pixels();
        byte[] b = second.pixels();
        byte[] diff = new byte[width * height * 4];

        long changed = 0;
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = -1;
        int maxY = -1;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int p = y * width + x;
                int offset = p * channels;
                boolean differs = false;
                for (int c = 0; c < channels; c++) {
                    if (a[offset + c] != b[offset + c]) {
                        differs = true;
                        break;
                    }
                }
                if (differs) {
                    changed++;
                    int d = p * 4;
                    diff[d] = (byte) (DiffImage.HIGHLIGHT_RGBA >>> 24);
                    diff[d + 1] = (byte) (DiffImage.HIGHLIGHT_RGBA >>> 16);
                    diff[d + 2] = (byte) (DiffImage.HIGHLIGHT_RGBA >>> 8);
                    diff[d + 3] = (byte) DiffImage.HIGHLIGHT_RGBA;
                    minX = Math.min(minX, x);
                    minY = Math.min(minY, y);
                    maxX = Math.max(maxX, x);
                    maxY = Math.max(maxY, y);
                }
            }
        }

        Rectangle bounds = changed == 0 ? null : new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
        DiffImage diffImage = new DiffImage(new PixelImage(width, height, ColorMode.RGBA, diff), changed, bounds);
        double ratio = (double) changed / ((long) width * height);
        return new Outcome(ratio, diffImage);
    }

    record Outcome(double ratio, DiffImage diffImage) {}
}
