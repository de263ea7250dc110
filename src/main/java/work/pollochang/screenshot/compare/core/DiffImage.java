package work.pollochang.screenshot.compare.core;

import java.awt.Rectangle;
import java.util.Optional;

/**
 * 差異圖：與比對圖片同尺寸的 RGBA 圖片，有變動的像素標為不透明紅色，其餘為全透明。
 *
 * @param image         RGBA 差異圖
 * @param changedPixels 有變動的像素數量
 * @param changedBounds 所有變動像素的外接矩形，沒有變動時為 {@code null}
 */
public record DiffImage(PixelImage image, long changedPixels, Rectangle changedBounds) {

    public static final int HIGHLIGHT_RGBA = 0xFF0000FF;

    public DiffImage {
        if (image.mode() != ColorMode.RGBA) {
            throw new IllegalArgumentException("差異圖必須為 RGBA，實際為 " + image.mode());
        }
        changedBounds = changedBounds == null ? null : new Rectangle(changedBounds);
    }

    public int width() {
        return image.width();
    }

    public int height() {
        return image.height();
    }

    /**
     * @return 外接矩形的複本，沒有變動時為 {@code null}
     */
    @Override
    public Rectangle changedBounds() {
        return changedBounds == null ? null : new Rectangle(changedBounds);
    }

    public boolean hasChanges() {
        return changedPixels > 0;
    }

    public Optional<Rectangle> bounds() {
        return Optional.ofNullable(changedBounds).map(Rectangle::new);
    }

    /**
     * 指定位置是否被標記為變動。
     */
    public boolean isChanged(int x, int y) {
        return image.sample(x, y, 3) != 0;
    }
}
