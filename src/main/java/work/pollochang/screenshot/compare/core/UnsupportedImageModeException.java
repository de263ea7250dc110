package work.pollochang.screenshot.compare.core;

/**
 * 圖片的色彩空間無法轉換為灰階、RGB 或 RGBA。
 */
public class UnsupportedImageModeException extends ImageDecodeException {

    public UnsupportedImageModeException(String message) {
        super(message);
    }
}
