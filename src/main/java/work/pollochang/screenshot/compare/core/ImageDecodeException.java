package work.pollochang.screenshot.compare.core;

import java.io.IOException;

/**
 * 資料無法解讀為有效的圖片。
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
