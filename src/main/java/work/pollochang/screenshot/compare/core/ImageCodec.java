package work.pollochang.screenshot.compare.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

/**
 * 截圖檔案與 {@link PixelImage} 之間的轉換 (ImageIO)。
 *
 * <p>比對器本身不做任何檔案 I/O，解碼與差異圖的儲存都透過這個類別在呼叫端完成。</p>
 */
@Slf4j
public final class ImageCodec {

    // 註冊 ImageIO 外掛程式並停用磁碟快取，全部在記憶體中處理
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    private ImageCodec() {}

    /**
     * 讀取並解碼圖片檔案。
     *
     * @throws ImageDecodeException 檔案內容不是可解碼的圖片
     * @throws IOException          檔案無法讀取
     */
    public static PixelImage read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        return decode(Files.readAllBytes(path));
    }

    /**
     * 解碼已編碼的圖片資料 (PNG、JPEG 等 ImageIO 支援的格式)。
     *
     * @throws ImageDecodeException          資料無法解讀為圖片
     * @throws UnsupportedImageModeException 色彩空間無法轉換
     */
    public static PixelImage decode(byte[] data) throws ImageDecodeException {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("圖片資料為空");
        }

        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (in == null) {
                throw new ImageDecodeException("無法建立圖片輸入流");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new ImageDecodeException("找不到對應的圖片讀取器 (" + data.length + " bytes)");
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                BufferedImage image = reader.read(0);
                log.debug("解碼完成: 格式 {}, 尺寸 {}x{}",
                        reader.getFormatName(), image.getWidth(), image.getHeight());
                try {
                    return fromBufferedImage(image);
                } finally {
                    image.flush();
                }
            } finally {
                reader.dispose();
            }
        } catch (ImageDecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("圖片解碼失敗: " + e.getMessage(), e);
        }
    }

    /**
     * 將 {@link BufferedImage} 轉成 {@link PixelImage}。
     * 單通道灰階直接讀取樣本值；含透明度者轉為 RGBA；其他 RGB 類型轉為 RGB。
     *
     * @throws UnsupportedImageModeException 色彩空間既非 RGB 也非灰階
     */
    public static PixelImage fromBufferedImage(BufferedImage image) throws UnsupportedImageModeException {
        Objects.requireNonNull(image, "image must not be null");
        ColorModel colorModel = image.getColorModel();
        int colorSpaceType = colorModel.getColorSpace().getType();
        int width = image.getWidth();
        int height = image.getHeight();

        if (colorSpaceType == ColorSpace.TYPE_GRAY && !colorModel.hasAlpha()) {
            return readGray(image.getRaster(), colorModel.getComponentSize(0), width, height);
        }
        if (colorSpaceType != ColorSpace.TYPE_RGB && colorSpaceType != ColorSpace.TYPE_GRAY) {
            throw new UnsupportedImageModeException("不支援的色彩空間類型: " + colorSpaceType);
        }

        ColorMode mode = colorModel.hasAlpha() ? ColorMode.RGBA : ColorMode.RGB;
        int channels = mode.channels();
        byte[] pixels = new byte[width * height * channels];
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                int offset = (y * width + x) * channels;
                pixels[offset] = (byte) (argb >>> 16);
                pixels[offset + 1] = (byte) (argb >>> 8);
                pixels[offset + 2] = (byte) argb;
                if (channels == 4) {
                    pixels[offset + 3] = (byte) (argb >>> 24);
                }
            }
        }
        return new PixelImage(width, height, mode, pixels);
    }

    /**
     * 將 {@link PixelImage} 轉成 {@link BufferedImage}，尺寸不可為零。
     */
    public static BufferedImage toBufferedImage(PixelImage image) {
        if (image.isEmpty()) {
            throw new IllegalArgumentException("無法轉換尺寸為零的圖片");
        }
        int width = image.width();
        int height = image.height();
        byte[] pixels = image.pixels();

        if (image.mode() == ColorMode.GRAY) {
            BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            int[] samples = new int[pixels.length];
            for (int i = 0; i < pixels.length; i++) {
                samples[i] = pixels[i] & 0xFF;
            }
            gray.getRaster().setPixels(0, 0, width, height, samples);
            return gray;
        }

        boolean alpha = image.mode() == ColorMode.RGBA;
        int channels = image.channels();
        BufferedImage result = new BufferedImage(width, height,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int offset = (y * width + x) * channels;
                int a = alpha ? pixels[offset + 3] & 0xFF : 0xFF;
                row[x] = (a << 24)
                        | ((pixels[offset] & 0xFF) << 16)
                        | ((pixels[offset + 1] & 0xFF) << 8)
                        | (pixels[offset + 2] & 0xFF);
            }
            result.setRGB(0, y, width, 1, row, 0, width);
        }
        return result;
    }

    public static byte[] encodePng(PixelImage image) throws IOException {
        BufferedImage buffered = toBufferedImage(image);
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(buffered, "png", bos)) {
                throw new IOException("找不到 PNG 寫入器");
            }
            return bos.toByteArray();
        } finally {
            buffered.flush();
        }
    }

    /**
     * 以 PNG 格式寫出圖片，例如比對產生的差異圖。
     */
    public static void writePng(PixelImage image, Path outputFile) throws IOException {
        Files.write(outputFile, encodePng(image));
        log.debug("{} - 已寫出 PNG ({}x{})", outputFile, image.width(), image.height());
    }

    private static PixelImage readGray(Raster raster, int bits, int width, int height) {
        int[] samples = raster.getSamples(0, 0, width, height, 0, (int[]) null);
        byte[] pixels = new byte[samples.length];
        int max = (1 << bits) - 1;
        for (int i = 0; i < samples.length; i++) {
            int value = samples[i];
            if (bits > 8) {
                value >>= bits - 8;
            } else if (bits < 8) {
                value = value * 255 / max;
            }
            pixels[i] = (byte) value;
        }
        return new PixelImage(width, height, ColorMode.GRAY, pixels);
    }
}
