package work.pollochang.screenshot.compare.core;

import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * 測試用的 ImageIO 讀取器：以 {@link #MAGIC} 開頭的資料解碼為 2x2 的 CIE XYZ 圖片。
 */
class XyzImageReaderSpi extends ImageReaderSpi {

    static final byte[] MAGIC = "XYZTEST".getBytes(StandardCharsets.US_ASCII);

    XyzImageReaderSpi() {
        super("screenshot-compare tests", "1.0",
                new String[]{"xyz-test"}, new String[]{"xyz"}, new String[]{"image/x-xyz-test"},
                XyzImageReader.class.getName(), new Class<?>[]{ImageInputStream.class}, null,
                false, null, null, null, null,
                false, null, null, null, null);
    }

    @Override
    public boolean canDecodeInput(Object source) throws IOException {
        if (!(source instanceof ImageInputStream)) {
            return false;
        }
        ImageInputStream stream = (ImageInputStream) source;
        byte[] header = new byte[MAGIC.length];
        stream.mark();
        try {
            int read = stream.read(header);
            return read == MAGIC.length && Arrays.equals(header, MAGIC);
        } finally {
            stream.reset();
        }
    }

    @Override
    public ImageReader createReaderInstance(Object extension) {
        return new XyzImageReader(this);
    }

    @Override
    public String getDescription(Locale locale) {
        return "CIE XYZ test images";
    }

    static class XyzImageReader extends ImageReader {

        private static final int SIZE = 2;

        XyzImageReader(ImageReaderSpi spi) {
            super(spi);
        }

        private static ComponentColorModel colorModel() {
            return new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_CIEXYZ),
                    false, false, Transparency.OPAQUE, DataBuffer.TYPE_BYTE);
        }

        @Override
        public int getNumImages(boolean allowSearch) {
            return 1;
        }

        @Override
        public int getWidth(int imageIndex) {
            return SIZE;
        }

        @Override
        public int getHeight(int imageIndex) {
            return SIZE;
        }

        @Override
        public Iterator<ImageTypeSpecifier> getImageTypes(int imageIndex) {
            ComponentColorModel colorModel = colorModel();
            return List.of(new ImageTypeSpecifier(colorModel, colorModel.createCompatibleSampleModel(SIZE, SIZE)))
                    .iterator();
        }

        @Override
        public IIOMetadata getStreamMetadata() {
            return null;
        }

        @Override
        public IIOMetadata getImageMetadata(int imageIndex) {
            return null;
        }

        @Override
        public BufferedImage read(int imageIndex, ImageReadParam param) {
            ComponentColorModel colorModel = colorModel();
            return new BufferedImage(colorModel, colorModel.createCompatibleWritableRaster(SIZE, SIZE), false, null);
        }
    }
}
