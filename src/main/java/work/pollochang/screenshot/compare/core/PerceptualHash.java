package work.pollochang.screenshot.compare.core;

import dev.brachtendorf.jimagehash.hash.Hash;
import dev.brachtendorf.jimagehash.hashAlgorithms.AverageHash;

import java.awt.image.BufferedImage;

/**
 * 平均雜湊 (aHash) 指紋，由 JImageHash 計算。
 *
 * <p>圖片縮成 {@code size x size} 格後，亮度大於等於平均值的格子為 1，其餘為 0。
 * 純色畫面因此是全 1 的指紋，小範圍變動只會翻轉所在的格子。</p>
 */
public final class PerceptualHash {

    private final Hash hash;

    private PerceptualHash(Hash hash) {
        this.hash = hash;
    }

    /**
     * @param image 非空圖片
     * @param size  每邊格數，位元數為其平方
     */
    public static PerceptualHash of(PixelImage image, int size) {
        if (image.isEmpty()) {
            throw new IllegalArgumentException("無法計算尺寸為零圖片的雜湊");
        }
        int bitResolution = Math.multiplyExact(size, size);
        BufferedImage buffered = ImageCodec.toBufferedImage(image);
        try {
            return new PerceptualHash(new AverageHash(bitResolution).hash(buffered));
        } finally {
            buffered.flush();
        }
    }

    public int bitCount() {
        return hash.getBitResolution();
    }

    /**
     * @throws IllegalArgumentException 兩個指紋的格數不同
     */
    public int hammingDistance(PerceptualHash other) {
        return hash.hammingDistance(other.hash);
    }

    /**
     * 相似度 = 1 - 正規化漢明距離。
     */
    public double similarity(PerceptualHash other) {
        return 1.0 - hash.normalizedHammingDistance(other.hash);
    }
}
