package work.pollochang.screenshot.compare.core;

public enum ComparisonError {
    DECODE_FAILURE("無法解碼圖片"),
    UNSUPPORTED_MODE("色彩模式不支援"),
    ZERO_SIZE("圖片尺寸為零"),
    SHAPE_MISMATCH("正規化後尺寸或通道仍不一致"),
    COMPUTATION_FAILURE("比對計算失敗"),
    OUT_OF_MEMORY("記憶體溢位");

    private final String description;
    ComparisonError(String description) { this.description = description; }
    public String getDescription() { return description; }
}
