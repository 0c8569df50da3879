package work.pollochang.forensics.ela.config;

/**
 * 重新壓縮用的參數，所有請求共用同一份且不可變，確保 ELA 結果可以互相比較。
 *
 * @param quality JPEG 壓縮品質，0.0f (最低) 到 1.0f (最高)
 */
public record CompressionParameters(float quality) {

    public CompressionParameters {
        if (Float.isNaN(quality) || quality < 0.0f || quality > 1.0f) {
            throw new IllegalArgumentException("壓縮品質必須介於 0.0 與 1.0: " + quality);
        }
    }
}
