package work.pollochang.forensics.ela.core;

/**
 * 正規化結果。
 *
 * @param buffer       放大後的緩衝區，每個樣本都在 0-255
 * @param anomalyScore 異常分數 (0.0 ~ 1.0)
 * @param maxMagnitude 原始差值中的最大值
 */
public record NormalizedDiff(PixelBuffer buffer, double anomalyScore, int maxMagnitude) {
}
