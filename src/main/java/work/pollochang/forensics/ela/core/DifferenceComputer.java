package work.pollochang.forensics.ela.core;

import work.pollochang.forensics.ela.error.ShapeMismatchException;

/**
 * 逐樣本計算原圖與往返圖的絕對差值。
 */
public class DifferenceComputer {

    public DiffBuffer difference(PixelBuffer original, PixelBuffer recompressed) throws ShapeMismatchException {
        if (!original.sameShapeAs(recompressed)) {
            throw new ShapeMismatchException("緩衝區尺寸不一致: " + original.shape() + " vs "
                    + (recompressed == null ? "null" : recompressed.shape()));
        }

        int[] magnitudes = new int[original.length()];
        for (int i = 0; i < magnitudes.length; i++) {
            magnitudes[i] = Math.abs(original.get(i) - recompressed.get(i));
        }
        return new DiffBuffer(original.getWidth(), original.getHeight(), original.getChannels(), magnitudes);
    }
}
