package work.pollochang.forensics.ela.report;

import work.pollochang.forensics.ela.core.PixelBuffer;

/**
 * ELA 熱圖的亮度統計，以灰階 (L) 計算。
 *
 * @param mean                平均亮度
 * @param standardDeviation   亮度標準差 (母體)
 * @param highVariancePercent 亮度高於 {@code mean + std} 的像素百分比
 * @param edgeDensity         相鄰像素亮度差的總和除以像素數
 */
public record ElaStatistics(double mean, double standardDeviation, double highVariancePercent, double edgeDensity) {

    public static ElaStatistics of(PixelBuffer heatmap) {
        int width = heatmap.getWidth();
        int height = heatmap.getHeight();
        int[] luma = luma(heatmap);
        int n = luma.length;

        long sum = 0;
        for (int v : luma) {
            sum += v;
        }
        double mean = (double) sum / n;

        double squares = 0.0;
        for (int v : luma) {
            double d = v - mean;
            squares += d * d;
        }
        double std = Math.sqrt(squares / n);

        double threshold = mean + std;
        long bright = 0;
        for (int v : luma) {
            if (v > threshold) bright++;
        }

        long edges = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int v = luma[y * width + x];
                if (y + 1 < height) edges += Math.abs(luma[(y + 1) * width + x] - v);
                if (x + 1 < width) edges += Math.abs(luma[y * width + x + 1] - v);
            }
        }

        return new ElaStatistics(mean, std, 100.0 * bright / n, (double) edges / n);
    }

    // ITU-R 601-2 luma，與常見影像函式庫的 RGB -> L 轉換一致
    private static int[] luma(PixelBuffer buffer) {
        int channels = buffer.getChannels();
        int[] luma = new int[buffer.getWidth() * buffer.getHeight()];
        for (int i = 0, j = 0; i < luma.length; i++, j += channels) {
            if (channels >= 3) {
                luma[i] = (buffer.get(j) * 19595 + buffer.get(j + 1) * 38470 + buffer.get(j + 2) * 7471 + 0x8000) >> 16;
            } else {
                luma[i] = buffer.get(j);
            }
        }
        return luma;
    }
}
