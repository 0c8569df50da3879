package work.pollochang.forensics.ela.core;

import java.util.Objects;

/**
 * 將差值放大到 0-255 的顯示範圍，並算出異常分數。
 *
 * <p>異常分數預設採用高百分位數而非最大值，單一雜訊像素不會把分數拉高。
 * 最大差值為 0 時，輸出全為 0 且分數為 0.0。</p>
 */
public class ErrorLevelNormalizer {

    private final AmplificationMode mode;
    private final int gain;
    private final ScoreStatistic statistic;
    private final double percentile;

    public ErrorLevelNormalizer(AmplificationMode mode, int gain, ScoreStatistic statistic, double percentile) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.statistic = Objects.requireNonNull(statistic, "statistic must not be null");
        if (gain <= 0) {
            throw new IllegalArgumentException("gain must be positive: " + gain);
        }
        if (!(percentile > 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("percentile must be in (0, 100]: " + percentile);
        }
        this.gain = gain;
        this.percentile = percentile;
    }

    public NormalizedDiff normalize(DiffBuffer diff) {
        int max = diff.max();
        PixelBuffer out = PixelBuffer.blank(diff.getWidth(), diff.getHeight(), diff.getChannels());
        if (max == 0) {
            return new NormalizedDiff(out, 0.0, 0);
        }

        for (int i = 0; i < diff.length(); i++) {
            out.set(i, amplify(diff.get(i), max));
        }
        return new NormalizedDiff(out, score(diff, max), max);
    }

    private int amplify(int magnitude, int max) {
        long value;
        switch (mode) {
            case FIXED_GAIN:
                value = (long) magnitude * gain;
                break;
            case STRETCH:
            default:
                // 四捨五入
                value = ((long) magnitude * PixelBuffer.MAX_SAMPLE + max / 2) / max;
                break;
        }
        return (int) Math.min(PixelBuffer.MAX_SAMPLE, value);
    }

    private double score(DiffBuffer diff, int max) {
        double value;
        switch (statistic) {
            case MAXIMUM:
                value = max;
                break;
            case MEAN:
                value = mean(diff);
                break;
            case PERCENTILE:
            default:
                value = percentileOf(diff, max);
                break;
        }
        return Math.max(0.0, Math.min(1.0, value / PixelBuffer.MAX_SAMPLE));
    }

    private static double mean(DiffBuffer diff) {
        long sum = 0;
        for (int i = 0; i < diff.length(); i++) {
            sum += diff.get(i);
        }
        return (double) sum / diff.length();
    }

    // 最近秩法，以直方圖計算
    private int percentileOf(DiffBuffer diff, int max) {
        long[] histogram = new long[max + 1];
        for (int i = 0; i < diff.length(); i++) {
            histogram[diff.get(i)]++;
        }
        long rank = Math.max(1L, (long) Math.ceil(percentile / 100.0 * diff.length()));
        long cumulative = 0;
        for (int value = 0; value <= max; value++) {
            cumulative += histogram[value];
            if (cumulative >= rank) {
                return value;
            }
        }
        return max;
    }
}
