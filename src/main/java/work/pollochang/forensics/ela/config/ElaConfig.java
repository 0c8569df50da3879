package work.pollochang.forensics.ela.config;

import lombok.Builder;
import work.pollochang.forensics.ela.core.AmplificationMode;
import work.pollochang.forensics.ela.core.HeatmapFormat;
import work.pollochang.forensics.ela.core.ScoreStatistic;

import java.time.Duration;
import java.util.Objects;

/**
 * 程式啟動時讀取一次的設定，之後不可變。
 *
 * @param quality               重新壓縮的 JPEG 品質 (0.0 ~ 1.0)
 * @param maxWidth              可接受的最大寬度 (px)
 * @param maxHeight             可接受的最大高度 (px)
 * @param maxBytes              可接受的最大檔案大小 (bytes)
 * @param timeout               單一請求的處理時限
 * @param maxConcurrentRequests 同時處理中的請求上限
 * @param amplificationMode     差值放大方式
 * @param amplificationGain     {@link AmplificationMode#FIXED_GAIN} 使用的增益
 * @param scoreStatistic        異常分數採用的統計量
 * @param scorePercentile       {@link ScoreStatistic#PERCENTILE} 使用的百分位數 (0, 100]
 * @param heatmapFormat         熱圖輸出格式
 * @param manipulationThreshold 判定為竄改的 ELA 平均亮度門檻
 */
@Builder(toBuilder = true)
public record ElaConfig(
        float quality,
        int maxWidth,
        int maxHeight,
        long maxBytes,
        Duration timeout,
        int maxConcurrentRequests,
        AmplificationMode amplificationMode,
        int amplificationGain,
        ScoreStatistic scoreStatistic,
        double scorePercentile,
        HeatmapFormat heatmapFormat,
        double manipulationThreshold
) {

    public static final float DEFAULT_QUALITY = 0.90f;

    public ElaConfig {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(amplificationMode, "amplificationMode must not be null");
        Objects.requireNonNull(scoreStatistic, "scoreStatistic must not be null");
        Objects.requireNonNull(heatmapFormat, "heatmapFormat must not be null");
        // 品質範圍交給 CompressionParameters 檢查
        new CompressionParameters(quality);
        if (maxWidth <= 0 || maxHeight <= 0) {
            throw new IllegalArgumentException("最大尺寸必須為正數: " + maxWidth + "x" + maxHeight);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("最大檔案大小必須為正數: " + maxBytes);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("處理時限必須為正數: " + timeout);
        }
        if (maxConcurrentRequests <= 0) {
            throw new IllegalArgumentException("同時處理上限必須為正數: " + maxConcurrentRequests);
        }
        if (amplificationGain <= 0) {
            throw new IllegalArgumentException("放大增益必須為正數: " + amplificationGain);
        }
        if (!(scorePercentile > 0.0 && scorePercentile <= 100.0)) {
            throw new IllegalArgumentException("百分位數必須介於 (0, 100]: " + scorePercentile);
        }
        if (manipulationThreshold < 0.0) {
            throw new IllegalArgumentException("竄改門檻不可為負數: " + manipulationThreshold);
        }
    }

    public static ElaConfig defaults() {
        return ElaConfig.builder()
                .quality(DEFAULT_QUALITY)
                .maxWidth(8192)
                .maxHeight(8192)
                .maxBytes(20L * 1024 * 1024)
                .timeout(Duration.ofSeconds(10))
                .maxConcurrentRequests(4)
                .amplificationMode(AmplificationMode.STRETCH)
                .amplificationGain(10)
                .scoreStatistic(ScoreStatistic.PERCENTILE)
                .scorePercentile(99.0)
                .heatmapFormat(HeatmapFormat.PNG)
                .manipulationThreshold(15.0)
                .build();
    }

    public CompressionParameters compressionParameters() {
        return new CompressionParameters(quality);
    }
}
