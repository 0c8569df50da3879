package work.pollochang.forensics.ela.pipeline;

import work.pollochang.forensics.ela.report.ElaStatistics;

import java.util.Objects;

/**
 * 單一請求的分析結果，建立後不可變。
 *
 * @param requestId            請求識別碼
 * @param heatmap              熱圖內容 (存取時回傳複本)
 * @param contentType          熱圖的 MIME 類型
 * @param anomalyScore         異常分數 (0.0 ~ 1.0)
 * @param processingDurationMs 處理時間 (毫秒)
 * @param width                原圖寬度
 * @param height               原圖高度
 * @param statistics           熱圖亮度統計
 */
public record AnalysisResult(
        String requestId,
        byte[] heatmap,
        String contentType,
        double anomalyScore,
        long processingDurationMs,
        int width,
        int height,
        ElaStatistics statistics
) {

    public AnalysisResult {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(heatmap, "heatmap must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        heatmap = heatmap.clone();
    }

    @Override
    public byte[] heatmap() {
        return heatmap.clone();
    }

    public int heatmapSize() {
        return heatmap.length;
    }
}
