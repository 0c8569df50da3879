package work.pollochang.forensics.ela.report;

import work.pollochang.forensics.ela.pipeline.AnalysisResult;
import work.pollochang.forensics.ela.tools.FileTools;

/**
 * 匯出用的分析報告。
 */
public record ElaReport(
        String fileName,
        String requestId,
        Verdict result,
        int certainty,
        String description,
        double anomalyScore,
        ElaStatistics metrics,
        String dimensions,
        long fileSizeBytes,
        String fileSize,
        long processingDurationMs,
        String heatmapContentType,
        String generatedAt
) {

    public static ElaReport of(String fileName, long fileSizeBytes, AnalysisResult result,
                               Assessment assessment, String generatedAt) {
        return new ElaReport(
                fileName,
                result.requestId(),
                assessment.verdict(),
                assessment.certainty(),
                assessment.description(),
                result.anomalyScore(),
                result.statistics(),
                result.width() + " x " + result.height(),
                fileSizeBytes,
                FileTools.formatFileSize(fileSizeBytes),
                result.processingDurationMs(),
                result.contentType(),
                generatedAt
        );
    }
}
