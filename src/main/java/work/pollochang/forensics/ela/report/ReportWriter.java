package work.pollochang.forensics.ela.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 將 {@link ElaReport} 輸出為 JSON 報告或純文字摘要。
 */
@Slf4j
public final class ReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀

    private ReportWriter() {}

    public static String toJson(ElaReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("無法將報告轉換為 JSON: " + report.fileName(), e);
        }
    }

    public static ElaReport fromJson(String json) {
        try {
            return MAPPER.readValue(json, ElaReport.class);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("無法解析 JSON 報告", e);
        }
    }

    public static String toSummary(ElaReport report) {
        ElaStatistics m = report.metrics();
        return "圖片鑑識報告\n"
                + "========================\n"
                + "檔案: " + report.fileName() + "\n"
                + "請求: " + report.requestId() + "\n"
                + "結果: " + report.result() + " (" + report.result().getDescription() + ")\n"
                + "信心程度: " + report.certainty() + "%\n"
                + "說明: " + report.description() + "\n"
                + "\n"
                + "技術指標:\n"
                + String.format("- 異常分數: %.4f%n", report.anomalyScore())
                + String.format("- ELA 平均值: %.2f%n", m.mean())
                + String.format("- ELA 標準差: %.2f%n", m.standardDeviation())
                + "- 圖片尺寸: " + report.dimensions() + "\n"
                + "- 檔案大小: " + report.fileSize() + "\n"
                + String.format("- 高變異像素: %.1f%%%n", m.highVariancePercent())
                + String.format("- 邊緣密度: %.2f%n", m.edgeDensity())
                + "- 處理時間: " + report.processingDurationMs() + " ms\n"
                + "\n"
                + "產生時間: " + report.generatedAt() + "\n";
    }

    public static void writeJson(Path path, ElaReport report) throws IOException {
        Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
        log.debug("{} - JSON 報告已寫入", path);
    }

    public static void writeSummary(Path path, ElaReport report) throws IOException {
        Files.writeString(path, toSummary(report), StandardCharsets.UTF_8);
        log.debug("{} - 文字摘要已寫入", path);
    }
}
