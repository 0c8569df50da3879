package work.pollochang.forensics.ela.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.forensics.ela.pipeline.AnalysisResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private static ElaReport sampleReport() {
        ElaStatistics stats = new ElaStatistics(20.0, 10.0, 5.0, 3.0);
        AnalysisResult result = new AnalysisResult("req-7", new byte[]{1, 2, 3}, "image/png",
                0.25, 42L, 640, 480, stats);
        Assessment assessment = new VerdictPolicy(15.0).assess(stats);
        return ElaReport.of("photo.jpg", 2048L, result, assessment, "2026-01-01T00:00:00Z");
    }

    @Test
    void testJson_ShouldContainReportFields() throws IOException {
        String json = ReportWriter.toJson(sampleReport());

        JsonNode node = new ObjectMapper().readTree(json);
        assertEquals("photo.jpg", node.get("fileName").asText());
        assertEquals("req-7", node.get("requestId").asText());
        assertEquals("MANIPULATED", node.get("result").asText());
        assertEquals(71, node.get("certainty").asInt());
        assertEquals("640 x 480", node.get("dimensions").asText());
        assertEquals("2 KB", node.get("fileSize").asText());
        assertEquals(20.0, node.get("metrics").get("mean").asDouble(), 1e-9);
        assertEquals("image/png", node.get("heatmapContentType").asText());
    }

    @Test
    void testJson_ShouldReadBackEqualReport() {
        ElaReport report = sampleReport();

        assertEquals(report, ReportWriter.fromJson(ReportWriter.toJson(report)));
    }

    @Test
    void testMalformedJson_ShouldThrow() {
        assertThrows(ReportSerializationException.class, () -> ReportWriter.fromJson("{ not json"));
    }

    @Test
    void testSummary_ShouldDescribeVerdict() {
        String summary = ReportWriter.toSummary(sampleReport());

        assertTrue(summary.contains("photo.jpg"));
        assertTrue(summary.contains("MANIPULATED"));
        assertTrue(summary.contains(Verdict.MANIPULATED.getDescription()));
        assertTrue(summary.contains("640 x 480"));
        assertTrue(summary.contains("42 ms"));
    }

    @Test
    void testWrite_ShouldCreateBothFiles(@TempDir Path dir) throws IOException {
        ElaReport report = sampleReport();
        Path json = dir.resolve("photo.ela.json");
        Path text = dir.resolve("photo.ela.txt");

        ReportWriter.writeJson(json, report);
        ReportWriter.writeSummary(text, report);

        assertEquals(report, ReportWriter.fromJson(Files.readString(json, StandardCharsets.UTF_8)));
        assertEquals(ReportWriter.toSummary(report), Files.readString(text, StandardCharsets.UTF_8));
    }
}
