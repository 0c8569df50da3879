package work.pollochang.forensics.ela;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.forensics.ela.error.AnalysisFailure;
import work.pollochang.forensics.ela.pipeline.AnalysisResult;
import work.pollochang.forensics.ela.pipeline.ElaAnalyzer;
import work.pollochang.forensics.ela.report.Assessment;
import work.pollochang.forensics.ela.report.ElaReport;
import work.pollochang.forensics.ela.report.ReportWriter;
import work.pollochang.forensics.ela.report.VerdictPolicy;
import work.pollochang.forensics.ela.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * 批次進行錯誤等級分析，每個檔案輸出熱圖、JSON 報告與文字摘要。
 */
@Setter
@Slf4j
public class AnalysisBatch {

    private List<Path> inputFiles = new ArrayList<>();
    private Path fileListPath;
    private Path outputDir;
    private ElaAnalyzer analyzer;
    @Getter
    private long timeOutMinutes = 60;

    /**
     * 批次執行結果。
     * @param total    處理的檔案數
     * @param counters 各結果的數量
     */
    public record BatchSummary(long total, Map<AnalysisOutcome, Long> counters) {

        public long count(AnalysisOutcome outcome) {
            return counters.getOrDefault(outcome, 0L);
        }

        /**
         * 失敗數 = 總數 - 完成 - 跳過。未回報結果的檔案 (任務異常中止或逾時未執行) 也算失敗。
         */
        public long failures() {
            return total - count(AnalysisOutcome.ANALYZED) - count(AnalysisOutcome.SKIPPED_NOT_FOUND);
        }

        /** 沒有回報任何結果的檔案數 */
        public long unaccounted() {
            long reported = counters.values().stream().mapToLong(Long::longValue).sum();
            return total - reported;
        }
    }

    public BatchSummary execute() throws IOException {
        FileTools.ensureDirectoryExists(outputDir);
        VerdictPolicy verdictPolicy = new VerdictPolicy(analyzer.getConfig().manipulationThreshold());

        // 使用 EnumMap 和 AtomicLong 進行線程安全的計數
        Map<AnalysisOutcome, AtomicLong> counters = new EnumMap<>(AnalysisOutcome.class);
        for (AnalysisOutcome outcome : AnalysisOutcome.values()) {
            counters.put(outcome, new AtomicLong(0));
        }

        List<Path> files = collectInputFiles();

        // 執行緒數不超過同時處理上限，避免批次本身觸發容量拒絕
        int poolSize = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(),
                analyzer.getConfig().maxConcurrentRequests()));
        log.info("共 {} 個檔案，建立固定大小為 {} 的執行緒池。", files.size(), poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            for (Path inputPath : files) {
                executor.submit(() -> {
                    AnalysisOutcome outcome;
                    try {
                        outcome = processImage(inputPath, outputDir, analyzer, verdictPolicy);
                    } catch (RuntimeException e) {
                        log.error("{} - 處理時發生未預期的錯誤", inputPath, e);
                        outcome = AnalysisOutcome.FAILED_INTERNAL;
                    }
                    counters.get(outcome).incrementAndGet();
                });
            }

            log.info("所有任務已提交，等待處理完成...");
            executor.shutdown();
            if (!executor.awaitTermination(timeOutMinutes, TimeUnit.MINUTES)) {
                log.warn("執行緒池等待逾時，部分任務可能未完成。");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("執行緒池被中斷。", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // 恢復中斷狀態
        }

        Map<AnalysisOutcome, Long> snapshot = new EnumMap<>(AnalysisOutcome.class);
        counters.forEach((outcome, count) -> snapshot.put(outcome, count.get()));
        BatchSummary summary = new BatchSummary(files.size(), Collections.unmodifiableMap(snapshot));

        log.info("處理結果 -> 總計: {}, 完成: {}, 跳過: {}, 失敗: {}",
                summary.total(),
                summary.count(AnalysisOutcome.ANALYZED),
                summary.count(AnalysisOutcome.SKIPPED_NOT_FOUND),
                summary.failures());
        for (AnalysisOutcome outcome : AnalysisOutcome.values()) {
            if (outcome.isFailure() && summary.count(outcome) > 0) {
                log.info(" {}: {}", outcome.getDescription(), summary.count(outcome));
            }
        }
        if (summary.unaccounted() > 0) {
            log.warn(" 未完成: {}", summary.unaccounted());
        }
        return summary;
    }

    private List<Path> collectInputFiles() throws IOException {
        List<Path> files = new ArrayList<>(inputFiles);
        if (fileListPath != null) {
            // 使用 Stream API 逐行讀取檔案列表
            try (Stream<String> lines = Files.lines(fileListPath)) {
                lines.map(String::trim)
                        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                        .map(Paths::get)
                        .forEach(files::add);
            }
        }
        return files;
    }

    /**
     * 分析單一檔案並將結果寫入輸出目錄。
     */
    static AnalysisOutcome processImage(Path inputPath, Path outputDir, ElaAnalyzer analyzer, VerdictPolicy verdictPolicy) {
        if (!Files.isRegularFile(inputPath) || !Files.isReadable(inputPath)) {
            log.warn("{} - 檔案不存在或不可讀，跳過", inputPath);
            return AnalysisOutcome.SKIPPED_NOT_FOUND;
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(inputPath);
        } catch (IOException e) {
            log.warn("{} - 無法讀取檔案", inputPath, e);
            return AnalysisOutcome.FAILED_IO_ERROR;
        }

        String fileName = inputPath.getFileName().toString();
        AnalysisResult result;
        try {
            result = analyzer.analyze(bytes, fileName);
        } catch (AnalysisFailure failure) {
            log.warn("{} - 分析失敗 [{}] {}", inputPath, failure.getKind(), failure.getMessage());
            return AnalysisOutcome.of(failure.getKind());
        }

        String baseName = FileTools.baseName(inputPath);
        String extension = analyzer.getConfig().heatmapFormat().extension();
        Assessment assessment = verdictPolicy.assess(result.statistics());
        ElaReport report = ElaReport.of(fileName, bytes.length, result, assessment, Instant.now().toString());
        try {
            Files.write(outputDir.resolve("ela_" + baseName + "." + extension), result.heatmap());
            ReportWriter.writeJson(outputDir.resolve(baseName + ".ela.json"), report);
            ReportWriter.writeSummary(outputDir.resolve(baseName + ".ela.txt"), report);
        } catch (IOException e) {
            log.warn("{} - 無法寫入分析結果", inputPath, e);
            return AnalysisOutcome.FAILED_IO_ERROR;
        }

        log.info("{} - {} (信心程度 {}%, 異常分數 {}, 大小: {})", inputPath, assessment.verdict(), assessment.certainty(),
                String.format("%.4f", result.anomalyScore()), FileTools.formatFileSize(bytes.length));
        return AnalysisOutcome.ANALYZED;
    }
}
