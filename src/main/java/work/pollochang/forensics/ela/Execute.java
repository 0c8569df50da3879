package work.pollochang.forensics.ela;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import work.pollochang.forensics.ela.config.ConfigLoader;
import work.pollochang.forensics.ela.config.ElaConfig;
import work.pollochang.forensics.ela.core.AmplificationMode;
import work.pollochang.forensics.ela.core.HeatmapFormat;
import work.pollochang.forensics.ela.core.ScoreStatistic;
import work.pollochang.forensics.ela.pipeline.ElaAnalyzer;
import work.pollochang.forensics.ela.tools.FileTools;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-ela",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "圖片錯誤等級分析 (ELA) 工具")
public class Execute implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "IMAGE", description = "要分析的圖片檔案。")
    private List<File> images = new ArrayList<>();

    @Option(names = {"-f", "--file-list"}, description = "包含圖片路徑的文字檔案，每行一個。")
    private File fileList;

    @Option(names = {"-o", "--output-dir"}, required = true, description = "熱圖與報告的儲存目錄。")
    private File saveDir;

    @Option(names = {"-c", "--config"}, description = "設定檔路徑 (預設: ./ela.properties 或 classpath)。")
    private File configFile;

    @Option(names = {"-q", "--quality"}, description = "重新壓縮品質，範圍從 0.0 到 1.0 (預設: 0.9)。")
    private Float quality;

    @Option(names = {"--max-width"}, description = "可接受的最大寬度 (預設: 8192)。")
    private Integer maxWidth;

    @Option(names = {"--max-height"}, description = "可接受的最大高度 (預設: 8192)。")
    private Integer maxHeight;

    @Option(names = {"--max-bytes"}, description = "可接受的最大檔案大小(bytes) (預設: 20971520, 即 20MB)。")
    private Long maxBytes;

    @Option(names = {"--timeout-ms"}, description = "單一圖片的處理時限(毫秒) (預設: 10000)。")
    private Long timeoutMs;

    @Option(names = {"--max-concurrent"}, description = "同時處理的圖片上限 (預設: 4)。")
    private Integer maxConcurrent;

    @Option(names = {"--amplification"}, description = "差值放大方式: ${COMPLETION-CANDIDATES} (預設: STRETCH)。")
    private AmplificationMode amplification;

    @Option(names = {"--gain"}, description = "FIXED_GAIN 使用的增益 (預設: 10)。")
    private Integer gain;

    @Option(names = {"--score-statistic"}, description = "異常分數統計量: ${COMPLETION-CANDIDATES} (預設: PERCENTILE)。")
    private ScoreStatistic scoreStatistic;

    @Option(names = {"--percentile"}, description = "PERCENTILE 使用的百分位數 (預設: 99)。")
    private Double percentile;

    @Option(names = {"--heatmap-format"}, description = "熱圖格式: ${COMPLETION-CANDIDATES} (預設: PNG)。")
    private HeatmapFormat heatmapFormat;

    @Option(names = {"--timeOut"}, defaultValue = "60", description = "整個批次的等待上限(分鐘) (預設: 60 分鐘)。")
    private long timeOutMinutes;

    @Option(names = {"--threshold"}, description = "判定為竄改的 ELA 平均亮度門檻 (預設: 15)。")
    private Double threshold;

    @Override
    public Integer call() throws Exception {
        if (images.isEmpty() && fileList == null) {
            throw new CommandLine.ParameterException(new CommandLine(this), "請指定圖片檔案或 --file-list");
        }

        ElaConfig config = applyOverrides(ConfigLoader.load(configFile == null ? null : configFile.toPath()));

        log.info("========================================分析程式參數設定========================================");
        log.info("來源列表: {}", fileList == null ? "-" : fileList.getAbsolutePath());
        log.info("指定圖片: {} 個", images.size());
        log.info("輸出目錄: {}", saveDir.getAbsolutePath());
        log.info("重新壓縮品質: {}", config.quality());
        log.info("最大尺寸: {}x{}", config.maxWidth(), config.maxHeight());
        log.info("最大檔案大小: {}", FileTools.formatFileSize(config.maxBytes()));
        log.info("處理時限: {} ms", config.timeout().toMillis());
        log.info("同時處理上限: {}", config.maxConcurrentRequests());
        log.info("放大方式: {} (增益 {})", config.amplificationMode(), config.amplificationGain());
        log.info("異常分數統計量: {} ({})", config.scoreStatistic(), config.scorePercentile());
        log.info("熱圖格式: {}", config.heatmapFormat());
        log.info("批次等待上限: {} 分鐘", timeOutMinutes);
        log.info("========================================分析程式參數設定========================================");

        AnalysisBatch.BatchSummary summary = createBatch(config).execute();

        log.info("所有任務執行完畢");
        return summary.failures() == 0 ? 0 : 1;
    }

    AnalysisBatch createBatch(ElaConfig config) {
        AnalysisBatch batch = new AnalysisBatch();
        List<Path> inputs = new ArrayList<>();
        images.forEach(f -> inputs.add(f.toPath()));
        batch.setInputFiles(inputs);
        batch.setFileListPath(fileList == null ? null : fileList.toPath());
        batch.setOutputDir(saveDir.toPath());
        batch.setAnalyzer(new ElaAnalyzer(config));
        batch.setTimeOutMinutes(timeOutMinutes);
        return batch;
    }

    ElaConfig applyOverrides(ElaConfig base) {
        ElaConfig.ElaConfigBuilder builder = base.toBuilder();
        if (quality != null) builder.quality(quality);
        if (maxWidth != null) builder.maxWidth(maxWidth);
        if (maxHeight != null) builder.maxHeight(maxHeight);
        if (maxBytes != null) builder.maxBytes(maxBytes);
        if (timeoutMs != null) builder.timeout(Duration.ofMillis(timeoutMs));
        if (maxConcurrent != null) builder.maxConcurrentRequests(maxConcurrent);
        if (amplification != null) builder.amplificationMode(amplification);
        if (gain != null) builder.amplificationGain(gain);
        if (scoreStatistic != null) builder.scoreStatistic(scoreStatistic);
        if (percentile != null) builder.scorePercentile(percentile);
        if (heatmapFormat != null) builder.heatmapFormat(heatmapFormat);
        if (threshold != null) builder.manipulationThreshold(threshold);
        return builder.build();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
