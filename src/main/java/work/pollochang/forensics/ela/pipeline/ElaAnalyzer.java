package work.pollochang.forensics.ela.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import work.pollochang.forensics.ela.config.CompressionParameters;
import work.pollochang.forensics.ela.config.ElaConfig;
import work.pollochang.forensics.ela.core.DiffBuffer;
import work.pollochang.forensics.ela.core.DifferenceComputer;
import work.pollochang.forensics.ela.core.ErrorLevelNormalizer;
import work.pollochang.forensics.ela.core.HeatmapRenderer;
import work.pollochang.forensics.ela.core.ImageDecoder;
import work.pollochang.forensics.ela.core.NormalizedDiff;
import work.pollochang.forensics.ela.core.PixelBuffer;
import work.pollochang.forensics.ela.core.RecompressionEngine;
import work.pollochang.forensics.ela.error.AnalysisFailure;
import work.pollochang.forensics.ela.error.ElaStageException;
import work.pollochang.forensics.ela.error.ErrorKind;
import work.pollochang.forensics.ela.report.ElaStatistics;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 錯誤等級分析 (ELA) 的請求協調器。
 *
 * <p>每個請求依序執行 解碼 → 重新壓縮 → 差值 → 正規化 → 熱圖編碼，所有緩衝區只屬於該請求。
 * 跨請求共用的只有不可變的設定與限制同時處理數量的號誌。</p>
 *
 * <ul>
 *   <li>同時處理數量達上限時立即以 {@link ErrorKind#CAPACITY_ERROR} 拒絕，不排隊等待。</li>
 *   <li>每個階段開始前檢查期限，逾時以 {@link ErrorKind#TIMEOUT_ERROR} 結束，不回傳部分結果。</li>
 *   <li>任何階段的失敗都轉換為恰好一種 {@link ErrorKind}，不會自動重試。</li>
 * </ul>
 *
 * <p>{@link #analyze(byte[], String)} 是同步呼叫，呼叫端負責排程到適當的執行緒。</p>
 *
 * <p>使用範例：
 * <pre>{@code
 * ElaAnalyzer analyzer = new ElaAnalyzer(ConfigLoader.loadDefault());
 * AnalysisResult result = analyzer.analyze(Files.readAllBytes(path), "upload-42");
 * }</pre>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ElaAnalyzer {

    /** MDC 中請求識別碼的鍵名 */
    public static final String MDC_REQUEST_ID = "requestId";

    private final ElaConfig config;
    private final CompressionParameters compressionParameters;
    private final ImageDecoder decoder;
    private final RecompressionEngine recompressionEngine;
    private final DifferenceComputer differenceComputer;
    private final ErrorLevelNormalizer normalizer;
    private final HeatmapRenderer renderer;
    private final Semaphore permits;
    private final Clock clock;

    public ElaAnalyzer(ElaConfig config) {
        this(config,
                new ImageDecoder(config.maxWidth(), config.maxHeight(), config.maxBytes()),
                new RecompressionEngine(),
                new DifferenceComputer(),
                new ErrorLevelNormalizer(config.amplificationMode(), config.amplificationGain(),
                        config.scoreStatistic(), config.scorePercentile()),
                new HeatmapRenderer(config.heatmapFormat()),
                Clock.systemUTC());
    }

    public ElaAnalyzer(ElaConfig config,
                       ImageDecoder decoder,
                       RecompressionEngine recompressionEngine,
                       DifferenceComputer differenceComputer,
                       ErrorLevelNormalizer normalizer,
                       HeatmapRenderer renderer,
                       Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.compressionParameters = config.compressionParameters();
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.recompressionEngine = Objects.requireNonNull(recompressionEngine, "recompressionEngine must not be null");
        this.differenceComputer = Objects.requireNonNull(differenceComputer, "differenceComputer must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.permits = new Semaphore(config.maxConcurrentRequests(), true);
    }

    public ElaConfig getConfig() {
        return config;
    }

    /** 目前還可以接受的請求數 */
    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * 以設定的處理時限建立請求內容。
     */
    public RequestContext newContext(byte[] bytes, String requestId) {
        return RequestContext.create(bytes, requestId, config.timeout(), clock);
    }

    /**
     * 分析一張上傳的圖片。
     *
     * @param bytes     圖片內容
     * @param requestId 請求識別碼，為 null 或空白時自動產生
     * @return 分析結果
     * @throws AnalysisFailure 任何階段失敗、逾時或超過同時處理上限
     */
    public AnalysisResult analyze(byte[] bytes, String requestId) throws AnalysisFailure {
        return analyze(newContext(bytes, requestId));
    }

    /**
     * 以呼叫端建立的請求內容 (含自訂期限) 進行分析。
     *
     * <p>{@link OutOfMemoryError} 轉為 {@link ErrorKind#CAPACITY_ERROR}，編解碼器的
     * {@link StackOverflowError} 轉為當時階段的錯誤類型；其他 {@link Error} 代表 JVM 已不可用，直接往上拋。</p>
     *
     * @throws NullPointerException context 為 null
     */
    public AnalysisResult analyze(RequestContext context) throws AnalysisFailure {
        Objects.requireNonNull(context, "context must not be null");
        String requestId = context.getRequestId();
        if (!permits.tryAcquire()) {
            log.warn("{} - 同時處理的請求已達上限 {}，拒絕請求", requestId, config.maxConcurrentRequests());
            throw new AnalysisFailure(requestId, ErrorKind.CAPACITY_ERROR,
                    ErrorKind.CAPACITY_ERROR.getDescription() + " (" + config.maxConcurrentRequests() + ")，請稍後再試");
        }

        MDC.put(MDC_REQUEST_ID, requestId);
        long start = System.nanoTime();
        PipelineStage stage = PipelineStage.DECODE;
        try {
            context.checkDeadline(stage.label());
            PixelBuffer original = decoder.decode(context.getBytes());
            log.debug("{} - 解碼完成 {}", requestId, original.shape());

            stage = PipelineStage.RECOMPRESS;
            context.checkDeadline(stage.label());
            PixelBuffer roundTripped = recompressionEngine.roundTrip(original, compressionParameters);

            stage = PipelineStage.DIFFERENCE;
            context.checkDeadline(stage.label());
            DiffBuffer diff = differenceComputer.difference(original, roundTripped);

            stage = PipelineStage.NORMALIZE;
            context.checkDeadline(stage.label());
            NormalizedDiff normalized = normalizer.normalize(diff);
            ElaStatistics statistics = ElaStatistics.of(normalized.buffer());
            log.debug("{} - 最大差值: {}, 異常分數: {}", requestId, normalized.maxMagnitude(),
                    String.format("%.4f", normalized.anomalyScore()));

            stage = PipelineStage.RENDER;
            context.checkDeadline(stage.label());
            byte[] heatmap = renderer.render(normalized.buffer());

            context.checkDeadline("回傳結果");
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.info("{} - 分析完成 {}x{}, 異常分數: {}, 耗時: {} ms", requestId,
                    original.getWidth(), original.getHeight(), String.format("%.4f", normalized.anomalyScore()), durationMs);

            return new AnalysisResult(requestId, heatmap, renderer.getFormat().contentType(),
                    normalized.anomalyScore(), durationMs, original.getWidth(), original.getHeight(), statistics);
        } catch (ElaStageException e) {
            throw failure(requestId, e.kind(), stage, e);
        } catch (RuntimeException | StackOverflowError e) {
            throw failure(requestId, stage.failureKind(), stage, e);
        } catch (OutOfMemoryError e) {
            // 同時處理上限已限制記憶體用量，極端情況下仍可能發生
            log.error("{} - {}階段記憶體溢位", requestId, stage.label(), e);
            throw new AnalysisFailure(requestId, ErrorKind.CAPACITY_ERROR,
                    "記憶體不足，無法完成" + stage.label() + "，請稍後再試", e);
        } finally {
            permits.release();
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private AnalysisFailure failure(String requestId, ErrorKind kind, PipelineStage stage, Throwable cause) {
        String message = kind.getDescription() + ": " + cause.getMessage();
        if (kind.isInternal()) {
            // 內部不變量被破壞，屬於管線缺陷
            log.error("{} - {}階段發生內部錯誤 [{}]", requestId, stage.label(), kind, cause);
        } else {
            log.warn("{} - {}階段失敗 [{}]: {}", requestId, stage.label(), kind, cause.getMessage());
        }
        return new AnalysisFailure(requestId, kind, message, cause);
    }
}
