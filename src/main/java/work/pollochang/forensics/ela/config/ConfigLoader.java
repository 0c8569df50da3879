package work.pollochang.forensics.ela.config;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.forensics.ela.core.AmplificationMode;
import work.pollochang.forensics.ela.core.HeatmapFormat;
import work.pollochang.forensics.ela.core.ScoreStatistic;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * 讀取 {@code ela.properties}。外部檔案優先於 classpath 內附的預設檔，
 * 檔案中沒有的鍵沿用 {@link ElaConfig#defaults()}。
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "ela.properties";

    static final String KEY_QUALITY = "ela.quality";
    static final String KEY_MAX_WIDTH = "ela.max-width";
    static final String KEY_MAX_HEIGHT = "ela.max-height";
    static final String KEY_MAX_BYTES = "ela.max-bytes";
    static final String KEY_TIMEOUT_MS = "ela.timeout-ms";
    static final String KEY_MAX_CONCURRENT = "ela.max-concurrent-requests";
    static final String KEY_AMPLIFICATION = "ela.amplification";
    static final String KEY_GAIN = "ela.amplification-gain";
    static final String KEY_SCORE_STATISTIC = "ela.score-statistic";
    static final String KEY_PERCENTILE = "ela.score-percentile";
    static final String KEY_HEATMAP_FORMAT = "ela.heatmap-format";
    static final String KEY_THRESHOLD = "ela.manipulation-threshold";

    private ConfigLoader() {}

    public static ElaConfig loadDefault() throws IOException {
        return load(null);
    }

    /**
     * @param externalFile 指定的設定檔，為 null 時依序尋找 {@code ./ela.properties}、
     *                     {@code ./config/ela.properties}，最後使用 classpath
     * @throws IOException 指定的檔案不存在或無法讀取
     */
    public static ElaConfig load(Path externalFile) throws IOException {
        Properties props = new Properties();

        if (externalFile != null) {
            if (!Files.isRegularFile(externalFile)) {
                throw new IOException("設定檔不存在: " + externalFile.toAbsolutePath());
            }
            loadFile(props, externalFile);
            return fromProperties(props);
        }

        Path candidate = Paths.get(DEFAULT_FILE_NAME);
        if (!Files.isRegularFile(candidate)) {
            candidate = Paths.get("config", DEFAULT_FILE_NAME);
        }
        if (Files.isRegularFile(candidate)) {
            loadFile(props, candidate);
            return fromProperties(props);
        }

        try (InputStream input = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_FILE_NAME)) {
            if (input == null) {
                log.info("找不到 {}，使用預設設定", DEFAULT_FILE_NAME);
            } else {
                props.load(input);
                log.info("從 classpath 載入設定: {}", DEFAULT_FILE_NAME);
            }
        }
        return fromProperties(props);
    }

    private static void loadFile(Properties props, Path file) throws IOException {
        try (InputStream input = Files.newInputStream(file)) {
            props.load(input);
            log.info("從外部檔案載入設定: {}", file.toAbsolutePath());
        }
    }

    /**
     * 將 properties 轉為設定，沒有的鍵沿用預設值。
     *
     * @throws IllegalArgumentException 值的格式不正確或超出範圍
     */
    public static ElaConfig fromProperties(Properties props) {
        ElaConfig defaults = ElaConfig.defaults();
        return ElaConfig.builder()
                .quality(parse(props, KEY_QUALITY, defaults.quality(), Float::parseFloat))
                .maxWidth(parse(props, KEY_MAX_WIDTH, defaults.maxWidth(), Integer::parseInt))
                .maxHeight(parse(props, KEY_MAX_HEIGHT, defaults.maxHeight(), Integer::parseInt))
                .maxBytes(parse(props, KEY_MAX_BYTES, defaults.maxBytes(), Long::parseLong))
                .timeout(Duration.ofMillis(parse(props, KEY_TIMEOUT_MS, defaults.timeout().toMillis(), Long::parseLong)))
                .maxConcurrentRequests(parse(props, KEY_MAX_CONCURRENT, defaults.maxConcurrentRequests(), Integer::parseInt))
                .amplificationMode(parse(props, KEY_AMPLIFICATION, defaults.amplificationMode(),
                        v -> AmplificationMode.valueOf(v.toUpperCase(Locale.ROOT))))
                .amplificationGain(parse(props, KEY_GAIN, defaults.amplificationGain(), Integer::parseInt))
                .scoreStatistic(parse(props, KEY_SCORE_STATISTIC, defaults.scoreStatistic(),
                        v -> ScoreStatistic.valueOf(v.toUpperCase(Locale.ROOT))))
                .scorePercentile(parse(props, KEY_PERCENTILE, defaults.scorePercentile(), Double::parseDouble))
                .heatmapFormat(parse(props, KEY_HEATMAP_FORMAT, defaults.heatmapFormat(),
                        v -> HeatmapFormat.valueOf(v.toUpperCase(Locale.ROOT))))
                .manipulationThreshold(parse(props, KEY_THRESHOLD, defaults.manipulationThreshold(), Double::parseDouble))
                .build();
    }

    private static <T> T parse(Properties props, String key, T fallback, Function<String, T> parser) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("設定值格式錯誤: " + key + "=" + raw, e);
        }
    }
}
