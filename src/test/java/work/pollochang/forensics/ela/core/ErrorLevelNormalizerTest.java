package work.pollochang.forensics.ela.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorLevelNormalizerTest {

    private static DiffBuffer diffOf(int... magnitudes) {
        return new DiffBuffer(magnitudes.length, 1, 1, magnitudes);
    }

    private static ErrorLevelNormalizer stretch(ScoreStatistic statistic) {
        return new ErrorLevelNormalizer(AmplificationMode.STRETCH, 10, statistic, 99.0);
    }

    @Test
    void testZeroDiff_ShouldGiveZeroBufferAndZeroScore() {
        for (ScoreStatistic statistic : ScoreStatistic.values()) {
            NormalizedDiff result = stretch(statistic).normalize(diffOf(0, 0, 0, 0));

            assertEquals(0.0, result.anomalyScore());
            assertEquals(0, result.maxMagnitude());
            for (int i = 0; i < result.buffer().length(); i++) {
                assertEquals(0, result.buffer().get(i));
            }
        }
    }

    @Test
    void testStretch_ShouldMapMaximumToFullRange() {
        NormalizedDiff result = stretch(ScoreStatistic.MAXIMUM).normalize(diffOf(0, 1, 2, 4));

        assertEquals(0, result.buffer().get(0));
        assertEquals(64, result.buffer().get(1));
        assertEquals(128, result.buffer().get(2));
        assertEquals(255, result.buffer().get(3));
        assertEquals(4, result.maxMagnitude());
        assertEquals(4 / 255.0, result.anomalyScore(), 1e-12);
    }

    @Test
    void testFixedGain_ShouldClampAtTopOfRange() {
        ErrorLevelNormalizer normalizer = new ErrorLevelNormalizer(AmplificationMode.FIXED_GAIN, 10, ScoreStatistic.MAXIMUM, 99.0);

        NormalizedDiff result = normalizer.normalize(diffOf(0, 3, 25, 26, 255));

        assertEquals(0, result.buffer().get(0));
        assertEquals(30, result.buffer().get(1));
        assertEquals(250, result.buffer().get(2));
        assertEquals(255, result.buffer().get(3));
        assertEquals(255, result.buffer().get(4));
        assertEquals(1.0, result.anomalyScore());
    }

    @Test
    void testPercentile_ShouldIgnoreSingleNoiseSpike() {
        int[] magnitudes = new int[1000];
        for (int i = 0; i < magnitudes.length; i++) {
            magnitudes[i] = i % 3;
        }
        magnitudes[500] = 255;

        NormalizedDiff percentile = stretch(ScoreStatistic.PERCENTILE).normalize(diffOf(magnitudes));
        NormalizedDiff maximum = stretch(ScoreStatistic.MAXIMUM).normalize(diffOf(magnitudes));

        assertEquals(2 / 255.0, percentile.anomalyScore(), 1e-12);
        assertEquals(1.0, maximum.anomalyScore(), 1e-12);
    }

    @Test
    void testMean_ShouldAverageAllSamples() {
        NormalizedDiff result = stretch(ScoreStatistic.MEAN).normalize(diffOf(0, 10, 20, 30));

        assertEquals(15 / 255.0, result.anomalyScore(), 1e-12);
    }

    @Test
    void testMagnitudeBound_ShouldStayWithinDisplayRange() {
        int[] magnitudes = new int[256 * 3];
        for (int i = 0; i < magnitudes.length; i++) {
            magnitudes[i] = i % 256;
        }
        DiffBuffer diff = new DiffBuffer(256, 1, 3, magnitudes);

        for (AmplificationMode mode : AmplificationMode.values()) {
            NormalizedDiff result = new ErrorLevelNormalizer(mode, 1000, ScoreStatistic.PERCENTILE, 50.0).normalize(diff);
            for (int i = 0; i < result.buffer().length(); i++) {
                int v = result.buffer().get(i);
                assertTrue(v >= 0 && v <= 255, "sample out of range: " + v);
            }
            assertTrue(result.anomalyScore() >= 0.0 && result.anomalyScore() <= 1.0);
            assertEquals(3, result.buffer().getChannels());
        }
    }

    @Test
    void testInvalidSettings_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ErrorLevelNormalizer(AmplificationMode.STRETCH, 0, ScoreStatistic.MEAN, 99.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ErrorLevelNormalizer(AmplificationMode.STRETCH, 10, ScoreStatistic.PERCENTILE, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ErrorLevelNormalizer(AmplificationMode.STRETCH, 10, ScoreStatistic.PERCENTILE, 100.5));
    }
}
