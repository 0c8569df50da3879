package work.pollochang.forensics.ela;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.pollochang.forensics.ela.config.ElaConfig;
import work.pollochang.forensics.ela.core.AmplificationMode;
import work.pollochang.forensics.ela.core.HeatmapFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    @Test
    void testOptions_ShouldOverrideConfig() {
        Execute execute = new Execute();
        new CommandLine(execute).parseArgs("-o", "out", "-q", "0.5", "--timeout-ms", "1500",
                "--amplification", "FIXED_GAIN", "--gain", "12", "--heatmap-format", "JPEG", "img.jpg");

        ElaConfig config = execute.applyOverrides(ElaConfig.defaults());

        assertEquals(0.5f, config.quality());
        assertEquals(Duration.ofMillis(1500), config.timeout());
        assertEquals(AmplificationMode.FIXED_GAIN, config.amplificationMode());
        assertEquals(12, config.amplificationGain());
        assertEquals(HeatmapFormat.JPEG, config.heatmapFormat());
        assertEquals(8192, config.maxWidth());
    }

    @Test
    void testTimeOutOption_ShouldReachBatch() {
        Execute execute = new Execute();
        new CommandLine(execute).parseArgs("-o", "out", "--timeOut", "5", "img.jpg");

        assertEquals(5, execute.createBatch(ElaConfig.defaults()).getTimeOutMinutes());
    }

    @Test
    void testTimeOutOption_ShouldDefaultToOneHour() {
        Execute execute = new Execute();
        new CommandLine(execute).parseArgs("-o", "out", "img.jpg");

        assertEquals(60, execute.createBatch(ElaConfig.defaults()).getTimeOutMinutes());
    }

    @Test
    void testRun_ShouldReturnZeroWhenEveryFileSucceeds(@TempDir Path dir) throws IOException {
        Path image = dir.resolve("scan.png");
        Files.write(image, TestImages.png(TestImages.gradient(20, 20)));
        Path output = dir.resolve("out");

        int exitCode = new CommandLine(new Execute()).execute("-o", output.toString(), image.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(output.resolve("ela_scan.png")));
        assertTrue(Files.exists(output.resolve("scan.ela.json")));
    }

    @Test
    void testRun_ShouldReturnOneOnFailure(@TempDir Path dir) throws IOException {
        Path image = dir.resolve("broken.png");
        Files.write(image, new byte[]{1, 2, 3, 4});

        int exitCode = new CommandLine(new Execute()).execute("-o", dir.resolve("out").toString(), image.toString());

        assertEquals(1, exitCode);
    }
}
