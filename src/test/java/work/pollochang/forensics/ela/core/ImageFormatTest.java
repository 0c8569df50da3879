package work.pollochang.forensics.ela.core;

import org.junit.jupiter.api.Test;
import work.pollochang.forensics.ela.TestImages;

import java.awt.Color;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ImageFormatTest {

    @Test
    void testSniffEncodedImages() {
        assertEquals(Optional.of(ImageFormat.PNG), ImageFormat.sniff(TestImages.png(TestImages.solid(4, 4, Color.RED))));
        assertEquals(Optional.of(ImageFormat.JPEG), ImageFormat.sniff(TestImages.jpeg(TestImages.solid(4, 4, Color.RED), 0.9f)));
    }

    @Test
    void testSniffMagicPrefixes() {
        assertEquals(Optional.of(ImageFormat.GIF), ImageFormat.sniff("GIF89a....".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(Optional.of(ImageFormat.BMP), ImageFormat.sniff("BM......".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void testUnknownOrShortInput_ShouldBeEmpty() {
        assertTrue(ImageFormat.sniff(null).isEmpty());
        assertTrue(ImageFormat.sniff(new byte[0]).isEmpty());
        assertTrue(ImageFormat.sniff(new byte[]{(byte) 0xFF, (byte) 0xD8}).isEmpty());
        assertTrue(ImageFormat.sniff("hello world".getBytes(StandardCharsets.US_ASCII)).isEmpty());
    }
}
