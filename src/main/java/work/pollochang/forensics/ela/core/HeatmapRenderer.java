package work.pollochang.forensics.ela.core;

import work.pollochang.forensics.ela.error.EncodeException;
import work.pollochang.forensics.ela.tools.ImageTools;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * 將正規化後的緩衝區編碼成可顯示的圖片，尺寸與原圖相同。
 */
public class HeatmapRenderer {

    static final float JPEG_HEATMAP_QUALITY = 0.95f;

    private final HeatmapFormat format;

    public HeatmapRenderer(HeatmapFormat format) {
        this.format = Objects.requireNonNull(format, "format must not be null");
    }

    public HeatmapFormat getFormat() {
        return format;
    }

    /**
     * @throws EncodeException 通道數不是 1 或 3，或編碼失敗
     */
    public byte[] render(PixelBuffer normalized) throws EncodeException {
        if (normalized.getChannels() != 1 && normalized.getChannels() != 3) {
            throw new EncodeException("不支援的通道數: " + normalized.getChannels());
        }

        BufferedImage image = normalized.toImage();
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            switch (format) {
                case JPEG:
                    ImageTools.writeJpeg(image, bos, JPEG_HEATMAP_QUALITY);
                    break;
                case PNG:
                default:
                    if (!ImageIO.write(image, format.writerFormatName(), bos)) {
                        throw new EncodeException("找不到 " + format + " 寫入器");
                    }
                    break;
            }
            return bos.toByteArray();
        } catch (IOException e) {
            throw new EncodeException("熱圖編碼失敗: " + e.getMessage(), e);
        } finally {
            image.flush();
        }
    }
}
