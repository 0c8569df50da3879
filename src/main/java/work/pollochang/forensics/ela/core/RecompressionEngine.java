package work.pollochang.forensics.ela.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.forensics.ela.config.CompressionParameters;
import work.pollochang.forensics.ela.error.RecompressionException;
import work.pollochang.forensics.ela.tools.FileTools;
import work.pollochang.forensics.ela.tools.ImageTools;

import javax.imageio.IIOException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * 以固定品質將緩衝區重新壓縮成 JPEG 後再解碼回來，得到「往返」緩衝區。
 *
 * <p>不論輸入格式為何一律使用 JPEG 編碼器，品質由 {@link CompressionParameters} 決定，
 * 不依個別圖片調整，確保不同上傳的結果可以比較。</p>
 */
@Slf4j
public class RecompressionEngine {

    /**
     * @param original 解碼後的原圖
     * @param params   重新壓縮參數
     * @return 與原圖尺寸、通道數相同的往返緩衝區
     * @throws RecompressionException 編碼、解碼失敗或往返後尺寸不一致
     */
    public PixelBuffer roundTrip(PixelBuffer original, CompressionParameters params) throws RecompressionException {
        byte[] encoded = encode(original, params.quality());
        log.debug("重新壓縮完成 (q={}, 大小: {})", String.format("%.2f", params.quality()), FileTools.formatFileSize(encoded.length));

        PixelBuffer roundTripped;
        try (DecodedImage decoded = DecodedImage.read(encoded, "jpeg", (w, h) -> {
            if (w != original.getWidth() || h != original.getHeight()) {
                throw new IIOException("往返後尺寸 " + w + "x" + h + " 與原圖 " + original.getWidth() + "x" + original.getHeight() + " 不符");
            }
        })) {
            if (!decoded.warnings().isEmpty()) {
                throw new RecompressionException("重新壓縮的資料解碼時出現警告: " + String.join("; ", decoded.warnings()));
            }
            roundTripped = PixelBuffer.fromImage(decoded.image());
        } catch (IOException | RuntimeException e) {
            throw new RecompressionException("無法解碼重新壓縮的 JPEG: " + e.getMessage(), e);
        }

        if (!roundTripped.sameShapeAs(original)) {
            throw new RecompressionException("往返緩衝區 " + roundTripped.shape() + " 與原圖 " + original.shape() + " 不符");
        }
        return roundTripped;
    }

    private static byte[] encode(PixelBuffer original, float quality) throws RecompressionException {
        BufferedImage image;
        try {
            image = original.toImage();
        } catch (IllegalArgumentException e) {
            throw new RecompressionException("無法重新壓縮 " + original.shape() + " 的緩衝區", e);
        }

        try (ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(1024, original.length() / 4))) {
            ImageTools.writeJpeg(image, bos, quality);
            return bos.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new RecompressionException("JPEG 編碼失敗: " + e.getMessage(), e);
        } finally {
            image.flush();
        }
    }
}
