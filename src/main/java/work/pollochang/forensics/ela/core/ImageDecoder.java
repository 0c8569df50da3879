package work.pollochang.forensics.ela.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.forensics.ela.error.DecodeException;
import work.pollochang.forensics.ela.tools.FileTools;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.spi.IIORegistry;
import java.io.IOException;

/**
 * 將上傳的原始位元組解碼為 {@link PixelBuffer}。
 *
 * <p>格式依檔頭判斷，只接受 {@link ImageFormat} 列出的格式。寬高在讀取像素前先檢查，
 * 避免解壓縮炸彈配置大量記憶體。</p>
 */
@Slf4j
public class ImageDecoder {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    private final int maxWidth;
    private final int maxHeight;
    private final long maxBytes;

    public ImageDecoder(int maxWidth, int maxHeight, long maxBytes) {
        this.maxWidth = maxWidth;
        this.maxHeight = maxHeight;
        this.maxBytes = maxBytes;
    }

    /**
     * @param bytes 上傳的圖片內容
     * @return 解碼後的緩衝區 (單通道灰階或三通道 RGB)
     * @throws DecodeException 內容為空、過大、格式不支援、尺寸不合法或資料損毀
     */
    public PixelBuffer decode(byte[] bytes) throws DecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("圖片內容為空");
        }
        if (bytes.length > maxBytes) {
            throw new DecodeException("檔案大小 " + FileTools.formatFileSize(bytes.length)
                    + " 超過上限 " + FileTools.formatFileSize(maxBytes));
        }

        ImageFormat format = ImageFormat.sniff(bytes)
                .orElseThrow(() -> new DecodeException("無法辨識的圖片格式"));
        log.debug("偵測到圖片格式: {} ({})", format, FileTools.formatFileSize(bytes.length));

        try (DecodedImage decoded = DecodedImage.read(bytes, format.readerFormatName(), this::checkDimensions)) {
            if (!decoded.warnings().isEmpty()) {
                throw new DecodeException("圖片資料不完整或損毀: " + String.join("; ", decoded.warnings()));
            }
            if (decoded.image() == null) {
                throw new DecodeException("圖片讀取器未回傳任何影像");
            }
            return PixelBuffer.fromImage(decoded.image());
        } catch (IOException e) {
            throw new DecodeException("圖片無法解碼: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // ImageIO 對損毀資料可能拋出非檢查例外
            throw new DecodeException("圖片資料損毀: " + e, e);
        }
    }

    private void checkDimensions(int width, int height) throws IOException {
        if (width <= 0 || height <= 0) {
            throw new IIOException("圖片尺寸為零: " + width + "x" + height);
        }
        if (width > maxWidth || height > maxHeight) {
            throw new IIOException("圖片尺寸 " + width + "x" + height + " 超過上限 " + maxWidth + "x" + maxHeight);
        }
    }
}
