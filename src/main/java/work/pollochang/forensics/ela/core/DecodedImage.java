package work.pollochang.forensics.ela.core;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

// 封裝解碼後的圖片、讀取器與解碼過程中的警告，方便資源管理
record DecodedImage(BufferedImage image, ImageReader reader, List<String> warnings) implements AutoCloseable {

    /**
     * 讀取像素前先檢查檔頭宣告的尺寸。
     */
    @FunctionalInterface
    interface HeaderCheck {
        void accept(int width, int height) throws IOException;
    }

    /**
     * 以指定格式的讀取器解碼記憶體中的位元組。
     *
     * <p>每次呼叫都會建立新的 {@link ImageReader}，由回傳的物件負責釋放。
     * 讀取器回報的警告 (例如 JPEG 資料提前結束) 會收集在 {@link #warnings()}。</p>
     *
     * @throws IOException 找不到讀取器、檔頭檢查不通過或資料損毀
     */
    static DecodedImage read(byte[] bytes, String formatName, HeaderCheck headerCheck) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (in == null) {
                throw new IIOException("無法建立圖片輸入流");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(formatName);
            if (!readers.hasNext()) {
                throw new IIOException("找不到 " + formatName + " 的圖片讀取器");
            }

            ImageReader reader = readers.next();
            List<String> warnings = Collections.synchronizedList(new ArrayList<>());
            reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));
            reader.setInput(in, true, true);

            try {
                headerCheck.accept(reader.getWidth(0), reader.getHeight(0));
                BufferedImage image = reader.read(0);
                // reader 交給 DecodedImage 關閉
                return new DecodedImage(image, reader, List.copyOf(warnings));
            } catch (IOException | RuntimeException e) {
                reader.dispose();
                throw e;
            }
        }
    }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
