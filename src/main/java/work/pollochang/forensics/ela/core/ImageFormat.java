package work.pollochang.forensics.ela.core;

import java.util.Optional;

/**
 * 支援的輸入格式，依檔頭 magic bytes 判斷。集合是固定的，新增格式時在此列舉。
 */
public enum ImageFormat {
    JPEG("jpeg", new int[]{0xFF, 0xD8, 0xFF}),
    PNG("png", new int[]{0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}),
    GIF("gif", new int[]{'G', 'I', 'F', '8'}),
    BMP("bmp", new int[]{'B', 'M'});

    private final String readerFormatName;
    private final int[] magic;

    ImageFormat(String readerFormatName, int[] magic) {
        this.readerFormatName = readerFormatName;
        this.magic = magic;
    }

    /** ImageIO 讀取器的格式名稱 */
    public String readerFormatName() {
        return readerFormatName;
    }

    public static Optional<ImageFormat> sniff(byte[] bytes) {
        if (bytes == null) {
            return Optional.empty();
        }
        for (ImageFormat format : values()) {
            if (format.matches(bytes)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    private boolean matches(byte[] bytes) {
        if (bytes.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if ((bytes[i] & 0xFF) != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
