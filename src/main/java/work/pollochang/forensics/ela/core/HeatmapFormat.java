package work.pollochang.forensics.ela.core;

/**
 * 熱圖輸出格式。
 */
public enum HeatmapFormat {
    PNG("png", "image/png", "png"),
    JPEG("jpeg", "image/jpeg", "jpg");

    private final String writerFormatName;
    private final String contentType;
    private final String extension;

    HeatmapFormat(String writerFormatName, String contentType, String extension) {
        this.writerFormatName = writerFormatName;
        this.contentType = contentType;
        this.extension = extension;
    }

    public String writerFormatName() { return writerFormatName; }

    public String contentType() { return contentType; }

    public String extension() { return extension; }
}
