package work.pollochang.forensics.ela.core;

import lombok.AccessLevel;
import lombok.Getter;
import work.pollochang.forensics.ela.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;

/**
 * 以 8 位元無號整數儲存的像素緩衝區，樣本依「列、行、通道」順序攤平。
 *
 * <p>每個緩衝區只屬於目前處理它的管線階段，處理完成後交給下一階段，
 * 不在請求之間共用。</p>
 */
@Getter
public final class PixelBuffer {

    public static final int MAX_SAMPLE = 255;
    public static final int MAX_CHANNELS = 4;

    private final int width;
    private final int height;
    private final int channels;
    @Getter(AccessLevel.NONE)
    private final byte[] samples;

    public PixelBuffer(int width, int height, int channels, byte[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("尺寸必須為正數: " + width + "x" + height);
        }
        if (channels < 1 || channels > MAX_CHANNELS) {
            throw new IllegalArgumentException("不支援的通道數: " + channels);
        }
        if ((long) width * height * channels != samples.length) {
            throw new IllegalArgumentException("樣本數 " + samples.length + " 與 "
                    + width + "x" + height + "x" + channels + " 不符");
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples;
    }

    /**
     * 建立全為 0 的緩衝區。
     */
    public static PixelBuffer blank(int width, int height, int channels) {
        return new PixelBuffer(width, height, channels, new byte[Math.multiplyExact(Math.multiplyExact(width, height), channels)]);
    }

    public int length() {
        return samples.length;
    }

    /** 取得攤平索引上的樣本值 (0-255) */
    public int get(int index) {
        return samples[index] & 0xFF;
    }

    public int get(int x, int y, int channel) {
        return get(indexOf(x, y, channel));
    }

    void set(int index, int value) {
        samples[index] = (byte) value;
    }

    public int indexOf(int x, int y, int channel) {
        return (y * width + x) * channels + channel;
    }

    public boolean sameShapeAs(PixelBuffer other) {
        return other != null && width == other.width && height == other.height && channels == other.channels;
    }

    public String shape() {
        return width + "x" + height + "x" + channels;
    }

    /**
     * 內容完全相同 (尺寸與每個樣本)。
     */
    public boolean contentEquals(PixelBuffer other) {
        return sameShapeAs(other) && Arrays.equals(samples, other.samples);
    }

    byte[] rawSamples() {
        return samples;
    }

    /**
     * 將 {@link BufferedImage} 轉成緩衝區。8 位元灰階圖保留為單通道，其餘一律轉為 RGB 三通道。
     */
    public static PixelBuffer fromImage(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int w = image.getWidth();
        int h = image.getHeight();

        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            int[] gray = image.getRaster().getSamples(0, 0, w, h, 0, (int[]) null);
            byte[] samples = new byte[gray.length];
            for (int i = 0; i < gray.length; i++) {
                samples[i] = (byte) gray[i];
            }
            return new PixelBuffer(w, h, 1, samples);
        }

        BufferedImage rgb = ImageTools.toRgb(image);
        try {
            int[] packed = rgb.getRGB(0, 0, w, h, null, 0, w);
            byte[] samples = new byte[packed.length * 3];
            for (int i = 0, j = 0; i < packed.length; i++) {
                int argb = packed[i];
                samples[j++] = (byte) (argb >> 16);
                samples[j++] = (byte) (argb >> 8);
                samples[j++] = (byte) argb;
            }
            return new PixelBuffer(w, h, 3, samples);
        } finally {
            if (rgb != image) rgb.flush();
        }
    }

    /**
     * 轉回 {@link BufferedImage}，只支援單通道 (灰階) 與三通道 (RGB)。
     *
     * @throws IllegalArgumentException 通道數不是 1 或 3
     */
    public BufferedImage toImage() {
        if (channels == 1) {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            int[] gray = new int[samples.length];
            for (int i = 0; i < samples.length; i++) {
                gray[i] = samples[i] & 0xFF;
            }
            image.getRaster().setSamples(0, 0, width, height, 0, gray);
            return image;
        }
        if (channels == 3) {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            int[] packed = new int[width * height];
            for (int i = 0, j = 0; i < packed.length; i++) {
                packed[i] = (samples[j++] & 0xFF) << 16 | (samples[j++] & 0xFF) << 8 | (samples[j++] & 0xFF);
            }
            image.setRGB(0, 0, width, height, packed, 0, width);
            return image;
        }
        throw new IllegalArgumentException("無法轉換 " + channels + " 通道的緩衝區為圖片");
    }
}
