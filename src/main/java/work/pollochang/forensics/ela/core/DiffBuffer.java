package work.pollochang.forensics.ela.core;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;

/**
 * 原圖與往返圖之間逐樣本的絕對差值。以 {@code int} 儲存，不會溢位或回繞。
 */
@Getter
public final class DiffBuffer {

    private final int width;
    private final int height;
    private final int channels;
    @Getter(AccessLevel.NONE)
    private final int[] magnitudes;

    DiffBuffer(int width, int height, int channels, int[] magnitudes) {
        Objects.requireNonNull(magnitudes, "magnitudes must not be null");
        if ((long) width * height * channels != magnitudes.length) {
            throw new IllegalArgumentException("差值數 " + magnitudes.length + " 與 "
                    + width + "x" + height + "x" + channels + " 不符");
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.magnitudes = magnitudes;
    }

    public int length() {
        return magnitudes.length;
    }

    public int get(int index) {
        return magnitudes[index];
    }

    public int get(int x, int y, int channel) {
        return magnitudes[(y * width + x) * channels + channel];
    }

    public int max() {
        int max = 0;
        for (int m : magnitudes) {
            if (m > max) max = m;
        }
        return max;
    }
}
