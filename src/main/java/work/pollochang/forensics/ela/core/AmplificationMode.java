package work.pollochang.forensics.ela.core;

/**
 * 差值放大的方式。
 */
public enum AmplificationMode {
    /** 線性拉伸，最大差值對應到 255 */
    STRETCH,
    /** 乘上固定增益後截斷在 255 (亮度增強) */
    FIXED_GAIN
}
