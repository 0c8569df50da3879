package work.pollochang.forensics.ela.core;

/**
 * 異常分數採用的統計量，結果再除以 255 落在 0.0 ~ 1.0。
 */
public enum ScoreStatistic {
    /** 指定百分位數 (最近秩)，對單一雜訊像素不敏感 */
    PERCENTILE,
    MAXIMUM,
    MEAN
}
