package work.pollochang.forensics.ela.error;

/**
 * 分析失敗的種類。呼叫端只會看到這些種類之一，不會看到內部的原始例外。
 */
public enum ErrorKind {
    DECODE_ERROR("圖片無法解碼或超出限制", 400, true, false),
    RECOMPRESSION_ERROR("重新壓縮失敗", 500, false, false),
    SHAPE_MISMATCH_ERROR("緩衝區尺寸不一致", 500, false, false),
    ENCODE_ERROR("熱圖編碼失敗", 500, false, false),
    TIMEOUT_ERROR("處理逾時", 504, false, true),
    CAPACITY_ERROR("同時處理的請求已達上限", 503, false, true);

    private final String description;
    private final int statusCode;
    private final boolean userError;
    private final boolean retryable;

    ErrorKind(String description, int statusCode, boolean userError, boolean retryable) {
        this.description = description;
        this.statusCode = statusCode;
        this.userError = userError;
        this.retryable = retryable;
    }

    public String getDescription() { return description; }

    /** 對應的 HTTP 狀態碼，供外層轉換使用 */
    public int getStatusCode() { return statusCode; }

    public boolean isUserError() { return userError; }

    public boolean isRetryable() { return retryable; }

    /**
     * 內部不變量被破壞，代表管線本身有缺陷，需要告警。
     */
    public boolean isInternal() {
        return !userError && !retryable;
    }
}
