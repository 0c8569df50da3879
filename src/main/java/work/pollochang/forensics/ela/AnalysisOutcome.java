package work.pollochang.forensics.ela;

import work.pollochang.forensics.ela.error.ErrorKind;

public enum AnalysisOutcome {
    ANALYZED("分析完成"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_DECODE("無法解碼"),
    FAILED_INTERNAL("內部錯誤"),
    FAILED_TIMEOUT("處理逾時"),
    FAILED_CAPACITY("超過同時處理上限");

    private final String description;
    AnalysisOutcome(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isFailure() {
        return this != ANALYZED && this != SKIPPED_NOT_FOUND;
    }

    public static AnalysisOutcome of(ErrorKind kind) {
        switch (kind) {
            case DECODE_ERROR:
                return FAILED_DECODE;
            case TIMEOUT_ERROR:
                return FAILED_TIMEOUT;
            case CAPACITY_ERROR:
                return FAILED_CAPACITY;
            default:
                return FAILED_INTERNAL;
        }
    }
}
