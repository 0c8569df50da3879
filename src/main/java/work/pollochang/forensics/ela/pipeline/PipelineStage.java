package work.pollochang.forensics.ela.pipeline;

import work.pollochang.forensics.ela.error.ErrorKind;

/**
 * 管線的各個階段，依宣告順序執行。每個階段記錄非預期例外時要對應的錯誤種類。
 */
enum PipelineStage {
    DECODE("解碼", ErrorKind.DECODE_ERROR),
    RECOMPRESS("重新壓縮", ErrorKind.RECOMPRESSION_ERROR),
    DIFFERENCE("差值計算", ErrorKind.SHAPE_MISMATCH_ERROR),
    NORMALIZE("正規化", ErrorKind.ENCODE_ERROR),
    RENDER("熱圖編碼", ErrorKind.ENCODE_ERROR);

    private final String label;
    private final ErrorKind failureKind;

    PipelineStage(String label, ErrorKind failureKind) {
        this.label = label;
        this.failureKind = failureKind;
    }

    String label() { return label; }

    ErrorKind failureKind() { return failureKind; }
}
