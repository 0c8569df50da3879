package work.pollochang.forensics.ela.error;

import java.util.Objects;

/**
 * {@code analyze} 唯一會拋給呼叫端的失敗型別。
 *
 * <p>每個失敗都帶有請求識別碼、恰好一種 {@link ErrorKind} 與可讀的訊息，
 * 不包含任何部分結果。</p>
 */
public class AnalysisFailure extends Exception {

    private final String requestId;
    private final ErrorKind kind;

    public AnalysisFailure(String requestId, ErrorKind kind, String message) {
        this(requestId, kind, message, null);
    }

    public AnalysisFailure(String requestId, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public String getRequestId() { return requestId; }

    public ErrorKind getKind() { return kind; }

    public boolean isRetryable() { return kind.isRetryable(); }

    @Override
    public String toString() {
        return "AnalysisFailure[requestId=" + requestId + ", kind=" + kind + ", message=" + getMessage() + "]";
    }
}
