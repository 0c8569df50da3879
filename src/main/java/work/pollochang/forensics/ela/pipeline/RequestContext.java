package work.pollochang.forensics.ela.pipeline;

import lombok.AccessLevel;
import lombok.Getter;
import work.pollochang.forensics.ela.error.DeadlineExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * 單一請求的內容：識別碼、上傳的位元組與處理期限。請求結束後即丟棄。
 */
@Getter
public final class RequestContext {

    private final String requestId;
    private final byte[] bytes;
    private final Instant deadline;
    @Getter(AccessLevel.NONE)
    private final Clock clock;

    private RequestContext(String requestId, byte[] bytes, Instant deadline, Clock clock) {
        this.requestId = requestId;
        this.bytes = bytes;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * @param bytes     上傳的圖片內容
     * @param requestId 呼叫端提供的識別碼，為 null 或空白時自動產生
     * @param timeout   從現在起算的處理時限
     * @param clock     計算期限用的時鐘
     */
    public static RequestContext create(byte[] bytes, String requestId, Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        String id = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId.trim();
        return new RequestContext(id, bytes, clock.instant().plus(timeout), clock);
    }

    public boolean isExpired() {
        return clock.instant().isAfter(deadline);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * 每個階段開始前呼叫。已逾時或執行緒被中斷時中止請求。
     */
    void checkDeadline(String nextStep) throws DeadlineExceededException {
        if (Thread.currentThread().isInterrupted()) {
            throw new DeadlineExceededException("請求在" + nextStep + "前被取消");
        }
        if (isExpired()) {
            throw new DeadlineExceededException("請求在" + nextStep + "前已超過處理期限 " + deadline);
        }
    }
}
