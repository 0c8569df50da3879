package work.pollochang.forensics.ela.report;

public class ReportSerializationException extends RuntimeException {

    public ReportSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
