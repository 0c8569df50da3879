package work.pollochang.forensics.ela.error;

public class DeadlineExceededException extends ElaStageException {

    public DeadlineExceededException(String message) {
        super(message);
    }

    public DeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT_ERROR;
    }
}
