package work.pollochang.forensics.ela.error;

public class RecompressionException extends ElaStageException {

    public RecompressionException(String message) {
        super(message);
    }

    public RecompressionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RECOMPRESSION_ERROR;
    }
}
