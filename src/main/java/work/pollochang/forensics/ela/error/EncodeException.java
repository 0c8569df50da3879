package work.pollochang.forensics.ela.error;

public class EncodeException extends ElaStageException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ENCODE_ERROR;
    }
}
