package work.pollochang.forensics.ela.error;

public class DecodeException extends ElaStageException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DECODE_ERROR;
    }
}
