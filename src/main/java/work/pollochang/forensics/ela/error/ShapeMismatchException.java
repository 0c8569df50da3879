package work.pollochang.forensics.ela.error;

public class ShapeMismatchException extends ElaStageException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SHAPE_MISMATCH_ERROR;
    }
}
