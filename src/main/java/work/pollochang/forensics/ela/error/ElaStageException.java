package work.pollochang.forensics.ela.error;

/**
 * 管線各階段拋出的例外基底類別，只在協調器內部流通。
 */
public abstract class ElaStageException extends Exception {

    protected ElaStageException(String message) {
        super(message);
    }

    protected ElaStageException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
