package skill.swap.platform.exception;

/**
 * Base class for expected business failures
 */
public abstract class BusinessException extends RuntimeException {

    private final ErrorKind kind;

    protected BusinessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
