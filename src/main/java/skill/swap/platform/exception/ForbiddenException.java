package skill.swap.platform.exception;

/**
 * Actor is not allowed to view or change the record
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
