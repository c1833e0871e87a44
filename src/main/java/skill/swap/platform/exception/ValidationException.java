package skill.swap.platform.exception;

/**
 * Malformed or missing input
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
