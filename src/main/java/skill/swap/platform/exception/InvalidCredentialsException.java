package skill.swap.platform.exception;

/**
 * Wrong password, unknown account, or missing/invalid bearer token
 */
public class InvalidCredentialsException extends BusinessException {
    public InvalidCredentialsException(String message) {
        super(ErrorKind.INVALID_CREDENTIALS, message);
    }
}
