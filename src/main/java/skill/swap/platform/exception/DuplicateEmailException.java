package skill.swap.platform.exception;

/**
 * Email already registered to another account
 */
public class DuplicateEmailException extends BusinessException {
    public DuplicateEmailException(String message) {
        super(ErrorKind.DUPLICATE_EMAIL, message);
    }
}
