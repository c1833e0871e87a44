package skill.swap.platform.exception;

/**
 * User not found exception
 */
public class UserNotFoundException extends BusinessException {
    public UserNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
