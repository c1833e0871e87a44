package skill.swap.platform.exception;

/**
 * An identical pending swap request already exists
 */
public class DuplicateSwapRequestException extends BusinessException {
    public DuplicateSwapRequestException(String message) {
        super(ErrorKind.DUPLICATE_REQUEST, message);
    }
}
