package skill.swap.platform.exception;

/**
 * Swap request not found exception
 */
public class SwapRequestNotFoundException extends BusinessException {
    public SwapRequestNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
