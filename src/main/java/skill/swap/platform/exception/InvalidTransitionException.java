package skill.swap.platform.exception;

/**
 * Swap request status change not permitted from its current state
 */
public class InvalidTransitionException extends BusinessException {
    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }
}
