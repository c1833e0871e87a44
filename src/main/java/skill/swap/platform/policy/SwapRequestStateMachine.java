package skill.swap.platform.policy;

import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.enums.SwapRequestStatus;
import skill.swap.platform.exception.ForbiddenException;
import skill.swap.platform.exception.InvalidTransitionException;
import skill.swap.platform.exception.ValidationException;
import skill.swap.platform.security.Actor;

/**
 * Legal status transitions of a swap request.
 *
 * <pre>
 * PENDING -> ACCEPTED   recipient
 * PENDING -> REJECTED   recipient
 * PENDING -> CANCELLED  requester
 * </pre>
 *
 * Checks run in order: party, role, current state. A party asking for the wrong
 * transition is refused with {@link ForbiddenException} even when the request is
 * already terminal.
 */
public final class SwapRequestStateMachine {

    private SwapRequestStateMachine() {
    }

    /**
     * Validate that {@code actor} may move {@code request} to {@code target}.
     *
     * @throws ValidationException if target is not a reachable state
     * @throws ForbiddenException if the actor may not perform this transition
     * @throws InvalidTransitionException if the request is no longer pending
     */
    public static void checkTransition(Actor actor, SwapRequest request, SwapRequestStatus target) {
        if (target == null || target == SwapRequestStatus.PENDING) {
            throw new ValidationException("Invalid status. Must be one of: ACCEPTED, REJECTED, CANCELLED");
        }

        Long actorId = actor.userId();
        if (!request.involves(actorId)) {
            throw new ForbiddenException("You are not authorized to update this request");
        }

        if (!allowedActor(request, target, actorId)) {
            throw new ForbiddenException(target == SwapRequestStatus.CANCELLED
                    ? "Only the requester can cancel requests"
                    : "Only the recipient can accept or reject requests");
        }

        checkPending(request, target);
    }

    /**
     * @throws InvalidTransitionException if the request is in a terminal state
     */
    public static void checkPending(SwapRequest request, SwapRequestStatus target) {
        if (request.getStatus().isTerminal()) {
            throw new InvalidTransitionException(String.format(
                    "Cannot change request %d from %s to %s",
                    request.getRequestId(), request.getStatus(), target));
        }
    }

    private static boolean allowedActor(SwapRequest request, SwapRequestStatus target, Long actorId) {
        switch (target) {
            case ACCEPTED:
            case REJECTED:
                return request.isRecipient(actorId);
            case CANCELLED:
                return request.isRequester(actorId);
            default:
                return false;
        }
    }
}
