package skill.swap.platform.policy;

import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.domain.User;
import skill.swap.platform.exception.ForbiddenException;
import skill.swap.platform.security.Actor;

/**
 * Read/write decisions for users and swap requests.
 * Pure functions over already-loaded records; no I/O.
 */
public final class AccessPolicy {

    private AccessPolicy() {
    }

    /**
     * Owner always; anyone else only while the profile is public
     */
    public static boolean canViewUser(Actor actor, User user) {
        return user.isOwnedBy(actor.userId()) || Boolean.TRUE.equals(user.getIsPublic());
    }

    public static boolean canMutateUser(Actor actor, User user) {
        return user.isOwnedBy(actor.userId());
    }

    /**
     * Only the requester and the recipient see a swap request
     */
    public static boolean canViewSwapRequest(Actor actor, SwapRequest request) {
        return request.involves(actor.userId());
    }

    public static void checkCanViewUser(Actor actor, User user) {
        if (!canViewUser(actor, user)) {
            throw new ForbiddenException("Profile is private");
        }
    }

    public static void checkCanMutateUser(Actor actor, User user) {
        if (!canMutateUser(actor, user)) {
            throw new ForbiddenException("You can only modify your own profile");
        }
    }

    public static void checkCanViewSwapRequest(Actor actor, SwapRequest request) {
        if (!canViewSwapRequest(actor, request)) {
            throw new ForbiddenException("You are not authorized to view this request");
        }
    }
}
