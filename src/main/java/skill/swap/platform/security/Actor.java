package skill.swap.platform.security;

/**
 * Authenticated identity making the current API call
 *
 * @param userId verified subject of the bearer token
 */
public record Actor(Long userId) {

    public Actor {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
    }
}
