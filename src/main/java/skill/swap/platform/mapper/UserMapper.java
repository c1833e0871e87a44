package skill.swap.platform.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import skill.swap.platform.domain.User;

import java.time.LocalDateTime;
import java.util.List;

/**
 * MyBatis mapper for User operations
 */
@Mapper
public interface UserMapper {
    /**
     * Insert a new user, filling in the generated userId
     * @return number of rows affected
     */
    int insert(User user);

    /**
     * Find user by ID
     * @return the user, or null if not found
     */
    User findById(@Param("userId") Long userId);

    /**
     * Lock the user's row until the current transaction ends
     * @return the user ID, or null if no such user
     */
    Long lockById(@Param("userId") Long userId);

    /**
     * Find user by email (exact match on the stored lower-cased value)
     */
    User findByEmail(@Param("email") String email);

    /**
     * Update profile fields (name, email, location, availability, photo, skills, visibility)
     * @return number of rows affected
     */
    int updateProfile(User user);

    /**
     * Replace the stored password hash
     * @return number of rows affected
     */
    int updatePassword(@Param("userId") Long userId,
                       @Param("passwordHash") String passwordHash,
                       @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Public profiles plus the viewer's own, optionally filtered by a name fragment
     * @param viewerId the viewing user
     * @param search case-insensitive name fragment with LIKE wildcards escaped by '!', or null
     * @return users ordered by ID
     */
    List<User> findViewable(@Param("viewerId") Long viewerId, @Param("search") String search);

    /**
     * All public profiles
     */
    List<User> findPublic();
}
