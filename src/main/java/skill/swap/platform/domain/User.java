package skill.swap.platform.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * User account and skill profile
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    /**
     * Unique user identifier (generated, never changes)
     */
    private Long userId;

    /**
     * Display name
     */
    private String name;

    /**
     * Email address (unique, stored lower-cased)
     */
    private String email;

    /**
     * Hashed password (BCrypt)
     */
    private String passwordHash;

    private String location;

    /**
     * Free-form availability, e.g. "Weekdays" or "Evenings"
     */
    private String availability;

    /**
     * Optional URL of a profile picture
     */
    private String profilePhoto;

    /**
     * Skills this user can teach
     */
    @Builder.Default
    private List<String> skillsOffered = new ArrayList<>();

    /**
     * Skills this user wants to learn
     */
    @Builder.Default
    private List<String> skillsWanted = new ArrayList<>();

    /**
     * Whether other users may see this profile
     */
    @Builder.Default
    private Boolean isPublic = Boolean.TRUE;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isOwnedBy(Long actorId) {
        return userId != null && userId.equals(actorId);
    }
}
