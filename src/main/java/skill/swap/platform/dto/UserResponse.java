package skill.swap.platform.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import skill.swap.platform.domain.User;

import java.time.LocalDateTime;
import java.util.List;

/**
 * User profile response DTO. Email is only filled in for the profile owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "User profile")
public class UserResponse {

    @Schema(description = "User ID", example = "1")
    private Long userId;

    @Schema(description = "Display name", example = "Alice Doe")
    private String name;

    @Schema(description = "Email address (own profile only)", example = "alice@example.com")
    private String email;

    @Schema(description = "Location", example = "Berlin")
    private String location;

    @Schema(description = "Availability", example = "Weekdays")
    private String availability;

    @Schema(description = "Profile photo URL", example = "https://example.com/alice.png")
    private String profilePhoto;

    @Schema(description = "Skills offered")
    private List<String> skillsOffered;

    @Schema(description = "Skills wanted")
    private List<String> skillsWanted;

    @Schema(description = "Profile visibility", example = "true")
    private Boolean isPublic;

    @Schema(description = "Created timestamp", example = "2025-01-15T10:30:00")
    private LocalDateTime createdAt;

    @Schema(description = "Updated timestamp", example = "2025-01-15T10:30:01")
    private LocalDateTime updatedAt;

    /**
     * Convert User entity to UserResponse DTO
     */
    public static UserResponse fromUser(User user, boolean includeEmail) {
        if (user == null) {
            return null;
        }

        return UserResponse.builder()
                .userId(user.getUserId())
                .name(user.getName())
                .email(includeEmail ? user.getEmail() : null)
                .location(user.getLocation())
                .availability(user.getAvailability())
                .profilePhoto(user.getProfilePhoto())
                .skillsOffered(List.copyOf(user.getSkillsOffered()))
                .skillsWanted(List.copyOf(user.getSkillsWanted()))
                .isPublic(user.getIsPublic())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
