package skill.swap.platform.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial profile update: null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Update profile request (all fields optional)")
public class UpdateProfileRequest {
    @Size(max = 100, message = "Name must be at most 100 characters")
    @Schema(description = "Display name", example = "Alice Doe")
    private String name;

    @Email(message = "Please enter a valid email address")
    @Size(max = 120, message = "Email must be at most 120 characters")
    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    @Size(max = 100, message = "Location must be at most 100 characters")
    @Schema(description = "Location", example = "Berlin")
    private String location;

    @Size(max = 50, message = "Availability must be at most 50 characters")
    @Schema(description = "Availability", example = "Evenings")
    private String availability;

    @Size(max = 255, message = "Profile photo URL must be at most 255 characters")
    @Schema(description = "Profile photo URL", example = "https://example.com/alice.png")
    private String profilePhoto;

    @Schema(description = "Skills the user can teach")
    private List<String> skillsOffered;

    @Schema(description = "Skills the user wants to learn")
    private List<String> skillsWanted;

    @Schema(description = "Profile visibility", example = "true")
    private Boolean isPublic;

    @JsonIgnore
    public boolean isEmpty() {
        return name == null && email == null && location == null && availability == null
                && profilePhoto == null
                && skillsOffered == null && skillsWanted == null && isPublic == null;
    }
}
