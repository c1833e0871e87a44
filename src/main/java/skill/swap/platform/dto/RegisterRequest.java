package skill.swap.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Register user request")
public class RegisterRequest {
    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @Schema(description = "Display name", example = "Alice Doe")
    private String name;

    @NotBlank(message = "Email is required")
    @Email(message = "Please enter a valid email address")
    @Size(max = 120, message = "Email must be at most 120 characters")
    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(min = 6, message = "Password must be at least 6 characters long")
    @Schema(description = "Password", example = "secret123")
    private String password;

    @Size(max = 100, message = "Location must be at most 100 characters")
    @Schema(description = "Location", example = "Berlin")
    private String location;

    @Size(max = 50, message = "Availability must be at most 50 characters")
    @Schema(description = "Availability", example = "Weekends")
    private String availability;

    @Size(max = 255, message = "Profile photo URL must be at most 255 characters")
    @Schema(description = "Profile photo URL", example = "https://example.com/alice.png")
    private String profilePhoto;

    @NotEmpty(message = "At least one skill offered is required")
    @Schema(description = "Skills the user can teach", example = "[\"guitar\"]")
    private List<String> skillsOffered;

    @NotEmpty(message = "At least one skill wanted is required")
    @Schema(description = "Skills the user wants to learn", example = "[\"python\"]")
    private List<String> skillsWanted;
}
