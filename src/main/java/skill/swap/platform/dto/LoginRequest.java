package skill.swap.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login request")
public class LoginRequest {
    @NotBlank(message = "Email is required")
    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    @NotBlank(message = "Password is required")
    @Schema(description = "Password", example = "secret123")
    private String password;
}
