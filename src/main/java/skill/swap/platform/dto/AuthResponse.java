package skill.swap.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Issued bearer token together with the authenticated user's own profile
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Authentication response")
public class AuthResponse {

    @Schema(description = "Own profile, including email")
    private UserResponse user;

    @Schema(description = "Bearer token for the Authorization header")
    private String token;

    @Builder.Default
    @Schema(description = "Token type", example = "Bearer")
    private String tokenType = "Bearer";

    @Schema(description = "Token expiry", example = "2025-01-16T10:30:00Z")
    private Instant expiresAt;
}
