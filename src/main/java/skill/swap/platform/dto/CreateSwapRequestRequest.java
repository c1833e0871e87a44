package skill.swap.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create swap request")
public class CreateSwapRequestRequest {
    @NotNull(message = "Recipient ID is required")
    @Positive(message = "Recipient ID must be positive")
    @Schema(description = "User the request is addressed to", example = "2")
    private Long recipientId;

    @NotBlank(message = "Skill offered is required")
    @Size(max = 100, message = "Skill offered must be at most 100 characters")
    @Schema(description = "Skill offered in exchange", example = "guitar")
    private String skillOffered;

    @NotBlank(message = "Skill wanted is required")
    @Size(max = 100, message = "Skill wanted must be at most 100 characters")
    @Schema(description = "Skill wanted", example = "python")
    private String skillWanted;

    @Size(max = 500, message = "Message must be at most 500 characters")
    @Schema(description = "Optional note to the recipient", example = "Happy to meet on weekends")
    private String message;
}
