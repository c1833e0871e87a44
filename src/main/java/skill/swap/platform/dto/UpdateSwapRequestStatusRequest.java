package skill.swap.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import skill.swap.platform.enums.SwapRequestStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Swap request status change")
public class UpdateSwapRequestStatusRequest {
    @NotNull(message = "Status is required")
    @Schema(description = "Target status: ACCEPTED, REJECTED or CANCELLED", example = "ACCEPTED")
    private SwapRequestStatus status;

    @Size(max = 500, message = "Response message must be at most 500 characters")
    @Schema(description = "Optional note from the recipient on accept/reject", example = "See you Saturday")
    private String responseMessage;
}
