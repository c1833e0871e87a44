package skill.swap.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.enums.SwapRequestStatus;

import java.time.LocalDateTime;

/**
 * Swap request response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Swap request")
public class SwapRequestResponse {

    @Schema(description = "Request ID", example = "10")
    private Long requestId;

    @Schema(description = "Requester user ID", example = "1")
    private Long requesterId;

    @Schema(description = "Requester display name", example = "Alice Doe")
    private String requesterName;

    @Schema(description = "Recipient user ID", example = "2")
    private Long recipientId;

    @Schema(description = "Recipient display name", example = "Bob Roe")
    private String recipientName;

    @Schema(description = "Skill offered", example = "guitar")
    private String skillOffered;

    @Schema(description = "Skill wanted", example = "python")
    private String skillWanted;

    @Schema(description = "Requester's note")
    private String message;

    @Schema(description = "Recipient's note on accept/reject")
    private String responseMessage;

    @Schema(description = "Status", example = "PENDING")
    private SwapRequestStatus status;

    @Schema(description = "Created timestamp", example = "2025-01-15T10:30:00")
    private LocalDateTime createdAt;

    @Schema(description = "Updated timestamp", example = "2025-01-15T10:30:01")
    private LocalDateTime updatedAt;

    /**
     * Convert SwapRequest entity to SwapRequestResponse DTO
     */
    public static SwapRequestResponse fromSwapRequest(SwapRequest request) {
        if (request == null) {
            return null;
        }

        return SwapRequestResponse.builder()
                .requestId(request.getRequestId())
                .requesterId(request.getRequesterId())
                .requesterName(request.getRequesterName())
                .recipientId(request.getRecipientId())
                .recipientName(request.getRecipientName())
                .skillOffered(request.getSkillOffered())
                .skillWanted(request.getSkillWanted())
                .message(request.getMessage())
                .responseMessage(request.getResponseMessage())
                .status(request.getStatus())
                .createdAt(request.getCreatedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }
}
