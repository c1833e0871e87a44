package skill.swap.platform.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import skill.swap.platform.enums.SwapRequestStatus;

import java.time.LocalDateTime;

/**
 * A proposal from one user to exchange an offered skill for a wanted skill with another user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapRequest {
    /**
     * Unique request identifier
     */
    private Long requestId;

    /**
     * User who sent the request
     */
    private Long requesterId;

    /**
     * User the request is addressed to
     */
    private Long recipientId;

    /**
     * Skill the requester teaches in exchange
     */
    private String skillOffered;

    /**
     * Skill the requester wants to learn
     */
    private String skillWanted;

    /**
     * Optional note from the requester
     */
    private String message;

    /**
     * Optional note from the recipient when accepting or rejecting
     */
    private String responseMessage;

    /**
     * Display names resolved by join on read, never written
     */
    private String requesterName;
    private String recipientName;

    @Builder.Default
    private SwapRequestStatus status = SwapRequestStatus.PENDING;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isRequester(Long actorId) {
        return requesterId != null && requesterId.equals(actorId);
    }

    public boolean isRecipient(Long actorId) {
        return recipientId != null && recipientId.equals(actorId);
    }

    public boolean involves(Long actorId) {
        return isRequester(actorId) || isRecipient(actorId);
    }
}
