package skill.swap.platform.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import skill.swap.platform.config.SkillSwapProperties;
import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.dto.CreateSwapRequestRequest;
import skill.swap.platform.enums.SwapRequestStatus;
import skill.swap.platform.exception.DuplicateSwapRequestException;
import skill.swap.platform.exception.ForbiddenException;
import skill.swap.platform.exception.InvalidTransitionException;
import skill.swap.platform.exception.SwapRequestNotFoundException;
import skill.swap.platform.exception.UserNotFoundException;
import skill.swap.platform.exception.ValidationException;
import skill.swap.platform.mapper.SwapRequestMapper;
import skill.swap.platform.mapper.UserMapper;
import skill.swap.platform.policy.AccessPolicy;
import skill.swap.platform.policy.SwapRequestStateMachine;
import skill.swap.platform.security.Actor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for SwapRequest lifecycle: creation, listing, status transitions and withdrawal
 */
@Slf4j
@Service
public class SwapRequestService {

    @Autowired
    private SwapRequestMapper swapRequestMapper;

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private SkillSwapProperties properties;

    @Autowired
    private SkillSwapMetrics metrics;

    @Autowired
    private Clock clock;

    /**
     * Send a new PENDING request from the actor to the recipient
     *
     * @throws ValidationException if the actor addresses themselves or a skill is blank
     * @throws UserNotFoundException if the recipient does not exist
     * @throws DuplicateSwapRequestException if an identical request is still pending
     *         and duplicates are not allowed
     */
    @Transactional
    public SwapRequest createRequest(Actor actor, CreateSwapRequestRequest request) {
        Long requesterId = actor.userId();
        Long recipientId = request.getRecipientId();

        if (requesterId.equals(recipientId)) {
            throw new ValidationException("You cannot send a swap request to yourself");
        }

        String skillOffered = requireText(request.getSkillOffered(), "Skill offered is required");
        String skillWanted = requireText(request.getSkillWanted(), "Skill wanted is required");

        if (userMapper.findById(recipientId) == null) {
            throw new UserNotFoundException("Recipient not found: " + recipientId);
        }

        // Creates by one requester run one at a time from here until commit
        if (userMapper.lockById(requesterId) == null) {
            throw new UserNotFoundException("Requester not found: " + requesterId);
        }

        if (!properties.swapRequests().allowDuplicatePending()
                && swapRequestMapper.countPendingDuplicates(requesterId, recipientId, skillOffered, skillWanted) > 0) {
            throw new DuplicateSwapRequestException(
                    "You already have a pending request for these skills with this user");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        SwapRequest swapRequest = SwapRequest.builder()
                .requesterId(requesterId)
                .recipientId(recipientId)
                .skillOffered(skillOffered)
                .skillWanted(skillWanted)
                .message(trimToNull(request.getMessage()))
                .status(SwapRequestStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = swapRequestMapper.insert(swapRequest);
        if (result <= 0) {
            throw new IllegalStateException("Failed to create swap request");
        }

        metrics.recordSwapRequest(SwapRequestStatus.PENDING);
        log.info("Swap request created: requestId={}, requesterId={}, recipientId={}, offered={}, wanted={}",
                swapRequest.getRequestId(), requesterId, recipientId, skillOffered, skillWanted);
        return load(swapRequest.getRequestId());
    }

    /**
     * Requests the actor has sent, newest first
     */
    @Transactional(readOnly = true)
    public List<SwapRequest> getSentRequests(Actor actor, SwapRequestStatus status) {
        return swapRequestMapper.findByRequesterId(actor.userId(), status);
    }

    /**
     * Requests addressed to the actor, newest first
     */
    @Transactional(readOnly = true)
    public List<SwapRequest> getReceivedRequests(Actor actor, SwapRequestStatus status) {
        return swapRequestMapper.findByRecipientId(actor.userId(), status);
    }

    /**
     * Get one request the actor is a party to
     *
     * @throws SwapRequestNotFoundException if no such request
     * @throws ForbiddenException if the actor is neither requester nor recipient
     */
    @Transactional(readOnly = true)
    public SwapRequest getRequest(Actor actor, Long requestId) {
        SwapRequest swapRequest = load(requestId);
        AccessPolicy.checkCanViewSwapRequest(actor, swapRequest);
        return swapRequest;
    }

    /**
     * Apply a status transition.
     * The write only succeeds while the stored row is still PENDING, so of two
     * concurrent transitions exactly one wins and the other fails.
     *
     * @param responseMessage optional note, kept only for accept/reject
     * @throws InvalidTransitionException if the request is no longer pending
     */
    @Transactional
    public SwapRequest updateStatus(Actor actor, Long requestId, SwapRequestStatus target, String responseMessage) {
        SwapRequest swapRequest = load(requestId);
        SwapRequestStateMachine.checkTransition(actor, swapRequest, target);

        String note = target == SwapRequestStatus.CANCELLED ? null : trimToNull(responseMessage);
        int updated = swapRequestMapper.updateStatusIfPending(requestId, target, note, LocalDateTime.now(clock));
        if (updated == 0) {
            log.warn("Swap request changed concurrently: requestId={}, attempted={}", requestId, target);
            throw new InvalidTransitionException(String.format(
                    "Cannot change request %d to %s: it is no longer pending", requestId, target));
        }

        metrics.recordSwapRequest(target);
        log.info("Swap request status changed: requestId={}, {} -> {}, actor={}",
                requestId, swapRequest.getStatus(), target, actor.userId());
        return load(requestId);
    }

    /**
     * Withdraw a pending request entirely. Decided requests are kept as history.
     *
     * @throws ForbiddenException if the actor is not the requester
     * @throws InvalidTransitionException if the request is no longer pending
     */
    @Transactional
    public void deleteRequest(Actor actor, Long requestId) {
        SwapRequest swapRequest = load(requestId);
        if (!swapRequest.isRequester(actor.userId())) {
            throw new ForbiddenException("Only the requester can delete the request");
        }

        SwapRequestStateMachine.checkPending(swapRequest, SwapRequestStatus.CANCELLED);
        if (swapRequestMapper.deleteIfPending(requestId) == 0) {
            throw new InvalidTransitionException(String.format(
                    "Cannot delete request %d: it is no longer pending", requestId));
        }

        log.info("Swap request deleted: requestId={}, requesterId={}", requestId, actor.userId());
    }

    private SwapRequest load(Long requestId) {
        SwapRequest swapRequest = swapRequestMapper.findById(requestId);
        if (swapRequest == null) {
            throw new SwapRequestNotFoundException("Swap request not found: " + requestId);
        }
        return swapRequest;
    }

    private static String requireText(String value, String message) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new ValidationException(message);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
