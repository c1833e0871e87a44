package skill.swap.platform.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.dto.ApiResponse;
import skill.swap.platform.dto.CreateSwapRequestRequest;
import skill.swap.platform.dto.SwapRequestResponse;
import skill.swap.platform.dto.UpdateSwapRequestStatusRequest;
import skill.swap.platform.enums.SwapRequestStatus;
import skill.swap.platform.exception.ValidationException;
import skill.swap.platform.security.Actor;
import skill.swap.platform.security.CurrentActor;
import skill.swap.platform.service.SwapRequestService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for swap requests
 * Handles creation, listing, status transitions and withdrawal
 */
@Slf4j
@RestController
@RequestMapping("/api/swap-requests")
@Validated
@Tag(name = "Swap Requests", description = "Propose and decide skill swaps")
public class SwapRequestController {

    @Autowired
    private SwapRequestService swapRequestService;

    /**
     * Send a swap request
     *
     * @param request the create swap request
     * @return API response with the created request
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create swap request", description = "Propose a skill exchange to another user")
    public ApiResponse<SwapRequestResponse> createRequest(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Valid @RequestBody CreateSwapRequestRequest request) {
        log.info("Creating swap request: requesterId={}, recipientId={}", actor.userId(), request.getRecipientId());
        SwapRequest created = swapRequestService.createRequest(actor, request);
        return ApiResponse.created("Swap request sent successfully", SwapRequestResponse.fromSwapRequest(created));
    }

    @GetMapping("/my-requests")
    @Operation(summary = "Sent requests", description = "Requests sent by the caller, newest first")
    public ApiResponse<List<SwapRequestResponse>> getMyRequests(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "Optional status filter")
            @RequestParam(name = "status", required = false) String status) {
        return ApiResponse.success(toResponses(swapRequestService.getSentRequests(actor, parseStatus(status))));
    }

    @GetMapping("/received")
    @Operation(summary = "Received requests", description = "Requests addressed to the caller, newest first")
    public ApiResponse<List<SwapRequestResponse>> getReceivedRequests(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "Optional status filter")
            @RequestParam(name = "status", required = false) String status) {
        return ApiResponse.success(toResponses(swapRequestService.getReceivedRequests(actor, parseStatus(status))));
    }

    @GetMapping("/{requestId}")
    @Operation(summary = "Get swap request", description = "Visible to the requester and the recipient only")
    public ApiResponse<SwapRequestResponse> getRequest(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "Request ID", required = true)
            @PathVariable("requestId") @NotNull Long requestId) {
        return ApiResponse.success(SwapRequestResponse.fromSwapRequest(swapRequestService.getRequest(actor, requestId)));
    }

    /**
     * Accept, reject or cancel a pending request
     */
    @PutMapping("/{requestId}")
    @Operation(summary = "Update swap request status",
               description = "Recipient may accept or reject; requester may cancel. Only pending requests change.")
    public ApiResponse<SwapRequestResponse> updateStatus(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "Request ID", required = true)
            @PathVariable("requestId") @NotNull Long requestId,
            @Valid @RequestBody UpdateSwapRequestStatusRequest request) {
        SwapRequest updated = swapRequestService.updateStatus(
                actor, requestId, request.getStatus(), request.getResponseMessage());
        return ApiResponse.success("Request " + updated.getStatus().name().toLowerCase() + " successfully",
                SwapRequestResponse.fromSwapRequest(updated));
    }

    @DeleteMapping("/{requestId}")
    @Operation(summary = "Delete swap request", description = "Requester withdraws a pending request")
    public ApiResponse<Void> deleteRequest(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "Request ID", required = true)
            @PathVariable("requestId") @NotNull Long requestId) {
        swapRequestService.deleteRequest(actor, requestId);
        return ApiResponse.success("Swap request deleted successfully", null);
    }

    private static SwapRequestStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return SwapRequestStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status: " + status);
        }
    }

    private static List<SwapRequestResponse> toResponses(List<SwapRequest> requests) {
        return requests.stream()
                .map(SwapRequestResponse::fromSwapRequest)
                .collect(Collectors.toList());
    }
}
