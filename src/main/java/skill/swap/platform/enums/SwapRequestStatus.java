package skill.swap.platform.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Swap request status representing the lifecycle of a request
 */
public enum SwapRequestStatus {
    /**
     * Sent and awaiting a decision
     */
    PENDING,

    /**
     * Accepted by the recipient
     */
    ACCEPTED,

    /**
     * Rejected by the recipient
     */
    REJECTED,

    /**
     * Withdrawn by the requester
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Lenient parsing for request bodies and query parameters ("accepted", "Accepted", "ACCEPTED")
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static SwapRequestStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be blank");
        }
        return SwapRequestStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
