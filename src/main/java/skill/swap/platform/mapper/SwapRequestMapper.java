package skill.swap.platform.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.enums.SwapRequestStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * MyBatis mapper interface for SwapRequest entity
 */
@Mapper
public interface SwapRequestMapper {

    /**
     * Insert a new swap request, filling in the generated requestId
     * @return number of rows affected
     */
    int insert(SwapRequest request);

    /**
     * Find request by ID, with requester and recipient names
     * @return the request, or null if not found
     */
    SwapRequest findById(@Param("requestId") Long requestId);

    /**
     * Requests sent by a user, newest first
     * @param status optional status filter, null for all
     */
    List<SwapRequest> findByRequesterId(@Param("requesterId") Long requesterId,
                                        @Param("status") SwapRequestStatus status);

    /**
     * Requests addressed to a user, newest first
     * @param status optional status filter, null for all
     */
    List<SwapRequest> findByRecipientId(@Param("recipientId") Long recipientId,
                                        @Param("status") SwapRequestStatus status);

    /**
     * Count pending requests with the same parties and skill pair
     */
    int countPendingDuplicates(@Param("requesterId") Long requesterId,
                               @Param("recipientId") Long recipientId,
                               @Param("skillOffered") String skillOffered,
                               @Param("skillWanted") String skillWanted);

    /**
     * Compare-and-set status change: only applies while the row is still PENDING
     * @return 1 if applied, 0 if the request was no longer pending
     */
    int updateStatusIfPending(@Param("requestId") Long requestId,
                              @Param("status") SwapRequestStatus status,
                              @Param("responseMessage") String responseMessage,
                              @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Delete a request only while it is still PENDING
     * @return number of rows affected
     */
    int deleteIfPending(@Param("requestId") Long requestId);
}
