package skill.swap.platform.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import skill.swap.platform.exception.ErrorKind;

/**
 * Unified API response wrapper class
 * @param <T> Response data type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * HTTP status code (200, 400, 500, etc.)
     */
    private Integer code;

    /**
     * Error kind, absent on success
     */
    private ErrorKind kind;

    /**
     * Response message
     */
    private String message;

    /**
     * Response data
     */
    private T data;

    /**
     * Timestamp
     */
    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    /**
     * Success response with data
     */
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .code(200)
                .message("Success")
                .data(data)
                .build();
    }

    /**
     * Success response with custom message and data
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
                .code(200)
                .message(message)
                .data(data)
                .build();
    }

    /**
     * Created response with custom message and data
     */
    public static <T> ApiResponse<T> created(String message, T data) {
        return ApiResponse.<T>builder()
                .code(201)
                .message(message)
                .data(data)
                .build();
    }

    /**
     * Error response for a taxonomy kind
     */
    public static <T> ApiResponse<T> error(ErrorKind kind, String message) {
        return ApiResponse.<T>builder()
                .code(kind.getStatus().value())
                .kind(kind)
                .message(message)
                .build();
    }
}
