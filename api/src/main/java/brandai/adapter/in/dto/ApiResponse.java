package brandai.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope wrapping every successful response.
 */
public record ApiResponse<T>(
        boolean success, @JsonProperty("status_code") int statusCode, String message, T data) {

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, 200, message, data);
    }
}
