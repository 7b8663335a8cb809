package me.internalizable.shopops.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitErrorResponse(
        String error,
        @JsonProperty("retry_after") Long retryAfter,
        Long limit,
        Long remaining,
        @JsonProperty("reset_at") String resetAt,
        @JsonProperty("device_id") String deviceId
) {

    public static RateLimitErrorResponse limitExceeded(String error, long retryAfter, long limit, String resetAt) {
        return new RateLimitErrorResponse(error, retryAfter, limit, 0L, resetAt, null);
    }

    public static RateLimitErrorResponse limitExceeded(String error, long retryAfter, long limit, String resetAt,
                                                       String deviceId) {
        return new RateLimitErrorResponse(error, retryAfter, limit, 0L, resetAt, deviceId);
    }

    public static RateLimitErrorResponse badRequest(String error) {
        return new RateLimitErrorResponse(error, null, null, null, null, null);
    }
}
