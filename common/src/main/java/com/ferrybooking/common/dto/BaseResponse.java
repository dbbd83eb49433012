package com.ferrybooking.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ferrybooking.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope returned by every endpoint of the engine.
 * Failed calls carry an {@link ErrorCode} name so clients can branch without parsing messages.
 *
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private boolean success;
    private String message;
    private T data;
    private String errorCode;
    private Instant timestamp;

    public static <T> BaseResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return BaseResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> BaseResponse<T> failure(String message, ErrorCode errorCode) {
        return failure(message, errorCode, null);
    }

    public static <T> BaseResponse<T> failure(String message, ErrorCode errorCode, T details) {
        return BaseResponse.<T>builder()
                .success(false)
                .message(message)
                .errorCode(errorCode.name())
                .data(details)
                .timestamp(Instant.now())
                .build();
    }
}
