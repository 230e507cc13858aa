package com.copytrader.api.dto.response;

import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Error envelope written by the global exception handler. {@code category} is omitted for plain HTTP errors. */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .category(errorCode.getCategory())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Value
    @Builder
    public static class ErrorDetail {
        String code;
        int status;
        ErrorCategory category;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
