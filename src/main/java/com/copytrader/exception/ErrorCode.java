package com.copytrader.exception;

import com.copytrader.domain.enums.ErrorCategory;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * REST error codes. Codes raised by broker or engine failures also carry the
 * {@link ErrorCategory} used by status notifications, so the dashboard can group
 * HTTP errors and pushed alerts the same way.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(400, null),
    BAD_REQUEST(400, null),
    NOT_FOUND(404, null),
    CONFLICT(409, null),
    LOCATE_FAILED(422, ErrorCategory.CAPACITY),
    INTERNAL_ERROR(500, null),
    BROKER_ERROR(502, ErrorCategory.REJECTION),
    FOLLOWER_UNREACHABLE(503, ErrorCategory.CONNECTIVITY);

    private final int httpStatus;
    private final ErrorCategory category;

    public String getCode() {
        return name();
    }
}
