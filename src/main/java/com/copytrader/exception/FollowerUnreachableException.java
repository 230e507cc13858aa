package com.copytrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Raised when an action targets a follower whose broker session is not live.
 * The engine turns this into a queued action rather than a failure.
 */
@Getter
public class FollowerUnreachableException extends BaseException {

    private final String followerId;

    public FollowerUnreachableException(String followerId) {
        super(
                ErrorCode.FOLLOWER_UNREACHABLE,
                String.format("Follower not connected: %s", followerId),
                Map.of("followerId", followerId));
        this.followerId = followerId;
    }

    public FollowerUnreachableException(String followerId, Throwable cause) {
        super(
                ErrorCode.FOLLOWER_UNREACHABLE,
                String.format("Follower not reachable: %s", followerId),
                Map.of("followerId", followerId),
                cause);
        this.followerId = followerId;
    }
}
