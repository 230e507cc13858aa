package com.copytrader.exception;

import java.util.Map;

public class LocateFailedException extends BaseException {

    public LocateFailedException(String symbol, long requested, long filled, String reason) {
        super(
                ErrorCode.LOCATE_FAILED,
                String.format("Locate failed for %s: filled %d of %d (%s)", symbol, filled, requested, reason),
                Map.of("symbol", symbol, "requested", requested, "filled", filled));
    }
}
