package com.copytrader.exception;

/**
 * The broker terminal rejected a submit, cancel, replace or query. Rejections are
 * surfaced to observers and never retried.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
