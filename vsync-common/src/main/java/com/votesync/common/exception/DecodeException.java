package com.votesync.common.exception;

/**
 * Exception thrown when an auxiliary log payload or a ledger response is malformed.
 */
public class DecodeException extends VoteSyncException {

    public DecodeException(String message) {
        super(ErrorCode.DECODE_FAILED, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorCode.DECODE_FAILED, message, cause);
    }

    public DecodeException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
