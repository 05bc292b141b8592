package com.votesync.common.exception;

/**
 * Exception thrown when a remote ledger operation fails.
 */
public class LedgerException extends VoteSyncException {

    public LedgerException(ErrorCode errorCode) {
        super(errorCode);
    }

    public LedgerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public LedgerException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }
}
