package com.votesync.common.exception;

/**
 * Network or timeout failure talking to the ledger.
 * Only retried by post-submission re-resolution, never by the write path.
 */
public class TransientRemoteException extends LedgerException {

    public TransientRemoteException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransientRemoteException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
