package com.votesync.common.exception;

/**
 * Exception thrown when a ledger entity does not exist
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String entity) {
        super(ErrorCode.PROPOSAL_NOT_FOUND, "Not found: " + entity);
    }

    public NotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
