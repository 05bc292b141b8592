package com.votesync.common.exception;

/**
 * Exception thrown when the ledger does not expose a read (e.g. no aggregate tally method)
 */
public class UnsupportedReadException extends LedgerException {

    public UnsupportedReadException(String read) {
        super(ErrorCode.UNSUPPORTED_READ, "Read not supported by ledger: " + read);
    }
}
