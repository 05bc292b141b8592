package com.votesync.common.exception;

/**
 * Error codes for categorizing different types of failures.
 * Error codes are organized by category:
 * - 1xxx: Client errors (bad input, rejected votes)
 * - 2xxx: Ledger errors
 * - 3xxx: Decode errors
 * - 4xxx: Network errors
 * - 5xxx: Overlay/Reconciliation errors
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    INVALID_CHOICE(1002, "Invalid vote choice. Must be 0 (Against), 1 (For), or 2 (Abstain)"),
    PROPOSAL_NOT_FOUND(1003, "Proposal does not exist"),
    ALREADY_VOTED(1004, "You have already voted on this proposal"),
    PROPOSAL_NOT_ACTIVE(1005, "Proposal is not active. Cannot vote on inactive proposals"),
    INSUFFICIENT_WEIGHT(1006, "You don't have any voting power for this proposal"),
    USER_REJECTED(1007, "Transaction was rejected by the user"),
    INSUFFICIENT_FUNDS(1008, "Not enough funds to pay for this transaction"),
    NO_ACCOUNT(1009, "No voting account configured"),

    // Ledger errors (2xxx)
    LEDGER_UNAVAILABLE(2001, "Ledger is unavailable"),
    READ_FAILED(2002, "Failed to read from the ledger"),
    UNSUPPORTED_READ(2003, "Read is not exposed by the ledger"),
    EVENT_LOG_UNAVAILABLE(2004, "Event log could not be retrieved"),
    WRITE_FAILED(2005, "Failed to submit transaction to the ledger"),

    // Decode errors (3xxx)
    DECODE_FAILED(3001, "Failed to decode log payload"),
    MALFORMED_RESPONSE(3002, "Ledger response could not be parsed"),

    // Network errors (4xxx)
    NETWORK_TIMEOUT(4001, "Network operation timed out"),
    SERVICE_UNAVAILABLE(4002, "Service temporarily unavailable"),
    CONNECTION_FAILED(4003, "Failed to establish connection"),

    // Overlay/Reconciliation errors (5xxx)
    STALE_OVERLAY(5001, "Pending vote expired before it was confirmed"),
    RECONCILIATION_EXHAUSTED(5002, "Ledger did not reflect the vote within the retry budget"),

    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public boolean isClientError() {
        return code >= 1000 && code < 2000;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }
}
