package com.votesync.common.exception;

/**
 * User-facing classes of vote submission failure
 */
public enum VoteFailureReason {
    USER_REJECTED(ErrorCode.USER_REJECTED, "Transaction rejected by user."),
    INSUFFICIENT_FUNDS(ErrorCode.INSUFFICIENT_FUNDS,
            "You don't have enough funds to pay for this transaction. Please add funds to your wallet."),
    ALREADY_VOTED(ErrorCode.ALREADY_VOTED, "You have already voted on this proposal."),
    INACTIVE_PROPOSAL(ErrorCode.PROPOSAL_NOT_ACTIVE,
            "Proposal is not active. Cannot vote on inactive proposals."),
    GENERIC_FAILURE(ErrorCode.WRITE_FAILED, "Vote submission failed");

    private final ErrorCode errorCode;
    private final String userMessage;

    VoteFailureReason(ErrorCode errorCode, String userMessage) {
        this.errorCode = errorCode;
        this.userMessage = userMessage;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
