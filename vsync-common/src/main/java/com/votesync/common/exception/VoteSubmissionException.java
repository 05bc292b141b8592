package com.votesync.common.exception;

/**
 * Exception thrown when a vote cannot be submitted.
 * The message is always the actionable, user-facing one for its {@link VoteFailureReason}.
 */
public class VoteSubmissionException extends VoteSyncException {

    private final VoteFailureReason reason;

    public VoteSubmissionException(VoteFailureReason reason) {
        super(reason.getErrorCode(), reason.getUserMessage());
        this.reason = reason;
    }

    public VoteSubmissionException(VoteFailureReason reason, String message, Throwable cause) {
        super(reason.getErrorCode(), message, cause);
        this.reason = reason;
    }

    public VoteFailureReason getReason() {
        return reason;
    }
}
