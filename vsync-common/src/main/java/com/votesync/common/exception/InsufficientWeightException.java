package com.votesync.common.exception;

/**
 * Exception thrown when the voter has zero voting power at the proposal's checkpoint
 */
public class InsufficientWeightException extends VoteSyncException {

    public InsufficientWeightException(long proposalId, String holderId) {
        super(ErrorCode.INSUFFICIENT_WEIGHT,
                "You don't have any voting power for proposal " + proposalId
                        + ". You may need to delegate to yourself or acquire tokens before the snapshot. (account "
                        + holderId + ")");
    }
}
