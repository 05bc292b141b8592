package com.votesync.common.exception;

/**
 * A pending vote aged out before the ledger confirmed it.
 */
public class StaleOverlayException extends VoteSyncException {

    public StaleOverlayException(long proposalId, String voterId) {
        super(ErrorCode.STALE_OVERLAY,
                "Pending vote of " + voterId + " on proposal " + proposalId + " expired unconfirmed");
    }
}
