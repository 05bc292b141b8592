package com.votesync.client;

import com.votesync.common.model.PendingMutation;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteReceipt;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * A committed vote: the ledger receipt, the pending mutation shown optimistically until the
 * ledger counts it, and the reconciliation that runs until then.
 */
@Getter
@AllArgsConstructor
public class VoteSubmission {

    private final VoteReceipt receipt;
    private final PendingMutation mutation;

    // Completes with the last authoritative tally read during reconciliation
    private final CompletableFuture<TallyResult> reconciliation;
}
