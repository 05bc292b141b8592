package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * A locally submitted vote the ledger has not yet been seen to count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingMutation {

    private Long proposalId;
    private String voterId;
    private VoteChoice choice;
    private BigInteger weight;
    private Instant submittedAt;

    @Builder.Default
    private MutationStatus status = MutationStatus.UNCONFIRMED;

    // Set once the ledger committed the write
    private VoteReceipt receipt;

    // Authoritative weight of the chosen option before this vote; null if it could not be read
    private BigInteger baselineWeight;

    public boolean isExpired(Instant now, Duration maxAge) {
        return !now.isBefore(submittedAt.plus(maxAge));
    }
}
