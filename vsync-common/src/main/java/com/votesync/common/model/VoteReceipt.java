package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Ledger confirmation of a committed vote
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteReceipt {
    private Long proposalId;
    private String voterId;
    private VoteChoice choice;
    private BigInteger weight;
    private String transactionId;
    private Instant committedAt;
}
