package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Result of the ledger's direct aggregate read, when it exposes one
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateVotes {
    private BigInteger forWeight;
    private BigInteger againstWeight;
    private BigInteger abstainWeight;
    private Long totalVoters;
}
