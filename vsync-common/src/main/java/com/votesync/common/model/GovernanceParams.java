package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Governance parameters read from the ledger (raw units, durations in seconds)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GovernanceParams {
    private BigInteger quorum;
    private Long votingDuration;
    private BigInteger proposalThreshold;
    private BigInteger proposalStake;
    private Long timelockDelay;
}
