package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Governance-wide rollup
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GovernanceStats {
    private long totalProposals;
    private long activeProposals;
    private long successfulProposals;
    private double successRate; // 0..1
    private long uniqueVoters;
    private long totalVotesCast;
    private Instant computedAt;
}
