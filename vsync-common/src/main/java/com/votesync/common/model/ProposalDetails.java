package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Proposal record joined with what its creation entry tells about it
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalDetails {
    private Long id;
    private ProposalState state;
    private String proposer;
    private Instant createdAt;
    private Instant deadline;
    private Long checkpointId;
    private Integer proposalType; // null when the creation entry is missing or malformed
}
