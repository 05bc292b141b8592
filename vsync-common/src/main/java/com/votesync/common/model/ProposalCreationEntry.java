package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Proposal-creation log entry. The payload is hex-encoded and holds two 32-byte words:
 * the proposal type and the checkpoint id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalCreationEntry {
    private Long proposalId;
    private String proposer;
    private String payload;
    private Long logSequence;
}
