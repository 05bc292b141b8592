package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * A governance proposal as read from the ledger (read-only here)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Proposal implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private ProposalState state;
    private Long checkpointId; // fixed at creation
    private Instant deadline;
    private Instant createdAt;
    private String proposer;
}
