package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigInteger;

/**
 * A single vote-cast entry of the ledger's append-only event log.
 * For one (proposal, voter) the entry with the greatest logSequence is authoritative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long proposalId;
    private String voterId;
    private VoteChoice choice;
    private BigInteger weight; // raw units
    private Long logSequence;
}
