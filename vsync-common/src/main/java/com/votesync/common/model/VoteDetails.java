package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * How one voter voted on one proposal
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteDetails {

    private Long proposalId;
    private boolean hasVoted;
    private VoteChoice choice; // null when unknown or not voted

    @Builder.Default
    private BigInteger weight = BigInteger.ZERO;

    private Long logSequence;

    public static VoteDetails notVoted(long proposalId) {
        return VoteDetails.builder().proposalId(proposalId).hasVoted(false).build();
    }
}
