package com.votesync.client.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter for vote log queries. Null fields match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteLogFilter {

    private Long proposalId;
    private String voterId;
    private Long fromSequence;

    public static VoteLogFilter forProposal(long proposalId) {
        return VoteLogFilter.builder().proposalId(proposalId).build();
    }

    public static VoteLogFilter forVoter(String voterId) {
        return VoteLogFilter.builder().voterId(voterId).build();
    }

    public static VoteLogFilter forVote(long proposalId, String voterId) {
        return VoteLogFilter.builder().proposalId(proposalId).voterId(voterId).build();
    }

    public static VoteLogFilter all() {
        return new VoteLogFilter();
    }
}
