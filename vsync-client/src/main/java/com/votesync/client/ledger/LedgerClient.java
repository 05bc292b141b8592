package com.votesync.client.ledger;

import com.votesync.common.model.AggregateVotes;
import com.votesync.common.model.GovernanceParams;
import com.votesync.common.model.Proposal;
import com.votesync.common.model.ProposalCreationEntry;
import com.votesync.common.model.VoteChoice;
import com.votesync.common.model.VoteReceipt;
import com.votesync.common.model.VoteRecord;

import java.math.BigInteger;
import java.util.List;

/**
 * Read/write contract of the remote ledger.
 * The ledger only answers point lookups and an append-only vote log; it has no aggregate query
 * in general and no way to enumerate valid proposal ids.
 */
public interface LedgerClient {

    /**
     * Point read of one proposal.
     *
     * @throws com.votesync.common.exception.NotFoundException if the id does not exist
     */
    Proposal getProposal(long proposalId);

    /**
     * Direct aggregate tally read.
     *
     * @throws com.votesync.common.exception.UnsupportedReadException if the ledger does not expose it
     */
    AggregateVotes aggregateVotes(long proposalId);

    /**
     * Total raw weight cast for one choice.
     */
    BigInteger choiceWeight(long proposalId, VoteChoice choice);

    /**
     * Vote-cast log entries matching the filter, in log order.
     */
    List<VoteRecord> voteLog(VoteLogFilter filter);

    ProposalCreationEntry proposalCreationEntry(long proposalId);

    /**
     * Weight the ledger has counted for a voter on a proposal, zero if the voter has not voted.
     */
    BigInteger voterWeight(long proposalId, String voterId);

    GovernanceParams governanceParams();

    /**
     * Submits a vote and returns only once the ledger committed it.
     */
    VoteReceipt submitVote(long proposalId, String voterId, VoteChoice choice);
}
