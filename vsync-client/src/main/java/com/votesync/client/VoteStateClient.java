package com.votesync.client;

import com.votesync.client.poll.TallyRefreshScheduler;
import com.votesync.common.model.DelegationInfo;
import com.votesync.common.model.GovernanceStats;
import com.votesync.common.model.ProposalDetails;
import com.votesync.common.model.ProposalRange;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import com.votesync.common.model.VoteDetails;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Consumer-facing view of voting state.
 * Reads degrade to fallback values; vote submission failures always surface.
 */
public interface VoteStateClient extends AutoCloseable {

    /**
     * Tally of the proposal with any pending local vote merged in.
     * Never throws for ledger read failures: the worst case is a zeroed tally.
     */
    TallyResult resolveTally(long proposalId, boolean forceRefresh);

    CompletableFuture<TallyResult> resolveTallyAsync(long proposalId, boolean forceRefresh);

    /**
     * Resolves several tallies concurrently, keyed by proposal id
     */
    CompletableFuture<Map<Long, TallyResult>> resolveTalliesAsync(Collection<Long> proposalIds);

    ProposalRange discoverProposalRange();

    /**
     * Every readable proposal with its details, newest first
     */
    List<ProposalDetails> listProposals();

    /**
     * Vote as the configured holder. Returns once the ledger committed the vote.
     *
     * @throws com.votesync.common.exception.VoteSubmissionException with an actionable message
     * @throws com.votesync.common.exception.InsufficientWeightException if the holder has no voting power
     */
    VoteSubmission submitVote(long proposalId, VoteChoice choice);

    /**
     * Voting power of the configured holder at a checkpoint, null meaning the current one
     */
    BigInteger getVotingPower(Long checkpointId);

    /**
     * Voting power of the configured holder at the proposal's checkpoint
     */
    BigInteger getProposalVotingPower(long proposalId);

    boolean hasVoted(long proposalId, String holderId);

    VoteDetails getVoteDetails(long proposalId, String holderId);

    Map<Long, VoteDetails> getVoteHistory(String holderId);

    GovernanceStats getGovernanceStats();

    /**
     * Delegate, delegated weight and delegators of the holder at the current checkpoint
     */
    DelegationInfo getDelegationInfo(String holderId);

    TallyRefreshScheduler getRefreshScheduler();

    @Override
    void close();
}
