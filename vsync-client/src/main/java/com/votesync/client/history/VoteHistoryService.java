package com.votesync.client.history;

import com.votesync.client.aggregate.EventLogReplayAggregator;
import com.votesync.client.cache.CacheKeys;
import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.ledger.VoteLogFilter;
import com.votesync.common.model.ProposalState;
import com.votesync.common.model.VoteDetails;
import com.votesync.common.model.VoteRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * How a holder voted: per proposal and across all proposals
 */
@Slf4j
@RequiredArgsConstructor
public class VoteHistoryService {

    private final LedgerClient ledgerClient;
    private final CachingLedgerReader reader;
    private final StalenessAwareCache cache;
    private final TtlPolicy ttlPolicy;

    /**
     * Whether the ledger counted a vote of the holder on the proposal. Cached per (proposal, holder);
     * a positive answer never expires early. False when the voter weight cannot be read; that outcome
     * is not cached.
     */
    public boolean hasVoted(long proposalId, String holderId) {
        try {
            return checkVoted(proposalId, holderId);
        } catch (Exception e) {
            log.warn("⚠️ Vote status of {} on proposal {} unavailable: {}", holderId, proposalId, e.getMessage());
            return false;
        }
    }

    /**
     * Same as {@link #hasVoted} but lets a failed voter-weight read propagate.
     */
    public boolean checkVoted(long proposalId, String holderId) {
        return cache.getOrCompute(CacheKeys.voteStatus(proposalId, holderId),
                (Boolean voted) -> ttlPolicy.voteStatusTtl(voted, stateOf(proposalId)),
                () -> positive(ledgerClient.voterWeight(proposalId, holderId)));
    }

    /**
     * The voter-weight read decides whether the holder voted; the latest log entry supplies the choice.
     * Not-voted details are returned uncached when the voter weight cannot be read.
     */
    public VoteDetails getVoteDetails(long proposalId, String holderId) {
        try {
            return cache.getOrCompute(CacheKeys.voteDetails(proposalId, holderId),
                    (VoteDetails details) -> ttlPolicy.voteStatusTtl(details.isHasVoted(), stateOf(proposalId)),
                    () -> readVoteDetails(proposalId, holderId));
        } catch (Exception e) {
            log.warn("⚠️ Vote details of {} on proposal {} unavailable: {}", holderId, proposalId, e.getMessage());
            return VoteDetails.notVoted(proposalId);
        }
    }

    /**
     * Latest vote of the holder on every proposal, keyed and ordered by proposal id.
     * Empty when the vote log cannot be read; that outcome is not cached.
     */
    public Map<Long, VoteDetails> getVoteHistory(String holderId) {
        try {
            return cache.getOrCompute(CacheKeys.voteHistory(holderId), ttlPolicy.getRollup(),
                    () -> readVoteHistory(holderId));
        } catch (Exception e) {
            log.warn("⚠️ Vote history of {} unavailable: {}", holderId, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private VoteDetails readVoteDetails(long proposalId, String holderId) {
        BigInteger weight = ledgerClient.voterWeight(proposalId, holderId);
        if (!positive(weight)) {
            return VoteDetails.notVoted(proposalId);
        }

        VoteDetails.VoteDetailsBuilder details = VoteDetails.builder()
                .proposalId(proposalId)
                .hasVoted(true)
                .weight(weight);
        try {
            List<VoteRecord> records = ledgerClient.voteLog(VoteLogFilter.forVote(proposalId, holderId));
            VoteRecord latest = EventLogReplayAggregator.latestByVoter(records).get(CacheKeys.normalize(holderId));
            if (latest != null) {
                details.choice(latest.getChoice()).logSequence(latest.getLogSequence());
            }
        } catch (Exception e) {
            log.warn("⚠️ Could not read the vote choice of {} on proposal {}: {}", holderId, proposalId, e.getMessage());
        }
        return details.build();
    }

    private Map<Long, VoteDetails> readVoteHistory(String holderId) {
        List<VoteRecord> records = new ArrayList<>(ledgerClient.voteLog(VoteLogFilter.forVoter(holderId)));
        Map<Long, List<VoteRecord>> byProposal = new TreeMap<>();
        for (VoteRecord record : records) {
            if (record.getProposalId() == null) {
                log.debug("Skipping vote record without proposal id for {}", holderId);
                continue;
            }
            byProposal.computeIfAbsent(record.getProposalId(), id -> new ArrayList<>()).add(record);
        }

        Map<Long, VoteDetails> history = new TreeMap<>();
        byProposal.forEach((proposalId, proposalRecords) -> {
            VoteRecord latest = EventLogReplayAggregator.latestByVoter(proposalRecords).get(CacheKeys.normalize(holderId));
            if (latest != null) {
                history.put(proposalId, VoteDetails.builder()
                        .proposalId(proposalId)
                        .hasVoted(true)
                        .choice(latest.getChoice())
                        .weight(latest.getWeight() != null ? latest.getWeight() : BigInteger.ZERO)
                        .logSequence(latest.getLogSequence())
                        .build());
            }
        });
        log.debug("Vote history of {}: {} proposals", holderId, history.size());
        return Collections.unmodifiableMap(history);
    }

    private ProposalState stateOf(long proposalId) {
        return reader.proposalState(proposalId).orElse(null);
    }

    private static boolean positive(BigInteger weight) {
        return weight != null && weight.signum() > 0;
    }
}
