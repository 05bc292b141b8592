package com.votesync.client.aggregate;

import com.votesync.client.cache.CacheKeys;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.ledger.VoteLogFilter;
import com.votesync.common.model.VoteRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a proposal's tally from the vote log when the ledger has no aggregate read.
 * Replay is last-write-wins per voter, in log order.
 */
@Slf4j
@RequiredArgsConstructor
public class EventLogReplayAggregator {

    private final LedgerClient ledgerClient;

    /**
     * Fetch and replay the proposal's vote log. Never throws: a failed log read is reported
     * as {@link ReplayOutcome#unavailable()}.
     */
    public ReplayOutcome replay(long proposalId) {
        List<VoteRecord> records;
        try {
            records = ledgerClient.voteLog(VoteLogFilter.forProposal(proposalId));
        } catch (Exception e) {
            log.warn("⚠️ Vote log unavailable for proposal {}: {}", proposalId, e.getMessage());
            return ReplayOutcome.unavailable();
        }

        Map<String, VoteRecord> latest = latestByVoter(records);
        log.debug("Replayed {} vote records of proposal {} into {} voters", records.size(), proposalId, latest.size());
        return ReplayOutcome.of(latest);
    }

    /**
     * Latest record per voter. Records are applied in logSequence order; records without a
     * sequence keep their position in the list.
     */
    public static Map<String, VoteRecord> latestByVoter(List<VoteRecord> records) {
        List<VoteRecord> ordered = new ArrayList<>(records);
        List<VoteRecord> sequenced = new ArrayList<>();
        for (VoteRecord record : records) {
            if (record.getLogSequence() != null) {
                sequenced.add(record);
            }
        }
        sequenced.sort(Comparator.comparing(VoteRecord::getLogSequence));

        // sequenced records are reordered among the slots they occupy
        int next = 0;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getLogSequence() != null) {
                ordered.set(i, sequenced.get(next++));
            }
        }

        Map<String, VoteRecord> latest = new LinkedHashMap<>();
        for (VoteRecord record : ordered) {
            if (record.getVoterId() == null || record.getChoice() == null) {
                log.warn("Skipping malformed vote record: {}", record);
                continue;
            }
            latest.put(CacheKeys.normalize(record.getVoterId()), record);
        }
        return latest;
    }
}
