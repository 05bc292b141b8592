package com.votesync.client.tally;

import com.votesync.client.cache.CacheKeys;
import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.overlay.OptimisticOverlay;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Cached tally reads with pending local votes merged in at read time
 */
@Slf4j
@RequiredArgsConstructor
public class TallyService {

    private final TallyResolutionPipeline pipeline;
    private final CachingLedgerReader reader;
    private final StalenessAwareCache cache;
    private final TtlPolicy ttlPolicy;
    private final OptimisticOverlay overlay;

    public TallyResult resolveTally(long proposalId, boolean forceRefresh) {
        return overlay.merge(resolveAuthoritative(proposalId, forceRefresh));
    }

    /**
     * Tally as the ledger reports it, without the overlay. forceRefresh bypasses the cached tally
     * and the cached proposal state.
     */
    public TallyResult resolveAuthoritative(long proposalId, boolean forceRefresh) {
        String key = CacheKeys.tally(proposalId);
        if (forceRefresh) {
            cache.delete(key);
            cache.delete(CacheKeys.proposal(proposalId));
        }
        return cache.getOrCompute(key, this::ttlOf, () -> pipeline.resolve(proposalId));
    }

    /**
     * Zeroed tallies are a degraded answer and always get the short TTL.
     */
    private Duration ttlOf(TallyResult result) {
        if (result.getProvenance() == Provenance.ZEROED) {
            return ttlPolicy.getActiveTally();
        }
        return ttlPolicy.tallyTtl(reader.proposalState(result.getProposalId()).orElse(null));
    }
}
