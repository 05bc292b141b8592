package com.votesync.client.tally;

import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.common.model.TallyResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a tally from prioritized sources, first success wins.
 * Falls back to a zeroed result tagged ZEROED instead of throwing.
 */
@Slf4j
public class TallyResolutionPipeline {

    private final List<TallySource> sources;
    private final CachingLedgerReader reader;
    private final Clock clock;

    public TallyResolutionPipeline(List<TallySource> sources, CachingLedgerReader reader, Clock clock) {
        this.sources = List.copyOf(sources);
        this.reader = reader;
        this.clock = clock;
    }

    public TallyResult resolve(long proposalId) {
        BigInteger quorum = reader.quorum();

        for (TallySource source : sources) {
            Optional<TallyResult> result = source.resolve(proposalId, quorum);
            if (result.isPresent()) {
                log.debug("Tally of proposal {} resolved from {}", proposalId, source.provenance());
                return result.get();
            }
        }

        log.warn("⚠️ All tally sources failed for proposal {}, returning zeroed tally", proposalId);
        return TallyCalculator.zeroed(proposalId, quorum, clock.instant());
    }

    public List<TallySource> getSources() {
        return sources;
    }
}
