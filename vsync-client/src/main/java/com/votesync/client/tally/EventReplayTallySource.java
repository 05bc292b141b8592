package com.votesync.client.tally;

import com.votesync.client.aggregate.EventLogReplayAggregator;
import com.votesync.client.aggregate.ReplayOutcome;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.time.Clock;
import java.util.HashSet;
import java.util.Optional;

/**
 * Tally rebuilt from the vote log. The only source that can name the counted voters.
 */
@RequiredArgsConstructor
public class EventReplayTallySource implements TallySource {

    private final EventLogReplayAggregator aggregator;
    private final Clock clock;

    @Override
    public Optional<TallyResult> resolve(long proposalId, BigInteger quorum) {
        ReplayOutcome outcome = aggregator.replay(proposalId);
        if (!outcome.isAvailable()) {
            return Optional.empty();
        }
        return Optional.of(TallyCalculator.build(proposalId, outcome.countsByChoice(), outcome.weightsByChoice(),
                outcome.uniqueVoters(), quorum, Provenance.EVENTS, new HashSet<>(outcome.voters()), clock.instant()));
    }

    @Override
    public Provenance provenance() {
        return Provenance.EVENTS;
    }
}
