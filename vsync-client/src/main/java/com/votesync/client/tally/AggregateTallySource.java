package com.votesync.client.tally;

import com.votesync.client.ledger.LedgerClient;
import com.votesync.common.exception.UnsupportedReadException;
import com.votesync.common.model.AggregateVotes;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Direct aggregate read. Carries weights and a voter total but no per-choice counts.
 */
@Slf4j
@RequiredArgsConstructor
public class AggregateTallySource implements TallySource {

    private final LedgerClient ledgerClient;
    private final Clock clock;

    @Override
    public Optional<TallyResult> resolve(long proposalId, BigInteger quorum) {
        AggregateVotes votes;
        try {
            votes = ledgerClient.aggregateVotes(proposalId);
        } catch (UnsupportedReadException e) {
            log.debug("Aggregate read not exposed for proposal {}", proposalId);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("⚠️ Aggregate read failed for proposal {}: {}", proposalId, e.getMessage());
            return Optional.empty();
        }
        if (votes == null) {
            return Optional.empty();
        }

        Map<VoteChoice, BigInteger> weights = new EnumMap<>(VoteChoice.class);
        weights.put(VoteChoice.AGAINST, orZero(votes.getAgainstWeight()));
        weights.put(VoteChoice.FOR, orZero(votes.getForWeight()));
        weights.put(VoteChoice.ABSTAIN, orZero(votes.getAbstainWeight()));
        long voters = votes.getTotalVoters() != null ? votes.getTotalVoters() : 0;

        return Optional.of(TallyCalculator.build(proposalId, Collections.emptyMap(), weights, voters, quorum,
                Provenance.AGGREGATE, Collections.emptySet(), clock.instant()));
    }

    @Override
    public Provenance provenance() {
        return Provenance.AGGREGATE;
    }

    private static BigInteger orZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
