package com.votesync.client.tally;

import com.votesync.client.ledger.LedgerClient;
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
 * Sum of the three per-choice weight reads. Voter counts are unknown and reported as 0.
 */
@Slf4j
@RequiredArgsConstructor
public class PerChoiceTallySource implements TallySource {

    private final LedgerClient ledgerClient;
    private final Clock clock;

    @Override
    public Optional<TallyResult> resolve(long proposalId, BigInteger quorum) {
        Map<VoteChoice, BigInteger> weights = new EnumMap<>(VoteChoice.class);
        try {
            for (VoteChoice choice : VoteChoice.values()) {
                BigInteger weight = ledgerClient.choiceWeight(proposalId, choice);
                weights.put(choice, weight != null ? weight : BigInteger.ZERO);
            }
        } catch (Exception e) {
            log.warn("⚠️ Per-choice reads failed for proposal {}: {}", proposalId, e.getMessage());
            return Optional.empty();
        }

        return Optional.of(TallyCalculator.build(proposalId, Collections.emptyMap(), weights, 0, quorum,
                Provenance.PER_CHOICE, Collections.emptySet(), clock.instant()));
    }

    @Override
    public Provenance provenance() {
        return Provenance.PER_CHOICE;
    }
}
