package com.votesync.client.tally;

import com.votesync.common.model.ChoiceTally;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import com.votesync.common.util.UnitScaling;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link TallyResult}s so that totalWeight is always the sum of the per-choice weights
 * and percentages are always derived from raw weights.
 */
public final class TallyCalculator {

    private TallyCalculator() {
    }

    public static TallyResult build(long proposalId,
                                    Map<VoteChoice, Long> counts,
                                    Map<VoteChoice, BigInteger> weights,
                                    long uniqueVoters,
                                    BigInteger quorum,
                                    Provenance provenance,
                                    Set<String> countedVoters,
                                    Instant computedAt) {
        BigInteger total = BigInteger.ZERO;
        for (VoteChoice choice : VoteChoice.values()) {
            total = total.add(weights.getOrDefault(choice, BigInteger.ZERO));
        }

        Map<VoteChoice, ChoiceTally> perChoice = new EnumMap<>(VoteChoice.class);
        for (VoteChoice choice : VoteChoice.values()) {
            BigInteger weight = weights.getOrDefault(choice, BigInteger.ZERO);
            perChoice.put(choice, ChoiceTally.builder()
                    .count(counts.getOrDefault(choice, 0L))
                    .weight(weight)
                    .scaledWeight(UnitScaling.toScaled(weight))
                    .percentage(UnitScaling.percentage(weight, total))
                    .build());
        }

        return TallyResult.builder()
                .proposalId(proposalId)
                .perChoice(perChoice)
                .totalWeight(total)
                .scaledTotalWeight(UnitScaling.toScaled(total))
                .uniqueVoters(uniqueVoters)
                .requiredQuorum(quorum)
                .quorumReached(quorumReached(total, quorum))
                .provenance(provenance)
                .countedVoters(countedVoters != null ? countedVoters : Collections.emptySet())
                .computedAt(computedAt)
                .build();
    }

    public static TallyResult zeroed(long proposalId, BigInteger quorum, Instant computedAt) {
        return build(proposalId, Collections.emptyMap(), Collections.emptyMap(), 0, quorum,
                Provenance.ZEROED, Collections.emptySet(), computedAt);
    }

    /**
     * Copy of the tally with one extra vote: count + 1, weight + power, uniqueVoters + 1.
     * Totals, percentages and quorum are recomputed.
     */
    public static TallyResult withVote(TallyResult base, VoteChoice choice, BigInteger weight) {
        Map<VoteChoice, Long> counts = new EnumMap<>(VoteChoice.class);
        Map<VoteChoice, BigInteger> weights = new EnumMap<>(VoteChoice.class);
        for (VoteChoice c : VoteChoice.values()) {
            counts.put(c, base.choice(c).getCount());
            weights.put(c, base.weightOf(c));
        }
        counts.merge(choice, 1L, Long::sum);
        weights.merge(choice, weight, BigInteger::add);

        TallyResult merged = build(base.getProposalId(), counts, weights, base.getUniqueVoters() + 1,
                base.getRequiredQuorum(), base.getProvenance(), base.getCountedVoters(), base.getComputedAt());
        merged.setOptimistic(true);
        return merged;
    }

    static boolean quorumReached(BigInteger total, BigInteger quorum) {
        return quorum != null && total.compareTo(quorum) >= 0;
    }
}
