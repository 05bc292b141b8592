package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolved tally of a proposal.
 * Invariant: totalWeight equals the sum of the per-choice weights.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TallyResult {

    private Long proposalId;

    @Builder.Default
    private Map<VoteChoice, ChoiceTally> perChoice = new EnumMap<>(VoteChoice.class);

    @Builder.Default
    private BigInteger totalWeight = BigInteger.ZERO;

    private BigDecimal scaledTotalWeight;

    @Builder.Default
    private long uniqueVoters = 0;

    private boolean quorumReached;

    private BigInteger requiredQuorum; // null when governance params could not be read

    private Provenance provenance;

    private Instant computedAt;

    // Voters the source can name (event replay only), empty otherwise
    @Builder.Default
    private Set<String> countedVoters = Collections.emptySet();

    // A pending local vote was merged in at read time
    private boolean optimistic;

    public ChoiceTally choice(VoteChoice choice) {
        ChoiceTally tally = perChoice.get(choice);
        return tally != null ? tally : ChoiceTally.builder().build();
    }

    public BigInteger weightOf(VoteChoice choice) {
        return choice(choice).getWeight();
    }

    public double percentageOf(VoteChoice choice) {
        return choice(choice).getPercentage();
    }

    public boolean hasCountedVoter(String voterId) {
        return voterId != null && countedVoters.contains(voterId.toLowerCase(Locale.ROOT));
    }
}
