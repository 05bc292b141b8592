package com.votesync.client.aggregate;

import com.votesync.common.model.VoteChoice;
import com.votesync.common.model.VoteRecord;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Result of replaying a proposal's vote log: the latest vote of every voter,
 * or an explicit "unavailable" marker when the log could not be read.
 */
public class ReplayOutcome {

    private static final ReplayOutcome UNAVAILABLE = new ReplayOutcome(false, Collections.emptyMap());

    private final boolean available;
    private final Map<String, VoteRecord> latestByVoter;

    private ReplayOutcome(boolean available, Map<String, VoteRecord> latestByVoter) {
        this.available = available;
        this.latestByVoter = latestByVoter;
    }

    public static ReplayOutcome of(Map<String, VoteRecord> latestByVoter) {
        return new ReplayOutcome(true, Collections.unmodifiableMap(latestByVoter));
    }

    public static ReplayOutcome unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return available;
    }

    public Map<String, VoteRecord> getLatestByVoter() {
        return latestByVoter;
    }

    public long uniqueVoters() {
        return latestByVoter.size();
    }

    public Set<String> voters() {
        return latestByVoter.keySet();
    }

    public Map<VoteChoice, Long> countsByChoice() {
        Map<VoteChoice, Long> counts = new EnumMap<>(VoteChoice.class);
        for (VoteChoice choice : VoteChoice.values()) {
            counts.put(choice, 0L);
        }
        latestByVoter.values().forEach(record -> counts.merge(record.getChoice(), 1L, Long::sum));
        return counts;
    }

    public Map<VoteChoice, BigInteger> weightsByChoice() {
        Map<VoteChoice, BigInteger> weights = new EnumMap<>(VoteChoice.class);
        for (VoteChoice choice : VoteChoice.values()) {
            weights.put(choice, BigInteger.ZERO);
        }
        latestByVoter.values().forEach(record -> weights.merge(record.getChoice(),
                record.getWeight() != null ? record.getWeight() : BigInteger.ZERO, BigInteger::add));
        return weights;
    }
}
