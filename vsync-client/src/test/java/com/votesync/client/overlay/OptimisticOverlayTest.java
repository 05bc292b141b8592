package com.votesync.client.overlay;

import com.votesync.client.support.InMemoryLedger;
import com.votesync.client.support.MutableClock;
import com.votesync.client.tally.TallyCalculator;
import com.votesync.common.model.MutationStatus;
import com.votesync.common.model.PendingMutation;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for read-time merging of pending votes
 */
public class OptimisticOverlayTest {

    private InMemoryLedger ledger;
    private MutableClock clock;
    private OptimisticOverlay overlay;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        clock = new MutableClock();
        overlay = new OptimisticOverlay(ledger, clock, Duration.ofSeconds(60));
    }

    @Test
    void testMergeAddsPendingVote() {
        overlay.record(mutation("0xme", VoteChoice.FOR, 42));

        TallyResult merged = overlay.merge(eventsTally(Set.of("0xother")));

        assertEquals(BigInteger.valueOf(142), merged.weightOf(VoteChoice.FOR));
        assertEquals(2, merged.getUniqueVoters());
        assertTrue(merged.isOptimistic());
    }

    @Test
    void testVoterAlreadyCountedByEventsConfirmsMutation() {
        PendingMutation mutation = mutation("0xMe", VoteChoice.FOR, 42);
        overlay.record(mutation);

        TallyResult merged = overlay.merge(eventsTally(Set.of("0xme")));

        assertFalse(merged.isOptimistic());
        assertEquals(MutationStatus.CONFIRMED, mutation.getStatus());
        assertEquals(0, overlay.size());
    }

    @Test
    void testNonEventTallyChecksVoterWeightDirectly() {
        overlay.record(mutation("0xme", VoteChoice.FOR, 42));
        TallyResult aggregate = TallyCalculator.build(1, Map.of(), Map.of(VoteChoice.FOR, BigInteger.valueOf(100)),
                1, null, Provenance.AGGREGATE, Set.of(), clock.instant());

        assertTrue(overlay.merge(aggregate).isOptimistic());
        assertEquals(1, ledger.voterWeightReads.get());

        ledger.castIndexed(1, "0xme", VoteChoice.FOR, BigInteger.valueOf(42));
        assertFalse(overlay.merge(aggregate).isOptimistic());
        assertEquals(0, overlay.size());
    }

    @Test
    void testUnreadableVoterWeightFallsBackToBaseline() {
        PendingMutation mutation = mutation("0xme", VoteChoice.FOR, 42);
        mutation.setBaselineWeight(BigInteger.valueOf(100));
        overlay.record(mutation);
        ledger.voterWeightAvailable = false;

        TallyResult unmoved = overlay.merge(aggregateTally(100, 1));
        assertTrue(unmoved.isOptimistic());
        assertEquals(BigInteger.valueOf(142), unmoved.weightOf(VoteChoice.FOR));
        assertEquals(2, unmoved.getUniqueVoters());

        TallyResult moved = overlay.merge(aggregateTally(142, 2));
        assertFalse(moved.isOptimistic());
        assertEquals(BigInteger.valueOf(142), moved.weightOf(VoteChoice.FOR));
        assertEquals(2, moved.getUniqueVoters());
        assertEquals(MutationStatus.CONFIRMED, mutation.getStatus());
    }

    @Test
    void testUnverifiableVoteIsLeftOut() {
        PendingMutation mutation = mutation("0xme", VoteChoice.FOR, 42);
        overlay.record(mutation);
        ledger.voterWeightAvailable = false;

        TallyResult merged = overlay.merge(aggregateTally(142, 2));

        assertEquals(OptimisticOverlay.Verification.UNVERIFIED, overlay.verify(aggregateTally(142, 2), mutation));
        assertFalse(merged.isOptimistic());
        assertEquals(BigInteger.valueOf(142), merged.weightOf(VoteChoice.FOR));
        assertEquals(MutationStatus.UNCONFIRMED, mutation.getStatus());
        assertEquals(1, overlay.size());
    }

    @Test
    void testExpiredMutationIsDiscarded() {
        overlay.record(mutation("0xme", VoteChoice.FOR, 42));

        clock.advance(Duration.ofSeconds(59));
        assertTrue(overlay.find(1, "0xme").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(overlay.find(1, "0xme").isEmpty());
        assertFalse(overlay.merge(eventsTally(Set.of())).isOptimistic());
        assertEquals(0, overlay.size());
    }

    @Test
    void testFailedMutation() {
        PendingMutation mutation = mutation("0xme", VoteChoice.AGAINST, 1);
        overlay.record(mutation);

        overlay.fail(mutation);

        assertEquals(MutationStatus.FAILED, mutation.getStatus());
        assertTrue(overlay.find(1, "0xme").isEmpty());
    }

    private PendingMutation mutation(String voter, VoteChoice choice, long weight) {
        return PendingMutation.builder()
                .proposalId(1L)
                .voterId(voter)
                .choice(choice)
                .weight(BigInteger.valueOf(weight))
                .submittedAt(clock.instant())
                .build();
    }

    private TallyResult aggregateTally(long forWeight, long voters) {
        return TallyCalculator.build(1, Map.of(), Map.of(VoteChoice.FOR, BigInteger.valueOf(forWeight)),
                voters, null, Provenance.AGGREGATE, Set.of(), clock.instant());
    }

    private TallyResult eventsTally(Set<String> voters) {
        return TallyCalculator.build(1, Map.of(VoteChoice.FOR, (long) voters.size()),
                Map.of(VoteChoice.FOR, BigInteger.valueOf(100)), voters.size(), null, Provenance.EVENTS,
                voters, Instant.parse("2024-01-01T00:00:00Z"));
    }
}
