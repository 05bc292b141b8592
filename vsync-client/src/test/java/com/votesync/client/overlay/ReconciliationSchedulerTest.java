package com.votesync.client.overlay;

import com.votesync.client.support.InMemoryLedger;
import com.votesync.client.support.MutableClock;
import com.votesync.client.tally.TallyCalculator;
import com.votesync.common.model.MutationStatus;
import com.votesync.common.model.PendingMutation;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for backoff-driven reconciliation of committed votes
 */
public class ReconciliationSchedulerTest {

    private MutableClock clock;
    private OptimisticOverlay overlay;
    private ScheduledExecutorService executor;
    private ReconciliationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        overlay = new OptimisticOverlay(new InMemoryLedger(), clock, Duration.ofSeconds(60));
        executor = Executors.newSingleThreadScheduledExecutor();
        BackoffPolicy fast = BackoffPolicy.builder()
                .initialDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(20))
                .build();
        scheduler = new ReconciliationScheduler(overlay, fast, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testStopsEarlyOnceCounted() throws Exception {
        PendingMutation mutation = pending();
        AtomicInteger reads = new AtomicInteger();
        AtomicInteger confirmations = new AtomicInteger();

        TallyResult result = scheduler.reconcile(mutation,
                id -> reads.incrementAndGet() < 3 ? tally(Set.of()) : tally(Set.of("0xme")),
                m -> confirmations.incrementAndGet()).get(5, TimeUnit.SECONDS);

        assertEquals(3, reads.get());
        assertEquals(1, confirmations.get());
        assertTrue(result.hasCountedVoter("0xme"));
        assertEquals(MutationStatus.CONFIRMED, mutation.getStatus());
    }

    @Test
    void testGivesUpAfterMaxAttempts() throws Exception {
        PendingMutation mutation = pending();
        AtomicInteger reads = new AtomicInteger();

        TallyResult result = scheduler.reconcile(mutation, id -> {
            reads.incrementAndGet();
            return tally(Set.of());
        }, m -> fail("not confirmed")).get(5, TimeUnit.SECONDS);

        assertEquals(5, reads.get());
        assertNotNull(result);
        assertEquals(MutationStatus.UNCONFIRMED, mutation.getStatus());
        assertEquals(1, overlay.size());
    }

    @Test
    void testStaleMutationEndsReconciliationQuietly() throws Exception {
        PendingMutation mutation = pending();
        clock.advance(Duration.ofSeconds(61));

        TallyResult result = scheduler.reconcile(mutation, id -> tally(Set.of()), m -> fail("not confirmed"))
                .get(5, TimeUnit.SECONDS);

        assertNotNull(result);
        assertEquals(0, overlay.size());
    }

    @Test
    void testFailingReadsAreRetried() throws Exception {
        PendingMutation mutation = pending();
        AtomicInteger reads = new AtomicInteger();

        TallyResult result = scheduler.reconcile(mutation, id -> {
            if (reads.incrementAndGet() == 1) {
                throw new IllegalStateException("ledger down");
            }
            return tally(Set.of("0xme"));
        }, m -> { }).get(5, TimeUnit.SECONDS);

        assertEquals(2, reads.get());
        assertTrue(result.hasCountedVoter("0xme"));
    }

    private PendingMutation pending() {
        PendingMutation mutation = PendingMutation.builder()
                .proposalId(1L)
                .voterId("0xme")
                .choice(VoteChoice.FOR)
                .weight(BigInteger.valueOf(42))
                .submittedAt(clock.instant())
                .build();
        overlay.record(mutation);
        return mutation;
    }

    private TallyResult tally(Set<String> voters) {
        return TallyCalculator.build(1, Map.of(), Map.of(), voters.size(), null, Provenance.EVENTS, voters,
                clock.instant());
    }
}
