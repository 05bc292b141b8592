package com.votesync.client.discovery;

import com.votesync.client.support.InMemoryLedger;
import com.votesync.common.model.ProposalRange;
import com.votesync.common.model.ProposalState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for proposal range discovery by probing
 */
public class ProposalRangeDiscoveryTest {

    @Test
    void testBoundaryFoundWithinNineReads() {
        // 0..150 exist: 100 answers, 200 fails, boundary 150
        InMemoryLedger ledger = new InMemoryLedger().addProposals(151, ProposalState.ACTIVE);

        ProposalRange range = new ProposalRangeDiscovery(ledger).discover();

        assertEquals(0, range.getMinId());
        assertEquals(150, range.getMaxId());
        assertTrue(ledger.proposalReads.get() <= 9, "reads: " + ledger.proposalReads.get());
    }

    @Test
    void testContiguousRangesOfVariousSizes() {
        for (int count : new int[]{1, 2, 57, 100, 101, 199, 200, 201, 777, 3201}) {
            InMemoryLedger ledger = new InMemoryLedger().addProposals(count, ProposalState.EXECUTED);

            ProposalRange range = new ProposalRangeDiscovery(ledger).discover();

            assertEquals(count - 1, range.getMaxId(), "count " + count);
            // doubling steps plus one binary search over the last interval
            assertTrue(ledger.proposalReads.get() <= 8 + 14, "count " + count + " reads " + ledger.proposalReads.get());
        }
    }

    @Test
    void testCeilingIsReportedWhenItExists() {
        InMemoryLedger ledger = new InMemoryLedger().addProposals(1001, ProposalState.EXECUTED);

        ProposalRange range = new ProposalRangeDiscovery(ledger, 100, 800, 20).discover();

        assertEquals(800, range.getMaxId());
        // 100, 200, 400, 800
        assertEquals(4, ledger.proposalReads.get());
    }

    @Test
    void testEmptyLedger() {
        InMemoryLedger ledger = new InMemoryLedger();

        ProposalRange range = new ProposalRangeDiscovery(ledger).discover();

        assertTrue(range.isEmpty());
        assertEquals(-1, range.getMaxId());
    }

    @Test
    void testLinearFallbackFindsSparseIds() {
        // Only id 7 exists, so the binary search never lands on it
        InMemoryLedger ledger = new InMemoryLedger().addProposal(7, ProposalState.ACTIVE);

        ProposalRange range = new ProposalRangeDiscovery(ledger).discover();

        assertEquals(7, range.getMaxId());
    }

    @Test
    void testInvalidBoundsRejected() {
        InMemoryLedger ledger = new InMemoryLedger();
        assertThrows(IllegalArgumentException.class, () -> new ProposalRangeDiscovery(ledger, 0, 100, 20));
        assertThrows(IllegalArgumentException.class, () -> new ProposalRangeDiscovery(ledger, 100, 50, 20));
    }
}
