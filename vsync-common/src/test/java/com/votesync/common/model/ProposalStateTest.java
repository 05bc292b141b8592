package com.votesync.common.model;

import com.votesync.common.exception.VoteSyncException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for lifecycle and choice enums
 */
public class ProposalStateTest {

    @Test
    void testAcceptsVotes() {
        assertTrue(ProposalState.PENDING.acceptsVotes());
        assertTrue(ProposalState.ACTIVE.acceptsVotes());
        assertFalse(ProposalState.SUCCEEDED.acceptsVotes());
        assertFalse(ProposalState.DEFEATED.acceptsVotes());
    }

    @Test
    void testSettledButNotTerminal() {
        assertFalse(ProposalState.SUCCEEDED.isTerminal());
        assertFalse(ProposalState.QUEUED.isTerminal());
        assertTrue(ProposalState.EXECUTED.isTerminal());
        assertTrue(ProposalState.EXPIRED.isTerminal());
        assertTrue(ProposalState.CANCELED.isTerminal());
    }

    @Test
    void testFromCode() {
        assertEquals(ProposalState.QUEUED, ProposalState.fromCode(5));
        assertThrows(IllegalArgumentException.class, () -> ProposalState.fromCode(8));
        assertEquals(VoteChoice.ABSTAIN, VoteChoice.fromCode(2));
        assertThrows(VoteSyncException.class, () -> VoteChoice.fromCode(3));
    }

    @Test
    void testProposalRange() {
        assertTrue(ProposalRange.empty().isEmpty());
        assertEquals(0, ProposalRange.empty().size());
        assertEquals(151, ProposalRange.of(0, 150).size());
    }
}
