package com.votesync.gateway.controller;

import com.votesync.common.exception.VoteFailureReason;
import com.votesync.common.exception.VoteSubmissionException;
import com.votesync.common.exception.VoteSyncException;
import com.votesync.common.model.DelegationInfo;
import com.votesync.common.model.ProposalDetails;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import com.votesync.gateway.dto.VoteRequest;
import com.votesync.gateway.dto.VoteResponse;
import com.votesync.gateway.dto.VotingPowerResponse;
import com.votesync.gateway.support.StubVoteStateClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for the governance REST controller, called directly
 */
public class VoteStateControllerTest {

    private StubVoteStateClient client;
    private VoteStateController controller;

    @BeforeEach
    void setUp() {
        client = new StubVoteStateClient();
        controller = new VoteStateController(client);
    }

    @Test
    void testCastVoteReturnsReceiptAndOptimisticTally() {
        ResponseEntity<VoteResponse> response = controller.castVote(7, VoteRequest.builder().choice(1).build());

        assertEquals(HttpStatus.OK, response.getStatusCode());
        VoteResponse body = response.getBody();
        assertNotNull(body);
        assertEquals(VoteChoice.FOR, body.getChoice());
        assertEquals("0xtx", body.getTransactionId());
        assertEquals(1, body.getTally().getUniqueVoters());
        assertEquals(client.votingPower, body.getTally().weightOf(VoteChoice.FOR));
    }

    @Test
    void testCastVoteWithUnknownChoice() {
        VoteSyncException ex = assertThrows(VoteSyncException.class,
                () -> controller.castVote(7, VoteRequest.builder().choice(5).build()));

        assertEquals(1002, ex.getCode());
    }

    @Test
    void testCastVoteFailurePropagates() {
        client.submitFailure = new VoteSubmissionException(VoteFailureReason.ALREADY_VOTED);

        VoteSubmissionException ex = assertThrows(VoteSubmissionException.class,
                () -> controller.castVote(7, VoteRequest.builder().choice(0).build()));

        assertEquals(VoteFailureReason.ALREADY_VOTED, ex.getReason());
    }

    @Test
    void testForceRefreshIsPassedThrough() {
        controller.getTally(3, false);
        assertTrue(client.forcedRefreshes.isEmpty());

        controller.getTally(3, true);
        assertTrue(client.forcedRefreshes.contains(3L));
    }

    @Test
    void testTalliesKeyedById() {
        Map<Long, TallyResult> tallies = controller.getTallies(List.of(2L, 1L)).getBody();

        assertNotNull(tallies);
        assertEquals(List.of(2L, 1L), List.copyOf(tallies.keySet()));
    }

    @Test
    void testVotingPowerIsScaled() {
        VotingPowerResponse body = controller.getVotingPower(null).getBody();

        assertNotNull(body);
        assertNull(body.getCheckpointId());
        assertEquals(0, BigDecimal.ONE.compareTo(body.getScaledVotingPower()));
    }

    @Test
    void testVoteStatus() {
        assertFalse(controller.hasVoted(7, "0xme").getBody().getHasVoted());

        controller.castVote(7, VoteRequest.builder().choice(2).build());

        assertTrue(controller.hasVoted(7, "0xMe").getBody().getHasVoted());
    }

    @Test
    void testRangeAndStats() {
        assertEquals(2, controller.getProposalRange().getBody().getMaxId());
        assertEquals(3, controller.getGovernanceStats().getBody().getTotalProposals());
    }

    @Test
    void testListProposalsNewestFirst() {
        ResponseEntity<List<ProposalDetails>> response = controller.listProposals();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(3, response.getBody().size());
        assertEquals(Long.valueOf(2), response.getBody().get(0).getId());
        assertEquals(Long.valueOf(0), response.getBody().get(2).getId());
    }

    @Test
    void testDelegationInfo() {
        ResponseEntity<DelegationInfo> response = controller.getDelegationInfo("0xme");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("0xme", response.getBody().getHolderId());
        assertTrue(response.getBody().isSelfDelegated());
        assertEquals(1, response.getBody().getDelegators().size());
        assertEquals("0xd1", response.getBody().getDelegators().get(0).getHolderId());
    }
}
