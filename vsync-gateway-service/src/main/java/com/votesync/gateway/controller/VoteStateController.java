package com.votesync.gateway.controller;

import com.votesync.client.VoteStateClient;
import com.votesync.client.VoteSubmission;
import com.votesync.common.model.DelegationInfo;
import com.votesync.common.model.GovernanceStats;
import com.votesync.common.model.ProposalDetails;
import com.votesync.common.model.ProposalRange;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import com.votesync.common.model.VoteDetails;
import com.votesync.common.model.VoteReceipt;
import com.votesync.common.util.UnitScaling;
import com.votesync.gateway.dto.VoteRequest;
import com.votesync.gateway.dto.VoteResponse;
import com.votesync.gateway.dto.VoteStatusResponse;
import com.votesync.gateway.dto.VotingPowerResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for voting state
 * Tallies and vote status are served from the client cache; votes are cast as the configured holder
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/governance")
@RequiredArgsConstructor
public class VoteStateController {

    private final VoteStateClient voteStateClient;

    @GetMapping("/proposals/range")
    public ResponseEntity<ProposalRange> getProposalRange() {
        return ResponseEntity.ok(voteStateClient.discoverProposalRange());
    }

    /**
     * Every readable proposal with its details, newest first
     */
    @GetMapping("/proposals")
    public ResponseEntity<List<ProposalDetails>> listProposals() {
        return ResponseEntity.ok(voteStateClient.listProposals());
    }

    /**
     * Tallies of several proposals, resolved concurrently
     */
    @GetMapping("/proposals/tallies")
    public ResponseEntity<Map<Long, TallyResult>> getTallies(@RequestParam List<Long> ids) {
        log.debug("Resolving tallies of {} proposals", ids.size());
        return ResponseEntity.ok(voteStateClient.resolveTalliesAsync(ids).join());
    }

    @GetMapping("/proposals/{proposalId}/tally")
    public ResponseEntity<TallyResult> getTally(
            @PathVariable long proposalId,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return ResponseEntity.ok(voteStateClient.resolveTally(proposalId, forceRefresh));
    }

    /**
     * Cast a vote. Returns once the ledger committed it; the tally in the response already
     * includes the vote even if the ledger has not indexed it yet.
     */
    @PostMapping("/proposals/{proposalId}/votes")
    public ResponseEntity<VoteResponse> castVote(
            @PathVariable long proposalId,
            @Validated @RequestBody VoteRequest request) {

        VoteChoice choice = VoteChoice.fromCode(request.getChoice());
        log.info("📝 Received {} vote on proposal {}", choice, proposalId);

        VoteSubmission submission = voteStateClient.submitVote(proposalId, choice);
        VoteReceipt receipt = submission.getReceipt();

        VoteResponse response = VoteResponse.builder()
                .proposalId(proposalId)
                .voterId(submission.getMutation().getVoterId())
                .choice(choice)
                .weight(submission.getMutation().getWeight())
                .transactionId(receipt != null ? receipt.getTransactionId() : null)
                .committedAt(receipt != null ? receipt.getCommittedAt() : null)
                .tally(voteStateClient.resolveTally(proposalId, false))
                .build();

        log.info("✅ Vote on proposal {} accepted", proposalId);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/voting-power")
    public ResponseEntity<VotingPowerResponse> getVotingPower(@RequestParam(required = false) Long checkpoint) {
        BigInteger power = voteStateClient.getVotingPower(checkpoint);
        return ResponseEntity.ok(VotingPowerResponse.builder()
                .checkpointId(checkpoint)
                .votingPower(power)
                .scaledVotingPower(UnitScaling.toScaled(power))
                .build());
    }

    @GetMapping("/proposals/{proposalId}/voting-power")
    public ResponseEntity<VotingPowerResponse> getProposalVotingPower(@PathVariable long proposalId) {
        BigInteger power = voteStateClient.getProposalVotingPower(proposalId);
        return ResponseEntity.ok(VotingPowerResponse.builder()
                .proposalId(proposalId)
                .votingPower(power)
                .scaledVotingPower(UnitScaling.toScaled(power))
                .build());
    }

    @GetMapping("/proposals/{proposalId}/voters/{holderId}/voted")
    public ResponseEntity<VoteStatusResponse> hasVoted(@PathVariable long proposalId, @PathVariable String holderId) {
        return ResponseEntity.ok(VoteStatusResponse.builder()
                .proposalId(proposalId)
                .holderId(holderId)
                .hasVoted(voteStateClient.hasVoted(proposalId, holderId))
                .build());
    }

    @GetMapping("/proposals/{proposalId}/voters/{holderId}")
    public ResponseEntity<VoteDetails> getVoteDetails(@PathVariable long proposalId, @PathVariable String holderId) {
        return ResponseEntity.ok(voteStateClient.getVoteDetails(proposalId, holderId));
    }

    @GetMapping("/voters/{holderId}/history")
    public ResponseEntity<Map<Long, VoteDetails>> getVoteHistory(@PathVariable String holderId) {
        return ResponseEntity.ok(voteStateClient.getVoteHistory(holderId));
    }

    @GetMapping("/voters/{holderId}/delegation")
    public ResponseEntity<DelegationInfo> getDelegationInfo(@PathVariable String holderId) {
        return ResponseEntity.ok(voteStateClient.getDelegationInfo(holderId));
    }

    @GetMapping("/stats")
    public ResponseEntity<GovernanceStats> getGovernanceStats() {
        return ResponseEntity.ok(voteStateClient.getGovernanceStats());
    }
}
