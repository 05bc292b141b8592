package com.votesync.client.cache;

import com.votesync.common.constant.VoteSyncConstants;

import java.util.List;
import java.util.Locale;

/**
 * Composite cache key builders. Account ids are lower-cased so one holder maps to one key.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String proposal(long proposalId) {
        return VoteSyncConstants.KEY_PROPOSAL + proposalId;
    }

    public static String tally(long proposalId) {
        return VoteSyncConstants.KEY_TALLY + proposalId;
    }

    public static String voteStatus(long proposalId, String holderId) {
        return VoteSyncConstants.KEY_VOTE_STATUS + proposalId + "-" + normalize(holderId);
    }

    public static String voteDetails(long proposalId, String holderId) {
        return VoteSyncConstants.KEY_VOTE_DETAILS + proposalId + "-" + normalize(holderId);
    }

    public static String voteHistory(String holderId) {
        return VoteSyncConstants.KEY_VOTE_HISTORY + normalize(holderId);
    }

    public static String votingPower(String holderId, long checkpointId) {
        return VoteSyncConstants.KEY_VOTING_POWER + normalize(holderId) + "-" + checkpointId;
    }

    public static String checkpoint(long proposalId) {
        return VoteSyncConstants.KEY_CHECKPOINT + proposalId;
    }

    public static String proposalDetails(long proposalId) {
        return VoteSyncConstants.KEY_PROPOSAL_DETAILS + proposalId;
    }

    public static String proposalType(long proposalId) {
        return VoteSyncConstants.KEY_PROPOSAL_TYPE + proposalId;
    }

    public static String delegation(String holderId) {
        return VoteSyncConstants.KEY_DELEGATION + normalize(holderId);
    }

    public static String governanceParams() {
        return VoteSyncConstants.KEY_GOVERNANCE_PARAMS;
    }

    public static String proposalRange() {
        return "proposal-range";
    }

    public static String governanceStats() {
        return VoteSyncConstants.KEY_ROLLUP + "stats";
    }

    /**
     * Keys a vote by the holder on the proposal can make stale. Rollup keys are cleared by prefix.
     */
    public static List<String> affectedByVote(long proposalId, String holderId) {
        return List.of(
                voteStatus(proposalId, holderId),
                voteDetails(proposalId, holderId),
                voteHistory(holderId),
                tally(proposalId));
    }

    public static String normalize(String holderId) {
        return holderId == null ? "" : holderId.toLowerCase(Locale.ROOT);
    }
}
