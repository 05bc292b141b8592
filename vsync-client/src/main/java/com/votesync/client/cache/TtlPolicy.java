package com.votesync.client.cache;

import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.model.ProposalState;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Lifecycle-dependent expiry of cached ledger reads.
 *
 * Pending/Active proposals change quickly and get short TTLs. Succeeded/Queued proposals
 * have a final tally but may still transition. Terminal proposals never change.
 */
@Data
@Builder
public class TtlPolicy {

    @Builder.Default
    private Duration activeTally = Duration.ofMillis(VoteSyncConstants.TTL_ACTIVE_TALLY_MS);

    @Builder.Default
    private Duration activeState = Duration.ofMillis(VoteSyncConstants.TTL_ACTIVE_STATE_MS);

    @Builder.Default
    private Duration settledState = Duration.ofMillis(VoteSyncConstants.TTL_SETTLED_STATE_MS);

    @Builder.Default
    private Duration immutable = Duration.ofMillis(VoteSyncConstants.TTL_IMMUTABLE_MS);

    @Builder.Default
    private Duration governanceParams = Duration.ofMillis(VoteSyncConstants.TTL_GOVERNANCE_PARAMS_MS);

    @Builder.Default
    private Duration rollup = Duration.ofMillis(VoteSyncConstants.TTL_ROLLUP_MS);

    public static TtlPolicy defaults() {
        return TtlPolicy.builder().build();
    }

    /**
     * Tallies of closed proposals are final. An unknown state gets the short TTL.
     */
    public Duration tallyTtl(ProposalState state) {
        return state == null || state.acceptsVotes() ? activeTally : immutable;
    }

    public Duration proposalTtl(ProposalState state) {
        if (state == null || state.acceptsVotes()) {
            return activeState;
        }
        return state.isTerminal() ? immutable : settledState;
    }

    /**
     * A cast vote never disappears; "not voted" can only change while the proposal accepts votes.
     */
    public Duration voteStatusTtl(boolean voted, ProposalState state) {
        if (voted) {
            return immutable;
        }
        return state == null || state.acceptsVotes() ? activeState : immutable;
    }

    public Duration votingPowerTtl() {
        return immutable;
    }
}
