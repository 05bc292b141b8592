package com.votesync.client.config;

import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.overlay.BackoffPolicy;
import com.votesync.common.constant.VoteSyncConstants;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Configuration for the vote state client
 */
@Data
@Builder
public class VoteClientConfig {

    // Ledger gateway endpoint
    private String ledgerUrl;

    // Account this client votes as
    private String holderId;

    @Builder.Default
    private Long requestTimeoutMs = (long) VoteSyncConstants.DEFAULT_REQUEST_TIMEOUT_MS;

    // Range discovery
    @Builder.Default
    private Long discoveryInitialProbe = VoteSyncConstants.DISCOVERY_INITIAL_PROBE;

    @Builder.Default
    private Long discoveryCeiling = VoteSyncConstants.DISCOVERY_CEILING;

    @Builder.Default
    private Integer discoveryLinearFallback = VoteSyncConstants.DISCOVERY_LINEAR_FALLBACK;

    // Cache TTLs
    @Builder.Default
    private Long activeTallyTtlMs = VoteSyncConstants.TTL_ACTIVE_TALLY_MS;

    @Builder.Default
    private Long activeStateTtlMs = VoteSyncConstants.TTL_ACTIVE_STATE_MS;

    @Builder.Default
    private Long settledStateTtlMs = VoteSyncConstants.TTL_SETTLED_STATE_MS;

    @Builder.Default
    private Long immutableTtlMs = VoteSyncConstants.TTL_IMMUTABLE_MS;

    @Builder.Default
    private Long governanceParamsTtlMs = VoteSyncConstants.TTL_GOVERNANCE_PARAMS_MS;

    @Builder.Default
    private Long rollupTtlMs = VoteSyncConstants.TTL_ROLLUP_MS;

    @Builder.Default
    private Long cacheMaximumSize = VoteSyncConstants.CACHE_MAXIMUM_SIZE;

    // Optimistic overlay and reconciliation
    @Builder.Default
    private Long overlayMaxAgeMs = VoteSyncConstants.OVERLAY_MAX_AGE_MS;

    @Builder.Default
    private Long reconcileInitialDelayMs = VoteSyncConstants.RECONCILE_INITIAL_DELAY_MS;

    @Builder.Default
    private Double reconcileMultiplier = VoteSyncConstants.RECONCILE_MULTIPLIER;

    @Builder.Default
    private Long reconcileMaxDelayMs = VoteSyncConstants.RECONCILE_MAX_DELAY_MS;

    @Builder.Default
    private Integer reconcileMaxAttempts = VoteSyncConstants.RECONCILE_MAX_ATTEMPTS;

    // Polling
    @Builder.Default
    private Long tallyRefreshIntervalMs = VoteSyncConstants.TALLY_REFRESH_INTERVAL_MS;

    @Builder.Default
    private Integer schedulerThreads = 2;

    public TtlPolicy toTtlPolicy() {
        return TtlPolicy.builder()
                .activeTally(Duration.ofMillis(activeTallyTtlMs))
                .activeState(Duration.ofMillis(activeStateTtlMs))
                .settledState(Duration.ofMillis(settledStateTtlMs))
                .immutable(Duration.ofMillis(immutableTtlMs))
                .governanceParams(Duration.ofMillis(governanceParamsTtlMs))
                .rollup(Duration.ofMillis(rollupTtlMs))
                .build();
    }

    public BackoffPolicy toBackoffPolicy() {
        return BackoffPolicy.builder()
                .initialDelay(Duration.ofMillis(reconcileInitialDelayMs))
                .multiplier(reconcileMultiplier)
                .maxDelay(Duration.ofMillis(reconcileMaxDelayMs))
                .maxAttempts(reconcileMaxAttempts)
                .build();
    }
}
