package com.votesync.gateway.config;

import com.votesync.client.config.VoteClientConfig;
import com.votesync.common.constant.VoteSyncConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized configuration for the Vote Sync gateway
 */
@Configuration
@ConfigurationProperties(prefix = "vsync.gateway")
@Data
public class GatewayProperties {

    // ========== LEDGER CONFIGURATION ==========
    private LedgerConfig ledger = new LedgerConfig();

    @Data
    public static class LedgerConfig {
        private String url = "http://localhost:8545";
        private Long requestTimeoutMs = (long) VoteSyncConstants.DEFAULT_REQUEST_TIMEOUT_MS;
    }

    // Account the gateway votes as
    private String holderId;

    // ========== CACHE CONFIGURATION ==========
    private CacheConfig cache = new CacheConfig();

    @Data
    public static class CacheConfig {
        private Long activeTallyTtlMs = VoteSyncConstants.TTL_ACTIVE_TALLY_MS;
        private Long activeStateTtlMs = VoteSyncConstants.TTL_ACTIVE_STATE_MS;
        private Long settledStateTtlMs = VoteSyncConstants.TTL_SETTLED_STATE_MS;
        private Long immutableTtlMs = VoteSyncConstants.TTL_IMMUTABLE_MS;   // 30 days
        private Long governanceParamsTtlMs = VoteSyncConstants.TTL_GOVERNANCE_PARAMS_MS;
        private Long rollupTtlMs = VoteSyncConstants.TTL_ROLLUP_MS;
        private Long maximumSize = VoteSyncConstants.CACHE_MAXIMUM_SIZE;
    }

    // ========== OVERLAY CONFIGURATION ==========
    private OverlayConfig overlay = new OverlayConfig();

    @Data
    public static class OverlayConfig {
        private Long maxAgeMs = VoteSyncConstants.OVERLAY_MAX_AGE_MS;
        private Long reconcileInitialDelayMs = VoteSyncConstants.RECONCILE_INITIAL_DELAY_MS;
        private Double reconcileMultiplier = VoteSyncConstants.RECONCILE_MULTIPLIER;
        private Long reconcileMaxDelayMs = VoteSyncConstants.RECONCILE_MAX_DELAY_MS;
        private Integer reconcileMaxAttempts = VoteSyncConstants.RECONCILE_MAX_ATTEMPTS;
    }

    // ========== TRACKING CONFIGURATION ==========
    private TrackingConfig tracking = new TrackingConfig();

    @Data
    public static class TrackingConfig {
        private Boolean enabled = true;
        private Long refreshIntervalMs = VoteSyncConstants.TALLY_REFRESH_INTERVAL_MS;
        private Long scanIntervalMs = 60000L;
        private Integer schedulerThreads = 2;
    }

    public VoteClientConfig toClientConfig() {
        return VoteClientConfig.builder()
                .ledgerUrl(ledger.getUrl())
                .requestTimeoutMs(ledger.getRequestTimeoutMs())
                .holderId(holderId)
                .activeTallyTtlMs(cache.getActiveTallyTtlMs())
                .activeStateTtlMs(cache.getActiveStateTtlMs())
                .settledStateTtlMs(cache.getSettledStateTtlMs())
                .immutableTtlMs(cache.getImmutableTtlMs())
                .governanceParamsTtlMs(cache.getGovernanceParamsTtlMs())
                .rollupTtlMs(cache.getRollupTtlMs())
                .cacheMaximumSize(cache.getMaximumSize())
                .overlayMaxAgeMs(overlay.getMaxAgeMs())
                .reconcileInitialDelayMs(overlay.getReconcileInitialDelayMs())
                .reconcileMultiplier(overlay.getReconcileMultiplier())
                .reconcileMaxDelayMs(overlay.getReconcileMaxDelayMs())
                .reconcileMaxAttempts(overlay.getReconcileMaxAttempts())
                .tallyRefreshIntervalMs(tracking.getRefreshIntervalMs())
                .schedulerThreads(tracking.getSchedulerThreads())
                .build();
    }
}
