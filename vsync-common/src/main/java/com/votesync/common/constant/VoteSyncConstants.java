package com.votesync.common.constant;

/**
 * Application-wide constants.
 */
public final class VoteSyncConstants {

    private VoteSyncConstants() {
        // Utility class - prevent instantiation
    }

    // Weights carry 18 implied decimals
    public static final int WEIGHT_DECIMALS = 18;

    // Range discovery
    public static final long DISCOVERY_INITIAL_PROBE = 100L;
    public static final long DISCOVERY_CEILING = 10_000L;
    public static final int DISCOVERY_LINEAR_FALLBACK = 20;

    // Cache TTLs (milliseconds)
    public static final long TTL_ACTIVE_TALLY_MS = 30_000L;                   // 30 seconds
    public static final long TTL_ACTIVE_STATE_MS = 15_000L;                   // 15 seconds
    public static final long TTL_SETTLED_STATE_MS = 3_600_000L;               // 1 hour
    public static final long TTL_IMMUTABLE_MS = 30L * 24 * 3_600_000L;        // 30 days
    public static final long TTL_GOVERNANCE_PARAMS_MS = 3_600_000L;           // 1 hour
    public static final long TTL_ROLLUP_MS = 30_000L;                         // 30 seconds

    // Cache capacity
    public static final long CACHE_MAXIMUM_SIZE = 10_000L;

    // Optimistic overlay
    public static final long OVERLAY_MAX_AGE_MS = 60_000L;                    // 60 seconds
    public static final long RECONCILE_INITIAL_DELAY_MS = 2_000L;
    public static final double RECONCILE_MULTIPLIER = 1.5;
    public static final long RECONCILE_MAX_DELAY_MS = 10_000L;
    public static final int RECONCILE_MAX_ATTEMPTS = 5;

    // Polling
    public static final long TALLY_REFRESH_INTERVAL_MS = 30_000L;

    // Timeouts
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 30_000;

    // Cache key prefixes
    public static final String KEY_PROPOSAL = "proposal-";
    public static final String KEY_TALLY = "tally-";
    public static final String KEY_VOTE_STATUS = "voted-";
    public static final String KEY_VOTE_DETAILS = "vote-";
    public static final String KEY_VOTE_HISTORY = "history-";
    public static final String KEY_VOTING_POWER = "power-";
    public static final String KEY_CHECKPOINT = "checkpoint-";
    public static final String KEY_PROPOSAL_DETAILS = "details-";
    public static final String KEY_PROPOSAL_TYPE = "type-";
    public static final String KEY_DELEGATION = "delegation-";
    public static final String KEY_GOVERNANCE_PARAMS = "governance-params";
    public static final String KEY_ROLLUP = "rollup-";

    // The "zero" account id, meaning no delegate set
    public static final String ZERO_ACCOUNT = "0x0000000000000000000000000000000000000000";

    // HTTP Headers
    public static final String HEADER_CLIENT_ID = "X-Client-Id";
}
