package com.votesync.client.overlay;

import com.votesync.common.constant.VoteSyncConstants;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Delay schedule for post-submission re-resolution: initial delay, multiplied per attempt, capped.
 * With the defaults: 2s, 3s, 4.5s, 6.75s, 10s.
 */
@Data
@Builder
public class BackoffPolicy {

    @Builder.Default
    private Duration initialDelay = Duration.ofMillis(VoteSyncConstants.RECONCILE_INITIAL_DELAY_MS);

    @Builder.Default
    private double multiplier = VoteSyncConstants.RECONCILE_MULTIPLIER;

    @Builder.Default
    private Duration maxDelay = Duration.ofMillis(VoteSyncConstants.RECONCILE_MAX_DELAY_MS);

    @Builder.Default
    private int maxAttempts = VoteSyncConstants.RECONCILE_MAX_ATTEMPTS;

    public static BackoffPolicy defaults() {
        return BackoffPolicy.builder().build();
    }

    /**
     * Delay before the given attempt, 1-based
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis(Math.min((long) millis, maxDelay.toMillis()));
    }

    public List<Duration> schedule() {
        List<Duration> delays = new ArrayList<>(maxAttempts);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            delays.add(delayBefore(attempt));
        }
        return delays;
    }
}
