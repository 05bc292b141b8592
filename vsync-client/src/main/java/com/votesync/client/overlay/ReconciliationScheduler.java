package com.votesync.client.overlay;

import com.votesync.common.exception.ErrorCode;
import com.votesync.common.exception.StaleOverlayException;
import com.votesync.common.model.MutationStatus;
import com.votesync.common.model.PendingMutation;
import com.votesync.common.model.TallyResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Re-resolves a proposal after a committed vote until the ledger counts it.
 *
 * Attempts follow the {@link BackoffPolicy}. Each attempt bypasses the cache. Reconciliation stops
 * early once the voter is counted, when the pending vote has expired, or when the attempts run
 * out. The returned future always completes with the last authoritative tally it read.
 */
@Slf4j
public class ReconciliationScheduler {

    private final OptimisticOverlay overlay;
    private final BackoffPolicy backoffPolicy;
    private final ScheduledExecutorService scheduler;

    public ReconciliationScheduler(OptimisticOverlay overlay, BackoffPolicy backoffPolicy,
                                   ScheduledExecutorService scheduler) {
        this.overlay = overlay;
        this.backoffPolicy = backoffPolicy;
        this.scheduler = scheduler;
    }

    /**
     * @param forcedResolve authoritative, cache-bypassing tally read
     * @param onConfirmed   called once the ledger counts the vote
     */
    public CompletableFuture<TallyResult> reconcile(PendingMutation mutation,
                                                    LongFunction<TallyResult> forcedResolve,
                                                    Consumer<PendingMutation> onConfirmed) {
        CompletableFuture<TallyResult> future = new CompletableFuture<>();
        schedule(mutation, forcedResolve, onConfirmed, future, 1, null);
        return future;
    }

    private void schedule(PendingMutation mutation, LongFunction<TallyResult> forcedResolve,
                          Consumer<PendingMutation> onConfirmed, CompletableFuture<TallyResult> future,
                          int attempt, TallyResult lastResult) {
        if (attempt > backoffPolicy.getMaxAttempts()) {
            log.warn("⚠️ {}: proposal {}, voter {} after {} attempts",
                    ErrorCode.RECONCILIATION_EXHAUSTED.getMessage(), mutation.getProposalId(),
                    mutation.getVoterId(), backoffPolicy.getMaxAttempts());
            future.complete(lastResult);
            return;
        }

        long delayMs = backoffPolicy.delayBefore(attempt).toMillis();
        log.debug("Reconciliation attempt {}/{} for proposal {} in {}ms", attempt,
                backoffPolicy.getMaxAttempts(), mutation.getProposalId(), delayMs);

        try {
            scheduler.schedule(() -> runAttempt(mutation, forcedResolve, onConfirmed, future, attempt, lastResult),
                    delayMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.error("❌ Could not schedule reconciliation for proposal {}: {}", mutation.getProposalId(), e.getMessage());
            future.completeExceptionally(e);
        }
    }

    private void runAttempt(PendingMutation mutation, LongFunction<TallyResult> forcedResolve,
                            Consumer<PendingMutation> onConfirmed, CompletableFuture<TallyResult> future,
                            int attempt, TallyResult lastResult) {
        TallyResult result = lastResult;
        try {
            result = forcedResolve.apply(mutation.getProposalId());

            if (mutation.getStatus() == MutationStatus.CONFIRMED
                    || overlay.isCounted(result, mutation)) {
                if (mutation.getStatus() != MutationStatus.CONFIRMED) {
                    overlay.confirm(mutation);
                }
                onConfirmed.accept(mutation);
                future.complete(result);
                return;
            }
        } catch (Exception e) {
            log.warn("⚠️ Reconciliation attempt {} for proposal {} failed: {}", attempt,
                    mutation.getProposalId(), e.getMessage());
        }

        if (overlay.isExpired(mutation)) {
            overlay.discard(mutation);
            StaleOverlayException stale = new StaleOverlayException(mutation.getProposalId(), mutation.getVoterId());
            log.warn("⚠️ {}", stale.getMessage());
            future.complete(result);
            return;
        }

        schedule(mutation, forcedResolve, onConfirmed, future, attempt + 1, result);
    }
}
