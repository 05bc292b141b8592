package com.votesync.client.poll;

import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.client.tally.TallyService;
import com.votesync.common.model.ProposalState;
import com.votesync.common.model.TallyResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keeps tracked proposals' tallies fresh with one cancellable periodic task per proposal.
 *
 * Open proposals are re-resolved with forceRefresh every interval. A closed proposal is refreshed
 * once more, which archives its final tally under the long TTL, and then untracked.
 * A failing refresh never cancels any task.
 */
@Slf4j
public class TallyRefreshScheduler {

    private final TallyService tallyService;
    private final CachingLedgerReader reader;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Map<Long, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<TallyResult>> listeners = new CopyOnWriteArrayList<>();

    public TallyRefreshScheduler(TallyService tallyService, CachingLedgerReader reader,
                                 ScheduledExecutorService scheduler, Duration interval) {
        this.tallyService = tallyService;
        this.reader = reader;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    /**
     * Start refreshing the proposal. Tracking an already tracked proposal is a no-op.
     */
    public void track(long proposalId) {
        tasks.computeIfAbsent(proposalId, id -> {
            log.info("🔄 Tracking tally of proposal {} every {}ms", id, interval.toMillis());
            return scheduler.scheduleWithFixedDelay(() -> refresh(id), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        });
    }

    public void untrack(long proposalId) {
        ScheduledFuture<?> task = tasks.remove(proposalId);
        if (task != null) {
            task.cancel(false);
            log.info("Stopped tracking proposal {}", proposalId);
        }
    }

    public Set<Long> trackedProposals() {
        return Set.copyOf(tasks.keySet());
    }

    public void addListener(Consumer<TallyResult> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<TallyResult> listener) {
        listeners.remove(listener);
    }

    /**
     * Cancel every task. In-flight refreshes finish on their own.
     */
    public void shutdown() {
        tasks.keySet().forEach(this::untrack);
        log.info("Tally refresh scheduler shut down");
    }

    void refresh(long proposalId) {
        try {
            TallyResult result = tallyService.resolveTally(proposalId, true);
            notifyListeners(result);

            Optional<ProposalState> state = reader.proposalState(proposalId);
            if (state.isPresent() && !state.get().acceptsVotes()) {
                log.info("Proposal {} is {}, final tally archived", proposalId, state.get());
                untrack(proposalId);
            }
        } catch (Exception e) {
            log.error("Error refreshing tally of proposal {}: {}", proposalId, e.getMessage());
        }
    }

    private void notifyListeners(TallyResult result) {
        for (Consumer<TallyResult> listener : listeners) {
            try {
                listener.accept(result);
            } catch (Exception e) {
                log.warn("⚠️ Tally listener failed for proposal {}: {}", result.getProposalId(), e.getMessage());
            }
        }
    }
}
