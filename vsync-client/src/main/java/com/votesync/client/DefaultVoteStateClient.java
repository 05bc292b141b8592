package com.votesync.client;

import com.votesync.client.aggregate.EventLogReplayAggregator;
import com.votesync.client.cache.CacheKeys;
import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.config.VoteClientConfig;
import com.votesync.client.discovery.ProposalCatalogService;
import com.votesync.client.discovery.ProposalRangeDiscovery;
import com.votesync.client.history.VoteHistoryService;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.ledger.VotingWeightSource;
import com.votesync.client.ledger.http.HttpLedgerClient;
import com.votesync.client.overlay.OptimisticOverlay;
import com.votesync.client.overlay.ReconciliationScheduler;
import com.votesync.client.poll.TallyRefreshScheduler;
import com.votesync.client.power.DelegationService;
import com.votesync.client.power.VotingPowerResolver;
import com.votesync.client.stats.GovernanceStatsService;
import com.votesync.client.submission.VoteErrorClassifier;
import com.votesync.client.tally.AggregateTallySource;
import com.votesync.client.tally.EventReplayTallySource;
import com.votesync.client.tally.PerChoiceTallySource;
import com.votesync.client.tally.TallyResolutionPipeline;
import com.votesync.client.tally.TallyService;
import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.exception.ErrorCode;
import com.votesync.common.exception.InsufficientWeightException;
import com.votesync.common.exception.NotFoundException;
import com.votesync.common.exception.VoteFailureReason;
import com.votesync.common.exception.VoteSubmissionException;
import com.votesync.common.exception.VoteSyncException;
import com.votesync.common.model.DelegationInfo;
import com.votesync.common.model.GovernanceStats;
import com.votesync.common.model.PendingMutation;
import com.votesync.common.model.Proposal;
import com.votesync.common.model.ProposalDetails;
import com.votesync.common.model.ProposalRange;
import com.votesync.common.model.ProposalState;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import com.votesync.common.model.VoteDetails;
import com.votesync.common.model.VoteReceipt;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link VoteStateClient}: wires the cache, resolution pipeline, overlay, reconciliation
 * and voting power resolver around one ledger.
 *
 * One cache instance is created here and shared by every component.
 */
@Slf4j
public class DefaultVoteStateClient implements VoteStateClient {

    private final VoteClientConfig config;
    private final LedgerClient ledgerClient;
    private final StalenessAwareCache cache;
    private final CachingLedgerReader reader;
    private final OptimisticOverlay overlay;
    private final TallyService tallyService;
    private final ReconciliationScheduler reconciliationScheduler;
    private final VotingPowerResolver votingPowerResolver;
    private final VoteHistoryService voteHistoryService;
    private final GovernanceStatsService statsService;
    private final ProposalCatalogService catalogService;
    private final DelegationService delegationService;
    private final TallyRefreshScheduler refreshScheduler;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService scheduler;

    public DefaultVoteStateClient(VoteClientConfig config) {
        this(config, new HttpLedgerClient(config.getLedgerUrl(), Duration.ofMillis(config.getRequestTimeoutMs())),
                Clock.systemUTC());
    }

    private DefaultVoteStateClient(VoteClientConfig config, HttpLedgerClient httpLedgerClient, Clock clock) {
        this(config, httpLedgerClient, httpLedgerClient, clock);
    }

    public DefaultVoteStateClient(VoteClientConfig config, LedgerClient ledgerClient,
                                  VotingWeightSource weightSource, Clock clock) {
        this.config = config;
        this.ledgerClient = ledgerClient;

        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("vsync-io-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newScheduledThreadPool(config.getSchedulerThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("vsync-scheduler-" + t.getId());
            t.setDaemon(true);
            return t;
        });

        TtlPolicy ttlPolicy = config.toTtlPolicy();
        this.cache = new StalenessAwareCache(clock, ttlPolicy.getActiveTally(), config.getCacheMaximumSize());

        ProposalRangeDiscovery discovery = new ProposalRangeDiscovery(ledgerClient,
                config.getDiscoveryInitialProbe(), config.getDiscoveryCeiling(), config.getDiscoveryLinearFallback());
        this.reader = new CachingLedgerReader(ledgerClient, discovery, cache, ttlPolicy);

        this.overlay = new OptimisticOverlay(ledgerClient, clock, Duration.ofMillis(config.getOverlayMaxAgeMs()));
        TallyResolutionPipeline pipeline = new TallyResolutionPipeline(List.of(
                new AggregateTallySource(ledgerClient, clock),
                new EventReplayTallySource(new EventLogReplayAggregator(ledgerClient), clock),
                new PerChoiceTallySource(ledgerClient, clock)), reader, clock);
        this.tallyService = new TallyService(pipeline, reader, cache, ttlPolicy, overlay);
        this.reconciliationScheduler = new ReconciliationScheduler(overlay, config.toBackoffPolicy(), scheduler);

        this.votingPowerResolver = new VotingPowerResolver(weightSource, ledgerClient, cache, ttlPolicy);
        this.voteHistoryService = new VoteHistoryService(ledgerClient, reader, cache, ttlPolicy);
        this.statsService = new GovernanceStatsService(ledgerClient, reader, cache, ttlPolicy, ioExecutor, clock);
        this.catalogService = new ProposalCatalogService(ledgerClient, reader, cache, ttlPolicy, ioExecutor);
        this.delegationService = new DelegationService(weightSource, cache, ttlPolicy, ioExecutor);
        this.refreshScheduler = new TallyRefreshScheduler(tallyService, reader, scheduler,
                Duration.ofMillis(config.getTallyRefreshIntervalMs()));

        log.info("DefaultVoteStateClient initialized for holder {}", config.getHolderId());
    }

    @Override
    public TallyResult resolveTally(long proposalId, boolean forceRefresh) {
        return tallyService.resolveTally(proposalId, forceRefresh);
    }

    @Override
    public CompletableFuture<TallyResult> resolveTallyAsync(long proposalId, boolean forceRefresh) {
        return CompletableFuture.supplyAsync(() -> resolveTally(proposalId, forceRefresh), ioExecutor);
    }

    @Override
    public CompletableFuture<Map<Long, TallyResult>> resolveTalliesAsync(Collection<Long> proposalIds) {
        List<Long> ids = new ArrayList<>(proposalIds);
        List<CompletableFuture<TallyResult>> futures = new ArrayList<>();
        for (Long id : ids) {
            futures.add(resolveTallyAsync(id, false));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<Long, TallyResult> results = new LinkedHashMap<>();
                    for (int i = 0; i < ids.size(); i++) {
                        results.put(ids.get(i), futures.get(i).join());
                    }
                    return results;
                });
    }

    @Override
    public ProposalRange discoverProposalRange() {
        return reader.proposalRange();
    }

    @Override
    public VoteSubmission submitVote(long proposalId, VoteChoice choice) {
        String holderId = requireHolder();
        log.info("Casting {} vote on proposal {} as {}", choice, proposalId, holderId);

        BigInteger power = checkEligibility(proposalId, holderId);

        PendingMutation mutation = PendingMutation.builder()
                .proposalId(proposalId)
                .voterId(holderId)
                .choice(choice)
                .weight(power)
                .baselineWeight(baselineWeight(proposalId, choice))
                .submittedAt(cache.getClock().instant())
                .build();
        overlay.record(mutation);

        VoteReceipt receipt;
        try {
            receipt = ledgerClient.submitVote(proposalId, holderId, choice);
        } catch (RuntimeException e) {
            overlay.fail(mutation);
            invalidateAffected(proposalId, holderId);
            VoteSubmissionException normalized = VoteErrorClassifier.toException(e);
            log.error("❌ Vote on proposal {} failed ({}): {}", proposalId, normalized.getReason(), e.getMessage());
            refreshAfterFailure(proposalId);
            throw normalized;
        }

        mutation.setReceipt(receipt);
        invalidateAffected(proposalId, holderId);

        CompletableFuture<TallyResult> reconciliation = reconciliationScheduler.reconcile(mutation,
                id -> tallyService.resolveAuthoritative(id, true),
                confirmed -> invalidateAffected(confirmed.getProposalId(), confirmed.getVoterId()));

        log.info("✅ Vote on proposal {} committed with weight {}", proposalId, power);
        return new VoteSubmission(receipt, mutation, reconciliation);
    }

    /**
     * Pre-submission checks. Returns the holder's voting power on the proposal; ledger read failures
     * surface as a generic submission failure.
     */
    private BigInteger checkEligibility(long proposalId, String holderId) {
        try {
            Proposal proposal = reader.proposal(proposalId, true);

            if (overlay.find(proposalId, holderId).isPresent()
                    || voteHistoryService.checkVoted(proposalId, holderId)) {
                throw new VoteSubmissionException(VoteFailureReason.ALREADY_VOTED);
            }
            if (proposal.getState() != ProposalState.ACTIVE) {
                throw new VoteSubmissionException(VoteFailureReason.INACTIVE_PROPOSAL);
            }

            BigInteger power = votingPowerResolver.proposalVotingPower(holderId, proposalId);
            if (power.signum() <= 0) {
                throw new InsufficientWeightException(proposalId, holderId);
            }
            return power;
        } catch (NotFoundException | VoteSubmissionException | InsufficientWeightException e) {
            throw e;
        } catch (RuntimeException e) {
            VoteSubmissionException normalized = VoteErrorClassifier.toException(e);
            log.error("❌ Pre-checks for a vote on proposal {} failed ({}): {}",
                    proposalId, normalized.getReason(), e.getMessage());
            throw normalized;
        }
    }

    /**
     * Authoritative weight of the option before the vote lands, or null when no tally is readable.
     */
    private BigInteger baselineWeight(long proposalId, VoteChoice choice) {
        try {
            TallyResult before = tallyService.resolveAuthoritative(proposalId, false);
            if (before.getProvenance() == Provenance.ZEROED) {
                return null;
            }
            return before.weightOf(choice);
        } catch (Exception e) {
            log.warn("⚠️ No baseline tally for proposal {}: {}", proposalId, e.getMessage());
            return null;
        }
    }

    @Override
    public BigInteger getVotingPower(Long checkpointId) {
        String holderId = requireHolder();
        if (checkpointId == null) {
            return votingPowerResolver.currentVotingPower(holderId);
        }
        return votingPowerResolver.votingPower(holderId, checkpointId);
    }

    @Override
    public BigInteger getProposalVotingPower(long proposalId) {
        return votingPowerResolver.proposalVotingPower(requireHolder(), proposalId);
    }

    /**
     * True when the ledger counted a vote of the holder, or a vote of the holder is still pending
     */
    @Override
    public boolean hasVoted(long proposalId, String holderId) {
        if (overlay.find(proposalId, holderId).isPresent()) {
            return true;
        }
        return voteHistoryService.hasVoted(proposalId, holderId);
    }

    @Override
    public VoteDetails getVoteDetails(long proposalId, String holderId) {
        return voteHistoryService.getVoteDetails(proposalId, holderId);
    }

    @Override
    public Map<Long, VoteDetails> getVoteHistory(String holderId) {
        return voteHistoryService.getVoteHistory(holderId);
    }

    @Override
    public List<ProposalDetails> listProposals() {
        return catalogService.listProposals();
    }

    @Override
    public GovernanceStats getGovernanceStats() {
        return statsService.getGovernanceStats();
    }

    @Override
    public DelegationInfo getDelegationInfo(String holderId) {
        return delegationService.getDelegationInfo(holderId);
    }

    @Override
    public TallyRefreshScheduler getRefreshScheduler() {
        return refreshScheduler;
    }

    public StalenessAwareCache getCache() {
        return cache;
    }

    public OptimisticOverlay getOverlay() {
        return overlay;
    }

    @Override
    public void close() {
        log.info("Closing DefaultVoteStateClient");
        refreshScheduler.shutdown();
        scheduler.shutdown();
        ioExecutor.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
            ioExecutor.shutdownNow();
        }
    }

    /**
     * Synchronously drop every cached read a vote of the holder on the proposal can make stale
     */
    private void invalidateAffected(long proposalId, String holderId) {
        CacheKeys.affectedByVote(proposalId, holderId).forEach(cache::delete);
        cache.clear(VoteSyncConstants.KEY_ROLLUP);
    }

    private void refreshAfterFailure(long proposalId) {
        try {
            tallyService.resolveTally(proposalId, true);
        } catch (Exception e) {
            log.warn("⚠️ Refresh after failed vote on proposal {} failed: {}", proposalId, e.getMessage());
        }
    }

    private String requireHolder() {
        String holderId = config.getHolderId();
        if (holderId == null || holderId.isBlank()) {
            throw new VoteSyncException(ErrorCode.NO_ACCOUNT);
        }
        return holderId;
    }
}
