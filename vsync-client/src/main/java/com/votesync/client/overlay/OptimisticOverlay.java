package com.votesync.client.overlay;

import com.votesync.client.cache.CacheKeys;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.tally.TallyCalculator;
import com.votesync.common.model.MutationStatus;
import com.votesync.common.model.PendingMutation;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds locally submitted votes the ledger has not yet been seen to count, and merges them into
 * tallies at read time. Merged results are never written to the cache.
 */
@Slf4j
public class OptimisticOverlay {

    private final Map<String, PendingMutation> pending = new ConcurrentHashMap<>();
    private final LedgerClient ledgerClient;
    private final Clock clock;
    private final Duration maxAge;

    public OptimisticOverlay(LedgerClient ledgerClient, Clock clock, Duration maxAge) {
        this.ledgerClient = ledgerClient;
        this.clock = clock;
        this.maxAge = maxAge;
    }

    public void record(PendingMutation mutation) {
        pending.put(key(mutation.getProposalId(), mutation.getVoterId()), mutation);
        log.info("🔄 Recorded pending {} vote of {} on proposal {} (weight {})",
                mutation.getChoice(), mutation.getVoterId(), mutation.getProposalId(), mutation.getWeight());
    }

    /**
     * Live unconfirmed mutation of the voter on the proposal. Expired mutations are discarded.
     */
    public Optional<PendingMutation> find(long proposalId, String voterId) {
        PendingMutation mutation = pending.get(key(proposalId, voterId));
        if (mutation == null) {
            return Optional.empty();
        }
        if (isExpired(mutation)) {
            discard(mutation);
            return Optional.empty();
        }
        return mutation.getStatus() == MutationStatus.UNCONFIRMED ? Optional.of(mutation) : Optional.empty();
    }

    public List<PendingMutation> pendingFor(long proposalId) {
        List<PendingMutation> result = new ArrayList<>();
        for (PendingMutation mutation : pending.values()) {
            if (mutation.getProposalId() == proposalId) {
                find(proposalId, mutation.getVoterId()).ifPresent(result::add);
            }
        }
        return result;
    }

    /**
     * Merge every live pending vote the authoritative tally has not counted yet.
     * A pending vote the tally already counts is confirmed and dropped. A pending vote whose
     * counting cannot be verified is left out of the result rather than risk counting it twice.
     */
    public TallyResult merge(TallyResult authoritative) {
        TallyResult result = authoritative;
        for (PendingMutation mutation : pendingFor(authoritative.getProposalId())) {
            switch (verify(authoritative, mutation)) {
                case COUNTED:
                    confirm(mutation);
                    break;
                case NOT_COUNTED:
                    result = TallyCalculator.withVote(result, mutation.getChoice(), mutation.getWeight());
                    log.debug("Applied pending {} vote of {} to proposal {}", mutation.getChoice(),
                            mutation.getVoterId(), mutation.getProposalId());
                    break;
                default:
                    log.debug("Pending vote of {} on proposal {} left out: counting unverified",
                            mutation.getVoterId(), mutation.getProposalId());
                    break;
            }
        }
        return result;
    }

    public boolean isCounted(TallyResult authoritative, PendingMutation mutation) {
        return verify(authoritative, mutation) == Verification.COUNTED;
    }

    /**
     * Whether the authoritative tally already includes the pending vote. Event-replay tallies name
     * their voters; for any other source the ledger's voter weight is read directly, bypassing the
     * cache. When that read fails, the tally counts the vote iff the chosen option's weight grew by
     * at least the pending weight since submission.
     */
    public Verification verify(TallyResult authoritative, PendingMutation mutation) {
        if (authoritative.getProvenance() == Provenance.EVENTS) {
            return authoritative.hasCountedVoter(mutation.getVoterId())
                    ? Verification.COUNTED
                    : Verification.NOT_COUNTED;
        }
        try {
            BigInteger weight = ledgerClient.voterWeight(authoritative.getProposalId(), mutation.getVoterId());
            return weight != null && weight.signum() > 0 ? Verification.COUNTED : Verification.NOT_COUNTED;
        } catch (Exception e) {
            log.warn("⚠️ Could not check whether {} is counted on proposal {}: {}",
                    mutation.getVoterId(), authoritative.getProposalId(), e.getMessage());
            return verifyAgainstBaseline(authoritative, mutation);
        }
    }

    private Verification verifyAgainstBaseline(TallyResult authoritative, PendingMutation mutation) {
        if (mutation.getBaselineWeight() == null) {
            return Verification.UNVERIFIED;
        }
        BigInteger expected = mutation.getBaselineWeight().add(mutation.getWeight());
        return authoritative.weightOf(mutation.getChoice()).compareTo(expected) >= 0
                ? Verification.COUNTED
                : Verification.NOT_COUNTED;
    }

    public void confirm(PendingMutation mutation) {
        mutation.setStatus(MutationStatus.CONFIRMED);
        discard(mutation);
        log.info("✅ Vote of {} on proposal {} confirmed by the ledger", mutation.getVoterId(), mutation.getProposalId());
    }

    public void fail(PendingMutation mutation) {
        mutation.setStatus(MutationStatus.FAILED);
        discard(mutation);
    }

    public void discard(PendingMutation mutation) {
        pending.remove(key(mutation.getProposalId(), mutation.getVoterId()), mutation);
    }

    public boolean isExpired(PendingMutation mutation) {
        return mutation.isExpired(clock.instant(), maxAge);
    }

    public int size() {
        return pending.size();
    }

    public enum Verification {
        COUNTED,
        NOT_COUNTED,
        UNVERIFIED
    }

    private static String key(long proposalId, String voterId) {
        return proposalId + "-" + CacheKeys.normalize(voterId);
    }
}
