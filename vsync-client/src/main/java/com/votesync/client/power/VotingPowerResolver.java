package com.votesync.client.power;

import com.votesync.client.cache.CacheKeys;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.ledger.VotingWeightSource;
import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.model.ProposalCreationEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Voting power of a holder at a checkpoint: own balance plus weight delegated to the holder,
 * counted only when the holder delegates to itself (or has no delegate set).
 */
@Slf4j
@RequiredArgsConstructor
public class VotingPowerResolver {

    private final VotingWeightSource weightSource;
    private final LedgerClient ledgerClient;
    private final StalenessAwareCache cache;
    private final TtlPolicy ttlPolicy;

    /**
     * Power at a fixed checkpoint. Checkpoints are immutable, so the result is cached long.
     */
    public BigInteger votingPower(String holderId, long checkpointId) {
        return cache.getOrCompute(CacheKeys.votingPower(holderId, checkpointId), ttlPolicy.votingPowerTtl(),
                () -> computePower(holderId, checkpointId));
    }

    /**
     * Power at the ledger's current checkpoint. Not cached since that checkpoint moves.
     */
    public BigInteger currentVotingPower(String holderId) {
        long checkpoint = weightSource.currentCheckpoint();
        return computePower(holderId, checkpoint);
    }

    public BigInteger proposalVotingPower(String holderId, long proposalId) {
        return votingPower(holderId, proposalCheckpoint(proposalId));
    }

    /**
     * Checkpoint recorded when the proposal was created. If the creation entry is missing or
     * malformed, the current checkpoint is used instead and not cached.
     */
    public long proposalCheckpoint(long proposalId) {
        String key = CacheKeys.checkpoint(proposalId);
        Optional<Long> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        try {
            ProposalCreationEntry entry = ledgerClient.proposalCreationEntry(proposalId);
            long checkpoint = CheckpointDecoder.decodeCheckpoint(entry != null ? entry.getPayload() : null);
            cache.set(key, checkpoint, ttlPolicy.getImmutable());
            return checkpoint;
        } catch (Exception e) {
            long current = weightSource.currentCheckpoint();
            log.warn("⚠️ Checkpoint of proposal {} unavailable ({}), using current checkpoint {}",
                    proposalId, e.getMessage(), current);
            return current;
        }
    }

    private BigInteger computePower(String holderId, long checkpointId) {
        BigInteger balance = orZero(weightSource.balanceAt(holderId, checkpointId));
        String delegate = weightSource.delegateOf(holderId);

        if (!isSelfDelegated(holderId, delegate)) {
            log.debug("{} delegates to {}, no voting power at checkpoint {}", holderId, delegate, checkpointId);
            return BigInteger.ZERO;
        }

        BigInteger delegated = orZero(weightSource.delegatedToAt(holderId, checkpointId));
        BigInteger power = balance.add(delegated);
        log.debug("Voting power of {} at checkpoint {}: {} (balance {}, delegated {})",
                holderId, checkpointId, power, balance, delegated);
        return power;
    }

    static boolean isSelfDelegated(String holderId, String delegate) {
        return delegate == null
                || delegate.isBlank()
                || delegate.equalsIgnoreCase(VoteSyncConstants.ZERO_ACCOUNT)
                || delegate.equalsIgnoreCase(holderId);
    }

    private static BigInteger orZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
