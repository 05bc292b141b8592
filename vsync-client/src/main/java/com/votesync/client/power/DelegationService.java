package com.votesync.client.power;

import com.votesync.client.cache.CacheKeys;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.ledger.VotingWeightSource;
import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.model.DelegationInfo;
import com.votesync.common.model.Delegator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Who a holder delegates to and who delegates to the holder, at the current checkpoint
 */
@Slf4j
@RequiredArgsConstructor
public class DelegationService {

    private final VotingWeightSource weightSource;
    private final StalenessAwareCache cache;
    private final TtlPolicy ttlPolicy;
    private final Executor executor;

    /**
     * Cached for the rollup TTL since the current checkpoint moves. Ledger read failures propagate.
     */
    public DelegationInfo getDelegationInfo(String holderId) {
        return cache.getOrCompute(CacheKeys.delegation(holderId), ttlPolicy.getRollup(),
                () -> readDelegationInfo(holderId));
    }

    private DelegationInfo readDelegationInfo(String holderId) {
        long checkpoint = weightSource.currentCheckpoint();
        String delegate = weightSource.delegateOf(holderId);
        boolean selfDelegated = VotingPowerResolver.isSelfDelegated(holderId, delegate);
        BigInteger balance = orZero(weightSource.balanceAt(holderId, checkpoint));
        BigInteger delegated = orZero(weightSource.delegatedToAt(holderId, checkpoint));

        List<Delegator> delegators = readDelegators(holderId, checkpoint);

        DelegationInfo info = DelegationInfo.builder()
                .holderId(holderId)
                .currentDelegate(isUnset(delegate) ? null : delegate)
                .selfDelegated(selfDelegated)
                .checkpointId(checkpoint)
                .balance(balance)
                .delegatedToHolder(delegated)
                .votingPower(selfDelegated ? balance.add(delegated) : BigInteger.ZERO)
                .delegators(delegators)
                .build();
        log.debug("Delegation of {} at checkpoint {}: delegate {}, {} delegators",
                holderId, checkpoint, info.getCurrentDelegate(), delegators.size());
        return info;
    }

    /**
     * Balances of the holder's delegators, read concurrently
     */
    private List<Delegator> readDelegators(String holderId, long checkpoint) {
        List<String> accounts = weightSource.delegatorsOf(holderId);
        if (accounts == null || accounts.isEmpty()) {
            return new ArrayList<>();
        }

        List<CompletableFuture<Delegator>> futures = accounts.stream()
                .map(account -> CompletableFuture.supplyAsync(() -> Delegator.builder()
                        .holderId(account)
                        .balance(orZero(weightSource.balanceAt(account, checkpoint)))
                        .build(), executor))
                .collect(Collectors.toList());

        try {
            return futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static boolean isUnset(String delegate) {
        return delegate == null
                || delegate.isBlank()
                || delegate.equalsIgnoreCase(VoteSyncConstants.ZERO_ACCOUNT);
    }

    private static BigInteger orZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
