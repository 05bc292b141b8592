package com.votesync.client.ledger;

import java.math.BigInteger;
import java.util.List;

/**
 * Checkpointed balances and delegation of voting weight
 */
public interface VotingWeightSource {

    BigInteger balanceAt(String holderId, long checkpointId);

    /**
     * Current delegate of the holder, null or the zero account when unset.
     */
    String delegateOf(String holderId);

    BigInteger delegatedToAt(String holderId, long checkpointId);

    long currentCheckpoint();

    /**
     * Accounts whose current delegate is the holder, empty when there are none.
     */
    List<String> delegatorsOf(String holderId);
}
