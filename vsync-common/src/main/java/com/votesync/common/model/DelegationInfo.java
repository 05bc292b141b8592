package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Delegation state of one holder at the current checkpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DelegationInfo {

    private String holderId;
    private String currentDelegate; // null when unset
    private boolean selfDelegated;
    private long checkpointId;

    @Builder.Default
    private BigInteger balance = BigInteger.ZERO;

    @Builder.Default
    private BigInteger delegatedToHolder = BigInteger.ZERO;

    // balance plus delegated weight when self-delegated, zero otherwise
    @Builder.Default
    private BigInteger votingPower = BigInteger.ZERO;

    @Builder.Default
    private List<Delegator> delegators = new ArrayList<>();
}
