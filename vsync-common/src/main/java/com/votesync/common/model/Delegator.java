package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * An account delegating its weight, with its balance at the checkpoint read
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Delegator {
    private String holderId;

    @Builder.Default
    private BigInteger balance = BigInteger.ZERO;
}
