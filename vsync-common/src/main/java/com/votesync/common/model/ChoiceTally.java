package com.votesync.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Count and weight for one vote choice
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChoiceTally {

    @Builder.Default
    private long count = 0;

    @Builder.Default
    private BigInteger weight = BigInteger.ZERO; // raw units

    private BigDecimal scaledWeight; // weight / 10^18

    @Builder.Default
    private double percentage = 0.0;
}
