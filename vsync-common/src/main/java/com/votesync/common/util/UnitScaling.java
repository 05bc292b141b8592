package com.votesync.common.util;

import com.votesync.common.constant.VoteSyncConstants;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Conversion between raw weights (integers with 18 implied decimals) and human-scaled values.
 * Percentages are always computed from raw weights.
 */
public final class UnitScaling {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private UnitScaling() {
    }

    public static BigDecimal toScaled(BigInteger raw) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(raw, VoteSyncConstants.WEIGHT_DECIMALS).stripTrailingZeros();
    }

    public static BigInteger toRaw(BigDecimal scaled) {
        return scaled.movePointRight(VoteSyncConstants.WEIGHT_DECIMALS).toBigIntegerExact();
    }

    /**
     * Share of {@code part} in {@code total} as a percentage, 0 when total is zero.
     */
    public static double percentage(BigInteger part, BigInteger total) {
        if (total == null || total.signum() == 0 || part == null) {
            return 0.0;
        }
        return new BigDecimal(part)
                .multiply(ONE_HUNDRED)
                .divide(new BigDecimal(total), 10, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Parses a decimal or 0x-prefixed hex integer.
     */
    public static BigInteger parseRaw(String value) {
        if (value == null || value.isBlank()) {
            return BigInteger.ZERO;
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            String digits = trimmed.substring(2);
            return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
        }
        return new BigInteger(trimmed);
    }
}
