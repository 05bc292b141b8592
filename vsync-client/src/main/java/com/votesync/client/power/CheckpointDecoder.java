package com.votesync.client.power;

import com.votesync.common.exception.DecodeException;

import java.math.BigInteger;

/**
 * Decodes the proposal-creation log payload: two 32-byte big-endian words,
 * the proposal type (fits in one byte) followed by the checkpoint id.
 */
public final class CheckpointDecoder {

    private static final int WORD_HEX_CHARS = 64;
    private static final BigInteger MAX_TYPE = BigInteger.valueOf(255);

    private CheckpointDecoder() {
    }

    public static long decodeCheckpoint(String payload) {
        return decode(payload)[1].longValueExact();
    }

    public static int decodeProposalType(String payload) {
        return decode(payload)[0].intValueExact();
    }

    private static BigInteger[] decode(String payload) {
        if (payload == null) {
            throw new DecodeException("Missing creation payload");
        }
        String hex = payload.startsWith("0x") || payload.startsWith("0X") ? payload.substring(2) : payload;
        if (hex.length() < 2 * WORD_HEX_CHARS) {
            throw new DecodeException("Creation payload too short: " + hex.length() + " hex chars");
        }

        BigInteger type = word(hex, 0);
        BigInteger checkpoint = word(hex, 1);
        if (type.compareTo(MAX_TYPE) > 0) {
            throw new DecodeException("Proposal type out of range: " + type);
        }
        if (checkpoint.bitLength() >= Long.SIZE) {
            throw new DecodeException("Checkpoint id out of range: " + checkpoint);
        }
        return new BigInteger[]{type, checkpoint};
    }

    private static BigInteger word(String hex, int index) {
        String word = hex.substring(index * WORD_HEX_CHARS, (index + 1) * WORD_HEX_CHARS);
        try {
            return new BigInteger(word, 16);
        } catch (NumberFormatException e) {
            throw new DecodeException("Invalid hex in creation payload word " + index, e);
        }
    }
}
