package com.votesync.common.model;

/**
 * Lifecycle state of a proposal as reported by the ledger.
 * Codes match the ledger's wire encoding.
 */
public enum ProposalState {
    PENDING(0),
    ACTIVE(1),
    CANCELED(2),
    DEFEATED(3),
    SUCCEEDED(4),
    QUEUED(5),
    EXECUTED(6),
    EXPIRED(7);

    private final int code;

    ProposalState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * True while the tally can still change.
     */
    public boolean acceptsVotes() {
        return this == PENDING || this == ACTIVE;
    }

    /**
     * True once no further state transition can happen.
     */
    public boolean isTerminal() {
        return this == CANCELED || this == DEFEATED || this == EXECUTED || this == EXPIRED;
    }

    /**
     * Counted as a passed proposal in governance stats.
     */
    public boolean isSuccessful() {
        return this == SUCCEEDED || this == QUEUED || this == EXECUTED;
    }

    public static ProposalState fromCode(int code) {
        for (ProposalState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown proposal state code: " + code);
    }
}
