package com.votesync.common.model;

import com.votesync.common.exception.ErrorCode;
import com.votesync.common.exception.VoteSyncException;

/**
 * Vote options. Codes match the ledger's wire encoding.
 */
public enum VoteChoice {
    AGAINST(0),
    FOR(1),
    ABSTAIN(2);

    private final int code;

    VoteChoice(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static VoteChoice fromCode(int code) {
        for (VoteChoice choice : values()) {
            if (choice.code == code) {
                return choice;
            }
        }
        throw new VoteSyncException(ErrorCode.INVALID_CHOICE);
    }
}
