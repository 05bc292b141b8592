package com.votesync.common.model;

public enum MutationStatus {
    UNCONFIRMED,
    CONFIRMED,
    FAILED
}
