package com.votesync.common.model;

/**
 * Which resolution stage produced a tally
 */
public enum Provenance {
    AGGREGATE,
    EVENTS,
    PER_CHOICE,
    ZEROED
}
