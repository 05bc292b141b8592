package com.votesync.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Range of existing proposal ids, both ends inclusive.
 * An empty range has both ends set to -1.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProposalRange {

    private long minId;
    private long maxId;

    public static ProposalRange of(long minId, long maxId) {
        return new ProposalRange(minId, maxId);
    }

    public static ProposalRange empty() {
        return new ProposalRange(-1, -1);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return maxId < 0;
    }

    @JsonIgnore
    public long size() {
        return isEmpty() ? 0 : maxId - minId + 1;
    }
}
