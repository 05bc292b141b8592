package com.votesync.gateway.dto;

import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response DTO for a committed vote, with the tally as the caller should display it
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteResponse {

    private Long proposalId;
    private String voterId;
    private VoteChoice choice;
    private BigInteger weight;
    private String transactionId;
    private Instant committedAt;
    private TallyResult tally;
}
