package com.votesync.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VotingPowerResponse {

    private Long checkpointId;      // null = current checkpoint
    private Long proposalId;
    private BigInteger votingPower;
    private BigDecimal scaledVotingPower;
}
