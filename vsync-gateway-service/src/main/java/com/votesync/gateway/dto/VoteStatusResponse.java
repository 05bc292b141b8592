package com.votesync.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteStatusResponse {

    private Long proposalId;
    private String holderId;
    private Boolean hasVoted;
}
