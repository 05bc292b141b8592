package com.votesync.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * Request DTO for casting a vote: 0 = Against, 1 = For, 2 = Abstain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {

    @NotNull(message = "choice is required")
    @Min(value = 0, message = "choice must be 0 (Against), 1 (For) or 2 (Abstain)")
    @Max(value = 2, message = "choice must be 0 (Against), 1 (For) or 2 (Abstain)")
    private Integer choice;
}
