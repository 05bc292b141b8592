package com.votesync.gateway.config;

import com.votesync.client.DefaultVoteStateClient;
import com.votesync.client.VoteStateClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class VoteSyncClientConfiguration {

    @Bean(destroyMethod = "close")
    public VoteStateClient voteStateClient(GatewayProperties properties) {
        log.info("Creating vote state client for ledger {}", properties.getLedger().getUrl());
        if (properties.getHolderId() == null || properties.getHolderId().isBlank()) {
            log.warn("⚠️ No holder configured: vote submission and voting power reads are disabled");
        }
        return new DefaultVoteStateClient(properties.toClientConfig());
    }
}
