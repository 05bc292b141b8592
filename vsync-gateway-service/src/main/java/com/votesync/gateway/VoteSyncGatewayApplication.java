package com.votesync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Vote Sync Gateway Application
 * Serves tallies, vote status and vote submission over REST
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class VoteSyncGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoteSyncGatewayApplication.class, args);
    }
}
