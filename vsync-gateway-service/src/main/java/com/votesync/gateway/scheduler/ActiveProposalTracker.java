package com.votesync.gateway.scheduler;

import com.votesync.client.VoteStateClient;
import com.votesync.common.model.ProposalRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background job that hands newly discovered proposals to the client's refresh scheduler.
 * Each proposal is handed over once; the refresh scheduler drops it after it closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "vsync.gateway.tracking", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class ActiveProposalTracker {

    private final VoteStateClient voteStateClient;

    private long highestTracked = -1;

    @Scheduled(fixedDelayString = "${vsync.gateway.tracking.scan-interval-ms:60000}", initialDelay = 5000)
    public void scanForNewProposals() {
        try {
            ProposalRange range = voteStateClient.discoverProposalRange();
            if (range.isEmpty() || range.getMaxId() <= highestTracked) {
                log.debug("No new proposals (highest tracked: {})", highestTracked);
                return;
            }

            long from = Math.max(range.getMinId(), highestTracked + 1);
            for (long id = from; id <= range.getMaxId(); id++) {
                voteStateClient.getRefreshScheduler().track(id);
            }
            log.info("🔍 Tracking proposals {}..{}", from, range.getMaxId());
            highestTracked = range.getMaxId();

        } catch (Exception e) {
            log.error("Error scanning for new proposals", e);
        }
    }

    long getHighestTracked() {
        return highestTracked;
    }
}
