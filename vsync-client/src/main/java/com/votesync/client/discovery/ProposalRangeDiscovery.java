package com.votesync.client.discovery;

import com.votesync.client.ledger.LedgerClient;
import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.model.ProposalRange;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the highest existing proposal id using only point lookups.
 *
 * Probes 100, 200, 400, ... (capped at the ceiling) until a lookup fails, then binary-searches
 * between the last id that answered and the first that did not. If nothing answers, a short
 * linear scan from id 0 is the last resort. Assumes ids are contiguous from 0.
 *
 * Any error during a probe, transient ones included, counts as "does not exist".
 */
@Slf4j
public class ProposalRangeDiscovery {

    private final LedgerClient ledgerClient;
    private final long initialProbe;
    private final long ceiling;
    private final int linearFallbackSize;

    public ProposalRangeDiscovery(LedgerClient ledgerClient) {
        this(ledgerClient, VoteSyncConstants.DISCOVERY_INITIAL_PROBE, VoteSyncConstants.DISCOVERY_CEILING,
                VoteSyncConstants.DISCOVERY_LINEAR_FALLBACK);
    }

    public ProposalRangeDiscovery(LedgerClient ledgerClient, long initialProbe, long ceiling, int linearFallbackSize) {
        if (initialProbe <= 0 || ceiling < initialProbe) {
            throw new IllegalArgumentException("Invalid probe bounds: initial=" + initialProbe + ", ceiling=" + ceiling);
        }
        this.ledgerClient = ledgerClient;
        this.initialProbe = initialProbe;
        this.ceiling = ceiling;
        this.linearFallbackSize = linearFallbackSize;
    }

    public ProposalRange discover() {
        log.debug("🔍 Discovering proposal range (initial probe {}, ceiling {})", initialProbe, ceiling);

        long low = 0;
        boolean lowVerified = false;
        long high = initialProbe;

        // Exponential probing
        while (exists(high)) {
            low = high;
            lowVerified = true;
            if (high >= ceiling) {
                log.warn("⚠️ Proposal {} exists at the discovery ceiling, reporting it as the max id", ceiling);
                return ProposalRange.of(0, ceiling);
            }
            high = Math.min(high * 2, ceiling);
        }

        // Binary search for the last existing id strictly below high
        long best = lowVerified ? low : -1;
        long lo = lowVerified ? low + 1 : low;
        long hi = high - 1;
        while (lo <= hi) {
            long mid = lo + (hi - lo) / 2;
            if (exists(mid)) {
                best = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }

        if (best < 0) {
            best = linearFallback();
        }

        if (best < 0) {
            log.info("No proposals found");
            return ProposalRange.empty();
        }

        log.info("✅ Discovered proposal range 0..{}", best);
        return ProposalRange.of(0, best);
    }

    private long linearFallback() {
        log.warn("⚠️ Binary search found no proposals, scanning ids 0..{}", linearFallbackSize - 1);
        long best = -1;
        for (long id = 0; id < linearFallbackSize; id++) {
            if (exists(id)) {
                best = id;
            }
        }
        return best;
    }

    private boolean exists(long proposalId) {
        try {
            ledgerClient.getProposal(proposalId);
            log.debug("Probe {}: exists", proposalId);
            return true;
        } catch (Exception e) {
            log.debug("Probe {}: absent ({})", proposalId, e.getMessage());
            return false;
        }
    }
}
