package com.votesync.client.cache;

import com.votesync.client.discovery.ProposalRangeDiscovery;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.common.model.GovernanceParams;
import com.votesync.common.model.Proposal;
import com.votesync.common.model.ProposalRange;
import com.votesync.common.model.ProposalState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Cached reads of proposal records, governance parameters and the proposal range
 */
@Slf4j
@RequiredArgsConstructor
public class CachingLedgerReader {

    private final LedgerClient ledgerClient;
    private final ProposalRangeDiscovery discovery;
    private final StalenessAwareCache cache;
    private final TtlPolicy ttlPolicy;

    /**
     * Proposal record, cached with a TTL that depends on its state.
     *
     * @throws com.votesync.common.exception.NotFoundException if the id does not exist
     */
    public Proposal proposal(long proposalId, boolean forceRefresh) {
        String key = CacheKeys.proposal(proposalId);
        if (forceRefresh) {
            cache.delete(key);
        }
        return cache.getOrCompute(key, (Proposal p) -> ttlPolicy.proposalTtl(p.getState()),
                () -> ledgerClient.getProposal(proposalId));
    }

    /**
     * Best-effort state read, empty when the proposal cannot be read
     */
    public Optional<ProposalState> proposalState(long proposalId) {
        try {
            return Optional.ofNullable(proposal(proposalId, false).getState());
        } catch (Exception e) {
            log.warn("⚠️ Could not read state of proposal {}: {}", proposalId, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<GovernanceParams> governanceParams() {
        try {
            return Optional.ofNullable(cache.getOrCompute(CacheKeys.governanceParams(),
                    ttlPolicy.getGovernanceParams(), ledgerClient::governanceParams));
        } catch (Exception e) {
            log.warn("⚠️ Governance params unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Quorum in raw units, null when governance params cannot be read
     */
    public BigInteger quorum() {
        return governanceParams().map(GovernanceParams::getQuorum).orElse(null);
    }

    public ProposalRange proposalRange() {
        return cache.getOrCompute(CacheKeys.proposalRange(), ttlPolicy.getRollup(), discovery::discover);
    }
}
