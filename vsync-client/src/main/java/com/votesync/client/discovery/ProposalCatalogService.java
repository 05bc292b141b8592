package com.votesync.client.discovery;

import com.votesync.client.cache.CacheKeys;
import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.power.CheckpointDecoder;
import com.votesync.common.model.Proposal;
import com.votesync.common.model.ProposalCreationEntry;
import com.votesync.common.model.ProposalDetails;
import com.votesync.common.model.ProposalRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Every proposal in the discovered range with its details, newest first
 */
@Slf4j
@RequiredArgsConstructor
public class ProposalCatalogService {

    private final LedgerClient ledgerClient;
    private final CachingLedgerReader reader;
    private final StalenessAwareCache cache;
    private final TtlPolicy ttlPolicy;
    private final Executor executor;

    /**
     * Details of every proposal from 0 to the highest id, read concurrently.
     * Proposals that cannot be read are left out.
     */
    public List<ProposalDetails> listProposals() {
        ProposalRange range = reader.proposalRange();
        if (range.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<ProposalDetails>> futures = new ArrayList<>();
        for (long id = range.getMinId(); id <= range.getMaxId(); id++) {
            long proposalId = id;
            futures.add(CompletableFuture.supplyAsync(() -> readDetails(proposalId), executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<ProposalDetails> proposals = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ProposalDetails::getId).reversed())
                .collect(Collectors.toList());
        log.debug("Listed {} of {} proposals", proposals.size(), range.size());
        return proposals;
    }

    /**
     * Details of one proposal, cached with the TTL of its state
     *
     * @throws com.votesync.common.exception.NotFoundException if the id does not exist
     */
    public ProposalDetails proposalDetails(long proposalId) {
        return cache.getOrCompute(CacheKeys.proposalDetails(proposalId),
                (ProposalDetails details) -> ttlPolicy.proposalTtl(details.getState()),
                () -> buildDetails(proposalId));
    }

    private ProposalDetails readDetails(long proposalId) {
        try {
            return proposalDetails(proposalId);
        } catch (Exception e) {
            log.warn("⚠️ Skipping proposal {} in listing: {}", proposalId, e.getMessage());
            return null;
        }
    }

    private ProposalDetails buildDetails(long proposalId) {
        Proposal proposal = reader.proposal(proposalId, false);
        return ProposalDetails.builder()
                .id(proposal.getId() != null ? proposal.getId() : proposalId)
                .state(proposal.getState())
                .proposer(proposal.getProposer())
                .createdAt(proposal.getCreatedAt())
                .deadline(proposal.getDeadline())
                .checkpointId(proposal.getCheckpointId())
                .proposalType(proposalType(proposalId).orElse(null))
                .build();
    }

    /**
     * Type recorded in the creation entry. It never changes, so a decoded type is cached long;
     * a missing or malformed entry is not cached.
     */
    private Optional<Integer> proposalType(long proposalId) {
        String key = CacheKeys.proposalType(proposalId);
        Optional<Integer> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached;
        }

        try {
            ProposalCreationEntry entry = ledgerClient.proposalCreationEntry(proposalId);
            int type = CheckpointDecoder.decodeProposalType(entry != null ? entry.getPayload() : null);
            cache.set(key, type, ttlPolicy.getImmutable());
            return Optional.of(type);
        } catch (Exception e) {
            log.debug("No proposal type for proposal {}: {}", proposalId, e.getMessage());
            return Optional.empty();
        }
    }
}
