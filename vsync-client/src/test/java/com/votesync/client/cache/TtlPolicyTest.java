package com.votesync.client.cache;

import com.votesync.common.model.ProposalState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for lifecycle-dependent TTLs
 */
public class TtlPolicyTest {

    private final TtlPolicy policy = TtlPolicy.defaults();

    @Test
    void testTallyTtl() {
        assertEquals(Duration.ofSeconds(30), policy.tallyTtl(ProposalState.ACTIVE));
        assertEquals(Duration.ofSeconds(30), policy.tallyTtl(ProposalState.PENDING));
        assertEquals(Duration.ofDays(30), policy.tallyTtl(ProposalState.SUCCEEDED));
        assertEquals(Duration.ofDays(30), policy.tallyTtl(ProposalState.DEFEATED));
        assertEquals(Duration.ofSeconds(30), policy.tallyTtl(null));
    }

    @Test
    void testProposalTtl() {
        assertEquals(Duration.ofSeconds(15), policy.proposalTtl(ProposalState.ACTIVE));
        assertEquals(Duration.ofHours(1), policy.proposalTtl(ProposalState.QUEUED));
        assertEquals(Duration.ofDays(30), policy.proposalTtl(ProposalState.EXECUTED));
    }

    @Test
    void testVoteStatusTtl() {
        assertEquals(Duration.ofDays(30), policy.voteStatusTtl(true, ProposalState.ACTIVE));
        assertEquals(Duration.ofSeconds(15), policy.voteStatusTtl(false, ProposalState.ACTIVE));
        assertEquals(Duration.ofDays(30), policy.voteStatusTtl(false, ProposalState.DEFEATED));
        assertEquals(Duration.ofDays(30), policy.votingPowerTtl());
        assertEquals(Duration.ofHours(1), policy.getGovernanceParams());
    }

    @Test
    void testCacheKeysNormalizeHolder() {
        assertEquals(CacheKeys.voteStatus(3, "0xABC"), CacheKeys.voteStatus(3, "0xabc"));
        assertTrue(CacheKeys.governanceStats().startsWith("rollup-"));
        assertTrue(CacheKeys.affectedByVote(3, "0xAbc").contains(CacheKeys.tally(3)));
        assertTrue(CacheKeys.affectedByVote(3, "0xAbc").contains(CacheKeys.voteHistory("0xabc")));
    }
}
