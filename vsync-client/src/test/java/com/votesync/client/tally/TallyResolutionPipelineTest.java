package com.votesync.client.tally;

import com.votesync.client.aggregate.EventLogReplayAggregator;
import com.votesync.client.cache.CachingLedgerReader;
import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.discovery.ProposalRangeDiscovery;
import com.votesync.client.support.InMemoryLedger;
import com.votesync.client.support.MutableClock;
import com.votesync.common.model.Provenance;
import com.votesync.common.model.ProposalState;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static com.votesync.client.support.InMemoryLedger.ONE_TOKEN;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for prioritized tally resolution and tally invariants
 */
public class TallyResolutionPipelineTest {

    private InMemoryLedger ledger;
    private TallyResolutionPipeline pipeline;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        ledger = new InMemoryLedger().addProposal(1, ProposalState.ACTIVE);
        ledger.castIndexed(1, "0xa", VoteChoice.FOR, tokens(60));
        ledger.castIndexed(1, "0xb", VoteChoice.AGAINST, tokens(30));
        ledger.castIndexed(1, "0xc", VoteChoice.ABSTAIN, tokens(10));

        StalenessAwareCache cache = new StalenessAwareCache(clock, Duration.ofSeconds(30));
        CachingLedgerReader reader = new CachingLedgerReader(ledger, new ProposalRangeDiscovery(ledger), cache,
                TtlPolicy.defaults());
        pipeline = new TallyResolutionPipeline(List.of(
                new AggregateTallySource(ledger, clock),
                new EventReplayTallySource(new EventLogReplayAggregator(ledger), clock),
                new PerChoiceTallySource(ledger, clock)), reader, clock);
    }

    @Test
    void testAggregateReadWinsWhenExposed() {
        ledger.aggregateSupported = true;

        TallyResult tally = pipeline.resolve(1);

        assertEquals(Provenance.AGGREGATE, tally.getProvenance());
        assertEquals(3, tally.getUniqueVoters());
        assertEquals(tokens(100), tally.getTotalWeight());
        assertEquals(0, ledger.voteLogReads.get());
    }

    @Test
    void testEventReplayWhenAggregateNotExposed() {
        TallyResult tally = pipeline.resolve(1);

        assertEquals(Provenance.EVENTS, tally.getProvenance());
        assertEquals(1, tally.choice(VoteChoice.FOR).getCount());
        assertEquals(3, tally.getUniqueVoters());
        assertTrue(tally.hasCountedVoter("0xA"));
        assertEquals(60.0, tally.percentageOf(VoteChoice.FOR), 1e-9);
        assertEquals(0, new BigDecimal("60").compareTo(tally.choice(VoteChoice.FOR).getScaledWeight()));
    }

    @Test
    void testPerChoiceWhenLogUnavailable() {
        ledger.voteLogAvailable = false;

        TallyResult tally = pipeline.resolve(1);

        assertEquals(Provenance.PER_CHOICE, tally.getProvenance());
        assertEquals(tokens(100), tally.getTotalWeight());
        assertEquals(0, tally.getUniqueVoters());
    }

    @Test
    void testZeroedWhenEverythingFails() {
        ledger.voteLogAvailable = false;
        ledger.perChoiceAvailable = false;

        TallyResult tally = pipeline.resolve(1);

        assertEquals(Provenance.ZEROED, tally.getProvenance());
        assertEquals(BigInteger.ZERO, tally.getTotalWeight());
        for (VoteChoice choice : VoteChoice.values()) {
            assertEquals(0.0, tally.percentageOf(choice));
        }
        assertFalse(tally.isQuorumReached());
    }

    @Test
    void testTotalIsSumOfChoicesAndPercentagesSumToHundred() {
        ledger.castIndexed(1, "0xd", VoteChoice.FOR, BigInteger.valueOf(7));

        TallyResult tally = pipeline.resolve(1);

        BigInteger sum = BigInteger.ZERO;
        double percentages = 0;
        for (VoteChoice choice : VoteChoice.values()) {
            sum = sum.add(tally.weightOf(choice));
            percentages += tally.percentageOf(choice);
        }
        assertEquals(tally.getTotalWeight(), sum);
        assertEquals(100.0, percentages, 1e-6);
    }

    @Test
    void testQuorumReachedAtExactlyTotalWeight() {
        ledger.quorum = tokens(100);
        assertTrue(pipeline.resolve(1).isQuorumReached());
    }

    @Test
    void testQuorumNotReachedBelowTotalWeight() {
        ledger.quorum = tokens(101);

        TallyResult tally = pipeline.resolve(1);

        assertFalse(tally.isQuorumReached());
        assertEquals(tokens(101), tally.getRequiredQuorum());
    }

    @Test
    void testQuorumFalseWhenParamsUnreadable() {
        ledger.governanceAvailable = false;

        TallyResult tally = pipeline.resolve(1);

        assertFalse(tally.isQuorumReached());
        assertNull(tally.getRequiredQuorum());
    }

    private static BigInteger tokens(long amount) {
        return ONE_TOKEN.multiply(BigInteger.valueOf(amount));
    }
}
