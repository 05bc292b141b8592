package com.votesync.client.tally;

import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;
import com.votesync.common.model.VoteChoice;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for tally construction and the read-time vote merge
 */
public class TallyCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testWithVoteAddsExactlyOneVote() {
        TallyResult base = TallyCalculator.build(4, Map.of(VoteChoice.FOR, 2L),
                Map.of(VoteChoice.FOR, BigInteger.valueOf(100), VoteChoice.AGAINST, BigInteger.valueOf(100)),
                3, BigInteger.valueOf(242), Provenance.EVENTS, Set.of("0xa"), NOW);

        TallyResult merged = TallyCalculator.withVote(base, VoteChoice.FOR, BigInteger.valueOf(42));

        assertEquals(3, merged.choice(VoteChoice.FOR).getCount());
        assertEquals(BigInteger.valueOf(142), merged.weightOf(VoteChoice.FOR));
        assertEquals(BigInteger.valueOf(242), merged.getTotalWeight());
        assertEquals(4, merged.getUniqueVoters());
        assertTrue(merged.isQuorumReached());
        assertTrue(merged.isOptimistic());
        assertEquals(Provenance.EVENTS, merged.getProvenance());

        // base untouched
        assertEquals(BigInteger.valueOf(100), base.weightOf(VoteChoice.FOR));
        assertFalse(base.isOptimistic());
        assertFalse(base.isQuorumReached());
    }

    @Test
    void testZeroedTally() {
        TallyResult zeroed = TallyCalculator.zeroed(9, BigInteger.TEN, NOW);

        assertEquals(Provenance.ZEROED, zeroed.getProvenance());
        assertEquals(BigInteger.ZERO, zeroed.getTotalWeight());
        assertEquals(0, zeroed.choice(VoteChoice.ABSTAIN).getCount());
        assertEquals(NOW, zeroed.getComputedAt());
    }
}
