package com.votesync.common.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for tally lookups
 */
public class TallyResultTest {

    @Test
    void testCountedVoterIgnoresCase() {
        TallyResult tally = TallyResult.builder().countedVoters(Set.of("0xabc")).build();

        assertTrue(tally.hasCountedVoter("0xABC"));
        assertFalse(tally.hasCountedVoter("0xdef"));
        assertFalse(tally.hasCountedVoter(null));
    }

    @Test
    void testCountedVoterUnderTurkishDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            TallyResult tally = TallyResult.builder().countedVoters(Set.of("voter-i")).build();
            assertTrue(tally.hasCountedVoter("VOTER-I"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testMissingChoiceReadsAsZero() {
        TallyResult tally = TallyResult.builder().build();

        assertEquals(BigInteger.ZERO, tally.weightOf(VoteChoice.FOR));
    }
}
