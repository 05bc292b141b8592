package com.votesync.client.power;

import com.votesync.client.cache.StalenessAwareCache;
import com.votesync.client.cache.TtlPolicy;
import com.votesync.client.support.InMemoryLedger;
import com.votesync.client.support.MutableClock;
import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.model.DelegationInfo;
import com.votesync.common.model.Delegator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for delegation reads
 */
public class DelegationServiceTest {

    private static final String HOLDER = "0xHolder";

    private InMemoryLedger ledger;
    private MutableClock clock;
    private DelegationService delegationService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ledger = new InMemoryLedger();
        ledger.setBalance(HOLDER, BigInteger.valueOf(30));
        ledger.setDelegatedTo(HOLDER, BigInteger.valueOf(12));
        ledger.setBalance("0xd1", BigInteger.valueOf(5));
        ledger.setBalance("0xd2", BigInteger.valueOf(7));
        ledger.setDelegate("0xd1", HOLDER);
        ledger.setDelegate("0xd2", HOLDER);
        ledger.setDelegate("0xd3", "0xsomeoneElse");

        StalenessAwareCache cache = new StalenessAwareCache(clock, Duration.ofSeconds(30));
        delegationService = new DelegationService(ledger, cache, TtlPolicy.defaults(), Runnable::run);
    }

    @Test
    void testSelfDelegatedHolderWithDelegators() {
        DelegationInfo info = delegationService.getDelegationInfo(HOLDER);

        assertNull(info.getCurrentDelegate());
        assertTrue(info.isSelfDelegated());
        assertEquals(500, info.getCheckpointId());
        assertEquals(BigInteger.valueOf(30), info.getBalance());
        assertEquals(BigInteger.valueOf(12), info.getDelegatedToHolder());
        assertEquals(BigInteger.valueOf(42), info.getVotingPower());

        List<String> delegators = info.getDelegators().stream()
                .map(Delegator::getHolderId)
                .collect(Collectors.toList());
        assertEquals(List.of("0xd1", "0xd2"), delegators);
        assertEquals(BigInteger.valueOf(7), info.getDelegators().get(1).getBalance());
    }

    @Test
    void testDelegatingAwayHasNoVotingPower() {
        ledger.setDelegate(HOLDER, "0xd1");

        DelegationInfo info = delegationService.getDelegationInfo(HOLDER);

        assertEquals("0xd1", info.getCurrentDelegate());
        assertFalse(info.isSelfDelegated());
        assertEquals(BigInteger.ZERO, info.getVotingPower());
    }

    @Test
    void testZeroAccountDelegateReadsAsUnset() {
        ledger.setDelegate(HOLDER, VoteSyncConstants.ZERO_ACCOUNT);

        DelegationInfo info = delegationService.getDelegationInfo(HOLDER);

        assertNull(info.getCurrentDelegate());
        assertTrue(info.isSelfDelegated());
    }

    @Test
    void testCachedForRollupTtl() {
        delegationService.getDelegationInfo(HOLDER);
        ledger.setDelegate("0xd3", HOLDER);

        assertEquals(2, delegationService.getDelegationInfo(HOLDER).getDelegators().size());

        clock.advance(Duration.ofSeconds(30));
        assertEquals(3, delegationService.getDelegationInfo("0xholder").getDelegators().size());
    }

    @Test
    void testNoDelegators() {
        DelegationInfo info = delegationService.getDelegationInfo("0xd3");

        assertEquals("0xsomeoneElse", info.getCurrentDelegate());
        assertTrue(info.getDelegators().isEmpty());
    }
}
