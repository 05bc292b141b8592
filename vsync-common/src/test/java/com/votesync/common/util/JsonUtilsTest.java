package com.votesync.common.util;

import com.votesync.common.exception.DecodeException;
import com.votesync.common.model.Proposal;
import com.votesync.common.model.ProposalState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for JSON helpers
 */
public class JsonUtilsTest {

    @Test
    void testReadsIsoTimestampsAndIgnoresUnknownFields() {
        String json = "{\"id\":7,\"state\":\"ACTIVE\",\"checkpointId\":1200,"
                + "\"deadline\":\"2024-03-01T12:00:00Z\",\"extra\":\"ignored\"}";

        Proposal proposal = JsonUtils.fromJson(json, Proposal.class);

        assertEquals(Long.valueOf(7), proposal.getId());
        assertEquals(ProposalState.ACTIVE, proposal.getState());
        assertEquals(Long.valueOf(1200), proposal.getCheckpointId());
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), proposal.getDeadline());
    }

    @Test
    void testWritesIsoTimestamps() {
        Proposal proposal = Proposal.builder()
                .id(1L)
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        assertTrue(JsonUtils.toJson(proposal).contains("\"2024-01-01T00:00:00Z\""));
    }

    @Test
    void testMalformedJsonIsDecodeException() {
        assertThrows(DecodeException.class, () -> JsonUtils.fromJson("{not json", Proposal.class));
        assertThrows(DecodeException.class, () -> JsonUtils.readTree("[1,"));
    }
}
