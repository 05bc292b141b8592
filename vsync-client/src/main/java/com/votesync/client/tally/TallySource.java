package com.votesync.client.tally;

import com.votesync.common.model.Provenance;
import com.votesync.common.model.TallyResult;

import java.math.BigInteger;
import java.util.Optional;

/**
 * One stage of the tally resolution pipeline.
 * A stage handles its own failures and reports them as an empty result.
 */
public interface TallySource {

    Optional<TallyResult> resolve(long proposalId, BigInteger quorum);

    Provenance provenance();
}
