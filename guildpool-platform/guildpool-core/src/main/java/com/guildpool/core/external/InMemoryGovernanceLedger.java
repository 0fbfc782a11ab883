package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Governance votes per activity and round. An account's verifier quota is the weight it voted
 * with in that round; the total is the sum over all voters.
 */
public class InMemoryGovernanceLedger implements GovernanceSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGovernanceLedger.class);

    private final Map<VoterKey, BigInteger> votesByVoter = new ConcurrentHashMap<>();
    private final Map<RoundKey, BigInteger> totals = new ConcurrentHashMap<>();

    public synchronized void recordVotes(ActivityKey activity, long round, Address voter, BigInteger amount) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(voter, "Voter cannot be null");
        Precision.requireNonNegative(amount, "Vote amount");
        votesByVoter.merge(new VoterKey(activity, round, voter), amount, BigInteger::add);
        totals.merge(new RoundKey(activity, round), amount, BigInteger::add);
        log.info("Recorded {} governance votes for {} in {} round {}", amount, voter, activity, round);
    }

    @Override
    public BigInteger verifierQuota(ActivityKey activity, long round, Address account) {
        return votesByVoter.getOrDefault(new VoterKey(activity, round, account), BigInteger.ZERO);
    }

    @Override
    public BigInteger totalVotes(ActivityKey activity, long round) {
        return totals.getOrDefault(new RoundKey(activity, round), BigInteger.ZERO);
    }

    private record VoterKey(ActivityKey activity, long round, Address voter) {}

    private record RoundKey(ActivityKey activity, long round) {}
}
