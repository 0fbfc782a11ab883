package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;

/**
 * Per-round governance weight that bounds distrust voting.
 */
public interface GovernanceSource {

    BigInteger verifierQuota(ActivityKey activity, long round, Address account);

    BigInteger totalVotes(ActivityKey activity, long round);
}
