package com.guildpool.core.distrust;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;

/**
 * Cumulative distrust one voter has cast against one group owner in a round, with the latest reason given.
 */
public record DistrustVote(
        ActivityKey activity,
        long round,
        Address voter,
        Address target,
        BigInteger amount,
        String reason
) {}
